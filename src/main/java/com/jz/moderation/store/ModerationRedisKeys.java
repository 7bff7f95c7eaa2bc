package com.jz.moderation.store;

/**
 * 统一管理审核相关的 Redis Key，按实体类型区分，避免手拼字符串。
 */
public final class ModerationRedisKeys {

    private final String prefix;

    public ModerationRedisKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    /** 设置：String(JSON) */
    public String settings(long chatId) {
        return prefix + "settings:" + chatId;
    }

    /** 刷屏窗口：ZSET(score=epochMs) */
    public String flood(long chatId, long userId) {
        return prefix + "flood:" + chatId + ":" + userId;
    }

    /** 入群时间：String(epochMs)，带 TTL */
    public String join(long chatId, long userId) {
        return prefix + "join:" + chatId + ":" + userId;
    }

    /** 警告：LIST(JSON)，RPUSH 追加 */
    public String warns(long chatId, long userId) {
        return prefix + "warns:" + chatId + ":" + userId;
    }

    /** 审计：LIST(JSON)，LPUSH + LTRIM */
    public String modlog(long chatId) {
        return prefix + "modlog:" + chatId;
    }

    /** 验证题：String(JSON)，带 TTL */
    public String challenge(long chatId, long userId) {
        return prefix + "captcha:" + chatId + ":" + userId;
    }

    /** 欢迎语去重：SET NX EX */
    public String welcomed(long chatId, long userId) {
        return prefix + "welcomed:" + chatId + ":" + userId;
    }
}
