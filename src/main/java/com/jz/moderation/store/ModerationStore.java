package com.jz.moderation.store;

import com.jz.moderation.domain.entity.Challenge;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.domain.entity.Warning;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 审核数据的存储端口。每个方法对单个实体是原子的；
 * 失败统一抛 {@link com.jz.moderation.common.StoreException}。
 */
public interface ModerationStore {

    // ---------- settings ----------
    Optional<PolicySettings> findSettings(long chatId);

    void saveSettings(PolicySettings settings);

    void deleteSettings(long chatId);

    // ---------- flood ----------
    /**
     * 记录一条消息并返回当前窗口。
     *
     * @param pruneBefore 早于该时刻的条目被清理
     * @param windowStart 窗口下界（含）
     * @param ttl         整个 key 的过期时间
     */
    FloodWindowSnapshot recordFlood(long chatId, long userId, FloodEntry entry,
                                    Instant pruneBefore, Instant windowStart, Duration ttl);

    void clearFlood(long chatId, long userId);

    // ---------- join ----------
    void saveJoin(long chatId, long userId, Instant joinedAt, Duration ttl);

    Optional<Instant> findJoin(long chatId, long userId);

    /** @return true 表示首次标记（本次应发送欢迎语） */
    boolean markWelcomed(long chatId, long userId, Duration ttl);

    // ---------- warnings ----------
    /** @return 追加后的总数 */
    long appendWarning(Warning warning);

    /** 按时间正序 */
    List<Warning> findWarnings(long chatId, long userId);

    long countWarnings(long chatId, long userId);

    /** @return 删除的条数 */
    long clearWarnings(long chatId, long userId);

    // ---------- audit ----------
    void appendModAction(ModAction action, int maxEntries);

    /** 最新在前 */
    List<ModAction> findModActions(long chatId, int limit);

    // ---------- challenge ----------
    void saveChallenge(Challenge challenge, Duration ttl);

    Optional<Challenge> findChallenge(long chatId, long userId);

    /** 仅当存活题目 id 等于 challengeId 时删除；返回是否删除成功 */
    boolean deleteChallenge(long chatId, long userId, String challengeId);
}
