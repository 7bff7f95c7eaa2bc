package com.jz.moderation.guard;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 已知垃圾内容的三类特征。命中即删除，不看发送者历史。
 */
public enum SpamCategory {

    CRYPTO_SCAM("crypto_scam", List.of(
            "binance-?\\w*\\.(?:com|org|net|io)",
            "coinbase-?\\w*\\.(?:com|org|net|io)",
            "metamask-?\\w*\\.(?:com|org|net|io)",
            "trustwallet-?\\w*\\.(?:com|org|net|io)",
            "airdrop-?\\w*\\.(?:com|org|net|io)",
            "claim-?\\w*\\.(?:com|org|net|io)",
            "free-?crypto\\.(?:com|org|net|io)",
            "earn-?btc\\.(?:com|org|net|io)")),

    ADULT_CONTENT("adult_content", List.of(
            "onlyfans\\.com",
            "pornhub\\.com",
            "xvideos\\.com",
            "chaturbate\\.com",
            "livejasmin\\.com",
            "stripchat\\.com")),

    SPAM_PATTERN("spam_pattern", List.of(
            "(?:заработ|зароб)[а-яё]*\\s*(?:от|до)?\\s*\\d+",
            "(?:пассивн|легк)[а-яё]*\\s*(?:доход|заработ)",
            "(?:работа|вакансия)\\s*(?:на\\s*дому|удалённ)",
            "(?:инвест|вложи)[а-яё]*\\s*(?:от)?\\s*\\d+",
            "(?:passive\\s+income|work\\s+from\\s+home)",
            "(?:казино|casino|slots?|рулетк)",
            "(?:ставки|betting|1xbet|fonbet)"));

    private final String reason;
    private final Pattern pattern;

    SpamCategory(String reason, List<String> alternatives) {
        this.reason = reason;
        this.pattern = Pattern.compile(String.join("|", alternatives),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /** 写入审核结论和审计记录的原因码 */
    public String reason() {
        return reason;
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
