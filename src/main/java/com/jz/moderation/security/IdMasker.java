package com.jz.moderation.security;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * 日志脱敏：HMAC-SHA256(salt, context:id) 取前 16 个 hex 字符。
 * 同一 salt 下结果稳定，可用于日志关联，但不可反推原始 id。
 */
@Slf4j
public class IdMasker {

    private static final String ALGORITHM = "HmacSHA256";

    private final byte[] secret;

    public IdMasker(String salt) {
        if (salt == null || salt.isBlank()) {
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            this.secret = random;
            log.warn("[IdMasker] masking salt not configured, using a random per-process salt");
        } else {
            this.secret = salt.getBytes(StandardCharsets.UTF_8);
        }
    }

    public String user(long userId) {
        return "u_" + digest("user", userId);
    }

    public String chat(long chatId) {
        return "c_" + digest("chat", chatId);
    }

    private String digest(String context, long id) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            byte[] out = mac.doFinal((context + ":" + id).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(out).substring(0, 16);
        } catch (Exception e) {
            throw new IllegalStateException("HMAC_SHA256_FAILED", e);
        }
    }
}
