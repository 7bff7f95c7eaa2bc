package com.jz.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "moderation")
public class ModerationProperties {

    private Store store = new Store();
    private Challenge challenge = new Challenge();
    private Cache cache = new Cache();
    private Masking masking = new Masking();

    /** 每个群最多保留的审计条数 */
    private int modlogMaxEntries = 1000;

    /** 入群记录保留时长：最长新人期(168h) + 1h */
    private Duration joinRecordTtl = Duration.ofHours(169);

    /** 同一用户欢迎语去重窗口 */
    private Duration welcomeDedupTtl = Duration.ofHours(1);

    /** 全局管理员，跳过平台角色查询 */
    private Set<Long> adminIds = new HashSet<>();

    @Data
    public static class Store {
        /** redis | memory */
        private String type = "redis";
        private String keyPrefix = "mod:";
    }

    @Data
    public static class Challenge {
        /** 存储 TTL = 超时 + grace，保证计时器先于记录过期触发 */
        private Duration grace = Duration.ofSeconds(60);
        private Duration failMuteDuration = Duration.ofHours(24);
        private int optionCount = 4;
    }

    @Data
    public static class Cache {
        private long settingsMaxSize = 10_000;
        private Duration adminTtl = Duration.ofMinutes(5);
        private long adminMaxSize = 50_000;
    }

    @Data
    public static class Masking {
        private String salt;
    }
}
