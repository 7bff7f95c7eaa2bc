package com.jz.moderation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.moderation.store.InMemoryModerationStore;
import com.jz.moderation.store.ModerationRedisKeys;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.store.RedisModerationStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.util.List;

@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ModerationRedisKeys moderationRedisKeys(ModerationProperties props) {
        return new ModerationRedisKeys(props.getStore().getKeyPrefix());
    }

    @Bean
    @SuppressWarnings("rawtypes")
    @ConditionalOnProperty(prefix = "moderation.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public ModerationStore redisModerationStore(StringRedisTemplate redis,
                                                ObjectMapper mapper,
                                                ModerationRedisKeys keys,
                                                DefaultRedisScript<List> floodWindowScript,
                                                DefaultRedisScript<Long> modlogAppendScript,
                                                DefaultRedisScript<Long> clearListScript,
                                                DefaultRedisScript<Long> challengeDeleteScript) {
        return new RedisModerationStore(redis, mapper, keys,
                floodWindowScript, modlogAppendScript, clearListScript, challengeDeleteScript);
    }

    @Bean
    @ConditionalOnProperty(prefix = "moderation.store", name = "type", havingValue = "memory")
    public ModerationStore inMemoryModerationStore(Clock clock) {
        return new InMemoryModerationStore(clock);
    }
}
