package com.jz.moderation.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jz.moderation.common.StoreException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.security.IdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 设置缓存：容量有界，无 TTL，靠显式失效保持一致。
 * 存储不可用时返回默认值但不缓存，下次仍会重试加载。
 */
@Slf4j
@Component
public class PolicySettingsCache {

    private final PolicyStore policyStore;
    private final IdMasker masker;
    private final Cache<Long, PolicySettings> cache;

    public PolicySettingsCache(PolicyStore policyStore, IdMasker masker, ModerationProperties props) {
        this.policyStore = policyStore;
        this.masker = masker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.getCache().getSettingsMaxSize())
                .build();
    }

    public PolicySettings get(long chatId) {
        try {
            return cache.get(chatId, policyStore::loadOrDefaults);
        } catch (StoreException e) {
            log.warn("[SettingsCache] load failed, serving defaults. chat={}, err={}", masker.chat(chatId), e.getMessage());
            return PolicySettings.defaults(chatId);
        }
    }

    public void invalidate(long chatId) {
        cache.invalidate(chatId);
    }

    @EventListener
    public void onPolicyChanged(PolicyChangedEvent event) {
        invalidate(event.chatId());
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
