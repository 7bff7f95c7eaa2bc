package com.jz.moderation.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jz.moderation.common.ForbiddenException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 管理员判定：全局管理员 → 平台角色（结果缓存 5 分钟）。平台查询失败按非管理员处理，且不缓存。
 */
@Slf4j
@Service
public class PermissionService {

    private final ChatTransport transport;
    private final ModerationProperties props;
    private final IdMasker masker;
    private final Cache<String, Boolean> adminCache;

    public PermissionService(ChatTransport transport, ModerationProperties props, IdMasker masker) {
        this.transport = transport;
        this.props = props;
        this.masker = masker;
        this.adminCache = Caffeine.newBuilder()
                .expireAfterWrite(props.getCache().getAdminTtl())
                .maximumSize(props.getCache().getAdminMaxSize())
                .build();
    }

    public boolean isAdmin(long chatId, long userId) {
        if (props.getAdminIds().contains(userId)) return true;
        try {
            return adminCache.get(chatId + ":" + userId,
                    k -> transport.getMemberStatus(chatId, userId).isAdmin());
        } catch (TransportException e) {
            log.warn("[Permission] role lookup failed chat={}, user={}, err={}",
                    masker.chat(chatId), masker.user(userId), e.getMessage());
            return false;
        }
    }

    public void requireAdmin(long chatId, long userId) {
        if (!isAdmin(chatId, userId)) {
            throw new ForbiddenException("user is not an administrator of this chat");
        }
    }
}
