package com.jz.moderation.domain.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * 一条审计记录。adminId 为空且 auto=true 表示系统自动处置。
 */
@Value
@Builder
@Jacksonized
public class ModAction {
    String id;
    long chatId;
    ModActionType actionType;
    long targetUserId;
    Long adminId;
    String reason;
    Instant createdAt;
    boolean auto;

    public static ModAction automatic(long chatId, ModActionType type, long userId, String reason, Instant at) {
        return ModAction.builder()
                .id(UUID.randomUUID().toString())
                .chatId(chatId).actionType(type).targetUserId(userId)
                .reason(reason).createdAt(at).auto(true)
                .build();
    }

    public static ModAction byAdmin(long chatId, ModActionType type, long userId, long adminId, String reason, Instant at) {
        return ModAction.builder()
                .id(UUID.randomUUID().toString())
                .chatId(chatId).actionType(type).targetUserId(userId)
                .adminId(adminId).reason(reason).createdAt(at).auto(false)
                .build();
    }
}
