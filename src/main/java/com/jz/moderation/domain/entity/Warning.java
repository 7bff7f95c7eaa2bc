package com.jz.moderation.domain.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class Warning {
    String id;
    long chatId;
    long userId;
    /** null = 系统发出 */
    Long adminId;
    String reason;
    Instant createdAt;
}
