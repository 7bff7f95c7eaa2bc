package com.jz.moderation.domain.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * 入群验证题。每个 (chatId, userId) 同时最多一个存活实例，id 用于区分新旧实例。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Challenge {
    String id;
    long chatId;
    long userId;
    String question;
    String answer;
    List<String> options;
    ChallengeDifficulty difficulty;
    FailAction failAction;
    /** 平台上的题目消息 id，发送成功后回填 */
    Long messageId;
    Instant createdAt;
    Instant expiresAt;
    @Builder.Default ChallengeState state = ChallengeState.ISSUED;

    public boolean isAnswer(String candidate) {
        return candidate != null && answer.trim().equalsIgnoreCase(candidate.trim());
    }
}
