package com.jz.moderation.domain.dto;

import com.jz.moderation.domain.entity.Warning;

/**
 * 追加警告后的结果。escalation 只是建议，由调用方执行。
 */
public record WarnResult(Warning warning, long totalCount, Escalation escalation, int muteDurationHours) {
}
