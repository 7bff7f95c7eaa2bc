package com.jz.moderation.domain.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 一条消息的审核结论。由引擎产出，由执行层落地。
 */
@Value
@Builder
public class ModerationResult {

    public static final String REASON_CRYPTO_SCAM = "crypto_scam";
    public static final String REASON_ADULT = "adult_content";
    public static final String REASON_SPAM_PATTERN = "spam_pattern";
    public static final String REASON_FLOOD = "flood";
    public static final String REASON_NEWBIE_LINK = "newbie_link";
    public static final String REASON_FILTER_PREFIX = "filter:";

    ModerationAction action;
    String reason;
    boolean shouldDelete;
    /** 仅 MUTE 有意义 */
    int muteDurationMin;
    String details;
    /** 刷屏命中时窗口内需要一并清理的消息 */
    @Builder.Default List<Long> relatedMessageIds = List.of();

    private static final ModerationResult NONE = ModerationResult.builder().action(ModerationAction.NONE).build();

    public static ModerationResult none() {
        return NONE;
    }

    public static ModerationResult delete(String reason, String details) {
        return ModerationResult.builder()
                .action(ModerationAction.DELETE).reason(reason).shouldDelete(true).details(details)
                .build();
    }

    public static ModerationResult mute(String reason, int minutes, String details, List<Long> relatedMessageIds) {
        return ModerationResult.builder()
                .action(ModerationAction.MUTE).reason(reason).shouldDelete(true)
                .muteDurationMin(minutes).details(details)
                .relatedMessageIds(List.copyOf(relatedMessageIds))
                .build();
    }

    public boolean isFilterMatch() {
        return reason != null && reason.startsWith(REASON_FILTER_PREFIX);
    }
}
