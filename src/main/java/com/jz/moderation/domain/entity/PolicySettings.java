package com.jz.moderation.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 单个群的全部审核设置。不可变；修改走 toBuilder() + PolicyStore.save()。
 * JSON 形态为 snake_case，且不包含 chatId（chatId 永远来自调用方）。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class PolicySettings {

    @JsonIgnore
    long chatId;

    // 欢迎语
    @Builder.Default boolean welcomeEnabled = false;
    @Builder.Default String welcomeMessage = "Welcome, {username}!";
    @Builder.Default int welcomeDelaySec = 0;
    @Builder.Default int welcomeAutoDeleteSec = 0;
    @Builder.Default boolean welcomePrivate = false;

    // 刷屏
    @Builder.Default boolean spamEnabled = true;
    @Builder.Default int spamMessageLimit = 5;
    @Builder.Default int spamTimeWindowSec = 10;
    @Builder.Default int spamMuteDurationMin = 5;

    // 新人链接
    @Builder.Default boolean linkFilterEnabled = false;
    @Builder.Default int linkNewbieHours = 24;
    @Builder.Default LinkAction linkAction = LinkAction.HOLD;
    @Builder.Default List<String> linkWhitelist = List.of();

    // 警告升级
    @Builder.Default int warnMuteThreshold = 3;
    @Builder.Default int warnBanThreshold = 5;
    @Builder.Default int warnMuteDurationHours = 24;

    // 入群验证
    @Builder.Default boolean captchaEnabled = false;
    @Builder.Default int captchaTimeoutSec = 120;
    @Builder.Default ChallengeDifficulty captchaDifficulty = ChallengeDifficulty.EASY;
    @Builder.Default FailAction captchaFailAction = FailAction.KICK;

    // 关键词过滤
    @Builder.Default List<String> filterWords = List.of();
    @Builder.Default boolean filterNotifyUser = true;

    /** 审计日志转发目标（群/频道 id），null 表示不转发 */
    Long logChannelId;

    public static PolicySettings defaults(long chatId) {
        return PolicySettings.builder().chatId(chatId).build();
    }

    public PolicySettings withChatId(long chatId) {
        return chatId == this.chatId ? this : toBuilder().chatId(chatId).build();
    }

    public PolicySettings withFilterWords(List<String> words) {
        return toBuilder().filterWords(List.copyOf(words)).build();
    }
}
