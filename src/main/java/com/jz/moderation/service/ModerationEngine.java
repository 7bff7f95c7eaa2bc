package com.jz.moderation.service;

import com.jz.moderation.admission.ChallengeManager;
import com.jz.moderation.common.StoreException;
import com.jz.moderation.domain.dto.FilterCheckResult;
import com.jz.moderation.domain.dto.FloodCheck;
import com.jz.moderation.domain.dto.JoinEventDTO;
import com.jz.moderation.domain.dto.JoinOutcome;
import com.jz.moderation.domain.dto.MessageEventDTO;
import com.jz.moderation.domain.dto.ModerationAction;
import com.jz.moderation.domain.dto.ModerationResult;
import com.jz.moderation.domain.dto.WarnResult;
import com.jz.moderation.domain.dto.WordListChange;
import com.jz.moderation.domain.entity.ChallengeState;
import com.jz.moderation.domain.entity.LinkAction;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.ModActionType;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.domain.entity.Warning;
import com.jz.moderation.guard.ContentFilter;
import com.jz.moderation.guard.FloodDetector;
import com.jz.moderation.guard.NewbieLinkGate;
import com.jz.moderation.guard.SpamCategory;
import com.jz.moderation.guard.WarnTracker;
import com.jz.moderation.security.IdMasker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 审核总入口：每个入站事件产出恰好一个结论。
 * <p>
 * 消息管线：关键词过滤 → 垃圾特征 → 新人链接 → 刷屏计数，前一步命中即短路。
 * 入群：跳过机器人 → 记录入群时间 → 出验证题 或 发欢迎语。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationEngine {

    private final PolicySettingsCache settingsCache;
    private final PolicyStore policyStore;
    private final ContentFilter contentFilter;
    private final FloodDetector floodDetector;
    private final NewbieLinkGate linkGate;
    private final WarnTracker warnTracker;
    private final ChallengeManager challengeManager;
    private final WelcomeService welcomeService;
    private final AuditLogService auditLog;
    private final PermissionService permissions;
    private final Clock clock;
    private final IdMasker masker;
    private final MeterRegistry meterRegistry;

    public PolicySettings settings(long chatId) {
        return settingsCache.get(chatId);
    }

    // ======================= events =======================

    public JoinOutcome onJoin(JoinEventDTO event) {
        if (event.isBot()) return JoinOutcome.IGNORED_BOT;

        long chatId = event.getChatId();
        long userId = event.getUserId();
        PolicySettings s = settings(chatId);
        try {
            linkGate.recordJoin(chatId, userId, clock.instant());
        } catch (StoreException e) {
            // 记录缺失时链接门禁按新人处理，不影响后续
            log.warn("[Engine] join record failed chat={}, user={}, err={}",
                    masker.chat(chatId), masker.user(userId), e.getMessage());
        }

        if (s.isCaptchaEnabled()) {
            return challengeManager.issue(s, userId, event.getDisplayName()).isPresent()
                    ? JoinOutcome.CHALLENGED : JoinOutcome.ADMITTED;
        }
        if (welcomeService.welcome(s, event)) return JoinOutcome.WELCOMED;
        return JoinOutcome.ADMITTED;
    }

    public ModerationResult onMessage(MessageEventDTO msg) {
        ModerationResult result = decide(msg);
        Counter.builder("moderation.decision.count")
                .tag("action", result.getAction().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        if (result.getAction() != ModerationAction.NONE) {
            log.info("[Engine] decision={} reason={} chat={}, user={}",
                    result.getAction(), result.getReason(), masker.chat(msg.getChatId()), masker.user(msg.getUserId()));
        }
        return result;
    }

    private ModerationResult decide(MessageEventDTO msg) {
        // 机器人消息不审核
        if (msg.isBot()) return ModerationResult.none();
        String text = msg.getText();
        if (text == null || text.isBlank()) return ModerationResult.none();

        long chatId = msg.getChatId();
        long userId = msg.getUserId();
        PolicySettings s = settings(chatId);
        Instant now = msg.getSentAt() != null ? msg.getSentAt() : clock.instant();

        boolean anyGuard = !s.getFilterWords().isEmpty() || s.isSpamEnabled() || s.isLinkFilterEnabled();
        if (!anyGuard || permissions.isAdmin(chatId, userId)) return ModerationResult.none();

        // 1) 关键词
        if (!s.getFilterWords().isEmpty()) {
            FilterCheckResult fc = contentFilter.check(s, text);
            if (fc.filtered()) return ModerationResult.delete(fc.reason(), null);
        }

        if (s.isSpamEnabled() || s.isLinkFilterEnabled()) {
            // 2) 垃圾特征
            Optional<SpamCategory> category = floodDetector.matchPatterns(text);
            if (category.isPresent()) {
                return ModerationResult.delete(category.get().reason(), "pattern match");
            }

            // 3) 新人链接
            Optional<LinkAction> linkAction = linkGate.check(s, userId, text, now);
            if (linkAction.isPresent()) {
                return linkDecision(linkAction.get(), s);
            }
        }

        // 4) 刷屏
        if (s.isSpamEnabled()) {
            FloodCheck flood = floodDetector.recordAndCheck(s, userId, msg.getMessageId(), now);
            if (flood.tripped()) {
                return ModerationResult.mute(ModerationResult.REASON_FLOOD, s.getSpamMuteDurationMin(),
                        flood.count() + " messages in " + s.getSpamTimeWindowSec() + "s",
                        flood.offendingMessageIds());
            }
        }
        return ModerationResult.none();
    }

    private static ModerationResult linkDecision(LinkAction action, PolicySettings s) {
        String details = "link from member younger than " + s.getLinkNewbieHours() + "h";
        return switch (action) {
            case DELETE -> ModerationResult.delete(ModerationResult.REASON_NEWBIE_LINK, details);
            case WARN -> ModerationResult.builder()
                    .action(ModerationAction.WARN).reason(ModerationResult.REASON_NEWBIE_LINK).details(details)
                    .build();
            case HOLD -> ModerationResult.builder()
                    .action(ModerationAction.HOLD).reason(ModerationResult.REASON_NEWBIE_LINK).details(details)
                    .shouldDelete(true)
                    .build();
        };
    }

    /** 提交验证答案；答对后按设置发欢迎语 */
    public ChallengeState verifyChallenge(long chatId, long userId, String answer, String displayName) {
        ChallengeState state = challengeManager.verify(chatId, userId, answer);
        if (state == ChallengeState.SOLVED) {
            PolicySettings s = settings(chatId);
            welcomeService.welcome(s, JoinEventDTO.builder()
                    .chatId(chatId).userId(userId).displayName(displayName)
                    .build());
        }
        return state;
    }

    // ======================= warnings =======================

    public WarnResult addWarning(long chatId, long userId, Long adminId, String reason) {
        PolicySettings s = settings(chatId);
        Instant now = clock.instant();
        WarnResult result = warnTracker.addWarning(s, userId, adminId, reason, now);
        ModAction action = adminId == null
                ? ModAction.automatic(chatId, ModActionType.WARN, userId, reason, now)
                : ModAction.byAdmin(chatId, ModActionType.WARN, userId, adminId, reason, now);
        auditLog.record(action);
        return result;
    }

    public List<Warning> listWarnings(long chatId, long userId) {
        return warnTracker.listWarnings(chatId, userId);
    }

    public long clearWarnings(long chatId, long userId, long adminId) {
        long removed = warnTracker.clearWarnings(chatId, userId);
        if (removed > 0) {
            auditLog.record(ModAction.byAdmin(chatId, ModActionType.CLEAR_WARNS, userId, adminId,
                    "Cleared " + removed + " warning(s)", clock.instant()));
        }
        return removed;
    }

    // ======================= filter words =======================

    public WordListChange addFilterWord(long chatId, String word) {
        return contentFilter.addWord(chatId, word);
    }

    public WordListChange removeFilterWord(long chatId, String word) {
        return contentFilter.removeWord(chatId, word);
    }

    public List<String> filterWords(long chatId) {
        return contentFilter.words(chatId);
    }

    public int clearFilterWords(long chatId) {
        return contentFilter.clear(chatId);
    }

    // ======================= settings =======================

    public PolicySettings updateSettings(long chatId, PolicySettings settings) {
        PolicySettings saved = policyStore.save(settings.withChatId(chatId));
        settingsCache.invalidate(chatId);
        return saved;
    }

    public void resetSettings(long chatId) {
        policyStore.reset(chatId);
        settingsCache.invalidate(chatId);
    }

    public String exportSettings(long chatId) {
        return policyStore.exportJson(chatId);
    }

    public PolicySettings importSettings(long chatId, String json) {
        PolicySettings saved = policyStore.importJson(chatId, json);
        settingsCache.invalidate(chatId);
        return saved;
    }

    // ======================= audit =======================

    public List<ModAction> modLog(long chatId, int limit, Long userId) {
        return auditLog.recent(chatId, limit, userId);
    }
}
