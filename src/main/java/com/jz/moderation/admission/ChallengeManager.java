package com.jz.moderation.admission;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.domain.entity.Challenge;
import com.jz.moderation.domain.entity.ChallengeState;
import com.jz.moderation.domain.entity.FailAction;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.ModActionType;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.service.AuditLogService;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.transport.ChatPermissions;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.OutboundMessage;
import com.jz.moderation.transport.TransportException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 入群验证生命周期：ISSUED → SOLVED | EXPIRED | SUPERSEDED。
 * <p>
 * 每个 (chat, user) 最多一个计时器，新题发出前先取消旧的。
 * 超时与答对之间的竞争由存储层的 "id 匹配才删除" 仲裁，保证只有一个终态动作。
 */
@Slf4j
@Component
public class ChallengeManager {

    static final String TIMEOUT_REASON = "Challenge failed (timeout)";

    private final ModerationStore store;
    private final ChatTransport transport;
    private final AuditLogService auditLog;
    private final ChallengeGenerator generator;
    private final ScheduledExecutorService scheduler;
    private final ModerationProperties props;
    private final Clock clock;
    private final IdMasker masker;
    private final MeterRegistry meterRegistry;

    /** key(chat:user) -> 当前计时器 */
    private final ConcurrentMap<String, PendingTimeout> timers = new ConcurrentHashMap<>();

    private record PendingTimeout(String challengeId, ScheduledFuture<?> future) {
    }

    public ChallengeManager(ModerationStore store,
                            ChatTransport transport,
                            AuditLogService auditLog,
                            ChallengeGenerator generator,
                            @Qualifier("moderationScheduler") ScheduledExecutorService scheduler,
                            ModerationProperties props,
                            Clock clock,
                            IdMasker masker,
                            MeterRegistry meterRegistry) {
        this.store = store;
        this.transport = transport;
        this.auditLog = auditLog;
        this.generator = generator;
        this.scheduler = scheduler;
        this.props = props;
        this.clock = clock;
        this.masker = masker;
        this.meterRegistry = meterRegistry;
        Gauge.builder("moderation.challenge.pending", timers, ConcurrentMap::size)
                .description("live challenge timers")
                .register(meterRegistry);
    }

    /**
     * 出题、发送、起计时器。同一用户已有存活题目时直接替换（旧题进入 SUPERSEDED）。
     * 题目在发送成功后才写入存储；起计时器前再核对存储中的题目 id，
     * 并发出题时只有最终留在存储里的那道题持有计时器。
     *
     * @return 发送失败时为空，此时不留存活题目也不起计时器
     * @throws StoreException 题目写入失败
     */
    public Optional<Challenge> issue(PolicySettings s, long userId, String displayName) {
        long chatId = s.getChatId();
        Instant now = clock.instant();
        Duration timeout = Duration.ofSeconds(s.getCaptchaTimeoutSec());
        Duration ttl = timeout.plus(props.getChallenge().getGrace());

        ChallengeQuestion q = generator.generate(s.getCaptchaDifficulty());
        long messageId;
        try {
            messageId = transport.sendMessage(chatId,
                    OutboundMessage.withButtons(prompt(displayName, q, s.getCaptchaTimeoutSec()), q.options()));
        } catch (TransportException e) {
            log.warn("[Challenge] send failed, challenge dropped. chat={}, user={}, err={}",
                    masker.chat(chatId), masker.user(userId), e.getMessage());
            return Optional.empty();
        }

        Challenge challenge = Challenge.builder()
                .id(UUID.randomUUID().toString())
                .chatId(chatId)
                .userId(userId)
                .question(q.question())
                .answer(q.answer())
                .options(q.options())
                .difficulty(s.getCaptchaDifficulty())
                .failAction(s.getCaptchaFailAction())
                .messageId(messageId)
                .createdAt(now)
                .expiresAt(now.plus(timeout))
                .build();
        store.saveChallenge(challenge, ttl);
        if (!schedule(challenge, timeout)) {
            // 已被并发出的新题覆盖，撤掉本题的消息
            log.debug("[Challenge] superseded before timer start chat={}, user={}",
                    masker.chat(chatId), masker.user(userId));
            deleteMessageQuietly(challenge);
            return Optional.of(challenge);
        }
        log.info("[Challenge] issued chat={}, user={}, difficulty={}, timeout={}s",
                masker.chat(chatId), masker.user(userId), s.getCaptchaDifficulty().code(), s.getCaptchaTimeoutSec());
        return Optional.of(challenge);
    }

    /**
     * 校验答案（去首尾空白、忽略大小写）。
     *
     * @return SOLVED 答对；ISSUED 答错但题目仍有效；EXPIRED 没有存活题目（含超时抢先的情况）
     */
    public ChallengeState verify(long chatId, long userId, String answer) {
        Optional<Challenge> live = store.findChallenge(chatId, userId);
        if (live.isEmpty()) return ChallengeState.EXPIRED;

        Challenge c = live.get();
        if (!c.isAnswer(answer)) {
            outcome("wrong_answer");
            return ChallengeState.ISSUED;
        }

        // 先撤计时器再删记录
        cancelTimer(chatId, userId, c.getId());
        if (!store.deleteChallenge(chatId, userId, c.getId())) {
            log.debug("[Challenge] solved too late chat={}, user={}", masker.chat(chatId), masker.user(userId));
            return ChallengeState.EXPIRED;
        }
        deleteMessageQuietly(c);
        outcome("solved");
        log.info("[Challenge] solved chat={}, user={}", masker.chat(chatId), masker.user(userId));
        return ChallengeState.SOLVED;
    }

    /**
     * 计时器回调。只处理仍是同一 id 的存活题目，否则什么都不做。
     *
     * @return EXPIRED 已执行失败处置；SUPERSEDED 已被新题替换；SOLVED 已不存在（答对或被清理）
     */
    public ChallengeState handleTimeout(long chatId, long userId, String challengeId) {
        timers.computeIfPresent(key(chatId, userId),
                (k, p) -> p.challengeId().equals(challengeId) ? null : p);

        Optional<Challenge> live = store.findChallenge(chatId, userId);
        if (live.isEmpty()) return ChallengeState.SOLVED;
        Challenge c = live.get();
        if (!c.getId().equals(challengeId)) return ChallengeState.SUPERSEDED;
        if (!store.deleteChallenge(chatId, userId, challengeId)) return ChallengeState.SOLVED;

        deleteMessageQuietly(c);
        if (applyFailAction(c)) {
            ModActionType type = c.getFailAction() == FailAction.MUTE ? ModActionType.MUTE : ModActionType.KICK;
            auditLog.record(ModAction.automatic(chatId, type, userId, TIMEOUT_REASON, clock.instant()));
        }
        outcome("expired");
        log.info("[Challenge] expired chat={}, user={}, action={}",
                masker.chat(chatId), masker.user(userId), c.getFailAction().code());
        return ChallengeState.EXPIRED;
    }

    public boolean hasPendingTimer(long chatId, long userId) {
        return timers.containsKey(key(chatId, userId));
    }

    public int pendingTimers() {
        return timers.size();
    }

    /** @return 是否为该题起了计时器；存储里已是别的题目时返回 false */
    private boolean schedule(Challenge c, Duration delay) {
        long chatId = c.getChatId();
        long userId = c.getUserId();
        String challengeId = c.getId();
        AtomicBoolean started = new AtomicBoolean(false);
        timers.compute(key(chatId, userId), (k, old) -> {
            if (!isStored(c)) return old;
            if (old != null) old.future().cancel(false);
            ScheduledFuture<?> f = scheduler.schedule(() -> runTimeout(chatId, userId, challengeId),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
            started.set(true);
            return new PendingTimeout(challengeId, f);
        });
        return started.get();
    }

    private boolean isStored(Challenge c) {
        try {
            return store.findChallenge(c.getChatId(), c.getUserId())
                    .map(live -> live.getId().equals(c.getId()))
                    .orElse(false);
        } catch (StoreException e) {
            // 读不到时照常起计时器，超时回调会再按 id 核对
            log.warn("[Challenge] live check failed chat={}, user={}, err={}",
                    masker.chat(c.getChatId()), masker.user(c.getUserId()), e.getMessage());
            return true;
        }
    }

    private void runTimeout(long chatId, long userId, String challengeId) {
        try {
            handleTimeout(chatId, userId, challengeId);
        } catch (RuntimeException e) {
            log.error("[Challenge] timeout handling failed chat={}, user={}, err={}",
                    masker.chat(chatId), masker.user(userId), e.toString());
        }
    }

    private void cancelTimer(long chatId, long userId, String challengeId) {
        timers.computeIfPresent(key(chatId, userId), (k, p) -> {
            if (!p.challengeId().equals(challengeId)) return p;
            p.future().cancel(false);
            return null;
        });
    }

    private boolean applyFailAction(Challenge c) {
        long chatId = c.getChatId();
        long userId = c.getUserId();
        try {
            if (c.getFailAction() == FailAction.MUTE) {
                transport.restrictUser(chatId, userId, ChatPermissions.READ_ONLY,
                        clock.instant().plus(props.getChallenge().getFailMuteDuration()));
            } else {
                // 踢出 = 封禁后立刻解封，允许重新加入
                transport.banUser(chatId, userId);
                transport.unbanUser(chatId, userId);
            }
            return true;
        } catch (TransportException e) {
            log.warn("[Challenge] fail action {} not applied chat={}, user={}, err={}",
                    c.getFailAction().code(), masker.chat(chatId), masker.user(userId), e.getMessage());
            return false;
        }
    }

    private void deleteMessageQuietly(Challenge c) {
        if (c.getMessageId() == null) return;
        try {
            transport.deleteMessage(c.getChatId(), c.getMessageId());
        } catch (TransportException e) {
            log.debug("[Challenge] prompt delete failed chat={}, err={}", masker.chat(c.getChatId()), e.getMessage());
        }
    }

    private void outcome(String result) {
        Counter.builder("moderation.challenge.outcome")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static String prompt(String displayName, ChallengeQuestion q, int timeoutSec) {
        String name = displayName == null || displayName.isBlank() ? "newcomer" : displayName;
        return "👋 " + HtmlUtils.htmlEscape(name) + ", please confirm you are human.\n\n"
                + "<b>" + HtmlUtils.htmlEscape(q.question()) + "</b>\n\n"
                + "You have " + timeoutSec + " seconds to answer.";
    }

    private static String key(long chatId, long userId) {
        return chatId + ":" + userId;
    }
}
