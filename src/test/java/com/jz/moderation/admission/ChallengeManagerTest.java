package com.jz.moderation.admission;

import com.jz.moderation.domain.entity.Challenge;
import com.jz.moderation.domain.entity.ChallengeDifficulty;
import com.jz.moderation.domain.entity.ChallengeState;
import com.jz.moderation.domain.entity.FailAction;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.ModActionType;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.service.AuditLogService;
import com.jz.moderation.store.InMemoryModerationStore;
import com.jz.moderation.support.MutableClock;
import com.jz.moderation.transport.ChatPermissions;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.OutboundMessage;
import com.jz.moderation.transport.TransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.jz.moderation.support.TestFixtures.CHAT;
import static com.jz.moderation.support.TestFixtures.T0;
import static com.jz.moderation.support.TestFixtures.masker;
import static com.jz.moderation.support.TestFixtures.props;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChallengeManagerTest {

    private static final long USER = 77L;

    private MutableClock clock;
    private InMemoryModerationStore store;
    private ChatTransport transport;
    private AuditLogService auditLog;
    private ScheduledExecutorService scheduler;
    private final List<Runnable> tasks = new ArrayList<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<Long> delays = new ArrayList<>();
    private ChallengeManager manager;
    private PolicySettings settings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryModerationStore(clock);
        transport = mock(ChatTransport.class);
        auditLog = mock(AuditLogService.class);
        scheduler = mock(ScheduledExecutorService.class);
        doAnswer(inv -> {
            tasks.add(inv.getArgument(0));
            delays.add(inv.getArgument(1));
            ScheduledFuture<?> f = mock(ScheduledFuture.class);
            futures.add(f);
            return f;
        }).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        when(transport.sendMessage(anyLong(), any())).thenReturn(500L, 501L, 502L);

        manager = new ChallengeManager(store, transport, auditLog, new ChallengeGenerator(new Random(7), 4),
                scheduler, props(), clock, masker(), new SimpleMeterRegistry());
        settings = PolicySettings.defaults(CHAT).toBuilder()
                .captchaEnabled(true)
                .captchaTimeoutSec(120)
                .captchaDifficulty(ChallengeDifficulty.MEDIUM)
                .captchaFailAction(FailAction.KICK)
                .build();
    }

    private Challenge issue() {
        return manager.issue(settings, USER, "Alice").orElseThrow();
    }

    @Test
    void issue_sends_prompt_with_options_and_starts_one_timer() {
        Challenge c = issue();

        ArgumentCaptor<OutboundMessage> msg = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(transport).sendMessage(eq(CHAT), msg.capture());
        assertThat(msg.getValue().buttons()).isEqualTo(c.getOptions()).contains(c.getAnswer());
        assertThat(msg.getValue().text()).contains("Alice").contains("120 seconds");

        assertThat(c.getMessageId()).isEqualTo(500L);
        assertThat(c.getExpiresAt()).isEqualTo(T0.plusSeconds(120));
        assertThat(store.findChallenge(CHAT, USER)).contains(c);
        assertThat(delays).containsExactly(120_000L);
        assertThat(manager.hasPendingTimer(CHAT, USER)).isTrue();
    }

    @Test
    void correct_answer_solves_cancels_timer_and_removes_prompt() {
        Challenge c = issue();

        ChallengeState state = manager.verify(CHAT, USER, "  " + c.getAnswer() + " ");

        assertThat(state).isEqualTo(ChallengeState.SOLVED);
        verify(futures.get(0)).cancel(false);
        verify(transport).deleteMessage(CHAT, 500L);
        assertThat(store.findChallenge(CHAT, USER)).isEmpty();
        assertThat(manager.hasPendingTimer(CHAT, USER)).isFalse();

        // 已取消的计时器即便仍被触发也不应有任何动作
        tasks.get(0).run();
        verify(transport, never()).banUser(anyLong(), anyLong());
        verify(auditLog, never()).record(any());
    }

    @Test
    void wrong_answer_keeps_challenge_live() {
        Challenge c = issue();

        assertThat(manager.verify(CHAT, USER, "not-a-number")).isEqualTo(ChallengeState.ISSUED);
        assertThat(store.findChallenge(CHAT, USER)).isPresent();
        assertThat(manager.verify(CHAT, USER, c.getAnswer())).isEqualTo(ChallengeState.SOLVED);
    }

    @Test
    void no_challenge_means_expired() {
        assertThat(manager.verify(CHAT, USER, "5")).isEqualTo(ChallengeState.EXPIRED);
    }

    @Test
    void timeout_kicks_deletes_prompt_and_audits_once() {
        Challenge c = issue();

        assertThat(manager.handleTimeout(CHAT, USER, c.getId())).isEqualTo(ChallengeState.EXPIRED);
        assertThat(manager.handleTimeout(CHAT, USER, c.getId())).isEqualTo(ChallengeState.SOLVED);

        verify(transport, times(1)).banUser(CHAT, USER);
        verify(transport, times(1)).unbanUser(CHAT, USER);
        verify(transport).deleteMessage(CHAT, 500L);
        ArgumentCaptor<ModAction> action = ArgumentCaptor.forClass(ModAction.class);
        verify(auditLog, times(1)).record(action.capture());
        assertThat(action.getValue().getActionType()).isEqualTo(ModActionType.KICK);
        assertThat(action.getValue().isAuto()).isTrue();
        assertThat(action.getValue().getReason()).isEqualTo(ChallengeManager.TIMEOUT_REASON);
        assertThat(store.findChallenge(CHAT, USER)).isEmpty();
        assertThat(manager.hasPendingTimer(CHAT, USER)).isFalse();
    }

    @Test
    void scheduled_task_runs_timeout_handler() {
        issue();

        tasks.get(0).run();

        verify(transport).banUser(CHAT, USER);
    }

    @Test
    void mute_fail_action_restricts_for_a_day() {
        settings = settings.toBuilder().captchaFailAction(FailAction.MUTE).build();
        Challenge c = issue();

        manager.handleTimeout(CHAT, USER, c.getId());

        verify(transport).restrictUser(CHAT, USER, ChatPermissions.READ_ONLY, T0.plus(Duration.ofHours(24)));
        verify(transport, never()).banUser(anyLong(), anyLong());
        ArgumentCaptor<ModAction> action = ArgumentCaptor.forClass(ModAction.class);
        verify(auditLog).record(action.capture());
        assertThat(action.getValue().getActionType()).isEqualTo(ModActionType.MUTE);
    }

    @Test
    void late_answer_after_timeout_is_rejected() {
        Challenge c = issue();
        manager.handleTimeout(CHAT, USER, c.getId());

        assertThat(manager.verify(CHAT, USER, c.getAnswer())).isEqualTo(ChallengeState.EXPIRED);
    }

    @Test
    void reissue_supersedes_previous_challenge() {
        Challenge first = issue();
        Challenge second = issue();

        verify(futures.get(0)).cancel(false);
        assertThat(second.getId()).isNotEqualTo(first.getId());

        assertThat(manager.handleTimeout(CHAT, USER, first.getId())).isEqualTo(ChallengeState.SUPERSEDED);
        verify(transport, never()).banUser(anyLong(), anyLong());
        assertThat(manager.hasPendingTimer(CHAT, USER)).isTrue();
        assertThat(store.findChallenge(CHAT, USER)).contains(second);
        assertThat(manager.pendingTimers()).isEqualTo(1);
    }

    @Test
    void send_failure_leaves_no_challenge_and_no_timer() {
        when(transport.sendMessage(anyLong(), any())).thenThrow(new TransportException("forbidden"));

        Optional<Challenge> issued = manager.issue(settings, USER, "Bob");

        assertThat(issued).isEmpty();
        assertThat(store.findChallenge(CHAT, USER)).isEmpty();
        assertThat(tasks).isEmpty();
    }

    @Test
    void failed_fail_action_is_not_audited() {
        Challenge c = issue();
        doAnswer(inv -> {
            throw new TransportException("not enough rights");
        }).when(transport).banUser(CHAT, USER);

        assertThat(manager.handleTimeout(CHAT, USER, c.getId())).isEqualTo(ChallengeState.EXPIRED);
        verify(auditLog, never()).record(any());
    }

    @Test
    void interleaved_reissue_keeps_timer_on_the_stored_challenge() {
        AtomicReference<ChallengeManager> holder = new AtomicReference<>();
        AtomicReference<Challenge> second = new AtomicReference<>();
        AtomicBoolean interleaved = new AtomicBoolean(false);
        InMemoryModerationStore racing = new InMemoryModerationStore(clock) {
            @Override
            public synchronized void saveChallenge(Challenge challenge, Duration ttl) {
                super.saveChallenge(challenge, ttl);
                // 第一道题写入后、起计时器前，第二次出题完整跑完
                if (interleaved.compareAndSet(false, true)) {
                    second.set(holder.get().issue(settings, USER, "Alice").orElseThrow());
                }
            }
        };
        ChallengeManager racingManager = new ChallengeManager(racing, transport, auditLog,
                new ChallengeGenerator(new Random(7), 4), scheduler, props(), clock, masker(), new SimpleMeterRegistry());
        holder.set(racingManager);

        Challenge first = racingManager.issue(settings, USER, "Alice").orElseThrow();

        Challenge live = racing.findChallenge(CHAT, USER).orElseThrow();
        assertThat(live.getId()).isEqualTo(second.get().getId()).isNotEqualTo(first.getId());
        assertThat(tasks).hasSize(1);
        assertThat(racingManager.hasPendingTimer(CHAT, USER)).isTrue();
        verify(transport).deleteMessage(CHAT, first.getMessageId());

        tasks.get(0).run();

        verify(transport, times(1)).banUser(CHAT, USER);
        assertThat(racing.findChallenge(CHAT, USER)).isEmpty();
        assertThat(racingManager.hasPendingTimer(CHAT, USER)).isFalse();
    }
}
