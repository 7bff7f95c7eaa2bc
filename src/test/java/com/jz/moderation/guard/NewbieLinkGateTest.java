package com.jz.moderation.guard;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.domain.entity.LinkAction;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.store.InMemoryModerationStore;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.jz.moderation.support.TestFixtures.CHAT;
import static com.jz.moderation.support.TestFixtures.T0;
import static com.jz.moderation.support.TestFixtures.masker;
import static com.jz.moderation.support.TestFixtures.props;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NewbieLinkGateTest {

    private static final long USER = 5L;

    private MutableClock clock;
    private NewbieLinkGate gate;
    private PolicySettings settings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        gate = new NewbieLinkGate(new InMemoryModerationStore(clock), props(), masker());
        settings = PolicySettings.defaults(CHAT).toBuilder()
                .linkFilterEnabled(true)
                .linkNewbieHours(24)
                .linkAction(LinkAction.DELETE)
                .linkWhitelist(List.of("GitHub.com"))
                .build();
    }

    @Test
    void unknown_member_is_treated_as_newbie() {
        assertThat(gate.check(settings, USER, "look at https://evil.example/x", T0)).contains(LinkAction.DELETE);
    }

    @Test
    void newbie_window_expires() {
        gate.recordJoin(CHAT, USER, T0);

        assertThat(gate.check(settings, USER, "go to example.org", T0.plus(Duration.ofHours(23)))).isPresent();
        assertThat(gate.check(settings, USER, "go to example.org", T0.plus(Duration.ofHours(24)))).isEmpty();
    }

    @Test
    void whitelisted_links_pass_but_mixed_messages_do_not() {
        assertThat(gate.check(settings, USER, "see https://github.com/org/repo", T0)).isEmpty();
        assertThat(gate.check(settings, USER, "https://github.com/a and bad.ru", T0)).isPresent();
    }

    @Test
    void no_links_or_disabled_filter_pass() {
        assertThat(gate.check(settings, USER, "hello there", T0)).isEmpty();
        PolicySettings off = settings.toBuilder().linkFilterEnabled(false).build();
        assertThat(gate.check(off, USER, "https://evil.example", T0)).isEmpty();
    }

    @Test
    void zero_newbie_hours_disables_gate() {
        PolicySettings none = settings.toBuilder().linkNewbieHours(0).build();

        assertThat(gate.isNewbie(none, USER, T0)).isFalse();
    }

    @Test
    void store_failure_fails_closed() {
        ModerationStore broken = mock(ModerationStore.class);
        when(broken.findJoin(anyLong(), anyLong())).thenThrow(new StoreException("down"));
        NewbieLinkGate g = new NewbieLinkGate(broken, props(), masker());

        assertThat(g.isNewbie(settings, USER, T0)).isTrue();
    }

    @Test
    void join_record_expires_with_store_ttl() {
        gate.recordJoin(CHAT, USER, T0);
        clock.advance(Duration.ofHours(170));

        // 记录过期后重新视为新人
        assertThat(gate.isNewbie(settings, USER, clock.instant())).isTrue();
    }

    @Test
    void extracts_schemed_and_bare_urls() {
        assertThat(NewbieLinkGate.extractUrls("a https://x.io/p?q=1 b www.site.com c plain.net/path"))
                .containsExactly("https://x.io/p?q=1", "www.site.com", "plain.net/path");
    }
}
