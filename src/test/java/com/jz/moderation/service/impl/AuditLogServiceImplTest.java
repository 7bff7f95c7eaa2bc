package com.jz.moderation.service.impl;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.ModActionType;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.service.PolicySettingsCache;
import com.jz.moderation.store.InMemoryModerationStore;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.support.MutableClock;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.OutboundMessage;
import com.jz.moderation.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static com.jz.moderation.support.TestFixtures.CHAT;
import static com.jz.moderation.support.TestFixtures.T0;
import static com.jz.moderation.support.TestFixtures.masker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuditLogServiceImplTest {

    private static final long SINK = -100999L;

    private InMemoryModerationStore store;
    private ChatTransport transport;
    private PolicySettingsCache settingsCache;
    private ModerationProperties props;
    private AuditLogServiceImpl auditLog;

    @BeforeEach
    void setUp() {
        store = new InMemoryModerationStore(new MutableClock(T0));
        transport = mock(ChatTransport.class);
        settingsCache = mock(PolicySettingsCache.class);
        when(settingsCache.get(CHAT)).thenReturn(PolicySettings.defaults(CHAT));
        props = new ModerationProperties();
        props.setModlogMaxEntries(3);
        auditLog = new AuditLogServiceImpl(store, transport, settingsCache, props, masker());
    }

    private static ModAction auto(long userId, String reason, int secondsAfter) {
        return ModAction.automatic(CHAT, ModActionType.FILTER, userId, reason, T0.plusSeconds(secondsAfter));
    }

    @Test
    void keeps_only_the_newest_entries() {
        for (int i = 0; i < 5; i++) {
            assertThat(auditLog.record(auto(1L, "r" + i, i))).isTrue();
        }

        List<ModAction> recent = auditLog.recent(CHAT, 10, null);

        assertThat(recent).extracting(ModAction::getReason).containsExactly("r4", "r3", "r2");
    }

    @Test
    void filters_by_target_user() {
        auditLog.record(auto(1L, "a", 0));
        auditLog.record(auto(2L, "b", 1));
        auditLog.record(auto(1L, "c", 2));

        assertThat(auditLog.recent(CHAT, 5, 1L)).extracting(ModAction::getReason).containsExactly("c", "a");
        assertThat(auditLog.recent(CHAT, 1, 1L)).extracting(ModAction::getReason).containsExactly("c");
        assertThat(auditLog.recent(CHAT, 0, null)).isEmpty();
    }

    @Test
    void no_sink_means_no_delivery() {
        auditLog.record(auto(1L, "x", 0));

        verify(transport, never()).sendMessage(anyLong(), any());
    }

    @Test
    void forwards_escaped_html_to_sink() {
        when(settingsCache.get(CHAT)).thenReturn(PolicySettings.defaults(CHAT).toBuilder().logChannelId(SINK).build());

        auditLog.record(ModAction.byAdmin(CHAT, ModActionType.BAN, 42L, 7L, "<script>spam</script>", T0));

        ArgumentCaptor<OutboundMessage> msg = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(transport).sendMessage(eq(SINK), msg.capture());
        String text = msg.getValue().text();
        assertThat(text).contains("<b>Ban</b>")
                .contains("User: <code>42</code>")
                .contains("Admin: <code>7</code>")
                .contains("&lt;script&gt;spam&lt;/script&gt;")
                .contains("2025-03-01 12:00:00 UTC")
                .doesNotContain("<script>");
    }

    @Test
    void automatic_action_is_labelled_as_such() {
        String text = AuditLogServiceImpl.format(auto(42L, "filter:casino", 0));

        assertThat(text).contains("Admin: automatic").contains("Reason: filter:casino");
    }

    @Test
    void sink_failure_does_not_lose_the_entry() {
        when(settingsCache.get(CHAT)).thenReturn(PolicySettings.defaults(CHAT).toBuilder().logChannelId(SINK).build());
        when(transport.sendMessage(anyLong(), any())).thenThrow(new TransportException("chat not found"));

        assertThat(auditLog.record(auto(1L, "x", 0))).isTrue();
        assertThat(auditLog.recent(CHAT, 10, null)).hasSize(1);
    }

    @Test
    void store_failure_is_reported_and_sink_still_notified() {
        ModerationStore broken = mock(ModerationStore.class);
        doThrow(new StoreException("down")).when(broken).appendModAction(any(), anyInt());
        when(broken.findModActions(anyLong(), anyInt())).thenThrow(new StoreException("down"));
        when(settingsCache.get(CHAT)).thenReturn(PolicySettings.defaults(CHAT).toBuilder().logChannelId(SINK).build());
        AuditLogServiceImpl degraded = new AuditLogServiceImpl(broken, transport, settingsCache, props, masker());

        assertThat(degraded.record(auto(1L, "x", 0))).isFalse();
        verify(transport).sendMessage(eq(SINK), any());
        assertThat(degraded.recent(CHAT, 10, null)).isEmpty();
    }
}
