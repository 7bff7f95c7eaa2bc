package com.jz.moderation.service;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.common.ValidationException;
import com.jz.moderation.common.Violation;
import com.jz.moderation.domain.entity.ChallengeDifficulty;
import com.jz.moderation.domain.entity.LinkAction;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.store.InMemoryModerationStore;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.jz.moderation.support.TestFixtures.CHAT;
import static com.jz.moderation.support.TestFixtures.T0;
import static com.jz.moderation.support.TestFixtures.mapper;
import static com.jz.moderation.support.TestFixtures.masker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PolicyStoreTest {

    private ModerationStore store;
    private List<Object> events;
    private PolicyStore policyStore;

    @BeforeEach
    void setUp() {
        store = new InMemoryModerationStore(new MutableClock(T0));
        events = new ArrayList<>();
        policyStore = new PolicyStore(store, mapper(), events::add, masker());
    }

    @Test
    void get_returns_defaults_for_unknown_chat() {
        PolicySettings s = policyStore.get(CHAT);

        assertThat(s).isEqualTo(PolicySettings.defaults(CHAT));
    }

    @Test
    void get_degrades_to_defaults_when_store_fails() {
        ModerationStore broken = mock(ModerationStore.class);
        when(broken.findSettings(anyLong())).thenThrow(new StoreException("down"));
        PolicyStore ps = new PolicyStore(broken, mapper(), events::add, masker());

        assertThat(ps.get(CHAT)).isEqualTo(PolicySettings.defaults(CHAT));
    }

    @Test
    void save_rejects_invalid_settings_without_writing() {
        PolicySettings bad = PolicySettings.defaults(CHAT).toBuilder()
                .spamMessageLimit(99).captchaTimeoutSec(1)
                .build();

        ValidationException ex = catchThrowableOfType(() -> policyStore.save(bad), ValidationException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getViolations()).extracting(Violation::field)
                .containsExactlyInAnyOrder("spam_message_limit", "captcha_timeout_sec");
        assertThat(store.findSettings(CHAT)).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void save_persists_and_publishes_change_event() {
        PolicySettings s = PolicySettings.defaults(CHAT).toBuilder().captchaEnabled(true).build();

        policyStore.save(s);

        assertThat(policyStore.get(CHAT).isCaptchaEnabled()).isTrue();
        assertThat(events).containsExactly(new PolicyChangedEvent(CHAT));
    }

    @Test
    void save_propagates_store_failure() {
        ModerationStore broken = mock(ModerationStore.class);
        org.mockito.Mockito.doThrow(new StoreException("down")).when(broken).saveSettings(any());
        PolicyStore ps = new PolicyStore(broken, mapper(), events::add, masker());

        StoreException ex = catchThrowableOfType(() -> ps.save(PolicySettings.defaults(CHAT)), StoreException.class);

        assertThat(ex).isNotNull();
        assertThat(events).isEmpty();
    }

    @Test
    void update_applies_mutation_on_current_value() {
        policyStore.save(PolicySettings.defaults(CHAT).toBuilder().spamMessageLimit(7).build());

        PolicySettings updated = policyStore.update(CHAT, s -> s.toBuilder().welcomeEnabled(true).build());

        assertThat(updated.getSpamMessageLimit()).isEqualTo(7);
        assertThat(updated.isWelcomeEnabled()).isTrue();
        assertThat(policyStore.get(CHAT)).isEqualTo(updated);
    }

    @Test
    void reset_restores_defaults() {
        policyStore.save(PolicySettings.defaults(CHAT).toBuilder().captchaEnabled(true).build());

        policyStore.reset(CHAT);

        assertThat(policyStore.get(CHAT)).isEqualTo(PolicySettings.defaults(CHAT));
        assertThat(events).hasSize(2);
    }

    @Test
    void export_then_import_into_another_chat_keeps_everything_but_the_chat_id() {
        PolicySettings s = PolicySettings.defaults(CHAT).toBuilder()
                .captchaEnabled(true)
                .captchaDifficulty(ChallengeDifficulty.HARD)
                .linkAction(LinkAction.WARN)
                .linkWhitelist(List.of("github.com"))
                .filterWords(List.of("casino", "скам"))
                .logChannelId(-100999L)
                .build();
        policyStore.save(s);

        String json = policyStore.exportJson(CHAT);
        PolicySettings imported = policyStore.importJson(42L, json);

        assertThat(json).contains("\"captcha_difficulty\" : \"hard\"").doesNotContain("chat_id");
        assertThat(imported.getChatId()).isEqualTo(42L);
        assertThat(imported.withChatId(CHAT)).isEqualTo(s);
    }

    @Test
    void import_ignores_chat_id_in_payload() {
        PolicySettings imported = policyStore.importJson(CHAT, "{\"chat_id\": 777, \"spam_message_limit\": 8}");

        assertThat(imported.getChatId()).isEqualTo(CHAT);
        assertThat(imported.getSpamMessageLimit()).isEqualTo(8);
        assertThat(imported.getSpamTimeWindowSec()).isEqualTo(10);
    }

    @Test
    void import_rejects_unknown_fields_with_full_list() {
        ValidationException ex = catchThrowableOfType(
                () -> policyStore.importJson(CHAT, "{\"spam_limit\": 3, \"foo\": true, \"spam_enabled\": false}"),
                ValidationException.class);

        assertThat(ex.getViolations()).extracting(Violation::field).containsExactlyInAnyOrder("spam_limit", "foo");
        assertThat(store.findSettings(CHAT)).isEmpty();
    }

    @Test
    void import_rejects_malformed_json_and_bad_types() {
        assertThat(catchThrowableOfType(() -> policyStore.importJson(CHAT, "{not json"), ValidationException.class)
                .getViolations()).extracting(Violation::field).containsExactly("json");

        assertThat(catchThrowableOfType(() -> policyStore.importJson(CHAT, "[1,2]"), ValidationException.class))
                .isNotNull();

        ValidationException badEnum = catchThrowableOfType(
                () -> policyStore.importJson(CHAT, "{\"captcha_difficulty\": \"impossible\"}"),
                ValidationException.class);
        assertThat(badEnum.getViolations()).extracting(Violation::field).containsExactly("captcha_difficulty");

        ValidationException badType = catchThrowableOfType(
                () -> policyStore.importJson(CHAT, "{\"spam_message_limit\": \"many\"}"),
                ValidationException.class);
        assertThat(badType.getViolations()).extracting(Violation::field).containsExactly("spam_message_limit");
    }

    @Test
    void import_rejects_out_of_range_values() {
        ValidationException ex = catchThrowableOfType(
                () -> policyStore.importJson(CHAT, "{\"warn_mute_threshold\": 6, \"warn_ban_threshold\": 4}"),
                ValidationException.class);

        assertThat(ex.getViolations()).extracting(Violation::field).containsExactly("warn_mute_threshold");
        assertThat(store.findSettings(CHAT)).isEmpty();
    }
}
