package com.jz.moderation;

import com.jz.moderation.domain.entity.Challenge;
import com.jz.moderation.store.ModerationStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ModerationApplicationTests {

    private static final String ADMIN = "1000";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ModerationStore store;

    @Test
    void filtered_message_is_deleted_and_logged() throws Exception {
        long chat = -1001L;
        mvc.perform(post("/api/moderation/{chat}/filters/{word}", chat, "Casino").header("X-Admin-Id", ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("ADDED"));

        mvc.perform(post("/api/moderation/{chat}/messages", chat)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":55,\"messageId\":10,\"text\":\"CASINO tonight\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.action").value("DELETE"))
                .andExpect(jsonPath("$.data.reason").value("filter:casino"));

        mvc.perform(get("/api/moderation/{chat}/modlog", chat).header("X-Admin-Id", ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].actionType").value("filter"))
                .andExpect(jsonPath("$.data[0].targetUserId").value(55));
    }

    @Test
    void captcha_join_then_answer() throws Exception {
        long chat = -1002L;
        mvc.perform(put("/api/moderation/{chat}/settings", chat).header("X-Admin-Id", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"captcha_enabled\":true,\"captcha_timeout_sec\":60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.captcha_enabled").value(true))
                .andExpect(jsonPath("$.data.spam_message_limit").value(5));

        mvc.perform(post("/api/moderation/{chat}/joins", chat)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":77,\"displayName\":\"Ann\"}"))
                .andExpect(jsonPath("$.data").value("CHALLENGED"));

        Challenge live = store.findChallenge(chat, 77L).orElseThrow();
        assertThat(live.getOptions()).contains(live.getAnswer());

        mvc.perform(post("/api/moderation/{chat}/challenges/{user}/answer", chat, 77)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"not a number\"}"))
                .andExpect(jsonPath("$.data").value("ISSUED"));

        mvc.perform(post("/api/moderation/{chat}/challenges/{user}/answer", chat, 77)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"" + live.getAnswer() + "\"}"))
                .andExpect(jsonPath("$.data").value("SOLVED"));

        mvc.perform(post("/api/moderation/{chat}/challenges/{user}/answer", chat, 77)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"" + live.getAnswer() + "\"}"))
                .andExpect(jsonPath("$.data").value("EXPIRED"));
    }

    @Test
    void invalid_import_is_rejected_with_every_violation() throws Exception {
        long chat = -1003L;
        mvc.perform(post("/api/moderation/{chat}/settings/import", chat).header("X-Admin-Id", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spam_message_limit\":0,\"unknown_field\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));

        mvc.perform(get("/api/moderation/{chat}/settings", chat))
                .andExpect(jsonPath("$.data.spam_message_limit").value(5));
    }

    @Test
    void members_cannot_change_settings() throws Exception {
        mvc.perform(put("/api/moderation/{chat}/settings", -1004L).header("X-Admin-Id", "5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spam_enabled\":false}"))
                .andExpect(status().isForbidden());
    }
}
