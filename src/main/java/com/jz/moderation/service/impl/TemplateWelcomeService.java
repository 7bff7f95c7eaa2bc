package com.jz.moderation.service.impl;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.domain.dto.JoinEventDTO;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.service.WelcomeService;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.OutboundMessage;
import com.jz.moderation.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 模板欢迎语，支持 {username} {chatname} {membercount} 占位符（替换值会做 HTML 转义）。
 */
@Slf4j
@Service
public class TemplateWelcomeService implements WelcomeService {

    private final ModerationStore store;
    private final ChatTransport transport;
    private final ScheduledExecutorService scheduler;
    private final ModerationProperties props;
    private final IdMasker masker;

    public TemplateWelcomeService(ModerationStore store,
                                  ChatTransport transport,
                                  @Qualifier("moderationScheduler") ScheduledExecutorService scheduler,
                                  ModerationProperties props,
                                  IdMasker masker) {
        this.store = store;
        this.transport = transport;
        this.scheduler = scheduler;
        this.props = props;
        this.masker = masker;
    }

    @Override
    public boolean welcome(PolicySettings s, JoinEventDTO member) {
        if (!s.isWelcomeEnabled()) return false;

        boolean first;
        try {
            first = store.markWelcomed(s.getChatId(), member.getUserId(), props.getWelcomeDedupTtl());
        } catch (StoreException e) {
            // 去重不可用时宁可重复欢迎
            log.warn("[Welcome] dedup unavailable chat={}, err={}", masker.chat(s.getChatId()), e.getMessage());
            first = true;
        }
        if (!first) return false;

        String text = render(s.getWelcomeMessage(), member);
        if (s.getWelcomeDelaySec() > 0) {
            scheduler.schedule(() -> deliver(s, member.getUserId(), text), s.getWelcomeDelaySec(), TimeUnit.SECONDS);
        } else {
            deliver(s, member.getUserId(), text);
        }
        return true;
    }

    String render(String template, JoinEventDTO member) {
        String name = member.getDisplayName() == null || member.getDisplayName().isBlank()
                ? "friend" : member.getDisplayName();
        String out = template
                .replace("{username}", HtmlUtils.htmlEscape(name))
                .replace("{chatname}", HtmlUtils.htmlEscape(member.getChatTitle() == null ? "" : member.getChatTitle()));
        if (out.contains("{membercount}")) {
            out = out.replace("{membercount}", memberCount(member.getChatId()));
        }
        return out;
    }

    private String memberCount(long chatId) {
        try {
            return String.valueOf(transport.getMemberCount(chatId));
        } catch (TransportException e) {
            log.debug("[Welcome] member count unavailable chat={}, err={}", masker.chat(chatId), e.getMessage());
            return "?";
        }
    }

    private void deliver(PolicySettings s, long userId, String text) {
        long target = s.isWelcomePrivate() ? userId : s.getChatId();
        try {
            long messageId = transport.sendMessage(target, OutboundMessage.html(text));
            if (!s.isWelcomePrivate() && s.getWelcomeAutoDeleteSec() > 0) {
                scheduler.schedule(() -> deleteQuietly(s.getChatId(), messageId),
                        s.getWelcomeAutoDeleteSec(), TimeUnit.SECONDS);
            }
        } catch (TransportException e) {
            log.warn("[Welcome] send failed chat={}, user={}, err={}",
                    masker.chat(s.getChatId()), masker.user(userId), e.getMessage());
        }
    }

    private void deleteQuietly(long chatId, long messageId) {
        try {
            transport.deleteMessage(chatId, messageId);
        } catch (TransportException e) {
            log.debug("[Welcome] auto-delete failed chat={}, err={}", masker.chat(chatId), e.getMessage());
        }
    }
}
