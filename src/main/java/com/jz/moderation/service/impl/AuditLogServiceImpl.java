package com.jz.moderation.service.impl;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.service.AuditLogService;
import com.jz.moderation.service.PolicySettingsCache;
import com.jz.moderation.store.ModerationStore;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.OutboundMessage;
import com.jz.moderation.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogServiceImpl implements AuditLogService {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    /** 按用户过滤时多取几倍，尽量凑满 limit */
    private static final int FILTER_FETCH_FACTOR = 5;

    private final ModerationStore store;
    private final ChatTransport transport;
    private final PolicySettingsCache settingsCache;
    private final ModerationProperties props;
    private final IdMasker masker;

    @Override
    public boolean record(ModAction action) {
        boolean persisted = true;
        try {
            store.appendModAction(action, props.getModlogMaxEntries());
        } catch (StoreException e) {
            persisted = false;
            log.error("[ModLog] persist failed chat={}, type={}, err={}",
                    masker.chat(action.getChatId()), action.getActionType().code(), e.getMessage());
        }
        log.info("[ModLog] {} chat={}, user={}, admin={}, auto={}",
                action.getActionType().code(),
                masker.chat(action.getChatId()),
                masker.user(action.getTargetUserId()),
                action.getAdminId() == null ? "-" : masker.user(action.getAdminId()),
                action.isAuto());

        forwardToSink(action);
        return persisted;
    }

    @Override
    public List<ModAction> recent(long chatId, int limit, Long userId) {
        if (limit <= 0) return List.of();
        int fetch = userId == null ? limit : limit * FILTER_FETCH_FACTOR;
        List<ModAction> rows;
        try {
            rows = store.findModActions(chatId, fetch);
        } catch (StoreException e) {
            log.warn("[ModLog] read failed chat={}, err={}", masker.chat(chatId), e.getMessage());
            return List.of();
        }
        if (userId == null) return rows;
        return rows.stream()
                .filter(a -> a.getTargetUserId() == userId)
                .limit(limit)
                .toList();
    }

    private void forwardToSink(ModAction action) {
        Long sink = settingsCache.get(action.getChatId()).getLogChannelId();
        if (sink == null) return;
        try {
            transport.sendMessage(sink, OutboundMessage.html(format(action)));
        } catch (TransportException e) {
            log.warn("[ModLog] sink delivery failed chat={}, err={}", masker.chat(action.getChatId()), e.getMessage());
        }
    }

    static String format(ModAction a) {
        StringBuilder sb = new StringBuilder();
        sb.append(a.getActionType().icon()).append(" <b>").append(a.getActionType().label()).append("</b>\n\n");
        sb.append("User: <code>").append(a.getTargetUserId()).append("</code>\n");
        if (a.getAdminId() != null) {
            sb.append("Admin: <code>").append(a.getAdminId()).append("</code>\n");
        } else {
            sb.append("Admin: automatic\n");
        }
        if (a.getReason() != null && !a.getReason().isBlank()) {
            sb.append("Reason: ").append(HtmlUtils.htmlEscape(a.getReason())).append('\n');
        }
        sb.append("Time: ").append(TIME.format(a.getCreatedAt())).append('\n');
        sb.append("Chat: <code>").append(a.getChatId()).append("</code>");
        return sb.toString();
    }
}
