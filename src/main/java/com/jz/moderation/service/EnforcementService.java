package com.jz.moderation.service;

import com.jz.moderation.domain.dto.Escalation;
import com.jz.moderation.domain.dto.MessageEventDTO;
import com.jz.moderation.domain.dto.ModerationResult;
import com.jz.moderation.domain.dto.WarnResult;
import com.jz.moderation.domain.entity.ModAction;
import com.jz.moderation.domain.entity.ModActionType;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.guard.FloodDetector;
import com.jz.moderation.guard.WarnTracker;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.transport.ChatPermissions;
import com.jz.moderation.transport.ChatTransport;
import com.jz.moderation.transport.OutboundMessage;
import com.jz.moderation.transport.TransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 把审核结论落到平台上，并写审计。
 * 平台调用失败只记日志、不重试，也不会因此改判。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnforcementService {

    private final ChatTransport transport;
    private final AuditLogService auditLog;
    private final WarnTracker warnTracker;
    private final FloodDetector floodDetector;
    private final Clock clock;
    private final IdMasker masker;

    public void enforce(PolicySettings s, MessageEventDTO msg, ModerationResult result) {
        long chatId = s.getChatId();
        long userId = msg.getUserId();
        Instant now = clock.instant();

        switch (result.getAction()) {
            case NONE -> {
                return;
            }
            case DELETE -> {
                // 删除失败：不审计也不通知
                if (!deleteQuietly(chatId, msg.getMessageId())) return;
                auditLog.record(ModAction.automatic(chatId, auditTypeOf(result), userId, result.getReason(), now));
                if (result.isFilterMatch() && s.isFilterNotifyUser()) {
                    notifyFiltered(userId, msg.getChatTitle());
                }
            }
            case MUTE -> {
                Set<Long> ids = new LinkedHashSet<>(result.getRelatedMessageIds());
                ids.add(msg.getMessageId());
                ids.forEach(id -> deleteQuietly(chatId, id));
                Instant until = now.plus(Duration.ofMinutes(result.getMuteDurationMin()));
                if (restrict(chatId, userId, until)) {
                    auditLog.record(ModAction.automatic(chatId, ModActionType.MUTE, userId,
                            result.getReason() + " (" + result.getMuteDurationMin() + " min)", now));
                }
            }
            case WARN -> {
                WarnResult w = warnTracker.addWarning(s, userId, null, result.getReason(), now);
                auditLog.record(ModAction.automatic(chatId, ModActionType.WARN, userId, result.getReason(), now));
                applyEscalation(s, userId, w);
            }
            case HOLD -> {
                if (!deleteQuietly(chatId, msg.getMessageId())) return;
                forwardForReview(s, msg);
                auditLog.record(ModAction.automatic(chatId, ModActionType.HOLD, userId, result.getReason(), now));
            }
        }
    }

    /** 执行警告升级建议（自动处置） */
    public void applyEscalation(PolicySettings s, long userId, WarnResult w) {
        long chatId = s.getChatId();
        Instant now = clock.instant();
        if (w.escalation() == Escalation.BAN) {
            if (ban(chatId, userId)) {
                auditLog.record(ModAction.automatic(chatId, ModActionType.BAN, userId,
                        "Warn limit reached (" + w.totalCount() + ")", now));
            }
        } else if (w.escalation() == Escalation.MUTE) {
            if (restrict(chatId, userId, now.plus(Duration.ofHours(w.muteDurationHours())))) {
                auditLog.record(ModAction.automatic(chatId, ModActionType.MUTE, userId,
                        "Warn limit reached (" + w.totalCount() + ")", now));
            }
        }
    }

    // ---------- 管理员手动处置：平台失败返回 false ----------

    public boolean ban(long chatId, long userId, long adminId, String reason) {
        if (!ban(chatId, userId)) return false;
        auditLog.record(ModAction.byAdmin(chatId, ModActionType.BAN, userId, adminId, reason, clock.instant()));
        return true;
    }

    public boolean kick(long chatId, long userId, long adminId, String reason) {
        try {
            transport.banUser(chatId, userId);
            transport.unbanUser(chatId, userId);
        } catch (TransportException e) {
            warnFailed("kick", chatId, userId, e);
            return false;
        }
        auditLog.record(ModAction.byAdmin(chatId, ModActionType.KICK, userId, adminId, reason, clock.instant()));
        return true;
    }

    public boolean mute(long chatId, long userId, long adminId, int minutes, String reason) {
        Instant now = clock.instant();
        if (!restrict(chatId, userId, now.plus(Duration.ofMinutes(minutes)))) return false;
        auditLog.record(ModAction.byAdmin(chatId, ModActionType.MUTE, userId, adminId,
                reason == null ? minutes + " min" : reason + " (" + minutes + " min)", now));
        return true;
    }

    public boolean unmute(long chatId, long userId, long adminId) {
        try {
            transport.restrictUser(chatId, userId, ChatPermissions.FULL, null);
        } catch (TransportException e) {
            warnFailed("unmute", chatId, userId, e);
            return false;
        }
        floodDetector.clearWindow(chatId, userId);
        auditLog.record(ModAction.byAdmin(chatId, ModActionType.UNMUTE, userId, adminId, null, clock.instant()));
        return true;
    }

    // ---------- helpers ----------

    static ModActionType auditTypeOf(ModerationResult r) {
        if (r.isFilterMatch()) return ModActionType.FILTER;
        String reason = r.getReason();
        if (ModerationResult.REASON_CRYPTO_SCAM.equals(reason)
                || ModerationResult.REASON_ADULT.equals(reason)
                || ModerationResult.REASON_SPAM_PATTERN.equals(reason)) {
            return ModActionType.SPAM;
        }
        return ModActionType.DELETE;
    }

    private boolean ban(long chatId, long userId) {
        try {
            transport.banUser(chatId, userId);
            return true;
        } catch (TransportException e) {
            warnFailed("ban", chatId, userId, e);
            return false;
        }
    }

    private boolean restrict(long chatId, long userId, Instant until) {
        try {
            transport.restrictUser(chatId, userId, ChatPermissions.READ_ONLY, until);
            return true;
        } catch (TransportException e) {
            warnFailed("mute", chatId, userId, e);
            return false;
        }
    }

    private boolean deleteQuietly(long chatId, long messageId) {
        try {
            transport.deleteMessage(chatId, messageId);
            return true;
        } catch (TransportException e) {
            log.debug("[Enforce] delete failed chat={}, messageId={}, err={}", masker.chat(chatId), messageId, e.getMessage());
            return false;
        }
    }

    private void notifyFiltered(long userId, String chatTitle) {
        String where = chatTitle == null || chatTitle.isBlank() ? "the group" : "«" + chatTitle + "»";
        try {
            transport.sendMessage(userId, OutboundMessage.plain(
                    "⚠️ Your message in " + where + " was removed because it contains a blocked word.\n\n"
                            + "Please follow the chat rules."));
        } catch (TransportException e) {
            // 用户可能屏蔽了机器人或从未私聊过
            log.debug("[Enforce] private notice failed user={}, err={}", masker.user(userId), e.getMessage());
        }
    }

    private void forwardForReview(PolicySettings s, MessageEventDTO msg) {
        if (s.getLogChannelId() == null) return;
        String text = "⏸ <b>Held for review</b>\n\nUser: <code>" + msg.getUserId() + "</code>\n"
                + "Chat: <code>" + s.getChatId() + "</code>\n\n"
                + HtmlUtils.htmlEscape(msg.getText() == null ? "" : msg.getText());
        try {
            transport.sendMessage(s.getLogChannelId(), OutboundMessage.html(text));
        } catch (TransportException e) {
            log.warn("[Enforce] hold forward failed chat={}, err={}", masker.chat(s.getChatId()), e.getMessage());
        }
    }

    private void warnFailed(String op, long chatId, long userId, TransportException e) {
        log.warn("[Enforce] {} failed chat={}, user={}, err={}", op, masker.chat(chatId), masker.user(userId), e.getMessage());
    }
}
