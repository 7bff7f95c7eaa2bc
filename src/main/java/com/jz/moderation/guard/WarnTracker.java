package com.jz.moderation.guard;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.domain.dto.Escalation;
import com.jz.moderation.domain.dto.WarnResult;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.domain.entity.Warning;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.store.ModerationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 警告累计与升级判定。只给出建议（MUTE/BAN），不执行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarnTracker {

    private final ModerationStore store;
    private final IdMasker masker;

    /** 追加一条警告并按新总数判定升级；BAN 优先于 MUTE */
    public WarnResult addWarning(PolicySettings s, long userId, Long adminId, String reason, Instant now) {
        Warning warning = Warning.builder()
                .id(UUID.randomUUID().toString())
                .chatId(s.getChatId())
                .userId(userId)
                .adminId(adminId)
                .reason(reason)
                .createdAt(now)
                .build();
        long total = store.appendWarning(warning);
        Escalation escalation = escalationFor(total, s);
        if (escalation != Escalation.NONE) {
            log.info("[Warn] escalation={} chat={}, user={}, total={}",
                    escalation, masker.chat(s.getChatId()), masker.user(userId), total);
        }
        return new WarnResult(warning, total, escalation, s.getWarnMuteDurationHours());
    }

    static Escalation escalationFor(long total, PolicySettings s) {
        if (total >= s.getWarnBanThreshold()) return Escalation.BAN;
        if (total >= s.getWarnMuteThreshold()) return Escalation.MUTE;
        return Escalation.NONE;
    }

    /** 最新在前；存储不可用时返回空列表 */
    public List<Warning> listWarnings(long chatId, long userId) {
        try {
            List<Warning> list = new ArrayList<>(store.findWarnings(chatId, userId));
            Collections.reverse(list);
            return list;
        } catch (StoreException e) {
            log.warn("[Warn] list failed chat={}, user={}, err={}", masker.chat(chatId), masker.user(userId), e.getMessage());
            return List.of();
        }
    }

    public long countWarnings(long chatId, long userId) {
        return store.countWarnings(chatId, userId);
    }

    /** @return 清掉的条数 */
    public long clearWarnings(long chatId, long userId) {
        return store.clearWarnings(chatId, userId);
    }
}
