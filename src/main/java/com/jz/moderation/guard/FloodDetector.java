package com.jz.moderation.guard;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.domain.dto.FloodCheck;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.store.FloodEntry;
import com.jz.moderation.store.FloodWindowSnapshot;
import com.jz.moderation.store.ModerationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 刷屏/垃圾检测：
 * 1) 特征匹配（无状态）；
 * 2) 滑动窗口计数：先记录再计数，窗口 [now - window, now] 两端都含，
 *    条数 >= 上限即命中。窗口 key 之前不存在时本条一律放行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FloodDetector {

    private final ModerationStore store;
    private final IdMasker masker;

    public Optional<SpamCategory> matchPatterns(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (SpamCategory c : SpamCategory.values()) {
            if (c.matches(text)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public FloodCheck recordAndCheck(PolicySettings s, long userId, long messageId, Instant sentAt) {
        Duration window = Duration.ofSeconds(s.getSpamTimeWindowSec());
        FloodWindowSnapshot snapshot;
        try {
            snapshot = store.recordFlood(s.getChatId(), userId, new FloodEntry(sentAt, messageId),
                    sentAt.minus(window.multipliedBy(2)),
                    sentAt.minus(window),
                    window.multipliedBy(3));
        } catch (StoreException e) {
            log.warn("[Flood] window unavailable, pass. chat={}, user={}, err={}",
                    masker.chat(s.getChatId()), masker.user(userId), e.getMessage());
            return FloodCheck.pass(0);
        }

        int count = snapshot.inWindow().size();
        if (!snapshot.existedBefore() || count < s.getSpamMessageLimit()) {
            return FloodCheck.pass(count);
        }
        List<Long> ids = snapshot.inWindow().stream().map(FloodEntry::messageId).toList();
        log.debug("[Flood] tripped chat={}, user={}, count={}, limit={}",
                masker.chat(s.getChatId()), masker.user(userId), count, s.getSpamMessageLimit());
        return new FloodCheck(true, count, ids);
    }

    /** 管理员解除禁言后清空窗口，避免立刻再次命中 */
    public void clearWindow(long chatId, long userId) {
        store.clearFlood(chatId, userId);
    }
}
