package com.jz.moderation.guard;

import com.jz.moderation.common.StoreException;
import com.jz.moderation.config.ModerationProperties;
import com.jz.moderation.domain.entity.LinkAction;
import com.jz.moderation.domain.entity.PolicySettings;
import com.jz.moderation.security.IdMasker;
import com.jz.moderation.store.ModerationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 新人发链接限制。找不到入群记录时按新人处理（宁严勿松）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NewbieLinkGate {

    static final Pattern URL = Pattern.compile(
            "https?://[^\\s<>\"']+|(?:www\\.)?[a-zA-Z0-9][-a-zA-Z0-9]*\\.[a-zA-Z]{2,}(?:/[^\\s<>\"']*)?");

    private final ModerationStore store;
    private final ModerationProperties props;
    private final IdMasker masker;

    public void recordJoin(long chatId, long userId, Instant joinedAt) {
        store.saveJoin(chatId, userId, joinedAt, props.getJoinRecordTtl());
    }

    public boolean isNewbie(PolicySettings s, long userId, Instant now) {
        if (s.getLinkNewbieHours() <= 0) return false;
        Optional<Instant> joinedAt;
        try {
            joinedAt = store.findJoin(s.getChatId(), userId);
        } catch (StoreException e) {
            log.warn("[LinkGate] join lookup failed, treat as newbie. chat={}, user={}, err={}",
                    masker.chat(s.getChatId()), masker.user(userId), e.getMessage());
            return true;
        }
        return joinedAt
                .map(t -> Duration.between(t, now).compareTo(Duration.ofHours(s.getLinkNewbieHours())) < 0)
                .orElse(true);
    }

    /** @return 需要执行的处置；不需要处置时为空 */
    public Optional<LinkAction> check(PolicySettings s, long userId, String text, Instant now) {
        if (!s.isLinkFilterEnabled() || text == null || text.isEmpty()) return Optional.empty();

        List<String> blocked = extractUrls(text).stream()
                .filter(url -> !isWhitelisted(url, s.getLinkWhitelist()))
                .toList();
        if (blocked.isEmpty()) return Optional.empty();
        if (!isNewbie(s, userId, now)) return Optional.empty();
        return Optional.of(s.getLinkAction());
    }

    public static List<String> extractUrls(String text) {
        List<String> out = new ArrayList<>();
        Matcher m = URL.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    static boolean isWhitelisted(String url, List<String> whitelist) {
        if (whitelist == null || whitelist.isEmpty()) return false;
        String u = url.toLowerCase(Locale.ROOT);
        for (String domain : whitelist) {
            String d = domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
            if (!d.isEmpty() && u.contains(d)) return true;
        }
        return false;
    }
}
