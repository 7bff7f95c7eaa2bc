package com.jz.moderation.guard;

import com.jz.moderation.common.Violation;
import com.jz.moderation.domain.entity.PolicySettings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 设置校验：纯函数，一次返回全部违规项。取值范围即每个字段的闭区间。
 */
public final class PolicyValidator {

    public static final int MAX_FILTER_WORDS = 500;
    public static final int MAX_WORD_LENGTH = 100;
    public static final int MAX_WHITELIST = 100;
    public static final int MAX_DOMAIN_LENGTH = 253;
    public static final int MAX_WELCOME_LENGTH = 4096;

    private PolicyValidator() {
    }

    public static List<Violation> validate(PolicySettings s) {
        List<Violation> out = new ArrayList<>();
        if (s == null) {
            out.add(new Violation("settings", "must not be null"));
            return out;
        }

        // welcome
        if (s.getWelcomeMessage() == null || s.getWelcomeMessage().isBlank()) {
            out.add(new Violation("welcome_message", "must not be blank"));
        } else if (s.getWelcomeMessage().length() > MAX_WELCOME_LENGTH) {
            out.add(new Violation("welcome_message", "must be at most " + MAX_WELCOME_LENGTH + " characters"));
        }
        range(out, "welcome_delay_sec", s.getWelcomeDelaySec(), 0, 30);
        range(out, "welcome_auto_delete_sec", s.getWelcomeAutoDeleteSec(), 0, 3600);

        // flood
        range(out, "spam_message_limit", s.getSpamMessageLimit(), 1, 20);
        range(out, "spam_time_window_sec", s.getSpamTimeWindowSec(), 5, 60);
        range(out, "spam_mute_duration_min", s.getSpamMuteDurationMin(), 1, 1440);

        // links
        range(out, "link_newbie_hours", s.getLinkNewbieHours(), 0, 168);
        notNull(out, "link_action", s.getLinkAction());
        words(out, "link_whitelist", s.getLinkWhitelist(), MAX_WHITELIST, MAX_DOMAIN_LENGTH);

        // warns
        boolean muteOk = range(out, "warn_mute_threshold", s.getWarnMuteThreshold(), 1, 10);
        boolean banOk = range(out, "warn_ban_threshold", s.getWarnBanThreshold(), 1, 20);
        if (muteOk && banOk && s.getWarnMuteThreshold() >= s.getWarnBanThreshold()) {
            out.add(new Violation("warn_mute_threshold", "must be less than warn_ban_threshold ("
                    + s.getWarnBanThreshold() + ")"));
        }
        range(out, "warn_mute_duration_hours", s.getWarnMuteDurationHours(), 1, 720);

        // captcha
        range(out, "captcha_timeout_sec", s.getCaptchaTimeoutSec(), 30, 600);
        notNull(out, "captcha_difficulty", s.getCaptchaDifficulty());
        notNull(out, "captcha_fail_action", s.getCaptchaFailAction());

        // filter
        if (words(out, "filter_words", s.getFilterWords(), MAX_FILTER_WORDS, MAX_WORD_LENGTH)) {
            Set<String> seen = new HashSet<>();
            for (String w : s.getFilterWords()) {
                if (!seen.add(w.trim().toLowerCase(Locale.ROOT))) {
                    out.add(new Violation("filter_words", "duplicate entry '" + w + "'"));
                }
            }
        }
        return out;
    }

    private static boolean range(List<Violation> out, String field, int value, int min, int max) {
        if (value < min || value > max) {
            out.add(new Violation(field, "must be between " + min + " and " + max + " (got " + value + ")"));
            return false;
        }
        return true;
    }

    private static void notNull(List<Violation> out, String field, Object value) {
        if (value == null) out.add(new Violation(field, "must not be null"));
    }

    private static boolean words(List<Violation> out, String field, List<String> list, int maxItems, int maxLen) {
        if (list == null) {
            out.add(new Violation(field, "must not be null"));
            return false;
        }
        boolean ok = true;
        if (list.size() > maxItems) {
            out.add(new Violation(field, "must contain at most " + maxItems + " entries (got " + list.size() + ")"));
            ok = false;
        }
        for (String w : list) {
            if (w == null || w.isBlank()) {
                out.add(new Violation(field, "entries must not be blank"));
                ok = false;
            } else if (w.trim().length() > maxLen) {
                out.add(new Violation(field, "entry '" + w.substring(0, 20) + "...' exceeds " + maxLen + " characters"));
                ok = false;
            }
        }
        return ok;
    }
}
