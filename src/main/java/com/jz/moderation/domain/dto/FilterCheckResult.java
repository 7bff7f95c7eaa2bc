package com.jz.moderation.domain.dto;

public record FilterCheckResult(boolean filtered, String matchedWord) {

    private static final FilterCheckResult CLEAN = new FilterCheckResult(false, null);

    public static FilterCheckResult clean() {
        return CLEAN;
    }

    public static FilterCheckResult matched(String word) {
        return new FilterCheckResult(true, word);
    }

    public String reason() {
        return matchedWord == null ? "filter" : ModerationResult.REASON_FILTER_PREFIX + matchedWord;
    }
}
