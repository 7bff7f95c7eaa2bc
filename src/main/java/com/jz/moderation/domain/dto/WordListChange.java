package com.jz.moderation.domain.dto;

/** 关键词增删的结果 */
public enum WordListChange {
    ADDED, REMOVED, DUPLICATE, NOT_FOUND, BLANK, TOO_LONG, LIST_FULL;

    public boolean changed() {
        return this == ADDED || this == REMOVED;
    }
}
