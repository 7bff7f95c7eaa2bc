package com.jz.moderation.domain.dto;

public enum JoinOutcome {
    IGNORED_BOT, CHALLENGED, WELCOMED, ADMITTED
}
