package com.jz.moderation.domain.dto;

public enum ModerationAction {
    NONE, DELETE, WARN, MUTE, HOLD
}
