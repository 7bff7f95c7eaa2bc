package com.jz.moderation.domain.dto;

public enum Escalation {
    NONE, MUTE, BAN
}
