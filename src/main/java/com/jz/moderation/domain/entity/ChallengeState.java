package com.jz.moderation.domain.entity;

public enum ChallengeState {
    ISSUED, SOLVED, EXPIRED, SUPERSEDED
}
