package com.jz.moderation.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 验证码难度 */
public enum ChallengeDifficulty {
    EASY("easy"), MEDIUM("medium"), HARD("hard");

    private final String code;

    ChallengeDifficulty(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ChallengeDifficulty fromCode(String code) {
        if (code != null) {
            String c = code.trim().toLowerCase(Locale.ROOT);
            for (ChallengeDifficulty v : values()) {
                if (v.code.equals(c)) return v;
            }
        }
        throw new IllegalArgumentException("unknown ChallengeDifficulty '" + code + "'");
    }
}
