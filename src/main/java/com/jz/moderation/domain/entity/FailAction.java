package com.jz.moderation.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 验证码超时后的处置 */
public enum FailAction {
    KICK("kick"), MUTE("mute");

    private final String code;

    FailAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FailAction fromCode(String code) {
        if (code != null) {
            String c = code.trim().toLowerCase(Locale.ROOT);
            for (FailAction v : values()) {
                if (v.code.equals(c)) return v;
            }
        }
        throw new IllegalArgumentException("unknown FailAction '" + code + "'");
    }
}
