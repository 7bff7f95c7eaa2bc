package com.jz.moderation.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 链接门禁命中后的处置 */
public enum LinkAction {
    DELETE("delete"), WARN("warn"), HOLD("hold");

    private final String code;

    LinkAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static LinkAction fromCode(String code) {
        if (code != null) {
            String c = code.trim().toLowerCase(Locale.ROOT);
            for (LinkAction v : values()) {
                if (v.code.equals(c)) return v;
            }
        }
        throw new IllegalArgumentException("unknown LinkAction '" + code + "'");
    }
}
