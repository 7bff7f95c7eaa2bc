package com.jz.moderation.domain.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** 审计动作类型，label 用于审计频道展示 */
public enum ModActionType {
    WARN("warn", "⚠️", "Warning"),
    MUTE("mute", "🔇", "Mute"),
    UNMUTE("unmute", "🔊", "Unmute"),
    BAN("ban", "🚫", "Ban"),
    KICK("kick", "👢", "Kick"),
    DELETE("delete", "🗑", "Message deleted"),
    FILTER("filter", "🔍", "Filtered"),
    HOLD("hold", "⏸", "Held for review"),
    CLEAR_WARNS("clearwarns", "🧹", "Warnings cleared"),
    SPAM("spam", "📛", "Spam");

    private final String code;
    private final String icon;
    private final String label;

    ModActionType(String code, String icon, String label) {
        this.code = code;
        this.icon = icon;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String icon() {
        return icon;
    }

    public String label() {
        return label;
    }

    @JsonCreator
    public static ModActionType fromCode(String code) {
        for (ModActionType t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        throw new IllegalArgumentException("unknown action type '" + code + "'");
    }
}
