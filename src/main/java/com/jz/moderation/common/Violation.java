package com.jz.moderation.common;

/** 单条校验失败：字段名（snake_case，与导出 JSON 一致）+ 人类可读原因 */
public record Violation(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
