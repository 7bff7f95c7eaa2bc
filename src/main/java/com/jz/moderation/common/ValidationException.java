package com.jz.moderation.common;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 设置校验失败。携带全部违规项，而不是第一条。
 */
public class ValidationException extends RuntimeException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(violations.stream().map(Violation::toString).collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(List.of(new Violation(field, message)));
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
