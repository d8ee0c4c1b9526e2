package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.violation.SecurityViolation;

import java.util.List;

/**
 * 执行前校验结论，只有 HIGH / CRITICAL 违规才否决
 */
public record ValidationResult(boolean valid, List<SecurityViolation> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public static ValidationResult of(List<SecurityViolation> violations) {
        boolean blocking = violations.stream().anyMatch(v -> v.getSeverity().isAtLeast(Severity.HIGH));
        return new ValidationResult(!blocking, violations);
    }
}
