package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.SecurityVulnerability;
import com.lingshield.core.audit.SecurityEventType;
import com.lingshield.core.signature.VerificationError;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;

import java.time.Instant;

/**
 * 将各组件的发现统一转换为 {@link SecurityViolation}
 */
public final class ViolationMapper {

    public static final String SOURCE_STATIC_ANALYSIS = "static-analysis";
    public static final String SOURCE_SIGNATURE = "signature";
    public static final String SOURCE_FRAMEWORK = "framework";
    public static final String SOURCE_ORCHESTRATION = "orchestration";

    private ViolationMapper() {
    }

    public static SecurityViolation fromVulnerability(String pluginId, SecurityVulnerability vulnerability,
                                                      Instant at) {
        return SecurityViolation.builder()
                .type(ViolationType.STATIC_ANALYSIS)
                .severity(vulnerability.getSeverity())
                .description(vulnerability.getTitle())
                .pluginId(pluginId)
                .blocked(vulnerability.getSeverity().isBlocking())
                .source(SOURCE_STATIC_ANALYSIS)
                .timestamp(at)
                .detail("vulnerabilityType", vulnerability.getType().name())
                .detail("location", vulnerability.getLocation().toString())
                .detail("pass", vulnerability.getPass().name())
                .build();
    }

    /**
     * FATAL 映射为 HIGH，ERROR 映射为 MEDIUM
     */
    public static SecurityViolation fromVerificationError(String pluginId, VerificationError error, Instant at) {
        Severity severity = error.isFatal() ? Severity.HIGH : Severity.MEDIUM;
        return SecurityViolation.builder()
                .type(ViolationType.SIGNATURE_VERIFICATION)
                .severity(severity)
                .description(error.getMessage())
                .pluginId(pluginId)
                .blocked(error.isFatal())
                .source(SOURCE_SIGNATURE)
                .timestamp(at)
                .detail("code", error.getCode().name())
                .detail("step", String.valueOf(error.getStep()))
                .build();
    }

    /**
     * 管线内部故障，按 HIGH 处理
     */
    public static SecurityViolation internalError(String pluginId, Throwable cause, Instant at) {
        return SecurityViolation.builder()
                .type(ViolationType.INTERNAL_ERROR)
                .severity(Severity.HIGH)
                .description("Security processing failed: " + cause.getMessage())
                .pluginId(pluginId)
                .blocked(true)
                .source(SOURCE_ORCHESTRATION)
                .timestamp(at)
                .detail("exception", cause.getClass().getName())
                .build();
    }

    /**
     * 违规写入审计时使用的事件类型
     */
    public static SecurityEventType eventTypeOf(ViolationType type) {
        switch (type) {
            case PERMISSION_DENIED:
                return SecurityEventType.PERMISSION_DENIED;
            case PRIVILEGE_ESCALATION:
            case ATTACK_SIGNATURE:
                return SecurityEventType.INTRUSION_ATTEMPT;
            case DATA_EXFILTRATION:
                return SecurityEventType.DATA_EXFILTRATION;
            case MALICIOUS_BEHAVIOR:
                return SecurityEventType.SUSPICIOUS_ACTIVITY;
            case POLICY_VIOLATION:
            case VULNERABLE_DEPENDENCY:
            case STATIC_ANALYSIS:
                return SecurityEventType.POLICY_VIOLATION;
            case SIGNATURE_VERIFICATION:
                return SecurityEventType.CERTIFICATE_EVENT;
            default:
                return SecurityEventType.RUNTIME_VIOLATION;
        }
    }
}
