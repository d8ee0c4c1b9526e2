package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.audit.ReportPeriod;
import com.lingshield.core.violation.ViolationType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 安全框架周期报告
 */
@Value
@Builder
public class FrameworkReport {

    ReportPeriod period;

    Instant generatedAt;

    long totalViolations;

    @Singular("violationsOfType")
    Map<ViolationType, Long> violationsByType;

    @Singular("violationsOfSeverity")
    Map<Severity, Long> violationsBySeverity;

    /**
     * 100 - 20 x CRITICAL - 10 x HIGH，最低为 0
     */
    int complianceScore;

    ComplianceStatus status;

    int activeSandboxes;

    FrameworkMetrics.Snapshot metrics;

    @Singular
    List<String> recommendations;
}
