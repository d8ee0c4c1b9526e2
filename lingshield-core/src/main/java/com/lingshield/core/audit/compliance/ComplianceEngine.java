package com.lingshield.core.audit.compliance;

import com.lingshield.api.security.Severity;
import com.lingshield.core.audit.ReportPeriod;
import com.lingshield.core.audit.SecurityEvent;
import com.lingshield.core.util.ContentHasher;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 合规评估引擎
 * <p>
 * 控制项得分 = 100 − 期间内每个相关未解决事件的扣分（CRITICAL 40，HIGH 20，MEDIUM 10，LOW 5），下限 0；
 * 100 为合规，≥ 70 为部分合规，其余为不合规。总分为各控制项得分的平均值。
 */
@Slf4j
public class ComplianceEngine {

    static final double PARTIAL_THRESHOLD = 70;

    private final ComplianceCatalog catalog;
    private final Clock clock;
    private final int reviewIntervalDays;

    public ComplianceEngine(ComplianceCatalog catalog, Clock clock, int reviewIntervalDays) {
        this.catalog = catalog;
        this.clock = clock;
        this.reviewIntervalDays = reviewIntervalDays;
    }

    public ComplianceReport generateReport(ComplianceFramework framework, ReportPeriod period,
                                           Collection<SecurityEvent> events) {
        Instant now = clock.instant();
        List<ComplianceCatalog.ControlDefinition> definitions = catalog.controls(framework);

        List<ComplianceControl> controls = new ArrayList<>();
        List<ComplianceEvidence> evidence = new ArrayList<>();
        for (ComplianceCatalog.ControlDefinition definition : definitions) {
            List<SecurityEvent> relevant = relevantEvents(definition, period, events);
            controls.add(assessControl(definition, relevant, now));
            evidence.add(collectEvidence(definition, relevant, now));
        }

        List<ComplianceViolation> violations = identifyViolations(controls, definitions, now);
        List<ComplianceRecommendation> recommendations = generateRecommendations(violations, controls);
        double overall = controls.isEmpty() ? 100.0
                : controls.stream().mapToDouble(ComplianceControl::getScore).average().orElse(100.0);

        log.info("[{}] Compliance report generated: score={}, violations={}", framework,
                String.format("%.1f", overall), violations.size());
        return ComplianceReport.builder()
                .id("rpt-" + UUID.randomUUID())
                .framework(framework)
                .period(period)
                .overallScore(overall)
                .controls(controls)
                .violations(violations)
                .recommendations(recommendations)
                .evidence(evidence)
                .generatedAt(now)
                .nextReviewDate(now.plus(Duration.ofDays(reviewIntervalDays)))
                .build();
    }

    private static List<SecurityEvent> relevantEvents(ComplianceCatalog.ControlDefinition definition,
                                                      ReportPeriod period, Collection<SecurityEvent> events) {
        return events.stream()
                .filter(e -> period.contains(e.getTimestamp()))
                .filter(e -> definition.getEventTypes().contains(e.getType()))
                .filter(e -> e.getSeverity().isAtLeast(definition.getMinSeverity()))
                .filter(e -> !e.isResolved())
                .collect(Collectors.toList());
    }

    ComplianceControl assessControl(ComplianceCatalog.ControlDefinition definition,
                                    List<SecurityEvent> relevant, Instant now) {
        ControlStatus status;
        double score;
        if (definition.getEventTypes().isEmpty()) {
            status = ControlStatus.NOT_ASSESSED;
            score = 100;
        } else {
            double deduction = relevant.stream().mapToDouble(e -> deduction(e.getSeverity())).sum();
            score = Math.max(0, 100 - deduction);
            if (score >= 100) {
                status = ControlStatus.COMPLIANT;
            } else if (score >= PARTIAL_THRESHOLD) {
                status = ControlStatus.PARTIALLY_COMPLIANT;
            } else {
                status = ControlStatus.NON_COMPLIANT;
            }
        }
        return ComplianceControl.builder()
                .id(definition.getId())
                .name(definition.getName())
                .description(definition.getDescription())
                .category(definition.getCategory())
                .owner(definition.getOwner())
                .status(status)
                .score(score)
                .evidence(relevant.stream().map(SecurityEvent::getId).collect(Collectors.toList()))
                .lastTested(now)
                .nextTest(now.plus(Duration.ofDays(reviewIntervalDays)))
                .build();
    }

    private static double deduction(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return 40;
            case HIGH:
                return 20;
            case MEDIUM:
                return 10;
            case LOW:
                return 5;
            default:
                return 0;
        }
    }

    private static ComplianceEvidence collectEvidence(ComplianceCatalog.ControlDefinition definition,
                                                      List<SecurityEvent> relevant, Instant now) {
        String ids = relevant.stream().map(SecurityEvent::getId).sorted().collect(Collectors.joining("\n"));
        return ComplianceEvidence.builder()
                .id("evd-" + UUID.randomUUID())
                .controlId(definition.getId())
                .type("AUDIT_TRAIL")
                .description("Security events assessed for control " + definition.getId())
                .timestamp(now)
                .eventCount(relevant.size())
                .hash(ContentHasher.sha256Hex(ids.getBytes(StandardCharsets.UTF_8)))
                .build();
    }

    List<ComplianceViolation> identifyViolations(List<ComplianceControl> controls,
                                                 List<ComplianceCatalog.ControlDefinition> definitions, Instant now) {
        List<ComplianceViolation> violations = new ArrayList<>();
        for (int i = 0; i < controls.size(); i++) {
            ComplianceControl control = controls.get(i);
            Severity severity;
            if (control.getStatus() == ControlStatus.NON_COMPLIANT) {
                severity = Severity.HIGH;
            } else if (control.getStatus() == ControlStatus.PARTIALLY_COMPLIANT) {
                severity = Severity.MEDIUM;
            } else {
                continue;
            }
            violations.add(ComplianceViolation.builder()
                    .id("cv-" + UUID.randomUUID())
                    .controlId(control.getId())
                    .severity(severity)
                    .description(control.getName() + " scored " + String.format("%.0f", control.getScore())
                            + " with " + control.getEvidence().size() + " unresolved event(s)")
                    .discoveredAt(now)
                    .remediation(definitions.get(i).getRemediation())
                    .dueDate(now.plus(Duration.ofDays(severity == Severity.HIGH ? 30 : 90)))
                    .build());
        }
        return violations;
    }

    List<ComplianceRecommendation> generateRecommendations(List<ComplianceViolation> violations,
                                                           List<ComplianceControl> controls) {
        List<ComplianceRecommendation> recommendations = new ArrayList<>();
        for (ComplianceViolation violation : violations) {
            String category = controls.stream()
                    .filter(c -> c.getId().equals(violation.getControlId()))
                    .map(ComplianceControl::getCategory)
                    .findFirst()
                    .orElse("GENERAL");
            recommendations.add(ComplianceRecommendation.builder()
                    .id("rec-" + UUID.randomUUID())
                    .title("Remediate control " + violation.getControlId())
                    .description(violation.getRemediation() != null ? violation.getRemediation()
                            : "Investigate and resolve the events recorded against this control")
                    .priority(violation.getSeverity())
                    .category(category)
                    .controlId(violation.getControlId())
                    .build());
        }
        return recommendations;
    }
}
