package com.lingshield.core.orchestration;

import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.core.audit.AuditSystem;
import com.lingshield.core.audit.IncidentStatus;
import com.lingshield.core.audit.ReportPeriod;
import com.lingshield.core.audit.SecurityIncident;
import com.lingshield.core.audit.SecurityMetrics;
import com.lingshield.core.audit.compliance.ComplianceFramework;
import com.lingshield.core.audit.compliance.ComplianceReport;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.framework.FrameworkReport;
import com.lingshield.core.framework.SecurityFramework;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 按报告类型汇总档案、事件单、合规与框架统计
 * <p>
 * sections 键名：
 * <ul>
 * <li>VULNERABILITY：assessedPlugins、violationsByType、violationsBySeverity、riskDistribution、highRiskPlugins</li>
 * <li>COMPLIANCE：frameworks（框架名 → ComplianceReport）</li>
 * <li>INCIDENT：incidents、incidentsByStatus、incidentsBySeverity、metrics</li>
 * <li>TREND：current、previous、violationDelta</li>
 * <li>EXECUTIVE：framework、riskDistribution、openIncidents、complianceScore</li>
 * </ul>
 */
@Slf4j
class SecurityReportGenerator {

    private static final int COMPLIANCE_ATTENTION_SCORE = 80;

    private final LingShieldConfig config;
    private final ProfileStore profiles;
    private final SecurityFramework framework;
    private final AuditSystem audit;
    private final Clock clock;

    SecurityReportGenerator(LingShieldConfig config, ProfileStore profiles, SecurityFramework framework,
                            AuditSystem audit, Clock clock) {
        this.config = config;
        this.profiles = profiles;
        this.framework = framework;
        this.audit = audit;
        this.clock = clock;
    }

    SecurityReport generate(ReportType type, ReportPeriod period) {
        FrameworkReport current = framework.generateSecurityReport(period);
        FrameworkReport previous = framework.generateSecurityReport(previousPeriod(period));
        RiskTrend trend = RiskTrend.compare(previous.getComplianceScore(), current.getComplianceScore());

        SecurityReport.SecurityReportBuilder report = SecurityReport.builder()
                .id("rpt-" + clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 8))
                .type(type)
                .period(period)
                .generatedAt(clock.instant());
        SecurityReport.Summary.SummaryBuilder summary = SecurityReport.Summary.builder().riskTrend(trend);

        switch (type) {
            case VULNERABILITY:
                vulnerability(period, report, summary);
                break;
            case COMPLIANCE:
                compliance(period, report, summary);
                break;
            case INCIDENT:
                incident(period, current, report, summary);
                break;
            case TREND:
                trend(current, previous, trend, report, summary);
                break;
            case EXECUTIVE:
            default:
                executive(period, current, report, summary);
                break;
        }
        SecurityReport result = report.summary(summary.build()).build();
        log.info("[{}] {} report generated, score={}, trend={}",
                result.getId(), type, result.getSummary().getOverallScore(), trend);
        return result;
    }

    // ==================== 各类报告 ====================

    private void vulnerability(ReportPeriod period, SecurityReport.SecurityReportBuilder report,
                               SecurityReport.Summary.SummaryBuilder summary) {
        List<SecurityProfile> assessed = assessedIn(period);
        Map<ViolationType, Long> byType = new EnumMap<>(ViolationType.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (SecurityProfile profile : assessed) {
            for (SecurityViolation v : profile.allViolations()) {
                byType.merge(v.getType(), 1L, Long::sum);
                bySeverity.merge(v.getSeverity(), 1L, Long::sum);
            }
        }
        List<String> highRisk = assessed.stream()
                .filter(p -> p.getRiskLevel().isAtLeast(RiskLevel.HIGH))
                .map(SecurityProfile::getPluginId)
                .collect(Collectors.toList());

        report.section("assessedPlugins", assessed.stream().map(SecurityProfile::getPluginId).collect(Collectors.toList()))
                .section("violationsByType", byType)
                .section("violationsBySeverity", bySeverity)
                .section("riskDistribution", riskDistribution(assessed))
                .section("highRiskPlugins", highRisk);

        long violations = bySeverity.values().stream().mapToLong(Long::longValue).sum();
        summary.overallScore(averageScore(assessed))
                .keyFinding(assessed.size() + " plugin(s) assessed")
                .keyFinding(violations + " violation(s) across assessed plugins")
                .keyFinding(highRisk.size() + " plugin(s) at HIGH or CRITICAL risk");
        assessed.stream()
                .filter(p -> p.getRiskLevel() == RiskLevel.CRITICAL)
                .forEach(p -> summary.criticalIssue(
                        "Plugin " + p.getPluginId() + " is at CRITICAL risk (score " + p.getSecurityScore() + ")"));
    }

    private void compliance(ReportPeriod period, SecurityReport.SecurityReportBuilder report,
                            SecurityReport.Summary.SummaryBuilder summary) {
        Map<String, ComplianceReport> reports = complianceReports(period);
        report.section("frameworks", reports);

        summary.overallScore(averageCompliance(reports));
        reports.forEach((name, r) -> {
            summary.keyFinding(String.format(Locale.ROOT, "%s: score %.1f, %d violation(s)",
                    name, r.getOverallScore(), r.getViolations().size()));
            if (r.getOverallScore() < COMPLIANCE_ATTENTION_SCORE) {
                summary.criticalIssue(String.format(Locale.ROOT, "%s compliance score %.1f is below %d",
                        name, r.getOverallScore(), COMPLIANCE_ATTENTION_SCORE));
            }
        });
    }

    private void incident(ReportPeriod period, FrameworkReport current, SecurityReport.SecurityReportBuilder report,
                          SecurityReport.Summary.SummaryBuilder summary) {
        List<SecurityIncident> incidents = audit.listIncidents().stream()
                .filter(i -> period.contains(i.getDetectedAt()))
                .collect(Collectors.toList());
        Map<IncidentStatus, Long> byStatus = new EnumMap<>(IncidentStatus.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        incidents.forEach(i -> {
            byStatus.merge(i.getStatus(), 1L, Long::sum);
            bySeverity.merge(i.getSeverity(), 1L, Long::sum);
        });
        SecurityMetrics metrics = audit.getMetrics();

        report.section("incidents", incidents.stream().map(SecurityIncident::getId).collect(Collectors.toList()))
                .section("incidentsByStatus", byStatus)
                .section("incidentsBySeverity", bySeverity)
                .section("metrics", metrics);

        summary.overallScore(current.getComplianceScore())
                .keyFinding(incidents.size() + " incident(s) detected")
                .keyFinding(String.format(Locale.ROOT, "Mean time to detect: %.1f min", metrics.getMeanTimeToDetect()))
                .keyFinding(String.format(Locale.ROOT, "Mean time to resolve: %.1f min", metrics.getMeanTimeToResolve()));
        incidents.stream()
                .filter(i -> i.getSeverity() == Severity.CRITICAL && i.getStatus().isActive())
                .forEach(i -> summary.criticalIssue("Unresolved critical incident " + i.getId() + ": " + i.getTitle()));
    }

    private void trend(FrameworkReport current, FrameworkReport previous, RiskTrend trend,
                       SecurityReport.SecurityReportBuilder report, SecurityReport.Summary.SummaryBuilder summary) {
        long delta = current.getTotalViolations() - previous.getTotalViolations();
        report.section("current", current)
                .section("previous", previous)
                .section("violationDelta", delta);

        summary.overallScore(current.getComplianceScore())
                .keyFinding("Risk trend: " + trend)
                .keyFinding(String.format(Locale.ROOT, "Violations: %d (previous period %d)",
                        current.getTotalViolations(), previous.getTotalViolations()))
                .keyFinding(String.format(Locale.ROOT, "Compliance score: %d (previous period %d)",
                        current.getComplianceScore(), previous.getComplianceScore()));
        if (trend == RiskTrend.DEGRADING) {
            summary.criticalIssue("Security posture degraded by "
                    + (previous.getComplianceScore() - current.getComplianceScore()) + " point(s)");
        }
    }

    private void executive(ReportPeriod period, FrameworkReport current, SecurityReport.SecurityReportBuilder report,
                           SecurityReport.Summary.SummaryBuilder summary) {
        List<SecurityProfile> active = profiles.list().stream()
                .filter(p -> !p.isRetired())
                .collect(Collectors.toList());
        long openIncidents = audit.listIncidents().stream().filter(i -> i.getStatus().isActive()).count();
        int complianceScore = averageCompliance(complianceReports(period));

        report.section("framework", current)
                .section("riskDistribution", riskDistribution(active))
                .section("openIncidents", openIncidents)
                .section("complianceScore", complianceScore);

        summary.overallScore(current.getComplianceScore())
                .keyFinding(active.size() + " active plugin profile(s)")
                .keyFinding(current.getTotalViolations() + " violation(s) handled in period")
                .keyFinding(openIncidents + " open incident(s)")
                .keyFinding("Compliance score: " + complianceScore);
        current.getRecommendations().forEach(summary::keyFinding);
        active.stream()
                .filter(p -> p.getRiskLevel() == RiskLevel.CRITICAL)
                .forEach(p -> summary.criticalIssue("Plugin " + p.getPluginId() + " is at CRITICAL risk"));
    }

    // ==================== 辅助 ====================

    static ReportPeriod previousPeriod(ReportPeriod period) {
        Duration length = Duration.between(period.start(), period.end());
        return new ReportPeriod(period.start().minus(length), period.start());
    }

    private List<SecurityProfile> assessedIn(ReportPeriod period) {
        return profiles.list().stream()
                .filter(p -> !p.isRetired())
                .filter(p -> p.latestAssessment().map(a -> period.contains(a.getAssessedAt())).orElse(false))
                .collect(Collectors.toList());
    }

    private Map<String, ComplianceReport> complianceReports(ReportPeriod period) {
        Map<String, ComplianceReport> reports = new LinkedHashMap<>();
        for (String name : config.getCompliance().getFrameworks()) {
            ComplianceFramework fw;
            try {
                fw = ComplianceFramework.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown compliance framework in configuration: {}", name);
                continue;
            }
            reports.put(fw.name(), audit.generateComplianceReport(fw, period));
        }
        return reports;
    }

    private static Map<RiskLevel, Long> riskDistribution(List<SecurityProfile> profiles) {
        Map<RiskLevel, Long> distribution = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level, 0L);
        }
        profiles.forEach(p -> distribution.merge(p.getRiskLevel(), 1L, Long::sum));
        return distribution;
    }

    private static int averageScore(List<SecurityProfile> profiles) {
        if (profiles.isEmpty()) {
            return 100;
        }
        return (int) Math.round(profiles.stream().mapToInt(SecurityProfile::getSecurityScore).average().orElse(100));
    }

    private static int averageCompliance(Map<String, ComplianceReport> reports) {
        if (reports.isEmpty()) {
            return 100;
        }
        List<Double> scores = new ArrayList<>();
        reports.values().forEach(r -> scores.add(r.getOverallScore()));
        return (int) Math.round(scores.stream().mapToDouble(Double::doubleValue).average().orElse(100));
    }
}
