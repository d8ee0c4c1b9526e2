package com.lingshield.core.orchestration;

import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.framework.SecurityRestriction;
import com.lingshield.core.violation.SecurityViolation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 风险评级与附加限制
 */
public final class RiskAssessor {

    /**
     * 低信任插件禁止访问的敏感目录
     */
    public static final List<String> SENSITIVE_ROOTS = List.of("/etc", "/root", "/home", "/var/lib", "/proc", "/sys");

    private RiskAssessor() {
    }

    /**
     * 风险级别只由违规集合与评分决定
     * <ul>
     * <li>CRITICAL：存在 CRITICAL 违规，或评分低于 30</li>
     * <li>HIGH：HIGH 违规超过 2 个，或评分低于 50</li>
     * <li>MEDIUM：至少 1 个 HIGH 违规，或评分低于 70</li>
     * </ul>
     */
    public static RiskLevel riskLevel(Collection<SecurityViolation> violations, int score) {
        long critical = violations.stream().filter(v -> v.getSeverity() == Severity.CRITICAL).count();
        long high = violations.stream().filter(v -> v.getSeverity() == Severity.HIGH).count();
        if (critical > 0 || score < 30) {
            return RiskLevel.CRITICAL;
        }
        if (high > 2 || score < 50) {
            return RiskLevel.HIGH;
        }
        if (high >= 1 || score < 70) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    /**
     * 高风险禁止全部网络访问，低信任禁止访问敏感目录
     */
    public static List<SecurityRestriction> restrictions(RiskLevel risk, TrustLevel trust) {
        List<SecurityRestriction> restrictions = new ArrayList<>();
        if (risk.isAtLeast(RiskLevel.HIGH)) {
            restrictions.add(SecurityRestriction.denyAllNetwork("Risk level " + risk));
        }
        if (!trust.isAtLeast(TrustLevel.MEDIUM)) {
            restrictions.addAll(SecurityRestriction.denyPaths(SENSITIVE_ROOTS, "Trust level " + trust));
        }
        return restrictions;
    }
}
