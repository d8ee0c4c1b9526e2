package com.lingshield.core.orchestration;

import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.framework.RestrictionAction;
import com.lingshield.core.framework.RestrictionType;
import com.lingshield.core.framework.SecurityRestriction;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskAssessor 单元测试")
class RiskAssessorTest {

    private static List<SecurityViolation> violations(int critical, int high, int medium) {
        List<SecurityViolation> list = new ArrayList<>();
        add(list, Severity.CRITICAL, critical);
        add(list, Severity.HIGH, high);
        add(list, Severity.MEDIUM, medium);
        return list;
    }

    private static void add(List<SecurityViolation> list, Severity severity, int count) {
        for (int i = 0; i < count; i++) {
            list.add(SecurityViolation.builder()
                    .type(ViolationType.POLICY_VIOLATION)
                    .severity(severity)
                    .description(severity + " finding " + i)
                    .build());
        }
    }

    @ParameterizedTest(name = "CRITICAL={0} HIGH={1} MEDIUM={2} score={3} -> {4}")
    @CsvSource({
            "0, 0, 0, 100, LOW",
            "0, 0, 5, 70, LOW",
            "0, 0, 0, 69, MEDIUM",
            "0, 1, 0, 95, MEDIUM",
            "0, 2, 0, 95, MEDIUM",
            "0, 3, 0, 95, HIGH",
            "0, 0, 0, 49, HIGH",
            "0, 0, 0, 29, CRITICAL",
            "1, 0, 0, 100, CRITICAL"
    })
    @DisplayName("风险级别由违规与评分决定")
    void riskLevel(int critical, int high, int medium, int score, RiskLevel expected) {
        assertEquals(expected, RiskAssessor.riskLevel(violations(critical, high, medium), score));
    }

    @Test
    @DisplayName("低风险高信任不附加限制")
    void noRestrictions() {
        assertTrue(RiskAssessor.restrictions(RiskLevel.MEDIUM, TrustLevel.MEDIUM).isEmpty());
    }

    @Test
    @DisplayName("高风险禁止全部网络")
    void highRiskDeniesNetwork() {
        List<SecurityRestriction> restrictions = RiskAssessor.restrictions(RiskLevel.HIGH, TrustLevel.ENTERPRISE);

        assertEquals(1, restrictions.size());
        assertEquals(RestrictionType.NETWORK, restrictions.get(0).getType());
        assertEquals("*", restrictions.get(0).getScope());
        assertEquals(RestrictionAction.DENY, restrictions.get(0).getAction());
    }

    @Test
    @DisplayName("低信任禁止访问敏感目录")
    void lowTrustDeniesSensitivePaths() {
        List<SecurityRestriction> restrictions = RiskAssessor.restrictions(RiskLevel.LOW, TrustLevel.LOW);

        assertEquals(RiskAssessor.SENSITIVE_ROOTS.size(), restrictions.size());
        assertTrue(restrictions.stream().allMatch(r -> r.getType() == RestrictionType.FILESYSTEM));
        assertTrue(restrictions.stream().anyMatch(r -> r.getScope().equals("/root")));
    }

    @Test
    @DisplayName("高风险且不受信任时两类限制叠加")
    void restrictionsAreAdditive() {
        List<SecurityRestriction> restrictions = RiskAssessor.restrictions(RiskLevel.CRITICAL, TrustLevel.UNTRUSTED);

        assertEquals(RiskAssessor.SENSITIVE_ROOTS.size() + 1, restrictions.size());
    }
}
