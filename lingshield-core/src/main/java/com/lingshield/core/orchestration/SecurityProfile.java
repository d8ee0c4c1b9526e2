package com.lingshield.core.orchestration;

import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.framework.ComplianceStatus;
import com.lingshield.core.framework.SecurityRestriction;
import com.lingshield.core.violation.SecurityViolation;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 插件安全档案（不可变快照）
 * <p>
 * 更新通过 {@link ProfileStore#update} 按版本比较并交换；风险级别与合规状态由违规集合和评分推导，不单独保存。
 * 卸载只标记退役，不删除。
 */
@Value
@Builder(toBuilder = true)
public class SecurityProfile {

    @NonNull
    String pluginId;

    /**
     * 每次写入递增，从 1 开始
     */
    long version;

    String pluginVersion;

    int securityScore;

    @NonNull
    @Builder.Default
    TrustLevel trustLevel = TrustLevel.UNTRUSTED;

    @Singular
    List<SecurityRestriction> restrictions;

    /**
     * 最近一次安装评估的违规
     */
    @Singular
    List<SecurityViolation> violations;

    /**
     * 运行期追加的违规
     */
    @Singular
    List<SecurityViolation> runtimeViolations;

    @Singular
    List<SecurityAssessment> assessments;

    @Singular
    List<String> incidentIds;

    boolean allowed;

    String sandboxId;

    String analysisSignature;

    /**
     * 运行期违规已达到升级阈值并开过事件单
     */
    boolean runtimeEscalated;

    boolean retired;

    Instant retiredAt;

    Instant createdAt;

    Instant updatedAt;

    public RiskLevel getRiskLevel() {
        return RiskAssessor.riskLevel(allViolations(), securityScore);
    }

    public ComplianceStatus getComplianceStatus() {
        if (retired || !allowed) {
            return ComplianceStatus.NON_COMPLIANT;
        }
        boolean attention = allViolations().stream().anyMatch(v -> v.getSeverity().isAtLeast(Severity.MEDIUM));
        return attention ? ComplianceStatus.REQUIRES_ATTENTION : ComplianceStatus.COMPLIANT;
    }

    public List<SecurityViolation> allViolations() {
        List<SecurityViolation> all = new ArrayList<>(violations);
        all.addAll(runtimeViolations);
        return all;
    }

    public boolean hasViolation(String violationId) {
        return violations.stream().anyMatch(v -> v.getId().equals(violationId))
                || runtimeViolations.stream().anyMatch(v -> v.getId().equals(violationId));
    }

    public Optional<String> sandbox() {
        return Optional.ofNullable(sandboxId);
    }

    public Optional<SecurityAssessment> latestAssessment() {
        return assessments.isEmpty() ? Optional.empty() : Optional.of(assessments.get(assessments.size() - 1));
    }
}
