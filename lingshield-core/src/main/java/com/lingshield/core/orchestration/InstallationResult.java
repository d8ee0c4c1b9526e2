package com.lingshield.core.orchestration;

import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.analysis.CodeAnalysisResult;
import com.lingshield.core.framework.SecurityRestriction;
import com.lingshield.core.signature.VerificationResult;
import com.lingshield.core.violation.SecurityViolation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 安装裁决
 * <p>
 * 无论允许与否都附带完整的违规列表与整改建议。
 */
@Value
@Builder
public class InstallationResult {

    String pluginId;

    boolean allowed;

    RiskLevel riskLevel;

    TrustLevel trustLevel;

    int securityScore;

    @Singular
    List<SecurityViolation> violations;

    @Singular
    List<SecurityRestriction> restrictions;

    @Singular
    List<String> recommendations;

    String sandboxId;

    long profileVersion;

    /**
     * 拒绝原因，允许时为空
     */
    String reason;

    CodeAnalysisResult analysis;

    VerificationResult verification;

    Instant decidedAt;

    public Optional<String> sandbox() {
        return Optional.ofNullable(sandboxId);
    }
}
