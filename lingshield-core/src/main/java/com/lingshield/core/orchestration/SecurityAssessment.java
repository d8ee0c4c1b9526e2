package com.lingshield.core.orchestration;

import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.TrustLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一次安全评估的记录，追加到档案历史中
 */
@Value
@Builder
public class SecurityAssessment {
    String id;
    AssessmentType type;
    Instant assessedAt;
    String policyId;
    int score;
    RiskLevel riskLevel;
    TrustLevel trustLevel;
    boolean allowed;
    boolean signatureValid;
    int violationCount;
    String summary;
}
