package com.lingshield.core.audit.compliance;

import com.lingshield.core.audit.ReportPeriod;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ComplianceReport {
    String id;
    ComplianceFramework framework;
    ReportPeriod period;
    double overallScore;
    @Singular
    List<ComplianceControl> controls;
    @Singular
    List<ComplianceViolation> violations;
    @Singular
    List<ComplianceRecommendation> recommendations;
    @Singular("evidenceItem")
    List<ComplianceEvidence> evidence;
    Instant generatedAt;
    Instant nextReviewDate;
}
