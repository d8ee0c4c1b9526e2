package com.lingshield.core.audit.compliance;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ComplianceRecommendation {
    String id;
    String title;
    String description;
    Severity priority;
    String category;
    String controlId;
}
