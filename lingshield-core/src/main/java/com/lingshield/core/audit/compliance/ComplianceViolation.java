package com.lingshield.core.audit.compliance;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ComplianceViolation {
    String id;
    String controlId;
    Severity severity;
    String description;
    Instant discoveredAt;
    @Builder.Default
    Status status = Status.OPEN;
    String remediation;
    Instant dueDate;

    public enum Status {
        OPEN, IN_PROGRESS, RESOLVED, ACCEPTED_RISK
    }
}
