package com.lingshield.core.audit.compliance;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 已评估的控制项
 */
@Value
@Builder
public class ComplianceControl {
    String id;
    String name;
    String description;
    String category;
    String owner;
    ControlStatus status;
    /**
     * 0..100
     */
    double score;
    /**
     * 作为证据的事件ID
     */
    @Singular("evidenceId")
    List<String> evidence;
    Instant lastTested;
    Instant nextTest;
}
