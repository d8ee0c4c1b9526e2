package com.lingshield.core.audit.compliance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 评估证据：对参与评估的事件集合做摘要，便于事后核对
 */
@Value
@Builder
public class ComplianceEvidence {
    String id;
    String controlId;
    String type;
    String description;
    Instant timestamp;
    int eventCount;
    /**
     * 事件ID列表的 SHA-256
     */
    String hash;
}
