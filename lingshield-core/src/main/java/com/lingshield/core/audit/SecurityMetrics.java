package com.lingshield.core.audit;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 审计指标快照
 */
@Value
@Builder
public class SecurityMetrics {
    long totalEvents;
    Map<SecurityEventType, Long> eventsByType;
    Map<Severity, Long> eventsBySeverity;
    long totalIncidents;
    Map<IncidentStatus, Long> incidentsByStatus;
    Map<Severity, Long> incidentsBySeverity;
    /**
     * 平均检测时间（分钟）
     */
    double meanTimeToDetect;
    /**
     * 平均解决时间（分钟）
     */
    double meanTimeToResolve;
    long threatsMatched;
    long activeIncidents;
}
