package com.lingshield.core.audit;

import java.time.Instant;

/**
 * 事件单时间线条目
 */
public record IncidentTimelineEntry(Instant timestamp, String action, String actor, String description) {
}
