package com.lingshield.core.audit;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * 事件检索条件，结果按时间倒序分页
 */
@Value
@Builder(toBuilder = true)
public class EventQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final EventQuery ALL = EventQuery.builder().build();

    SecurityEventType type;
    Severity severity;
    String pluginId;
    String userId;
    Instant from;
    Instant to;

    /**
     * 任一标签命中即可
     */
    @Singular
    Set<String> tags;

    Boolean resolved;

    @Builder.Default
    int page = 0;

    /**
     * 每页条数；未设置时检索使用 {@link #DEFAULT_LIMIT}，导出不分页
     */
    int limit;

    public boolean isPaged() {
        return limit > 0;
    }

    public int pageSize() {
        return limit > 0 ? limit : DEFAULT_LIMIT;
    }

    public boolean matches(SecurityEvent event) {
        if (type != null && event.getType() != type) {
            return false;
        }
        if (severity != null && event.getSeverity() != severity) {
            return false;
        }
        if (pluginId != null && !pluginId.equals(event.getPluginId())) {
            return false;
        }
        if (userId != null && !userId.equals(event.getUserId())) {
            return false;
        }
        if (from != null && event.getTimestamp().isBefore(from)) {
            return false;
        }
        if (to != null && event.getTimestamp().isAfter(to)) {
            return false;
        }
        if (resolved != null && event.isResolved() != resolved) {
            return false;
        }
        return tags.isEmpty() || !Collections.disjoint(tags, event.getTags());
    }
}
