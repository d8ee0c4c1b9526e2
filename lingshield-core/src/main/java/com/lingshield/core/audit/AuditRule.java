package com.lingshield.core.audit;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.Set;

/**
 * 审计策略规则
 * <p>
 * 空的匹配集合表示不限制该维度；命中 HIGH / CRITICAL 规则会开事件单。
 */
@Value
@Builder(toBuilder = true)
public class AuditRule {

    @NonNull
    String id;

    @NonNull
    String name;

    String description;

    @Singular
    Set<SecurityEventType> eventTypes;

    /**
     * 事件最低严重级别
     */
    @Builder.Default
    Severity minEventSeverity = Severity.INFO;

    /**
     * 任一标签命中即可
     */
    @Singular
    Set<String> tags;

    @Singular
    Set<String> pluginIds;

    /**
     * 规则本身的严重级别
     */
    @NonNull
    Severity severity;

    @Builder.Default
    boolean enabled = true;

    public boolean matches(SecurityEvent event) {
        if (!enabled) {
            return false;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.getType())) {
            return false;
        }
        if (!event.getSeverity().isAtLeast(minEventSeverity)) {
            return false;
        }
        if (!pluginIds.isEmpty() && !pluginIds.contains(event.getPluginId())) {
            return false;
        }
        return tags.isEmpty() || !Collections.disjoint(tags, event.getTags());
    }
}
