package com.lingshield.core.audit;

import com.lingshield.api.security.Severity;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 安全事件单
 * <p>
 * 状态只能经 {@link AuditSystem#updateIncidentStatus} 推进，写操作由 AuditSystem 串行化。
 */
@Getter
public class SecurityIncident {

    private final String id;
    private final String title;
    private final String description;
    private final IncidentCategory category;
    private final String source;
    private final Instant detectedAt;

    private final Severity severity;
    private volatile IncidentStatus status = IncidentStatus.OPEN;
    private volatile ImpactAssessment impact = ImpactAssessment.NONE;
    private volatile String assignedTo;
    private volatile Instant resolvedAt;
    private volatile Instant closedAt;
    private volatile String rootCause;

    private final Set<String> eventIds = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> affectedPlugins = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> affectedUsers = Collections.synchronizedSet(new LinkedHashSet<>());
    private final List<IncidentTimelineEntry> timeline = Collections.synchronizedList(new ArrayList<>());

    SecurityIncident(String id, String title, String description, Severity severity,
                     IncidentCategory category, String source, Instant detectedAt) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.severity = severity;
        this.category = category;
        this.source = source;
        this.detectedAt = detectedAt;
    }

    public List<String> getEventIds() {
        synchronized (eventIds) {
            return List.copyOf(eventIds);
        }
    }

    public Set<String> getAffectedPlugins() {
        synchronized (affectedPlugins) {
            return Set.copyOf(affectedPlugins);
        }
    }

    public Set<String> getAffectedUsers() {
        synchronized (affectedUsers) {
            return Set.copyOf(affectedUsers);
        }
    }

    public List<IncidentTimelineEntry> getTimeline() {
        synchronized (timeline) {
            return List.copyOf(timeline);
        }
    }

    public Optional<Instant> resolvedAt() {
        return Optional.ofNullable(resolvedAt);
    }

    // ==================== 仅供 AuditSystem 调用 ====================

    void attach(SecurityEvent event) {
        eventIds.add(event.getId());
        if (event.getPluginId() != null) {
            affectedPlugins.add(event.getPluginId());
        }
        if (event.getUserId() != null) {
            affectedUsers.add(event.getUserId());
        }
    }

    void addTimeline(Instant at, String action, String actor, String text) {
        timeline.add(new IncidentTimelineEntry(at, action, actor, text));
    }

    void setStatus(IncidentStatus status) {
        this.status = status;
    }

    void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    void setImpact(ImpactAssessment impact) {
        this.impact = impact;
    }

    void setRootCause(String rootCause) {
        this.rootCause = rootCause;
    }

    @Override
    public String toString() {
        return "SecurityIncident{id=" + id + ", severity=" + severity + ", status=" + status
                + ", events=" + eventIds.size() + "}";
    }
}
