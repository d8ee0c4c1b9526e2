package com.lingshield.core.audit;

import com.lingshield.api.event.ShieldEvent;
import com.lingshield.api.exception.InvalidArgumentException;
import com.lingshield.api.security.Severity;
import com.lingshield.core.audit.compliance.ComplianceCatalog;
import com.lingshield.core.audit.compliance.ComplianceEngine;
import com.lingshield.core.audit.compliance.ComplianceFramework;
import com.lingshield.core.audit.compliance.ComplianceReport;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.event.EventBus;
import com.lingshield.core.event.ShieldEvents;
import com.lingshield.core.exception.IncidentTransitionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * 安全审计系统
 * <p>
 * 职责：
 * <ul>
 * <li>事件记录：补全默认值、按记录顺序存储、更新聚合计数</li>
 * <li>检测：关联分析、突发异常、审计规则、威胁情报，满足任一条件即开事件单</li>
 * <li>事件单：受控的状态迁移、时间线、MTTD / MTTR</li>
 * <li>合规报告、检索与导出</li>
 * </ul>
 * 所有写操作串行执行，通知在释放锁之后发布到 {@link EventBus}。
 */
@Slf4j
public class AuditSystem {

    private static final String SYSTEM_ACTOR = "SYSTEM";

    private final LingShieldConfig.Audit auditConfig;
    private final LingShieldConfig.IncidentResponse responseConfig;
    private final EventBus eventBus;
    private final Clock clock;

    private final EventCorrelator correlator;
    private final AnomalyDetector anomalyDetector;
    private final ThreatIntelligence threatIntelligence = new ThreatIntelligence();
    private final ComplianceEngine complianceEngine;
    private final AuditExporter exporter = new AuditExporter();

    private final Object lock = new Object();

    // 按顺序号排列，即记录顺序
    private final ConcurrentSkipListMap<Long, SecurityEvent> events = new ConcurrentSkipListMap<>();
    private final Map<String, Long> eventIndex = new ConcurrentHashMap<>();
    private final Map<String, SecurityIncident> incidents = new ConcurrentHashMap<>();
    // 关联分组键 -> 事件单ID，组内后续事件直接挂到该事件单
    private final Map<String, String> groupIncidents = new ConcurrentHashMap<>();
    private final Map<String, AuditRule> rules = new ConcurrentHashMap<>();
    private final Map<ComplianceFramework, ComplianceReport> latestReports = new ConcurrentHashMap<>();

    // ==================== 聚合指标（受 lock 保护） ====================

    private long sequence;
    private long totalEvents;
    private long totalIncidents;
    private long threatsMatched;
    private final Map<SecurityEventType, Long> eventsByType = new EnumMap<>(SecurityEventType.class);
    private final Map<Severity, Long> eventsBySeverity = new EnumMap<>(Severity.class);
    private final Map<IncidentStatus, Long> incidentsByStatus = new EnumMap<>(IncidentStatus.class);
    private final Map<Severity, Long> incidentsBySeverity = new EnumMap<>(Severity.class);
    private Double meanTimeToDetect;
    private Double meanTimeToResolve;

    public AuditSystem(LingShieldConfig config) {
        this(config, new EventBus(), Clock.systemUTC(), ComplianceCatalog.loadDefault());
    }

    public AuditSystem(LingShieldConfig config, EventBus eventBus, Clock clock, ComplianceCatalog catalog) {
        this.auditConfig = config.getAudit();
        this.responseConfig = config.getIncidentResponse();
        this.eventBus = eventBus;
        this.clock = clock;
        this.correlator = new EventCorrelator(Duration.ofMillis(auditConfig.getCorrelationWindowMs()));
        this.anomalyDetector = new AnomalyDetector(
                Duration.ofMillis(auditConfig.getAnomalyWindowMs()),
                Duration.ofMillis(auditConfig.getAnomalyBaselineMs()),
                auditConfig.getAnomalyBurstSize());
        this.complianceEngine = new ComplianceEngine(catalog, clock, config.getCompliance().getReviewIntervalDays());
        for (IncidentStatus status : IncidentStatus.values()) {
            incidentsByStatus.put(status, 0L);
        }
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public ThreatIntelligence getThreatIntelligence() {
        return threatIntelligence;
    }

    // ==================== 事件 ====================

    /**
     * 记录安全事件
     * <p>
     * ID、时间戳与顺序号由审计系统分配，调用方提供的值会被覆盖。
     */
    public SecurityEvent recordEvent(SecurityEvent partial) {
        InvalidArgumentException.requireNonNull(partial, "event");
        List<ShieldEvent> outbox = new ArrayList<>();
        SecurityEvent event;
        synchronized (lock) {
            Instant now = clock.instant();
            long seq = ++sequence;
            event = partial.toBuilder()
                    .id("evt-" + now.toEpochMilli() + "-" + shortId())
                    .timestamp(now)
                    .sequence(seq)
                    .resolved(false)
                    .resolvedAt(null)
                    .resolvedBy(null)
                    .build();
            events.put(seq, event);
            eventIndex.put(event.getId(), seq);
            updateEventMetrics(event);
            process(event, outbox);
        }
        log.debug("[{}] Security event recorded: {} {} - {}", event.getId(), event.getType(),
                event.getSeverity(), event.getDescription());
        publish(outbox);
        return event;
    }

    public Optional<SecurityEvent> getEvent(String eventId) {
        Long seq = eventIndex.get(eventId);
        return seq == null ? Optional.empty() : Optional.ofNullable(events.get(seq));
    }

    /**
     * 检索事件，按时间倒序分页
     */
    public List<SecurityEvent> searchEvents(EventQuery query) {
        EventQuery q = query == null ? EventQuery.ALL : query;
        int limit = q.pageSize();
        long skip = (long) Math.max(0, q.getPage()) * limit;
        return events.descendingMap().values().stream()
                .filter(q::matches)
                .skip(skip)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * 全部命中事件，按时间倒序，不分页
     */
    public List<SecurityEvent> matchingEvents(EventQuery query) {
        EventQuery q = query == null ? EventQuery.ALL : query;
        return events.descendingMap().values().stream()
                .filter(q::matches)
                .collect(Collectors.toList());
    }

    /**
     * 标记事件已解决
     */
    public SecurityEvent resolveEvent(String eventId, String actor, String mitigation) {
        synchronized (lock) {
            Long seq = eventIndex.get(eventId);
            if (seq == null) {
                throw new InvalidArgumentException("eventId", eventId, "Security event not found: " + eventId);
            }
            SecurityEvent resolved = events.get(seq).toBuilder()
                    .resolved(true)
                    .resolvedAt(clock.instant())
                    .resolvedBy(actor)
                    .mitigation(mitigation)
                    .build();
            events.put(seq, resolved);
            log.info("[{}] Security event resolved by {}", eventId, actor);
            return resolved;
        }
    }

    /**
     * 清理超过保留期的事件
     *
     * @return 删除数量
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(auditConfig.getRetentionDays()));
        int removed = 0;
        synchronized (lock) {
            for (SecurityEvent event : new ArrayList<>(events.values())) {
                if (!event.getTimestamp().isBefore(cutoff)) {
                    break;
                }
                events.remove(event.getSequence());
                eventIndex.remove(event.getId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} security event(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    // ==================== 检测 ====================

    private void process(SecurityEvent event, List<ShieldEvent> outbox) {
        Instant horizon = event.getTimestamp().minus(Duration.ofMillis(
                Math.max(auditConfig.getCorrelationWindowMs(), auditConfig.getAnomalyBaselineMs())));
        List<SecurityEvent> recent = recentEvents(horizon);

        List<SecurityEvent> correlated = correlator.correlate(event, recent);
        double anomalyScore = anomalyDetector.score(event, recent);
        List<AuditRule> ruleHits = evaluateRules(event);
        List<ThreatIndicator> threats = threatIntelligence.match(event);
        threatsMatched += threats.size();

        Optional<String> groupKey = correlator.groupKey(event);
        Optional<SecurityIncident> existing = groupKey
                .map(groupIncidents::get)
                .map(incidents::get)
                .filter(incident -> incident.getStatus().isActive());
        if (existing.isPresent()) {
            SecurityIncident incident = existing.get();
            incident.attach(event);
            incident.addTimeline(event.getTimestamp(), "EVENT_ATTACHED", SYSTEM_ACTOR,
                    "Correlated event " + event.getId() + " attached");
            incident.setImpact(assessImpact(eventsOf(incident.getEventIds())));
            log.debug("[{}] Event {} attached to incident", incident.getId(), event.getId());
            return;
        }

        List<String> reasons = new ArrayList<>();
        Severity severity = null;
        String title = null;
        if (event.getSeverity() == Severity.CRITICAL) {
            title = "Critical security event: " + event.getType();
            severity = Severity.CRITICAL;
            reasons.add("event severity CRITICAL");
        }
        List<AuditRule> blocking = ruleHits.stream()
                .filter(rule -> rule.getSeverity().isAtLeast(Severity.HIGH))
                .collect(Collectors.toList());
        if (!blocking.isEmpty()) {
            Severity ruleSeverity = blocking.stream().map(AuditRule::getSeverity)
                    .reduce(Severity.HIGH, Severity::max);
            title = title != null ? title : "Audit rule triggered: " + blocking.get(0).getName();
            severity = severity == null ? ruleSeverity : severity.max(ruleSeverity);
            reasons.add("audit rules " + blocking.stream().map(AuditRule::getId).collect(Collectors.toList()));
        }
        if (!threats.isEmpty()) {
            ThreatIndicator first = threats.get(0);
            title = title != null ? title : "Threat indicator match: " + first.getType() + " " + first.getValue();
            Severity threatSeverity = event.getSeverity().max(Severity.HIGH);
            severity = severity == null ? threatSeverity : severity.max(threatSeverity);
            reasons.add(threats.size() + " threat indicator(s) matched");
        }
        boolean correlatedTrigger = correlated.size() >= auditConfig.getCorrelationThreshold();
        if (correlatedTrigger) {
            Severity groupSeverity = correlated.stream().map(SecurityEvent::getSeverity)
                    .reduce(Severity.INFO, Severity::max);
            title = title != null ? title
                    : "Correlated " + event.getType() + " events" + (event.getPluginId() != null
                    ? " from plugin " + event.getPluginId() : "");
            severity = severity == null ? groupSeverity : severity.max(groupSeverity);
            reasons.add(correlated.size() + " correlated events");
        }
        if (anomalyScore > auditConfig.getAnomalyThreshold()) {
            title = title != null ? title : "Anomalous " + event.getType() + " burst from plugin " + event.getPluginId();
            Severity anomalySeverity = event.getSeverity().max(Severity.MEDIUM);
            severity = severity == null ? anomalySeverity : severity.max(anomalySeverity);
            reasons.add(String.format("anomaly score %.2f", anomalyScore));
        }
        if (title == null) {
            return;
        }

        List<String> eventIds = correlatedTrigger
                ? correlated.stream().map(SecurityEvent::getId).collect(Collectors.toList())
                : List.of(event.getId());
        SecurityIncident incident = openIncident(title,
                event.getDescription() + " (" + String.join("; ", reasons) + ")",
                severity, IncidentCategory.of(event.getType()), "audit:" + event.getSource().component(),
                eventIds, outbox);
        groupKey.ifPresent(key -> groupIncidents.put(key, incident.getId()));
    }

    private List<SecurityEvent> recentEvents(Instant since) {
        List<SecurityEvent> recent = new ArrayList<>();
        for (SecurityEvent e : events.descendingMap().values()) {
            if (e.getTimestamp().isBefore(since)) {
                break;
            }
            recent.add(e);
        }
        recent.sort(Comparator.comparingLong(SecurityEvent::getSequence));
        return recent;
    }

    private List<AuditRule> evaluateRules(SecurityEvent event) {
        List<AuditRule> hits = new ArrayList<>();
        for (AuditRule rule : rules.values()) {
            if (rule.matches(event)) {
                hits.add(rule);
                log.debug("[{}] Audit rule {} matched event {}", rule.getId(), rule.getName(), event.getId());
            }
        }
        return hits;
    }

    private void updateEventMetrics(SecurityEvent event) {
        totalEvents++;
        eventsByType.merge(event.getType(), 1L, Long::sum);
        eventsBySeverity.merge(event.getSeverity(), 1L, Long::sum);
    }

    // ==================== 审计规则 ====================

    public void addRule(AuditRule rule) {
        rules.put(rule.getId(), rule);
        log.info("[{}] Audit rule registered: {}", rule.getId(), rule.getName());
    }

    public boolean removeRule(String ruleId) {
        return rules.remove(ruleId) != null;
    }

    public List<AuditRule> listRules() {
        return List.copyOf(rules.values());
    }

    // ==================== 事件单 ====================

    /**
     * 创建事件单，CRITICAL 事件单立即升级
     */
    public SecurityIncident createIncident(String title, String description, Severity severity,
                                           IncidentCategory category, String source, Collection<String> eventIds) {
        InvalidArgumentException.requireText(title, "title");
        InvalidArgumentException.requireNonNull(severity, "severity");
        List<ShieldEvent> outbox = new ArrayList<>();
        SecurityIncident incident;
        synchronized (lock) {
            incident = openIncident(title, description, severity,
                    category == null ? IncidentCategory.SECURITY : category, source,
                    eventIds == null ? List.of() : List.copyOf(eventIds), outbox);
        }
        publish(outbox);
        return incident;
    }

    private SecurityIncident openIncident(String title, String description, Severity severity,
                                          IncidentCategory category, String source, List<String> eventIds,
                                          List<ShieldEvent> outbox) {
        Instant now = clock.instant();
        SecurityIncident incident = new SecurityIncident("inc-" + now.toEpochMilli() + "-" + shortId(),
                title, description, severity, category, source, now);
        List<SecurityEvent> linked = eventsOf(eventIds);
        linked.forEach(incident::attach);
        incident.setImpact(assessImpact(linked));
        incident.addTimeline(now, "INCIDENT_CREATED", SYSTEM_ACTOR, "Incident created: " + title);

        incidents.put(incident.getId(), incident);
        totalIncidents++;
        incidentsByStatus.merge(IncidentStatus.OPEN, 1L, Long::sum);
        incidentsBySeverity.merge(severity, 1L, Long::sum);

        linked.stream().map(SecurityEvent::getTimestamp).min(Comparator.naturalOrder()).ifPresent(first -> {
            double minutes = Duration.between(first, now).toMillis() / 60_000.0;
            meanTimeToDetect = runningAverage(meanTimeToDetect, minutes);
        });

        outbox.add(new ShieldEvents.IncidentOpened(incident.getId(), title, severity));
        log.info("[{}] Security incident opened: {} ({})", incident.getId(), title, severity);

        if (severity == Severity.CRITICAL) {
            escalate(incident, SYSTEM_ACTOR, "Automatic escalation of critical incident", outbox);
        }
        return incident;
    }

    private void escalate(SecurityIncident incident, String actor, String notes, List<ShieldEvent> outbox) {
        IncidentStatus from = incident.getStatus();
        applyStatus(incident, IncidentStatus.ESCALATED, actor, notes, outbox);
        if (incident.getAssignedTo() == null) {
            incident.setAssignedTo(responseConfig.getEscalationAssignee());
        }
        outbox.add(new ShieldEvents.IncidentEscalated(incident.getId(), incident.getAssignedTo(), incident.getSeverity()));
        log.warn("[{}] Incident escalated from {} to {}", incident.getId(), from, incident.getAssignedTo());
    }

    /**
     * 推进事件单状态
     *
     * @throws IncidentTransitionException 事件单不存在或迁移不合法
     */
    public SecurityIncident updateIncidentStatus(String incidentId, IncidentStatus status, String actor, String notes) {
        InvalidArgumentException.requireNonNull(status, "status");
        List<ShieldEvent> outbox = new ArrayList<>();
        SecurityIncident incident;
        synchronized (lock) {
            incident = incidents.get(incidentId);
            if (incident == null) {
                throw new IncidentTransitionException(incidentId, "Incident not found: " + incidentId);
            }
            IncidentStatus current = incident.getStatus();
            if (!current.canTransitionTo(status)) {
                throw new IncidentTransitionException(incidentId,
                        "Illegal incident transition " + current + " -> " + status);
            }
            if (status == IncidentStatus.ESCALATED) {
                if (incident.getSeverity() != Severity.CRITICAL) {
                    throw new IncidentTransitionException(incidentId,
                            "Only CRITICAL incidents can be escalated, severity is " + incident.getSeverity());
                }
                escalate(incident, actor, notes, outbox);
            } else {
                applyStatus(incident, status, actor, notes, outbox);
            }
        }
        publish(outbox);
        return incident;
    }

    private void applyStatus(SecurityIncident incident, IncidentStatus status, String actor, String notes,
                             List<ShieldEvent> outbox) {
        Instant now = clock.instant();
        IncidentStatus from = incident.getStatus();
        incident.setStatus(status);
        if (status == IncidentStatus.RESOLVED) {
            incident.setResolvedAt(now);
            double minutes = Duration.between(incident.getDetectedAt(), now).toMillis() / 60_000.0;
            meanTimeToResolve = runningAverage(meanTimeToResolve, minutes);
        } else if (status == IncidentStatus.CLOSED) {
            incident.setClosedAt(now);
        } else if (from == IncidentStatus.RESOLVED) {
            incident.setResolvedAt(null);
        }
        incident.addTimeline(now, "STATUS_CHANGED", actor,
                "Status changed from " + from + " to " + status + (notes != null ? ": " + notes : ""));
        incidentsByStatus.merge(from, -1L, Long::sum);
        incidentsByStatus.merge(status, 1L, Long::sum);
        outbox.add(new ShieldEvents.IncidentStatusChanged(incident.getId(), from, status, actor));
        log.info("[{}] Incident status {} -> {} by {}", incident.getId(), from, status, actor);
    }

    public SecurityIncident assignIncident(String incidentId, String assignee, String actor) {
        synchronized (lock) {
            SecurityIncident incident = incidents.get(incidentId);
            if (incident == null) {
                throw new IncidentTransitionException(incidentId, "Incident not found: " + incidentId);
            }
            incident.setAssignedTo(assignee);
            incident.addTimeline(clock.instant(), "ASSIGNED", actor, "Assigned to " + assignee);
            return incident;
        }
    }

    /**
     * 记录根因并追加时间线
     */
    public SecurityIncident recordRootCause(String incidentId, String rootCause, String actor) {
        synchronized (lock) {
            SecurityIncident incident = incidents.get(incidentId);
            if (incident == null) {
                throw new IncidentTransitionException(incidentId, "Incident not found: " + incidentId);
            }
            incident.setRootCause(rootCause);
            incident.addTimeline(clock.instant(), "ROOT_CAUSE", actor, rootCause);
            return incident;
        }
    }

    public Optional<SecurityIncident> getIncident(String incidentId) {
        return Optional.ofNullable(incidents.get(incidentId));
    }

    /**
     * 按检测时间倒序
     */
    public List<SecurityIncident> listIncidents() {
        return incidents.values().stream()
                .sorted(Comparator.comparing(SecurityIncident::getDetectedAt).reversed())
                .collect(Collectors.toList());
    }

    public List<SecurityIncident> incidentsForPlugin(String pluginId) {
        return listIncidents().stream()
                .filter(incident -> incident.getAffectedPlugins().contains(pluginId))
                .collect(Collectors.toList());
    }

    private ImpactAssessment assessImpact(List<SecurityEvent> linked) {
        ImpactAssessment.ImpactAssessmentBuilder impact = ImpactAssessment.builder();
        Set<String> users = new HashSet<>();
        Set<String> systems = new HashSet<>();
        long volume = 0;
        boolean exposed = false;
        Severity worst = Severity.LOW;
        ImpactAssessment.Availability availability = ImpactAssessment.Availability.NONE;
        for (SecurityEvent e : linked) {
            if (e.getUserId() != null) {
                users.add(e.getUserId());
            }
            if (e.getPluginId() != null) {
                systems.add(e.getPluginId());
            }
            if (e.getType() == SecurityEventType.DATA_EXFILTRATION) {
                exposed = true;
            }
            Object bytes = e.getDetails().get("bytes");
            if (bytes instanceof Number) {
                volume += ((Number) bytes).longValue();
            }
            worst = worst.max(e.getSeverity());
            if (e.getType() == SecurityEventType.RUNTIME_VIOLATION) {
                availability = e.getSeverity() == Severity.CRITICAL
                        ? ImpactAssessment.Availability.MAJOR : ImpactAssessment.Availability.MINOR;
            }
        }
        impact.dataExposed(exposed)
                .systemsAffected(systems)
                .usersAffected(users.size())
                .dataVolume(volume)
                .reputationImpact(worst)
                .availabilityImpact(availability);
        if (exposed) {
            impact.complianceImpact("GDPR");
        }
        return impact.build();
    }

    private List<SecurityEvent> eventsOf(Collection<String> ids) {
        List<SecurityEvent> found = new ArrayList<>();
        for (String id : ids) {
            Optional<SecurityEvent> event = getEvent(id);
            if (event.isPresent()) {
                found.add(event.get());
            } else {
                log.warn("Unknown security event referenced by incident: {}", id);
            }
        }
        return found;
    }

    // ==================== 指标、合规与导出 ====================

    public SecurityMetrics getMetrics() {
        synchronized (lock) {
            long active = incidents.values().stream().filter(i -> i.getStatus().isActive()).count();
            return SecurityMetrics.builder()
                    .totalEvents(totalEvents)
                    .eventsByType(Map.copyOf(eventsByType))
                    .eventsBySeverity(Map.copyOf(eventsBySeverity))
                    .totalIncidents(totalIncidents)
                    .incidentsByStatus(Map.copyOf(incidentsByStatus))
                    .incidentsBySeverity(Map.copyOf(incidentsBySeverity))
                    .meanTimeToDetect(meanTimeToDetect == null ? 0 : meanTimeToDetect)
                    .meanTimeToResolve(meanTimeToResolve == null ? 0 : meanTimeToResolve)
                    .threatsMatched(threatsMatched)
                    .activeIncidents(active)
                    .build();
        }
    }

    public ComplianceReport generateComplianceReport(ComplianceFramework framework, ReportPeriod period) {
        ComplianceReport report = complianceEngine.generateReport(framework, period, List.copyOf(events.values()));
        latestReports.put(framework, report);
        return report;
    }

    public Optional<ComplianceReport> latestComplianceReport(ComplianceFramework framework) {
        return Optional.ofNullable(latestReports.get(framework));
    }

    /**
     * 导出审计数据，EVENTS 使用检索条件过滤；条件未显式设置每页条数时导出全部命中事件
     */
    public byte[] exportData(ExportKind kind, ExportFormat format, EventQuery filters) {
        Object data;
        switch (kind) {
            case EVENTS:
                data = filters != null && filters.isPaged() ? searchEvents(filters) : matchingEvents(filters);
                break;
            case INCIDENTS:
                data = listIncidents();
                break;
            case METRICS:
                data = getMetrics();
                break;
            case COMPLIANCE:
                data = List.copyOf(latestReports.values());
                break;
            default:
                throw new InvalidArgumentException("kind", kind, "Unknown export kind: " + kind);
        }
        log.info("Exporting {} as {}", kind, format);
        return exporter.export(kind, format, data);
    }

    // ==================== 内部 ====================

    /**
     * 首个样本直接采用，之后与上一次均值取平均
     */
    private static double runningAverage(Double previous, double sample) {
        return previous == null ? sample : (previous + sample) / 2;
    }

    private void publish(List<ShieldEvent> outbox) {
        for (ShieldEvent event : outbox) {
            eventBus.publish(event);
        }
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
