package com.lingshield.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.lingshield.api.security.Severity;
import com.lingshield.core.MutableClock;
import com.lingshield.core.audit.compliance.ComplianceCatalog;
import com.lingshield.core.audit.compliance.ComplianceFramework;
import com.lingshield.core.audit.compliance.ComplianceReport;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.event.EventBus;
import com.lingshield.core.event.ShieldEvents;
import com.lingshield.core.exception.IncidentTransitionException;
import com.lingshield.core.util.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditSystem 单元测试")
class AuditSystemTest {

    private MutableClock clock;
    private EventBus eventBus;
    private AuditSystem audit;
    private final List<ShieldEvents.IncidentOpened> opened = new CopyOnWriteArrayList<>();
    private final List<ShieldEvents.IncidentEscalated> escalated = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        eventBus = new EventBus();
        eventBus.subscribe("test", ShieldEvents.IncidentOpened.class, opened::add);
        eventBus.subscribe("test", ShieldEvents.IncidentEscalated.class, escalated::add);
        audit = new AuditSystem(LingShieldConfig.defaults(), eventBus, clock, ComplianceCatalog.loadDefault());
    }

    private SecurityEvent.SecurityEventBuilder denied(String pluginId) {
        return SecurityEvent.builder()
                .type(SecurityEventType.PERMISSION_DENIED)
                .severity(Severity.MEDIUM)
                .pluginId(pluginId)
                .source(EventSource.plugin("sandbox", pluginId))
                .description("filesystem write denied");
    }

    @Nested
    @DisplayName("事件记录")
    class Recording {

        @Test
        @DisplayName("记录时分配 ID、时间戳与递增顺序号")
        void assignsIdentity() {
            SecurityEvent first = audit.recordEvent(SecurityEvent.builder()
                    .id("caller-id")
                    .timestamp(Instant.EPOCH)
                    .type(SecurityEventType.PLUGIN_INSTALL)
                    .severity(Severity.INFO)
                    .build());
            clock.advance(Duration.ofSeconds(1));
            SecurityEvent second = audit.recordEvent(SecurityEvent.builder()
                    .type(SecurityEventType.PLUGIN_INSTALL)
                    .severity(Severity.INFO)
                    .build());

            assertTrue(first.getId().startsWith("evt-"));
            assertNotEquals("caller-id", first.getId());
            assertEquals(Instant.parse("2026-03-01T10:00:00Z"), first.getTimestamp());
            assertTrue(second.getSequence() > first.getSequence());
            assertEquals("0.0.0.0", first.getIpAddress());
            assertEquals(first, audit.getEvent(first.getId()).orElseThrow());
        }

        @Test
        @DisplayName("检索按时间倒序并分页")
        void searchNewestFirst() {
            for (int i = 0; i < 5; i++) {
                audit.recordEvent(SecurityEvent.builder()
                        .type(SecurityEventType.DATA_ACCESS)
                        .severity(Severity.LOW)
                        .description("read " + i)
                        .build());
                clock.advance(Duration.ofSeconds(1));
            }
            audit.recordEvent(SecurityEvent.builder().type(SecurityEventType.PLUGIN_INSTALL).severity(Severity.INFO).build());

            List<SecurityEvent> page0 = audit.searchEvents(EventQuery.builder()
                    .type(SecurityEventType.DATA_ACCESS).limit(2).build());
            List<SecurityEvent> page2 = audit.searchEvents(EventQuery.builder()
                    .type(SecurityEventType.DATA_ACCESS).limit(2).page(2).build());

            assertEquals(List.of("read 4", "read 3"),
                    List.of(page0.get(0).getDescription(), page0.get(1).getDescription()));
            assertEquals(1, page2.size());
            assertEquals("read 0", page2.get(0).getDescription());
        }

        @Test
        @DisplayName("解决事件后以新实例替换")
        void resolveEvent() {
            SecurityEvent event = audit.recordEvent(denied("p1").build());

            audit.resolveEvent(event.getId(), "alice", "permission revoked");

            SecurityEvent stored = audit.getEvent(event.getId()).orElseThrow();
            assertTrue(stored.isResolved());
            assertEquals("alice", stored.getResolvedBy());
            assertEquals(1, audit.searchEvents(EventQuery.builder().resolved(true).build()).size());
        }

        @Test
        @DisplayName("超过保留期的事件被清理")
        void purgeExpired() {
            audit.recordEvent(SecurityEvent.builder().type(SecurityEventType.PLUGIN_INSTALL).severity(Severity.INFO).build());
            clock.advance(Duration.ofDays(400));
            SecurityEvent fresh = audit.recordEvent(SecurityEvent.builder()
                    .type(SecurityEventType.PLUGIN_INSTALL).severity(Severity.INFO).build());

            assertEquals(1, audit.purgeExpired());
            assertEquals(List.of(fresh), audit.searchEvents(EventQuery.ALL));
        }
    }

    @Nested
    @DisplayName("检测与事件单")
    class Detection {

        @Test
        @DisplayName("窗口内 3 个关联事件只开一个事件单，后续事件挂入")
        void correlatedEventsOpenSingleIncident() {
            SecurityEvent e1 = audit.recordEvent(denied("p1").build());
            clock.advance(Duration.ofSeconds(30));
            SecurityEvent e2 = audit.recordEvent(denied("p1").build());
            assertTrue(audit.listIncidents().isEmpty());
            clock.advance(Duration.ofSeconds(30));
            SecurityEvent e3 = audit.recordEvent(denied("p1").build());

            List<SecurityIncident> incidents = audit.listIncidents();
            assertEquals(1, incidents.size());
            SecurityIncident incident = incidents.get(0);
            assertEquals(IncidentStatus.OPEN, incident.getStatus());
            assertEquals(List.of(e1.getId(), e2.getId(), e3.getId()), incident.getEventIds());
            assertTrue(incident.getAffectedPlugins().contains("p1"));
            assertEquals(1, opened.size());

            clock.advance(Duration.ofSeconds(10));
            SecurityEvent e4 = audit.recordEvent(denied("p1").build());
            assertEquals(1, audit.listIncidents().size());
            assertTrue(incident.getEventIds().contains(e4.getId()));
        }

        @Test
        @DisplayName("窗口外的事件不参与关联")
        void eventsOutsideWindowDoNotCorrelate() {
            audit.recordEvent(denied("p1").build());
            clock.advance(Duration.ofMinutes(10));
            audit.recordEvent(denied("p1").build());
            clock.advance(Duration.ofMinutes(10));
            audit.recordEvent(denied("p1").build());

            assertTrue(audit.listIncidents().isEmpty());
        }

        @Test
        @DisplayName("不同插件的事件互不关联")
        void differentPluginsDoNotCorrelate() {
            audit.recordEvent(denied("p1").build());
            audit.recordEvent(denied("p2").build());
            audit.recordEvent(denied("p3").build());

            assertTrue(audit.listIncidents().isEmpty());
        }

        @Test
        @DisplayName("CRITICAL 事件立即开单并自动升级")
        void criticalEventEscalates() {
            audit.recordEvent(SecurityEvent.builder()
                    .type(SecurityEventType.MALWARE_DETECTED)
                    .severity(Severity.CRITICAL)
                    .pluginId("evil")
                    .description("known malware hash")
                    .build());

            SecurityIncident incident = audit.listIncidents().get(0);
            assertEquals(Severity.CRITICAL, incident.getSeverity());
            assertEquals(IncidentStatus.ESCALATED, incident.getStatus());
            assertEquals("security-oncall", incident.getAssignedTo());
            assertEquals(1, escalated.size());
            assertEquals(List.of("INCIDENT_CREATED", "STATUS_CHANGED"),
                    incident.getTimeline().stream().map(IncidentTimelineEntry::action).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("命中威胁情报开单")
        void threatIndicatorMatch() {
            audit.getThreatIntelligence().add(ThreatIndicator.builder()
                    .type(IndicatorType.IP_ADDRESS)
                    .value("203.0.113.7")
                    .source("feed")
                    .build());

            audit.recordEvent(SecurityEvent.builder()
                    .type(SecurityEventType.DATA_ACCESS)
                    .severity(Severity.LOW)
                    .pluginId("p1")
                    .ipAddress("203.0.113.7")
                    .build());

            assertEquals(1, audit.listIncidents().size());
            assertEquals(Severity.HIGH, audit.listIncidents().get(0).getSeverity());
            assertEquals(1, audit.getMetrics().getThreatsMatched());
        }

        @Test
        @DisplayName("命中 HIGH 审计规则开单，LOW 规则不开单")
        void auditRules() {
            audit.addRule(AuditRule.builder().id("r-low").name("low").severity(Severity.LOW)
                    .eventType(SecurityEventType.CONFIGURATION_CHANGE).build());
            audit.recordEvent(SecurityEvent.builder().type(SecurityEventType.CONFIGURATION_CHANGE).severity(Severity.LOW).build());
            assertTrue(audit.listIncidents().isEmpty());

            audit.addRule(AuditRule.builder().id("r-high").name("privileged config").severity(Severity.HIGH)
                    .eventType(SecurityEventType.CONFIGURATION_CHANGE).tag("privileged").build());
            audit.recordEvent(SecurityEvent.builder().type(SecurityEventType.CONFIGURATION_CHANGE)
                    .severity(Severity.LOW).tag("privileged").build());

            assertEquals(1, audit.listIncidents().size());
            assertTrue(audit.listIncidents().get(0).getTitle().contains("privileged config"));
            assertEquals(2, audit.listRules().size());
            assertTrue(audit.removeRule("r-low"));
        }

        @Test
        @DisplayName("同类事件突发触发异常检测")
        void burstTriggersAnomaly() {
            for (int i = 0; i < 20; i++) {
                audit.recordEvent(SecurityEvent.builder()
                        .type(SecurityEventType.DATA_ACCESS)
                        .severity(Severity.LOW)
                        .pluginId("scraper")
                        .build());
            }

            List<SecurityIncident> incidents = audit.listIncidents();
            assertEquals(1, incidents.size());
            assertTrue(incidents.get(0).getTitle().startsWith("Anomalous"));
        }
    }

    @Nested
    @DisplayName("事件单状态迁移")
    class Lifecycle {

        private SecurityIncident incident;

        @BeforeEach
        void openIncident() {
            incident = audit.createIncident("Manual review", "suspicious install", Severity.HIGH,
                    IncidentCategory.SECURITY, "operator", List.of());
        }

        @Test
        @DisplayName("OPEN 不能直接关闭")
        void openCannotClose() {
            assertThrows(IncidentTransitionException.class,
                    () -> audit.updateIncidentStatus(incident.getId(), IncidentStatus.CLOSED, "bob", null));
            assertEquals(IncidentStatus.OPEN, incident.getStatus());
        }

        @Test
        @DisplayName("OPEN 不能直接解决，需先进入处理中")
        void openCannotResolve() {
            assertThrows(IncidentTransitionException.class,
                    () -> audit.updateIncidentStatus(incident.getId(), IncidentStatus.RESOLVED, "bob", null));
            assertEquals(IncidentStatus.OPEN, incident.getStatus());
            assertEquals(Set.of(IncidentStatus.IN_PROGRESS, IncidentStatus.ESCALATED),
                    IncidentStatus.OPEN.next());
        }

        @Test
        @DisplayName("非 CRITICAL 事件单不能升级")
        void onlyCriticalEscalates() {
            assertThrows(IncidentTransitionException.class,
                    () -> audit.updateIncidentStatus(incident.getId(), IncidentStatus.ESCALATED, "bob", null));
        }

        @Test
        @DisplayName("未知事件单抛出异常")
        void unknownIncident() {
            assertThrows(IncidentTransitionException.class,
                    () -> audit.updateIncidentStatus("inc-missing", IncidentStatus.IN_PROGRESS, "bob", null));
        }

        @Test
        @DisplayName("完整流转并计算 MTTR")
        void fullLifecycle() {
            audit.updateIncidentStatus(incident.getId(), IncidentStatus.IN_PROGRESS, "bob", "triage");
            clock.advance(Duration.ofMinutes(30));
            audit.updateIncidentStatus(incident.getId(), IncidentStatus.RESOLVED, "bob", "plugin removed");
            audit.updateIncidentStatus(incident.getId(), IncidentStatus.CLOSED, "bob", null);

            assertEquals(IncidentStatus.CLOSED, incident.getStatus());
            assertNotNull(incident.getClosedAt());
            assertEquals(Instant.parse("2026-03-01T10:30:00Z"), incident.resolvedAt().orElseThrow());
            SecurityMetrics metrics = audit.getMetrics();
            assertEquals(30.0, metrics.getMeanTimeToResolve(), 0.001);
            assertEquals(1L, metrics.getIncidentsByStatus().get(IncidentStatus.CLOSED));
            assertEquals(0L, metrics.getIncidentsByStatus().get(IncidentStatus.OPEN));
            assertEquals(0, metrics.getActiveIncidents());
        }

        @Test
        @DisplayName("已解决的事件单可以重新打开")
        void reopenResolved() {
            audit.updateIncidentStatus(incident.getId(), IncidentStatus.IN_PROGRESS, "bob", null);
            audit.updateIncidentStatus(incident.getId(), IncidentStatus.RESOLVED, "bob", null);
            audit.updateIncidentStatus(incident.getId(), IncidentStatus.IN_PROGRESS, "bob", "recurred");

            assertEquals(IncidentStatus.IN_PROGRESS, incident.getStatus());
            assertTrue(incident.resolvedAt().isEmpty());
        }
    }

    @Nested
    @DisplayName("合规与导出")
    class Reporting {

        @Test
        @DisplayName("无违规事件时合规评分为满分")
        void cleanCompliance() {
            ComplianceReport report = audit.generateComplianceReport(ComplianceFramework.ISO27001,
                    ReportPeriod.lastDays(clock, 30));

            assertEquals(100.0, report.getOverallScore(), 0.001);
            assertTrue(report.getViolations().isEmpty());
            assertSame(report, audit.latestComplianceReport(ComplianceFramework.ISO27001).orElseThrow());
        }

        @Test
        @DisplayName("导出 JSON 包含完整事件")
        void exportJson() throws Exception {
            SecurityEvent event = audit.recordEvent(denied("p1").detail("path", "/etc/passwd").build());

            byte[] bytes = audit.exportData(ExportKind.EVENTS, ExportFormat.JSON, EventQuery.ALL);

            JsonNode tree = JsonSupport.mapper().readTree(bytes);
            assertTrue(tree.isArray());
            assertEquals(event.getId(), tree.get(0).get("id").asText());
            assertEquals("/etc/passwd", tree.get(0).get("details").get("path").asText());
        }

        @Test
        @DisplayName("未指定分页时导出全部事件，显式分页时按页导出")
        void exportIsNotTruncatedByDefaultPage() throws Exception {
            for (int i = 0; i < 120; i++) {
                audit.recordEvent(SecurityEvent.builder()
                        .type(SecurityEventType.LOGIN_SUCCESS)
                        .severity(Severity.INFO)
                        .userId("user-" + i)
                        .source(EventSource.system("auth"))
                        .description("login")
                        .build());
            }

            JsonNode all = JsonSupport.mapper().readTree(audit.exportData(ExportKind.EVENTS, ExportFormat.JSON, null));
            JsonNode logins = JsonSupport.mapper().readTree(audit.exportData(ExportKind.EVENTS, ExportFormat.JSON,
                    EventQuery.builder().type(SecurityEventType.LOGIN_SUCCESS).build()));
            JsonNode firstPage = JsonSupport.mapper().readTree(audit.exportData(ExportKind.EVENTS, ExportFormat.JSON,
                    EventQuery.builder().type(SecurityEventType.LOGIN_SUCCESS).limit(10).build()));

            assertEquals(audit.getMetrics().getTotalEvents(), all.size());
            assertEquals(120, logins.size());
            assertEquals(10, firstPage.size());
            assertEquals(EventQuery.DEFAULT_LIMIT, audit.searchEvents(null).size());
        }

        @Test
        @DisplayName("导出 CSV 首行为表头")
        void exportCsv() {
            audit.recordEvent(denied("p1").build());
            audit.recordEvent(denied("p2").build());

            String csv = new String(audit.exportData(ExportKind.EVENTS, ExportFormat.CSV, EventQuery.ALL),
                    StandardCharsets.UTF_8);

            String[] lines = csv.trim().split("\\R");
            assertEquals(3, lines.length);
            assertTrue(lines[0].contains("pluginId"));
            assertTrue(csv.contains("p2"));
        }

        @Test
        @DisplayName("导出 XML 以类型名为根节点")
        void exportXml() {
            audit.createIncident("Manual review", "desc", Severity.LOW, IncidentCategory.SECURITY, "operator", List.of());

            String xml = new String(audit.exportData(ExportKind.INCIDENTS, ExportFormat.XML, null),
                    StandardCharsets.UTF_8);

            assertTrue(xml.startsWith("<incidents>"));
            assertTrue(xml.contains("Manual review"));
        }
    }
}
