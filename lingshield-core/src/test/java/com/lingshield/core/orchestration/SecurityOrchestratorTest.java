package com.lingshield.core.orchestration;

import com.lingshield.api.context.SecurityContext;
import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.MutableClock;
import com.lingshield.core.analysis.AnalysisPass;
import com.lingshield.core.analysis.AnalysisStatus;
import com.lingshield.core.analysis.CodeAnalysisResult;
import com.lingshield.core.analysis.CodeAnalyzer;
import com.lingshield.core.analysis.QualityMetrics;
import com.lingshield.core.analysis.SecurityVulnerability;
import com.lingshield.core.analysis.SourceLocation;
import com.lingshield.core.analysis.VulnerabilityType;
import com.lingshield.core.audit.AuditSystem;
import com.lingshield.core.audit.EventQuery;
import com.lingshield.core.audit.ReportPeriod;
import com.lingshield.core.audit.SecurityEvent;
import com.lingshield.core.audit.SecurityEventType;
import com.lingshield.core.audit.SecurityIncident;
import com.lingshield.core.audit.compliance.ComplianceCatalog;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.event.EventBus;
import com.lingshield.core.event.ShieldEvents;
import com.lingshield.core.exception.PluginSecurityException;
import com.lingshield.core.framework.ComplianceStatus;
import com.lingshield.core.framework.MonitorResult;
import com.lingshield.core.framework.OperationType;
import com.lingshield.core.framework.PluginOperation;
import com.lingshield.core.framework.PolicyStore;
import com.lingshield.core.framework.RestrictionType;
import com.lingshield.core.framework.SecurityFramework;
import com.lingshield.core.framework.VulnerableDependencyCatalog;
import com.lingshield.core.sandbox.InProcessIsolationProvider;
import com.lingshield.core.sandbox.Sandbox;
import com.lingshield.core.sandbox.SandboxState;
import com.lingshield.core.signature.SignatureVerifier;
import com.lingshield.core.signature.VerificationResult;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SecurityOrchestrator 单元测试")
class SecurityOrchestratorTest {

    private static final String PLUGIN_ID = "report-exporter";

    @TempDir
    Path tempDir;

    @Mock
    private CodeAnalyzer analyzer;

    @Mock
    private SignatureVerifier verifier;

    private MutableClock clock;
    private LingShieldConfig config;
    private AuditSystem audit;
    private SecurityFramework framework;
    private SecurityOrchestrator orchestrator;
    private SecurityContext context;
    private Path pluginDir;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-05-04T08:00:00Z"));
        config = LingShieldConfig.defaults();
        config.getRuntimeProtection().setSandboxing(false);
        config.getRuntimeProtection().setGracePeriodMs(100);
        config.getRuntimeProtection().setWorkspaceRoot(tempDir.resolve("sandboxes").toString());
        audit = new AuditSystem(config, new EventBus(), clock, ComplianceCatalog.loadDefault());
        framework = new SecurityFramework(config, audit, new PolicyStore(), new InProcessIsolationProvider(),
                VulnerableDependencyCatalog.loadDefault(), clock);
        orchestrator = new SecurityOrchestrator(config, analyzer, verifier, framework, audit, clock);
        context = SecurityContext.builder()
                .requestId("req-7")
                .userId("ops-admin")
                .sourceIp("10.1.2.3")
                .build();
        pluginDir = Files.createDirectories(tempDir.resolve("plugins").resolve(PLUGIN_ID));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    // ==================== 辅助 ====================

    private void given(CodeAnalysisResult analysis, VerificationResult verification) {
        when(analyzer.analyze(any(Path.class))).thenReturn(analysis);
        when(verifier.verify(any(Path.class))).thenReturn(verification);
    }

    private InstallationResult install() {
        return orchestrator.processPluginInstallation(PLUGIN_ID, pluginDir, context);
    }

    private InstallationResult installTrusted() {
        given(analysis(80), signed(TrustLevel.ENTERPRISE));
        return install();
    }

    private static CodeAnalysisResult analysis(int score, SecurityVulnerability... findings) {
        CodeAnalysisResult.CodeAnalysisResultBuilder builder = CodeAnalysisResult.builder()
                .status(AnalysisStatus.COMPLETED)
                .safe(findings.length == 0)
                .score(score)
                .qualityMetrics(QualityMetrics.EMPTY)
                .signature("sha256:0f1e2d");
        for (SecurityVulnerability finding : findings) {
            builder.vulnerability(finding);
        }
        return builder.build();
    }

    private static SecurityVulnerability finding(Severity severity) {
        return SecurityVulnerability.builder()
                .type(VulnerabilityType.COMMAND_INJECTION)
                .severity(severity)
                .title("Runtime.exec with request parameter")
                .location(SourceLocation.of("src/main/java/demo/Shell.java", 21))
                .pass(AnalysisPass.DATA_FLOW)
                .build();
    }

    private static VerificationResult signed(TrustLevel trust) {
        return VerificationResult.builder().valid(true).trustLevel(trust).build();
    }

    private static VerificationResult unsigned() {
        return VerificationResult.builder().valid(false).trustLevel(TrustLevel.UNTRUSTED).build();
    }

    private static PluginOperation spawn(String executable) {
        return PluginOperation.builder().type(OperationType.PROCESS_SPAWN).target(executable).build();
    }

    private List<SecurityEvent> events(SecurityEventType type) {
        return audit.searchEvents(EventQuery.builder().pluginId(PLUGIN_ID).type(type).build());
    }

    // ==================== 安装裁决 ====================

    @Nested
    @DisplayName("安装裁决")
    class InstallationTests {

        @Test
        @DisplayName("评分 80、无高危发现、ENTERPRISE 签名：允许安装，风险 LOW，创建沙箱")
        void trustedPluginIsAllowed() {
            InstallationResult result = installTrusted();

            assertTrue(result.isAllowed());
            assertEquals(RiskLevel.LOW, result.getRiskLevel());
            assertEquals(TrustLevel.ENTERPRISE, result.getTrustLevel());
            assertTrue(result.getViolations().isEmpty());
            assertTrue(result.getRestrictions().isEmpty());
            assertNull(result.getReason());
            assertTrue(result.sandbox().isPresent());
            assertEquals(SandboxState.ACTIVE,
                    framework.getSandbox(result.getSandboxId()).orElseThrow().getState());

            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            assertEquals(result.getSandboxId(), profile.getSandboxId());
            assertEquals(result.getProfileVersion(), profile.getVersion());
            assertEquals(ComplianceStatus.COMPLIANT, profile.getComplianceStatus());
            assertEquals("sha256:0f1e2d", profile.getAnalysisSignature());
        }

        @Test
        @DisplayName("存在 CRITICAL 违规时无论评分与签名都拒绝")
        void criticalViolationDenies() {
            given(analysis(95, finding(Severity.CRITICAL)), signed(TrustLevel.SYSTEM));

            InstallationResult result = install();

            assertFalse(result.isAllowed());
            assertEquals(RiskLevel.CRITICAL, result.getRiskLevel());
            assertNull(result.getSandboxId());
            assertTrue(result.getViolations().stream().anyMatch(v -> v.getSeverity() == Severity.CRITICAL));
            assertTrue(framework.sandboxesFor(PLUGIN_ID).isEmpty());

            SecurityEvent event = events(SecurityEventType.PLUGIN_INSTALL).get(0);
            assertEquals(Severity.CRITICAL, event.getSeverity());
            assertEquals(false, event.getDetails().get("allowed"));
        }

        @Test
        @DisplayName("严格模式下评分低于 50 拒绝，关闭严格模式后允许并附加限制")
        void strictModeScoreFloor() {
            given(analysis(40), unsigned());

            InstallationResult strict = install();
            assertFalse(strict.isAllowed());
            assertTrue(strict.getReason().contains("below 50"));

            config.getStaticAnalysis().setStrictMode(false);
            InstallationResult lenient = install();

            assertTrue(lenient.isAllowed());
            assertEquals(RiskLevel.HIGH, lenient.getRiskLevel());
            assertTrue(lenient.getRestrictions().stream()
                    .anyMatch(r -> r.getType() == RestrictionType.NETWORK && r.getScope().equals("*")));
            assertTrue(lenient.getRestrictions().stream()
                    .anyMatch(r -> r.getType() == RestrictionType.FILESYSTEM && r.getScope().equals("/etc")));
            assertEquals(lenient.getRestrictions(),
                    framework.restrictionsOf(lenient.getSandboxId()));
        }

        @Test
        @DisplayName("强制签名时未签名插件被拒绝")
        void requireSignature() {
            config.getSignatureVerification().setRequireSignature(true);
            given(analysis(90), unsigned());

            InstallationResult result = install();

            assertFalse(result.isAllowed());
            assertEquals("Valid signature required", result.getReason());
            assertTrue(result.getRecommendations().stream().anyMatch(r -> r.contains("Sign the plugin")));
        }

        @Test
        @DisplayName("静态分析超时记为 HIGH 违规")
        void analysisTimeoutAddsViolation() {
            config.getStaticAnalysis().setStrictMode(false);
            given(CodeAnalysisResult.failed(AnalysisStatus.TIMEOUT, "Analysis exceeded 300000 ms", 300_000),
                    signed(TrustLevel.HIGH));

            InstallationResult result = install();

            SecurityViolation violation = result.getViolations().stream()
                    .filter(v -> v.getType() == ViolationType.STATIC_ANALYSIS)
                    .findFirst().orElseThrow();
            assertEquals(Severity.HIGH, violation.getSeverity());
            assertEquals("TIMEOUT", violation.getDetails().get("status"));
            assertEquals(RiskLevel.CRITICAL, result.getRiskLevel());
        }

        @Test
        @DisplayName("内部故障不向调用方抛出，按 INTERNAL_ERROR 拒绝")
        void internalErrorBecomesDenial() {
            when(analyzer.analyze(any(Path.class))).thenThrow(new IllegalStateException("parser crashed"));
            when(verifier.verify(any(Path.class))).thenReturn(signed(TrustLevel.HIGH));

            InstallationResult result = assertDoesNotThrow(() -> install());

            assertFalse(result.isAllowed());
            assertEquals(1, result.getViolations().size());
            SecurityViolation violation = result.getViolations().get(0);
            assertEquals(ViolationType.INTERNAL_ERROR, violation.getType());
            assertEquals(Severity.HIGH, violation.getSeverity());
            assertTrue(result.getReason().contains("parser crashed"));

            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            assertFalse(profile.isAllowed());
            assertEquals(AssessmentType.FAILED_INSTALLATION, profile.latestAssessment().orElseThrow().getType());
        }

        @Test
        @DisplayName("非 VirtualMachineError 的 Error 同样按 INTERNAL_ERROR 拒绝")
        void assertionErrorBecomesDenial() {
            when(analyzer.analyze(any(Path.class))).thenThrow(new AssertionError("visitor invariant broken"));
            when(verifier.verify(any(Path.class))).thenReturn(signed(TrustLevel.HIGH));

            InstallationResult result = assertDoesNotThrow(() -> install());

            assertFalse(result.isAllowed());
            assertEquals(ViolationType.INTERNAL_ERROR, result.getViolations().get(0).getType());
            assertTrue(result.getReason().contains("visitor invariant broken"));
        }

        @Test
        @DisplayName("虚拟机错误先记录拒绝再向上抛出")
        void virtualMachineErrorIsRecordedThenRethrown() {
            installTrusted();
            String previousSandbox = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow().getSandboxId();
            when(analyzer.analyze(any(Path.class))).thenThrow(new StackOverflowError());

            assertThrows(StackOverflowError.class, () -> install());

            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            assertFalse(profile.isAllowed());
            assertNull(profile.getSandboxId());
            assertEquals(AssessmentType.FAILED_INSTALLATION, profile.latestAssessment().orElseThrow().getType());
            assertTrue(framework.getSandbox(previousSandbox).isEmpty());
            assertEquals(2, events(SecurityEventType.PLUGIN_INSTALL).size());
        }

        @Test
        @DisplayName("缺少插件 ID 也按拒绝返回")
        void blankPluginIdIsDenied() {
            InstallationResult result = orchestrator.processPluginInstallation(" ", pluginDir, context);

            assertFalse(result.isAllowed());
            assertEquals(ViolationType.INTERNAL_ERROR, result.getViolations().get(0).getType());
            assertTrue(orchestrator.listProfiles().isEmpty());
            verify(analyzer, never()).analyze(any(Path.class));
        }

        @Test
        @DisplayName("重复安装追加评估历史并替换沙箱")
        void reinstallAppendsHistory() {
            InstallationResult first = installTrusted();
            InstallationResult second = install();

            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            assertEquals(2, profile.getAssessments().size());
            assertTrue(second.getProfileVersion() > first.getProfileVersion());
            assertNotEquals(first.getSandboxId(), second.getSandboxId());
            assertTrue(framework.getSandbox(first.getSandboxId()).isEmpty());
            assertEquals(1, framework.sandboxesFor(PLUGIN_ID).size());
        }

        @Test
        @DisplayName("并发重复安装只保留档案记录的那一个沙箱")
        void concurrentReinstallKeepsOneSandbox() throws Exception {
            given(analysis(80), signed(TrustLevel.ENTERPRISE));
            int installers = 8;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(installers);
            try {
                List<Future<InstallationResult>> results = new ArrayList<>();
                for (int i = 0; i < installers; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return install();
                    }));
                }
                start.countDown();
                for (Future<InstallationResult> result : results) {
                    assertTrue(result.get(10, TimeUnit.SECONDS).isAllowed());
                }
            } finally {
                pool.shutdownNow();
            }

            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            List<Sandbox> sandboxes = framework.sandboxesFor(PLUGIN_ID);
            assertEquals(1, sandboxes.size());
            assertEquals(profile.getSandboxId(), sandboxes.get(0).getId());
            assertEquals(installers, profile.getAssessments().size());
            assertEquals(1, framework.activeSandboxes().stream()
                    .filter(s -> s.getPluginId().equals(PLUGIN_ID))
                    .count());
        }

        @Test
        @DisplayName("裁决通过事件总线广播")
        void decisionIsPublished() {
            List<ShieldEvents.InstallationDecided> decisions = new ArrayList<>();
            audit.getEventBus().subscribe("test", ShieldEvents.InstallationDecided.class, decisions::add);

            installTrusted();

            assertEquals(1, decisions.size());
            assertTrue(decisions.get(0).isAllowed());
            assertEquals(RiskLevel.LOW, decisions.get(0).getRiskLevel());
        }

        @Test
        @DisplayName("关闭运行期防护时允许安装但不创建沙箱")
        void runtimeProtectionDisabled() {
            config.getRuntimeProtection().setEnabled(false);

            InstallationResult result = installTrusted();

            assertTrue(result.isAllowed());
            assertNull(result.getSandboxId());
        }
    }

    // ==================== 运行期 ====================

    @Nested
    @DisplayName("运行期监控")
    class RuntimeTests {

        @Test
        @DisplayName("允许的操作写入 PLUGIN_OPERATION 审计事件")
        void allowedOperationIsAudited() {
            installTrusted();

            MonitorResult result = orchestrator.monitorPluginExecution(PLUGIN_ID,
                    PluginOperation.connect("api.example.com", 443, 512), context);

            assertTrue(result.allowed());
            List<SecurityEvent> operations = events(SecurityEventType.PLUGIN_OPERATION);
            assertEquals(1, operations.size());
            assertEquals("NETWORK_CONNECT", operations.get(0).getDetails().get("operation"));
        }

        @Test
        @DisplayName("没有档案、被拒绝或已退役的插件不能运行")
        void requiresAllowedProfile() {
            assertThrows(PluginSecurityException.class, () -> orchestrator.monitorPluginExecution(PLUGIN_ID,
                    PluginOperation.read("/tmp/plugin-storage/a.txt"), context));

            given(analysis(90, finding(Severity.CRITICAL)), signed(TrustLevel.HIGH));
            install();
            assertThrows(PluginSecurityException.class, () -> orchestrator.monitorPluginExecution(PLUGIN_ID,
                    PluginOperation.read("/tmp/plugin-storage/a.txt"), context));
        }

        @Test
        @DisplayName("高危拒绝隔离沙箱，违规只在档案中记录一次")
        void highViolationRecordedOnce() {
            InstallationResult installed = installTrusted();

            MonitorResult result = orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("/bin/bash"), context);

            assertFalse(result.allowed());
            assertEquals(SandboxState.TERMINATED,
                    framework.getSandbox(installed.getSandboxId()).orElseThrow().getState());
            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            assertEquals(1, profile.getRuntimeViolations().size());
            assertEquals(RiskLevel.MEDIUM, profile.getRiskLevel());
            assertEquals(ComplianceStatus.REQUIRES_ATTENTION, profile.getComplianceStatus());
        }

        @Test
        @DisplayName("运行期高危违规达到阈值时开一张插件级事件单")
        void runtimeEscalation() {
            config.getIncidentResponse().setAutoResponse(false);
            config.getIncidentResponse().setEscalationThreshold(3);
            installTrusted();

            orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("/bin/sh"), context);
            orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("curl"), context);
            assertTrue(orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow().getIncidentIds().isEmpty());

            orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("wget"), context);
            orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("nc"), context);

            SecurityProfile profile = orchestrator.getSecurityProfile(PLUGIN_ID).orElseThrow();
            assertTrue(profile.isRuntimeEscalated());
            assertEquals(1, profile.getIncidentIds().size());
            assertEquals(RiskLevel.HIGH, profile.getRiskLevel());
            SecurityIncident incident = audit.getIncident(profile.getIncidentIds().get(0)).orElseThrow();
            assertEquals("orchestration:runtime", incident.getSource());
            assertEquals(Severity.HIGH, incident.getSeverity());
            assertEquals(3, incident.getEventIds().size());
        }

        @Test
        @DisplayName("卸载后档案保留并标记退役")
        void retirement() {
            InstallationResult installed = installTrusted();

            SecurityProfile retired = orchestrator.retirePlugin(PLUGIN_ID, context);

            assertTrue(retired.isRetired());
            assertNull(retired.getSandboxId());
            assertEquals(ComplianceStatus.NON_COMPLIANT, retired.getComplianceStatus());
            assertTrue(framework.getSandbox(installed.getSandboxId()).isEmpty());
            assertEquals(1, events(SecurityEventType.PLUGIN_UNINSTALL).size());
            assertTrue(orchestrator.getSecurityProfile(PLUGIN_ID).isPresent());
            assertThrows(PluginSecurityException.class, () -> orchestrator.monitorPluginExecution(PLUGIN_ID,
                    PluginOperation.connect("api.example.com", 443, 1), context));
            assertThrows(PluginSecurityException.class, () -> orchestrator.retirePlugin("unknown", context));
        }
    }

    // ==================== 报告 ====================

    @Nested
    @DisplayName("安全报告")
    class ReportTests {

        @Test
        @DisplayName("漏洞报告统计已评估插件的风险分布")
        @SuppressWarnings("unchecked")
        void vulnerabilityReport() {
            installTrusted();
            when(analyzer.analyze(any(Path.class))).thenReturn(analysis(70, finding(Severity.CRITICAL)));
            orchestrator.processPluginInstallation("legacy-importer", pluginDir, context);

            SecurityReport report = orchestrator.generateSecurityReport(ReportType.VULNERABILITY);

            assertEquals(ReportType.VULNERABILITY, report.getType());
            assertEquals(75, report.getSummary().getOverallScore());
            Map<RiskLevel, Long> distribution = (Map<RiskLevel, Long>) report.getSections().get("riskDistribution");
            assertEquals(1L, distribution.get(RiskLevel.LOW));
            assertEquals(1L, distribution.get(RiskLevel.CRITICAL));
            assertEquals(List.of("legacy-importer"), report.getSections().get("highRiskPlugins"));
            assertEquals(1, report.getSummary().getCriticalIssues().size());
        }

        @Test
        @DisplayName("本期出现高危违规时趋势为 DEGRADING")
        void trendDegrades() {
            installTrusted();
            orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("/bin/bash"), context);

            SecurityReport report = orchestrator.generateSecurityReport(ReportType.TREND,
                    ReportPeriod.lastDays(clock, 7));

            assertEquals(RiskTrend.DEGRADING, report.getSummary().getRiskTrend());
            assertEquals(90, report.getSummary().getOverallScore());
            assertEquals(1L, report.getSections().get("violationDelta"));
        }

        @Test
        @DisplayName("合规报告覆盖配置中的每个框架")
        @SuppressWarnings("unchecked")
        void complianceReport() {
            SecurityReport report = orchestrator.generateSecurityReport(ReportType.COMPLIANCE);

            Map<String, ?> frameworks = (Map<String, ?>) report.getSections().get("frameworks");
            assertEquals(List.of("ISO27001", "SOC2"), new ArrayList<>(frameworks.keySet()));
            assertEquals(RiskTrend.STABLE, report.getSummary().getRiskTrend());
            assertEquals(2, report.getSummary().getKeyFindings().size());
        }

        @Test
        @DisplayName("管理层报告汇总框架评分与未关闭事件单")
        void executiveReport() {
            installTrusted();
            orchestrator.monitorPluginExecution(PLUGIN_ID, spawn("/bin/bash"), context);

            SecurityReport report = orchestrator.generateSecurityReport(ReportType.EXECUTIVE);

            assertEquals(90, report.getSummary().getOverallScore());
            assertTrue((Long) report.getSections().get("openIncidents") >= 1);
            assertTrue(report.getSummary().getKeyFindings().contains("1 active plugin profile(s)"));
        }
    }
}
