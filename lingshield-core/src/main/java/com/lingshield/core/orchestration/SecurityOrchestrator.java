package com.lingshield.core.orchestration;

import com.lingshield.api.context.SecurityContext;
import com.lingshield.api.exception.InvalidArgumentException;
import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.analysis.AnalysisOptions;
import com.lingshield.core.analysis.AnalysisStatus;
import com.lingshield.core.analysis.CodeAnalysisResult;
import com.lingshield.core.analysis.CodeAnalyzer;
import com.lingshield.core.analysis.QualityMetrics;
import com.lingshield.core.analysis.SecurityRecommendation;
import com.lingshield.core.audit.AuditSystem;
import com.lingshield.core.audit.EventQuery;
import com.lingshield.core.audit.EventSource;
import com.lingshield.core.audit.ExportFormat;
import com.lingshield.core.audit.ExportKind;
import com.lingshield.core.audit.IncidentCategory;
import com.lingshield.core.audit.ReportPeriod;
import com.lingshield.core.audit.SecurityEvent;
import com.lingshield.core.audit.SecurityEventType;
import com.lingshield.core.audit.SecurityIncident;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.event.ShieldEvents;
import com.lingshield.core.exception.PluginSecurityException;
import com.lingshield.core.framework.MonitorResult;
import com.lingshield.core.framework.PluginOperation;
import com.lingshield.core.framework.SecurityFramework;
import com.lingshield.core.framework.SecurityRestriction;
import com.lingshield.core.framework.ViolationMapper;
import com.lingshield.core.sandbox.Sandbox;
import com.lingshield.core.signature.ManifestLoader;
import com.lingshield.core.signature.PluginManifest;
import com.lingshield.core.signature.SignatureVerifier;
import com.lingshield.core.signature.TrustAnchor;
import com.lingshield.core.signature.VerificationResult;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 安全编排：插件安装裁决、运行期监控与安全报告的统一入口
 * <p>
 * 安装流程：
 * <ol>
 * <li>并行执行静态分析与签名验证</li>
 * <li>汇总违规，按违规集合与评分定级</li>
 * <li>无 CRITICAL 违规、评分达标（严格模式）且签名有效（强制签名时）才允许安装</li>
 * <li>按风险与信任级别附加限制，写入安全档案，允许时创建沙箱</li>
 * </ol>
 * 安装入口不向调用方抛出异常，内部故障一律按拒绝处理。
 */
@Slf4j
public class SecurityOrchestrator {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final String COMPONENT = "orchestration";
    private static final String BUS_OWNER = "security-orchestrator";
    private static final int STRICT_MIN_SCORE = 50;
    private static final int DEFAULT_REPORT_DAYS = 30;

    private final LingShieldConfig config;
    private final CodeAnalyzer analyzer;
    private final SignatureVerifier verifier;
    private final SecurityFramework framework;
    private final AuditSystem audit;
    private final Clock clock;
    private final ManifestLoader manifestLoader;
    private final ProfileStore profiles = new ProfileStore();
    private final ConcurrentMap<String, Object> pluginLocks = new ConcurrentHashMap<>();
    private final SecurityReportGenerator reports;
    private final ExecutorService assessmentExecutor;

    public SecurityOrchestrator(LingShieldConfig config) {
        this(config, new AuditSystem(config));
    }

    private SecurityOrchestrator(LingShieldConfig config, AuditSystem audit) {
        this(config,
                new CodeAnalyzer(AnalysisOptions.from(config.getStaticAnalysis())),
                new SignatureVerifier(config.getSignatureVerification()),
                new SecurityFramework(config, audit),
                audit,
                Clock.systemUTC());
    }

    public SecurityOrchestrator(LingShieldConfig config, CodeAnalyzer analyzer, SignatureVerifier verifier,
                                SecurityFramework framework, AuditSystem audit, Clock clock) {
        this.config = config;
        this.analyzer = analyzer;
        this.verifier = verifier;
        this.framework = framework;
        this.audit = audit;
        this.clock = clock;
        this.manifestLoader = new ManifestLoader(config.getSignatureVerification().getManifestName());
        this.reports = new SecurityReportGenerator(config, profiles, framework, audit, clock);
        this.assessmentExecutor = createExecutor();
        audit.getEventBus().subscribe(BUS_OWNER, ShieldEvents.ViolationDetected.class, this::onViolationDetected);
    }

    // ==================== 安装裁决 ====================

    public InstallationResult processPluginInstallation(String pluginId, Path pluginPath, SecurityContext context) {
        return processPluginInstallation(pluginId, pluginPath, context, null);
    }

    /**
     * 评估插件并给出安装裁决
     * <p>
     * 重复安装会重新评估，追加评估历史并替换原有沙箱。
     *
     * @param policyId 为空时使用默认策略
     */
    public InstallationResult processPluginInstallation(String pluginId, Path pluginPath, SecurityContext context,
                                                        String policyId) {
        try {
            InvalidArgumentException.requireText(pluginId, "pluginId");
            InvalidArgumentException.requireNonNull(pluginPath, "pluginPath");
            return assess(pluginId, pluginPath, context, resolvePolicyId(policyId));
        } catch (Throwable e) {
            Throwable cause = unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("[{}] Installation assessment failed", pluginId, cause);
            InstallationResult denied = deny(pluginId, cause, context);
            if (cause instanceof VirtualMachineError) {
                throw (VirtualMachineError) cause;
            }
            return denied;
        }
    }

    private InstallationResult assess(String pluginId, Path pluginPath, SecurityContext context, String policyId)
            throws InterruptedException, ExecutionException {
        log.info("[{}] Assessing plugin installation from {}", pluginId, pluginPath);
        CompletableFuture<CodeAnalysisResult> analysisTask =
                CompletableFuture.supplyAsync(() -> runAnalysis(pluginId, pluginPath), assessmentExecutor);
        CompletableFuture<VerificationResult> verificationTask =
                CompletableFuture.supplyAsync(() -> runVerification(pluginId, pluginPath), assessmentExecutor);
        CompletableFuture.allOf(analysisTask, verificationTask).get();
        CodeAnalysisResult analysis = analysisTask.get();
        VerificationResult verification = verificationTask.get();
        PluginManifest manifest = verification.getManifest() != null
                ? verification.getManifest()
                : loadManifest(pluginId, pluginPath);

        List<SecurityViolation> violations = new ArrayList<>(framework.validatePluginForExecution(
                pluginId, analysis, verification, manifest, policyId).violations());
        if (!analysis.isCompleted()) {
            violations.add(incompleteAnalysis(pluginId, analysis, clock.instant()));
        }

        int score = analysis.getScore();
        TrustLevel trust = verification.getTrustLevel();
        RiskLevel risk = RiskAssessor.riskLevel(violations, score);
        List<SecurityRestriction> restrictions = RiskAssessor.restrictions(risk, trust);
        String reason = denialReason(violations, score, verification);
        boolean allowed = reason == null;
        Instant now = clock.instant();

        SecurityAssessment assessment = SecurityAssessment.builder()
                .id(newId("asm"))
                .type(AssessmentType.INSTALLATION)
                .assessedAt(now)
                .policyId(policyId)
                .score(score)
                .riskLevel(risk)
                .trustLevel(trust)
                .allowed(allowed)
                .signatureValid(verification.isValid())
                .violationCount(violations.size())
                .summary(allowed ? "Installation allowed" : reason)
                .build();

        SecurityProfile profile;
        synchronized (lockFor(pluginId)) {
            releaseSandbox(pluginId);
            profile = profiles.update(pluginId, current -> baseOf(current, pluginId, now)
                    .pluginVersion(manifest == null ? null : manifest.getVersion())
                    .securityScore(score)
                    .trustLevel(trust)
                    .clearRestrictions()
                    .restrictions(restrictions)
                    .clearViolations()
                    .violations(violations)
                    .clearRuntimeViolations()
                    .runtimeEscalated(false)
                    .assessment(assessment)
                    .allowed(allowed)
                    .sandboxId(null)
                    .analysisSignature(analysis.getSignature())
                    .retired(false)
                    .retiredAt(null)
                    .updatedAt(now)
                    .build());

            if (allowed && config.getRuntimeProtection().isEnabled()) {
                Sandbox sandbox = framework.createSecureSandbox(pluginId, policyId, context, restrictions);
                profile = profiles.update(pluginId, current -> current.toBuilder()
                        .sandboxId(sandbox.getId())
                        .updatedAt(clock.instant())
                        .build());
            }
        }

        recordInstallEvent(pluginId, allowed, risk, trust, score, violations, reason, context);
        audit.getEventBus().publish(new ShieldEvents.InstallationDecided(pluginId, allowed, risk));
        log.info("[{}] Installation decision: allowed={}, risk={}, trust={}, score={}, violations={}",
                pluginId, allowed, risk, trust, score, violations.size());

        return InstallationResult.builder()
                .pluginId(pluginId)
                .allowed(allowed)
                .riskLevel(risk)
                .trustLevel(trust)
                .securityScore(score)
                .violations(violations)
                .restrictions(restrictions)
                .recommendations(recommendations(analysis, verification, violations))
                .sandboxId(profile.getSandboxId())
                .profileVersion(profile.getVersion())
                .reason(reason)
                .analysis(analysis)
                .verification(verification)
                .decidedAt(now)
                .build();
    }

    /**
     * 允许条件：无 CRITICAL 违规，严格模式下评分不低于 50，强制签名时签名有效
     *
     * @return 拒绝原因，允许时为空
     */
    private String denialReason(List<SecurityViolation> violations, int score, VerificationResult verification) {
        long critical = violations.stream().filter(v -> v.getSeverity() == Severity.CRITICAL).count();
        if (critical > 0) {
            return critical + " critical violation(s) found";
        }
        if (config.getStaticAnalysis().isStrictMode() && score < STRICT_MIN_SCORE) {
            return "Security score " + score + " is below " + STRICT_MIN_SCORE;
        }
        if (config.getSignatureVerification().isRequireSignature() && !verification.isValid()) {
            return "Valid signature required";
        }
        return null;
    }

    private CodeAnalysisResult runAnalysis(String pluginId, Path pluginPath) {
        if (!config.getStaticAnalysis().isEnabled()) {
            log.info("[{}] Static analysis disabled", pluginId);
            return CodeAnalysisResult.builder()
                    .status(AnalysisStatus.COMPLETED)
                    .safe(true)
                    .score(100)
                    .qualityMetrics(QualityMetrics.EMPTY)
                    .build();
        }
        return analyzer.analyze(pluginPath);
    }

    private VerificationResult runVerification(String pluginId, Path pluginPath) {
        if (!config.getSignatureVerification().isEnabled()) {
            log.info("[{}] Signature verification disabled", pluginId);
            return VerificationResult.builder()
                    .valid(false)
                    .trustLevel(TrustLevel.UNTRUSTED)
                    .verifiedAt(clock.instant())
                    .build();
        }
        return verifier.verify(pluginPath);
    }

    private PluginManifest loadManifest(String pluginId, Path pluginPath) {
        Path manifestFile = manifestLoader.resolve(pluginPath, null);
        if (!Files.isRegularFile(manifestFile)) {
            return null;
        }
        try {
            return manifestLoader.load(manifestFile);
        } catch (IOException e) {
            log.warn("[{}] Unreadable manifest {}, skipping manifest checks: {}", pluginId, manifestFile, e.getMessage());
            return null;
        }
    }

    private static SecurityViolation incompleteAnalysis(String pluginId, CodeAnalysisResult analysis, Instant at) {
        return SecurityViolation.builder()
                .type(ViolationType.STATIC_ANALYSIS)
                .severity(Severity.HIGH)
                .description("Static analysis did not complete (" + analysis.getStatus() + ")"
                        + (analysis.getError() == null ? "" : ": " + analysis.getError()))
                .pluginId(pluginId)
                .blocked(false)
                .source(ViolationMapper.SOURCE_ORCHESTRATION)
                .timestamp(at)
                .detail("status", analysis.getStatus().name())
                .build();
    }

    private static List<String> recommendations(CodeAnalysisResult analysis, VerificationResult verification,
                                                List<SecurityViolation> violations) {
        Set<String> recommendations = new LinkedHashSet<>();
        analysis.getRecommendations().stream()
                .map(SecurityRecommendation::getTitle)
                .forEach(recommendations::add);
        if (!verification.isValid()) {
            recommendations.add("Sign the plugin with a certificate issued by a registered trust anchor");
        }
        violations.stream()
                .map(SecurityViolation::getType)
                .distinct()
                .map(SecurityFramework::recommendationFor)
                .forEach(recommendations::add);
        return new ArrayList<>(recommendations);
    }

    /**
     * 内部故障：记录一条 HIGH 违规并拒绝
     */
    private InstallationResult deny(String pluginId, Throwable cause, SecurityContext context) {
        Instant now = clock.instant();
        SecurityViolation violation = ViolationMapper.internalError(pluginId, cause, now);
        List<SecurityViolation> violations = List.of(violation);
        RiskLevel risk = RiskAssessor.riskLevel(violations, 0);
        String reason = "Security processing failed: " + cause.getMessage();
        long version = 0;
        if (pluginId != null && !pluginId.isBlank()) {
            try {
                SecurityAssessment assessment = SecurityAssessment.builder()
                        .id(newId("asm"))
                        .type(AssessmentType.FAILED_INSTALLATION)
                        .assessedAt(now)
                        .score(0)
                        .riskLevel(risk)
                        .trustLevel(TrustLevel.UNTRUSTED)
                        .allowed(false)
                        .violationCount(1)
                        .summary(reason)
                        .build();
                synchronized (lockFor(pluginId)) {
                    releaseSandbox(pluginId);
                    version = profiles.update(pluginId, current -> baseOf(current, pluginId, now)
                            .securityScore(0)
                            .trustLevel(TrustLevel.UNTRUSTED)
                            .clearRestrictions()
                            .clearViolations()
                            .violation(violation)
                            .clearRuntimeViolations()
                            .assessment(assessment)
                            .allowed(false)
                            .sandboxId(null)
                            .updatedAt(now)
                            .build()).getVersion();
                }
                recordInstallEvent(pluginId, false, risk, TrustLevel.UNTRUSTED, 0, violations, reason, context);
                audit.getEventBus().publish(new ShieldEvents.InstallationDecided(pluginId, false, risk));
            } catch (Exception e) {
                log.error("[{}] Failed to record denied installation", pluginId, e);
            }
        }
        return InstallationResult.builder()
                .pluginId(pluginId)
                .allowed(false)
                .riskLevel(risk)
                .trustLevel(TrustLevel.UNTRUSTED)
                .securityScore(0)
                .violation(violation)
                .recommendation(SecurityFramework.recommendationFor(ViolationType.INTERNAL_ERROR))
                .profileVersion(version)
                .reason(reason)
                .decidedAt(now)
                .build();
    }

    private void recordInstallEvent(String pluginId, boolean allowed, RiskLevel risk, TrustLevel trust, int score,
                                    List<SecurityViolation> violations, String reason, SecurityContext context) {
        Severity severity = allowed ? Severity.INFO : violations.stream()
                .map(SecurityViolation::getSeverity)
                .max(Comparator.naturalOrder())
                .filter(s -> s.isAtLeast(Severity.MEDIUM))
                .orElse(Severity.MEDIUM);
        audit.recordEvent(SecurityEvent.builder()
                .type(SecurityEventType.PLUGIN_INSTALL)
                .severity(severity)
                .source(EventSource.plugin(COMPONENT, pluginId))
                .pluginId(pluginId)
                .context(context)
                .description(allowed ? "Plugin installation allowed" : "Plugin installation denied: " + reason)
                .detail("allowed", allowed)
                .detail("riskLevel", risk.name())
                .detail("trustLevel", trust.name())
                .detail("securityScore", score)
                .detail("violations", violations.size())
                .tag("installation")
                .tag(allowed ? "allowed" : "denied")
                .build());
    }

    // ==================== 运行期 ====================

    /**
     * 在插件沙箱内监控一次操作
     *
     * @throws PluginSecurityException 插件没有可运行的档案或沙箱
     */
    public MonitorResult monitorPluginExecution(String pluginId, PluginOperation operation, SecurityContext context) {
        InvalidArgumentException.requireNonNull(operation, "operation");
        SecurityProfile profile = requireRunnable(pluginId);
        MonitorResult result = framework.monitorPluginExecution(profile.getSandboxId(), operation, context);
        if (result.violation() == null) {
            audit.recordEvent(SecurityEvent.builder()
                    .type(SecurityEventType.PLUGIN_OPERATION)
                    .severity(Severity.INFO)
                    .source(EventSource.plugin(COMPONENT, pluginId))
                    .pluginId(pluginId)
                    .sandboxId(profile.getSandboxId())
                    .context(context)
                    .description("Operation " + operation.getType() + " on " + operation.getTarget())
                    .detail("operation", operation.getType().name())
                    .detail("target", operation.getTarget())
                    .build());
        } else {
            recordRuntimeViolation(pluginId, result.violation());
        }
        return result;
    }

    /**
     * 周期检测之外的即时可疑行为检测
     */
    public List<SecurityViolation> detectSuspiciousActivity(String pluginId, SecurityContext context) {
        SecurityProfile profile = requireRunnable(pluginId);
        List<SecurityViolation> findings = framework.detectSuspiciousActivity(profile.getSandboxId(), context);
        findings.forEach(v -> recordRuntimeViolation(pluginId, v));
        return findings;
    }

    private SecurityProfile requireRunnable(String pluginId) {
        SecurityProfile profile = profiles.get(pluginId)
                .orElseThrow(() -> new PluginSecurityException(pluginId, "No security profile for plugin: " + pluginId));
        if (profile.isRetired() || !profile.isAllowed()) {
            throw new PluginSecurityException(pluginId, "Plugin is not permitted to run: " + pluginId);
        }
        if (profile.getSandboxId() == null) {
            throw new PluginSecurityException(pluginId, "Plugin has no sandbox: " + pluginId);
        }
        return profile;
    }

    private void onViolationDetected(ShieldEvents.ViolationDetected event) {
        String pluginId = event.getPluginId();
        if (pluginId == null || profiles.get(pluginId).map(SecurityProfile::isRetired).orElse(true)) {
            return;
        }
        recordRuntimeViolation(pluginId, event.getViolation());
    }

    /**
     * 追加运行期违规（按违规 id 去重），HIGH 以上违规累计达到阈值时开一张插件级事件单
     */
    private void recordRuntimeViolation(String pluginId, SecurityViolation violation) {
        Optional<SecurityProfile> existing = profiles.get(pluginId);
        if (existing.isEmpty() || existing.get().hasViolation(violation.getId())) {
            return;
        }
        int threshold = config.getIncidentResponse().getEscalationThreshold();
        boolean[] escalate = {false};
        SecurityProfile updated = profiles.update(pluginId, current -> {
            escalate[0] = false;
            if (current.hasViolation(violation.getId())) {
                return current;
            }
            SecurityProfile next = current.toBuilder()
                    .runtimeViolation(violation)
                    .updatedAt(clock.instant())
                    .build();
            long serious = next.getRuntimeViolations().stream().filter(v -> v.isAtLeast(Severity.HIGH)).count();
            if (!next.isRuntimeEscalated() && serious >= threshold) {
                escalate[0] = true;
                next = next.toBuilder().runtimeEscalated(true).build();
            }
            return next;
        });
        if (escalate[0]) {
            openRuntimeIncident(updated);
        }
    }

    private void openRuntimeIncident(SecurityProfile profile) {
        String pluginId = profile.getPluginId();
        List<SecurityViolation> serious = profile.getRuntimeViolations().stream()
                .filter(v -> v.isAtLeast(Severity.HIGH))
                .collect(Collectors.toList());
        Set<String> violationIds = serious.stream().map(SecurityViolation::getId).collect(Collectors.toSet());
        List<String> eventIds = audit.matchingEvents(EventQuery.builder().pluginId(pluginId).build())
                .stream()
                .filter(e -> violationIds.contains(String.valueOf(e.getDetails().get("violationId"))))
                .map(SecurityEvent::getId)
                .collect(Collectors.toList());
        Severity severity = serious.stream().anyMatch(v -> v.getSeverity() == Severity.CRITICAL)
                ? Severity.CRITICAL : Severity.HIGH;
        ViolationType dominant = serious.get(serious.size() - 1).getType();

        SecurityIncident incident = audit.createIncident(
                "Repeated runtime violations in plugin " + pluginId,
                serious.size() + " high-severity runtime violation(s) reached the escalation threshold",
                severity,
                IncidentCategory.of(ViolationMapper.eventTypeOf(dominant)),
                "orchestration:runtime",
                eventIds);
        profiles.update(pluginId, current -> current.toBuilder()
                .incidentId(incident.getId())
                .updatedAt(clock.instant())
                .build());
        log.warn("[{}] Runtime violations escalated to incident {}", pluginId, incident.getId());
    }

    // ==================== 档案与卸载 ====================

    public Optional<SecurityProfile> getSecurityProfile(String pluginId) {
        return profiles.get(pluginId);
    }

    public List<SecurityProfile> listProfiles() {
        return profiles.list();
    }

    /**
     * 卸载插件：销毁沙箱并将档案标记为退役，档案保留用于审计
     *
     * @throws PluginSecurityException 插件没有档案
     */
    public SecurityProfile retirePlugin(String pluginId, SecurityContext context) {
        if (profiles.get(pluginId).isEmpty()) {
            throw new PluginSecurityException(pluginId, "No security profile for plugin: " + pluginId);
        }
        Instant now = clock.instant();
        SecurityProfile retired;
        synchronized (lockFor(pluginId)) {
            releaseSandbox(pluginId);
            retired = profiles.update(pluginId, current -> current.toBuilder()
                    .sandboxId(null)
                    .retired(true)
                    .retiredAt(now)
                    .updatedAt(now)
                    .build());
        }
        audit.recordEvent(SecurityEvent.builder()
                .type(SecurityEventType.PLUGIN_UNINSTALL)
                .severity(Severity.INFO)
                .source(EventSource.plugin(COMPONENT, pluginId))
                .pluginId(pluginId)
                .context(context)
                .description("Plugin retired")
                .tag("retirement")
                .build());
        log.info("[{}] Plugin retired", pluginId);
        return retired;
    }

    /**
     * 同一插件的沙箱替换与档案写入串行执行
     */
    private Object lockFor(String pluginId) {
        return pluginLocks.computeIfAbsent(pluginId, id -> new Object());
    }

    private void releaseSandbox(String pluginId) {
        profiles.get(pluginId)
                .flatMap(SecurityProfile::sandbox)
                .ifPresent(sandboxId -> {
                    if (framework.destroySandbox(sandboxId)) {
                        log.info("[{}] Previous sandbox {} destroyed", pluginId, sandboxId);
                    }
                });
    }

    // ==================== 报告与导出 ====================

    public SecurityReport generateSecurityReport(ReportType type) {
        return generateSecurityReport(type, ReportPeriod.lastDays(clock, DEFAULT_REPORT_DAYS));
    }

    public SecurityReport generateSecurityReport(ReportType type, ReportPeriod period) {
        InvalidArgumentException.requireNonNull(type, "type");
        InvalidArgumentException.requireNonNull(period, "period");
        return reports.generate(type, period);
    }

    public byte[] exportData(ExportKind kind, ExportFormat format, EventQuery filters) {
        return audit.exportData(kind, format, filters);
    }

    // ==================== 信任锚 ====================

    public void addTrustAnchor(TrustAnchor anchor, SecurityContext context) {
        verifier.addTrustAnchor(anchor);
        recordCertificateEvent("Trust anchor added: " + anchor.getId(), anchor.getId(), context);
    }

    public boolean removeTrustAnchor(String anchorId, SecurityContext context) {
        boolean removed = verifier.removeTrustAnchor(anchorId);
        if (removed) {
            recordCertificateEvent("Trust anchor removed: " + anchorId, anchorId, context);
        }
        return removed;
    }

    public List<TrustAnchor> listTrustAnchors() {
        return verifier.listTrustAnchors();
    }

    private void recordCertificateEvent(String description, String anchorId, SecurityContext context) {
        audit.recordEvent(SecurityEvent.builder()
                .type(SecurityEventType.CERTIFICATE_EVENT)
                .severity(Severity.INFO)
                .source(EventSource.system(COMPONENT))
                .context(context)
                .description(description)
                .detail("anchorId", anchorId)
                .tag("trust-anchor")
                .build());
    }

    // ==================== 组件访问 ====================

    public AuditSystem getAuditSystem() {
        return audit;
    }

    public SecurityFramework getFramework() {
        return framework;
    }

    public SignatureVerifier getSignatureVerifier() {
        return verifier;
    }

    // ==================== 生命周期 ====================

    public void start() {
        framework.start();
        log.info("SecurityOrchestrator started");
    }

    public void shutdown() {
        log.info("Shutting down SecurityOrchestrator...");
        audit.getEventBus().unsubscribeAll(BUS_OWNER);
        try {
            framework.shutdown();
        } catch (Exception e) {
            log.error("Error shutting down SecurityFramework", e);
        }
        assessmentExecutor.shutdownNow();
        try {
            if (!assessmentExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Assessment executor did not terminate during shutdownNow");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ==================== 基础设施 ====================

    private static SecurityProfile.SecurityProfileBuilder baseOf(SecurityProfile current, String pluginId,
                                                                 Instant now) {
        return current == null
                ? SecurityProfile.builder().pluginId(pluginId).createdAt(now)
                : current.toBuilder();
    }

    private String resolvePolicyId(String policyId) {
        return policyId == null || policyId.isBlank() ? config.getDefaultPolicyId() : policyId;
    }

    private static Throwable unwrap(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String newId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8).toLowerCase(Locale.ROOT);
    }

    private ExecutorService createExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "lingshield-assessment-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(
                    (thread, e) -> log.error("Assessment thread {} error: {}", thread.getName(), e.getMessage()));
            return t;
        });
    }
}
