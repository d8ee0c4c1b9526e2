package com.lingshield.core.framework;

import com.lingshield.api.context.SecurityContext;
import com.lingshield.api.exception.InvalidArgumentException;
import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.CodeAnalysisResult;
import com.lingshield.core.audit.AuditSystem;
import com.lingshield.core.audit.EventSource;
import com.lingshield.core.audit.IncidentCategory;
import com.lingshield.core.audit.ReportPeriod;
import com.lingshield.core.audit.SecurityEvent;
import com.lingshield.core.audit.SecurityIncident;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.event.ShieldEvents;
import com.lingshield.core.exception.SandboxException;
import com.lingshield.core.sandbox.InProcessIsolationProvider;
import com.lingshield.core.sandbox.ProcessIsolationProvider;
import com.lingshield.core.sandbox.Sandbox;
import com.lingshield.core.sandbox.SandboxConfig;
import com.lingshield.core.sandbox.SandboxListener;
import com.lingshield.core.sandbox.SandboxMetrics;
import com.lingshield.core.signature.PluginManifest;
import com.lingshield.core.signature.VerificationResult;
import com.lingshield.core.spi.IsolationProvider;
import com.lingshield.core.util.PermissionMatcher;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 安全框架：策略引擎与运行期防护
 * <p>
 * 五个阶段：
 * <ol>
 * <li>执行前校验：静态分析、签名、依赖、权限、资源需求，只有 HIGH / CRITICAL 否决</li>
 * <li>按策略创建沙箱，附加限制叠加在策略之上</li>
 * <li>逐次操作监控：先查策略（拒绝），再查资源（降级不拒绝）</li>
 * <li>周期性可疑行为检测，与逐次监控相互独立</li>
 * <li>违规处置：框架产生的 HIGH / CRITICAL 违规立即隔离、通知并开事件单</li>
 * </ol>
 * 沙箱自身产生的违规已由沙箱处置，这里只做审计。
 */
@Slf4j
public class SecurityFramework {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final String SANDBOX_SOURCE = "sandbox";

    private final LingShieldConfig config;
    private final AuditSystem audit;
    private final PolicyStore policies;
    private final PolicyEvaluator evaluator;
    private final ThreatDetector threatDetector;
    private final IsolationProvider isolationProvider;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final FrameworkMetrics metrics = new FrameworkMetrics();

    private final Map<String, ManagedSandbox> sandboxes = new ConcurrentHashMap<>();
    // 处置过的违规，供周期报告统计
    private final ConcurrentLinkedDeque<HandledViolation> history = new ConcurrentLinkedDeque<>();

    private volatile ScheduledFuture<?> detectionTask;
    private volatile ScheduledFuture<?> retentionTask;

    /**
     * 沙箱及其创建时的策略快照
     */
    private record ManagedSandbox(Sandbox sandbox, SecurityPolicy policy, ActivityLog activity,
                                  List<SecurityRestriction> restrictions) {
    }

    private record HandledViolation(Instant at, SecurityViolation violation) {
    }

    public SecurityFramework(LingShieldConfig config, AuditSystem audit) {
        this(config, audit, new PolicyStore(), createIsolationProvider(config.getRuntimeProtection()),
                VulnerableDependencyCatalog.loadDefault(), Clock.systemUTC());
    }

    public SecurityFramework(LingShieldConfig config, AuditSystem audit, PolicyStore policies,
                             IsolationProvider isolationProvider, VulnerableDependencyCatalog dependencies,
                             Clock clock) {
        this.config = config;
        this.audit = audit;
        this.policies = policies;
        this.evaluator = new PolicyEvaluator(dependencies, clock);
        this.threatDetector = new ThreatDetector(config.getThreatDetection(), clock);
        this.isolationProvider = isolationProvider;
        this.clock = clock;
        this.scheduler = createScheduler();
    }

    public PolicyStore getPolicies() {
        return policies;
    }

    public FrameworkMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    // ==================== 阶段 1：执行前校验 ====================

    /**
     * 汇总静态分析、签名与策略检查的违规
     *
     * @param manifest 可为空，此时跳过依赖、权限与资源检查
     */
    public ValidationResult validatePluginForExecution(String pluginId, CodeAnalysisResult analysis,
                                                       VerificationResult verification, PluginManifest manifest,
                                                       String policyId) {
        InvalidArgumentException.requireText(pluginId, "pluginId");
        Instant now = clock.instant();
        List<SecurityViolation> violations = new ArrayList<>();
        if (analysis != null) {
            analysis.getVulnerabilities().forEach(v -> violations.add(ViolationMapper.fromVulnerability(pluginId, v, now)));
        }
        if (verification != null) {
            verification.getErrors().forEach(e -> violations.add(ViolationMapper.fromVerificationError(pluginId, e, now)));
        }
        violations.addAll(evaluatePolicy(pluginId, manifest, policyId));

        ValidationResult result = ValidationResult.of(violations);
        metrics.recordValidation(result.valid());
        log.info("[{}] Pre-execution validation: valid={}, violations={}", pluginId, result.valid(), violations.size());
        return result;
    }

    /**
     * 仅做策略部分的检查：依赖漏洞、权限、资源需求
     */
    public List<SecurityViolation> evaluatePolicy(String pluginId, PluginManifest manifest, String policyId) {
        return evaluator.evaluate(pluginId, manifest, policies.get(resolvePolicyId(policyId)));
    }

    // ==================== 阶段 2：沙箱 ====================

    /**
     * 按策略创建并启动沙箱
     *
     * @throws com.lingshield.core.exception.SecurityPolicyException 策略不存在
     * @throws SandboxException                                      沙箱启动失败
     */
    public Sandbox createSecureSandbox(String pluginId, String policyId, SecurityContext context,
                                       List<SecurityRestriction> restrictions) {
        InvalidArgumentException.requireText(pluginId, "pluginId");
        SecurityPolicy policy = policies.get(resolvePolicyId(policyId));
        List<SecurityRestriction> extra = restrictions == null ? List.of() : List.copyOf(restrictions);

        Sandbox sandbox = new Sandbox("sbx-" + pluginId + "-" + UUID.randomUUID().toString().substring(0, 8),
                buildSandboxConfig(pluginId, policy, extra), isolationProvider, scheduler, audit.getEventBus(), clock);
        sandbox.addListener(new AuditingListener(context));
        ManagedSandbox managed = new ManagedSandbox(sandbox, policy, new ActivityLog(), extra);
        sandboxes.put(sandbox.getId(), managed);
        try {
            sandbox.start();
        } catch (RuntimeException e) {
            sandboxes.remove(sandbox.getId());
            throw e;
        }
        metrics.recordSandboxCreated();
        log.info("[{}] Secure sandbox {} created with policy {} (v{}), {} extra restriction(s)",
                pluginId, sandbox.getId(), policy.getId(), policy.getVersion(), extra.size());
        return sandbox;
    }

    SandboxConfig buildSandboxConfig(String pluginId, SecurityPolicy policy, List<SecurityRestriction> restrictions) {
        LingShieldConfig.RuntimeProtection runtime = config.getRuntimeProtection();
        SecurityPolicy.NetworkPolicy net = policy.getNetwork();
        SecurityPolicy.FilesystemPolicy fs = policy.getFilesystem();
        SecurityPolicy.ExecutionPolicy exec = policy.getExecution();

        SandboxConfig.NetworkConfig.NetworkConfigBuilder network = SandboxConfig.NetworkConfig.builder()
                .allowedHosts(net.getAllowedHosts())
                .blockedHosts(net.getBlockedHosts())
                .allowedPorts(net.getAllowedPorts())
                .maxConnections(net.getMaxConnections());
        SandboxConfig.FilesystemConfig.FilesystemConfigBuilder filesystem = SandboxConfig.FilesystemConfig.defaults()
                .toBuilder()
                .writablePaths(fs.getAllowedPaths())
                .blockedPaths(fs.getBlockedPaths())
                .maxFileSizeBytes(fs.getMaxFileSizeBytes());

        for (SecurityRestriction restriction : restrictions) {
            if (restriction.getAction() != RestrictionAction.DENY) {
                continue;
            }
            if (restriction.getType() == RestrictionType.NETWORK) {
                network.blockedHost(restriction.getScope());
            } else if (restriction.getType() == RestrictionType.FILESYSTEM) {
                filesystem.blockedPath(restriction.getScope());
            }
        }

        return SandboxConfig.builder()
                .pluginId(pluginId)
                .policyId(policy.getId())
                .limits(SandboxConfig.ResourceLimits.builder()
                        .cpuTimeMs(exec.getMaxCpuTimeMs())
                        .memoryBytes(exec.getMaxMemoryBytes())
                        .diskBytes(fs.getMaxDiskUsageBytes())
                        .maxConnections(net.getMaxConnections())
                        .maxProcesses(exec.getMaxProcesses())
                        .build())
                .network(network.build())
                .filesystem(filesystem.build())
                .monitoring(SandboxConfig.MonitoringConfig.builder()
                        .enabled(runtime.isSandboxing())
                        .intervalMs(runtime.getMetricsIntervalMs())
                        .build())
                .executionTimeoutMs(runtime.getExecutionTimeoutMs())
                .gracePeriodMs(runtime.getGracePeriodMs())
                .workspaceRoot(runtime.getWorkspaceRoot() == null ? null : Paths.get(runtime.getWorkspaceRoot()))
                .build();
    }

    public Optional<Sandbox> getSandbox(String sandboxId) {
        ManagedSandbox managed = sandboxes.get(sandboxId);
        return managed == null ? Optional.empty() : Optional.of(managed.sandbox());
    }

    public List<Sandbox> sandboxesFor(String pluginId) {
        return sandboxes.values().stream()
                .map(ManagedSandbox::sandbox)
                .filter(s -> s.getPluginId().equals(pluginId))
                .collect(Collectors.toList());
    }

    public List<SecurityRestriction> restrictionsOf(String sandboxId) {
        return require(sandboxId).restrictions();
    }

    /**
     * 停止并注销沙箱
     */
    public boolean destroySandbox(String sandboxId) {
        ManagedSandbox managed = sandboxes.remove(sandboxId);
        if (managed == null) {
            return false;
        }
        managed.sandbox().stop();
        log.info("[{}] Sandbox destroyed", sandboxId);
        return true;
    }

    /**
     * 停止插件的全部沙箱，返回停止的数量
     */
    public int stopSandboxesFor(String pluginId) {
        int stopped = 0;
        for (Sandbox sandbox : sandboxesFor(pluginId)) {
            if (sandbox.getState().isRunning()) {
                sandbox.stop();
                stopped++;
            }
        }
        return stopped;
    }

    // ==================== 阶段 3：运行期监控 ====================

    /**
     * 检查一次插件操作
     * <p>
     * 策略不允许的操作被拒绝；资源超限的操作放行，但沙箱降级并返回违规。
     *
     * @throws SandboxException 沙箱不存在或未运行
     */
    public MonitorResult monitorPluginExecution(String sandboxId, PluginOperation operation, SecurityContext context) {
        InvalidArgumentException.requireNonNull(operation, "operation");
        ManagedSandbox managed = require(sandboxId);
        Sandbox sandbox = managed.sandbox();
        if (!sandbox.getState().isRunning()) {
            throw new SandboxException(sandboxId, "Sandbox is not running: " + sandbox.getState());
        }

        MonitorResult result;
        Optional<SecurityViolation> denied = checkPolicy(managed, operation);
        if (denied.isPresent()) {
            managed.activity().record(operation, false, clock.instant());
            result = MonitorResult.denied(denied.get());
            log.warn("[{}] Operation {} {} denied: {}", sandboxId, operation.getType(), operation.getTarget(),
                    denied.get().getDescription());
            handleSecurityViolation(denied.get(), context);
        } else {
            managed.activity().record(operation, true, clock.instant());
            Optional<SecurityViolation> exhausted = checkResources(managed, operation);
            if (exhausted.isPresent()) {
                sandbox.throttle();
                handleSecurityViolation(exhausted.get(), context);
                result = MonitorResult.throttled(exhausted.get());
            } else {
                result = MonitorResult.ALLOWED;
            }
        }
        metrics.recordOperation(result);
        return result;
    }

    private Optional<SecurityViolation> checkPolicy(ManagedSandbox managed, PluginOperation op) {
        SandboxConfig sandboxConfig = managed.sandbox().getConfig();
        SecurityPolicy policy = managed.policy();
        String target = op.getTarget();
        switch (op.getType()) {
            case NETWORK_CONNECT:
                if (!sandboxConfig.getNetwork().isAllowed(target, op.getPort())) {
                    return deny(managed, ViolationType.NETWORK_VIOLATION, Severity.MEDIUM, op,
                            "Connection to " + target + ":" + op.getPort() + " is not permitted");
                }
                break;
            case FILE_READ:
                return checkFileAccess(managed, op, false);
            case FILE_WRITE:
                return checkFileAccess(managed, op, true);
            case PROCESS_SPAWN: {
                String executable = executableName(target);
                if (executable == null || !policy.getExecution().getAllowedExecutables().contains(executable)) {
                    return deny(managed, ViolationType.PRIVILEGE_ESCALATION, Severity.HIGH, op,
                            "Process spawn of '" + target + "' is not permitted");
                }
                break;
            }
            case DATA_QUERY: {
                SecurityPolicy.DataAccessPolicy data = policy.getDataAccess();
                int dot = target.indexOf('.');
                String database = dot < 0 ? target : target.substring(0, dot);
                String table = dot < 0 ? null : target.substring(dot + 1);
                if (!data.getAllowedDatabases().isEmpty() && !data.getAllowedDatabases().contains(database)) {
                    return deny(managed, ViolationType.PERMISSION_DENIED, Severity.MEDIUM, op,
                            "Database " + database + " is not accessible");
                }
                if (table != null && !data.getAllowedTables().isEmpty() && !data.getAllowedTables().contains(table)) {
                    return deny(managed, ViolationType.PERMISSION_DENIED, Severity.MEDIUM, op,
                            "Table " + table + " is not accessible");
                }
                break;
            }
            case PERMISSION_USE:
                return checkPermission(managed, op, target);
            case API_CALL:
                if (op.getPermission() != null) {
                    return checkPermission(managed, op, op.getPermission());
                }
                break;
            default:
                break;
        }
        return Optional.empty();
    }

    /**
     * 相对路径按沙箱工作区解析，解析结果不得离开工作区；绝对路径按禁止/可写规则判定
     */
    private Optional<SecurityViolation> checkFileAccess(ManagedSandbox managed, PluginOperation op, boolean write) {
        SandboxConfig.FilesystemConfig filesystem = managed.sandbox().getConfig().getFilesystem();
        Optional<Path> workspace = managed.sandbox().getWorkspace().map(ws -> ws.toAbsolutePath().normalize());
        String action = write ? "Write" : "Read";

        Path requested = parsePath(op.getTarget());
        if (requested == null) {
            return deny(managed, ViolationType.FILESYSTEM_VIOLATION, Severity.MEDIUM, op,
                    action + " access to invalid path '" + op.getTarget() + "' is not permitted");
        }
        boolean relative = !requested.isAbsolute();
        if (relative && workspace.isEmpty()) {
            return deny(managed, ViolationType.FILESYSTEM_VIOLATION, Severity.MEDIUM, op,
                    "Relative path " + op.getTarget() + " cannot be resolved without a workspace");
        }
        Path resolved = (relative ? workspace.get().resolve(requested) : requested).normalize();
        boolean inWorkspace = workspace.isPresent() && resolved.startsWith(workspace.get());
        if (relative && !inWorkspace) {
            return deny(managed, ViolationType.FILESYSTEM_VIOLATION, Severity.MEDIUM, op,
                    "Path " + op.getTarget() + " escapes the sandbox workspace");
        }

        String path = resolved.toString();
        if (filesystem.isBlocked(path)) {
            return deny(managed, ViolationType.FILESYSTEM_VIOLATION, Severity.MEDIUM, op,
                    action + " access to " + path + " is blocked");
        }
        if (!write) {
            return Optional.empty();
        }
        if (!(inWorkspace || filesystem.isWritable(path))) {
            return deny(managed, ViolationType.FILESYSTEM_VIOLATION, Severity.MEDIUM, op,
                    "Write access to " + path + " is not permitted");
        }
        if (op.getBytes() > filesystem.getMaxFileSizeBytes()) {
            return deny(managed, ViolationType.FILESYSTEM_VIOLATION, Severity.MEDIUM, op,
                    "Write of " + op.getBytes() + " bytes exceeds file size limit " + filesystem.getMaxFileSizeBytes());
        }
        return Optional.empty();
    }

    private Optional<SecurityViolation> checkPermission(ManagedSandbox managed, PluginOperation op, String permission) {
        if (PermissionMatcher.grants(managed.policy().getPermissions(), permission)) {
            return Optional.empty();
        }
        boolean privileged = PolicyEvaluator.isPrivileged(permission);
        return deny(managed,
                privileged ? ViolationType.PRIVILEGE_ESCALATION : ViolationType.PERMISSION_DENIED,
                privileged ? Severity.HIGH : Severity.MEDIUM, op,
                "Permission " + permission + " is not granted by policy " + managed.policy().getId());
    }

    private Optional<SecurityViolation> checkResources(ManagedSandbox managed, PluginOperation op) {
        Sandbox sandbox = managed.sandbox();
        SandboxConfig.ResourceLimits limits = sandbox.getConfig().getLimits();
        SecurityPolicy.DataAccessPolicy data = managed.policy().getDataAccess();
        SandboxMetrics.Snapshot usage = sandbox.getMetrics();

        String breach = null;
        if (op.getType() == OperationType.DATA_QUERY && op.getDurationMs() > data.getMaxQueryTimeMs()) {
            breach = "Query time " + op.getDurationMs() + " ms exceeds " + data.getMaxQueryTimeMs() + " ms";
        } else if (op.getType() == OperationType.DATA_QUERY && op.getBytes() > data.getMaxResultSizeBytes()) {
            breach = "Query result " + op.getBytes() + " bytes exceeds " + data.getMaxResultSizeBytes() + " bytes";
        } else if (op.getType() == OperationType.NETWORK_CONNECT && op.getBytes() > limits.getNetworkBytesPerSec()) {
            breach = "Network transfer " + op.getBytes() + " bytes exceeds bandwidth " + limits.getNetworkBytesPerSec() + " B/s";
        } else if (op.getType() == OperationType.FILE_WRITE && op.getBytes() > limits.getIoBytesPerSec()) {
            breach = "Disk write " + op.getBytes() + " bytes exceeds IO budget " + limits.getIoBytesPerSec() + " B/s";
        } else if (usage.getMemoryBytes() >= limits.getMemoryBytes()) {
            breach = "Memory usage " + usage.getMemoryBytes() + " bytes at limit " + limits.getMemoryBytes();
        } else if (usage.getCpuPercent() >= sandbox.getConfig().getMonitoring().getCpuPercentThreshold()) {
            breach = "CPU usage " + usage.getCpuPercent() + "% above threshold";
        }
        if (breach == null) {
            return Optional.empty();
        }
        return Optional.of(SecurityViolation.builder()
                .type(ViolationType.RESOURCE_EXHAUSTION)
                .severity(Severity.MEDIUM)
                .description(breach)
                .pluginId(sandbox.getPluginId())
                .sandboxId(sandbox.getId())
                .blocked(false)
                .source(ViolationMapper.SOURCE_FRAMEWORK)
                .timestamp(clock.instant())
                .detail("operation", op.getType().name())
                .build());
    }

    private Optional<SecurityViolation> deny(ManagedSandbox managed, ViolationType type, Severity severity,
                                             PluginOperation op, String description) {
        Sandbox sandbox = managed.sandbox();
        return Optional.of(SecurityViolation.builder()
                .type(type)
                .severity(severity)
                .description(description)
                .pluginId(sandbox.getPluginId())
                .sandboxId(sandbox.getId())
                .blocked(true)
                .source(ViolationMapper.SOURCE_FRAMEWORK)
                .timestamp(clock.instant())
                .detail("operation", op.getType().name())
                .detail("target", op.getTarget())
                .build());
    }

    private static Path parsePath(String target) {
        if (target.isBlank()) {
            return null;
        }
        try {
            return Paths.get(target);
        } catch (InvalidPathException e) {
            log.debug("Rejecting unparseable path '{}': {}", target, e.getMessage());
            return null;
        }
    }

    /**
     * 可执行文件名；根路径、空串或非法路径返回 null
     */
    private static String executableName(String target) {
        Path path = parsePath(target);
        Path fileName = path == null ? null : path.getFileName();
        return fileName == null ? null : fileName.toString();
    }

    // ==================== 阶段 4：可疑行为检测 ====================

    /**
     * 对单个沙箱执行一次检测，发现的违规进入阶段 5 处置
     */
    public List<SecurityViolation> detectSuspiciousActivity(String sandboxId, SecurityContext context) {
        ManagedSandbox managed = require(sandboxId);
        List<SecurityViolation> findings = threatDetector.detect(
                managed.sandbox().getPluginId(), sandboxId, managed.activity());
        metrics.recordThreats(findings.size());
        for (SecurityViolation finding : findings) {
            handleSecurityViolation(finding, context);
        }
        return findings;
    }

    /**
     * 对所有运行中的沙箱执行检测，单个沙箱失败不影响其它沙箱
     */
    public int runDetectionCycle() {
        int findings = 0;
        for (ManagedSandbox managed : sandboxes.values()) {
            if (!managed.sandbox().getState().isRunning()) {
                continue;
            }
            try {
                findings += detectSuspiciousActivity(managed.sandbox().getId(), SecurityContext.system()).size();
            } catch (Exception e) {
                log.error("[{}] Threat detection failed", managed.sandbox().getId(), e);
            }
        }
        return findings;
    }

    // ==================== 阶段 5：违规处置 ====================

    /**
     * 审计违规；框架产生的 HIGH / CRITICAL 违规在开启自动响应时隔离沙箱、通知并开事件单
     */
    public ViolationResponse handleSecurityViolation(SecurityViolation violation, SecurityContext context) {
        InvalidArgumentException.requireNonNull(violation, "violation");
        Instant now = clock.instant();
        trimHistory(retentionCutoff(now));
        history.addLast(new HandledViolation(now, violation));

        SecurityEvent event = audit.recordEvent(SecurityEvent.builder()
                .type(ViolationMapper.eventTypeOf(violation.getType()))
                .severity(violation.getSeverity())
                .source(EventSource.plugin(sourceComponent(violation), violation.getPluginId()))
                .pluginId(violation.getPluginId())
                .sandboxId(violation.getSandboxId())
                .context(context)
                .description(violation.getDescription())
                .details(violation.getDetails())
                .detail("violationId", violation.getId())
                .detail("violationType", violation.getType().name())
                .detail("blocked", violation.isBlocked())
                .tag(violation.getType().name().toLowerCase(Locale.ROOT))
                .build());

        boolean respond = violation.getSeverity().isBlocking()
                && config.getIncidentResponse().isAutoResponse()
                && !SANDBOX_SOURCE.equals(violation.getSource());
        if (!respond) {
            metrics.recordViolation(false);
            return new ViolationResponse(event, false, incidentOf(event).map(SecurityIncident::getId).orElse(null));
        }

        boolean contained = contain(violation);
        audit.getEventBus().publish(new ShieldEvents.ViolationDetected(
                violation.getPluginId(), violation.getSandboxId(), violation));
        SecurityIncident incident = incidentOf(event).orElseGet(() -> audit.createIncident(
                "Security violation: " + violation.getType() + " in plugin " + violation.getPluginId(),
                violation.getDescription(),
                violation.getSeverity(),
                IncidentCategory.of(event.getType()),
                "framework:" + sourceComponent(violation),
                List.of(event.getId())));
        metrics.recordViolation(contained);
        log.warn("[{}] Automatic response to {} {}: contained={}, incident={}", violation.getPluginId(),
                violation.getSeverity(), violation.getType(), contained, incident.getId());
        return new ViolationResponse(event, contained, incident.getId());
    }

    private boolean contain(SecurityViolation violation) {
        if (violation.getSandboxId() != null) {
            ManagedSandbox managed = sandboxes.get(violation.getSandboxId());
            if (managed == null || !managed.sandbox().getState().isRunning()) {
                return false;
            }
            managed.sandbox().stop();
            log.warn("[{}] Sandbox {} stopped for containment", violation.getPluginId(), violation.getSandboxId());
            return true;
        }
        return violation.getPluginId() != null && stopSandboxesFor(violation.getPluginId()) > 0;
    }

    private Optional<SecurityIncident> incidentOf(SecurityEvent event) {
        if (event.getPluginId() == null) {
            return Optional.empty();
        }
        return audit.incidentsForPlugin(event.getPluginId()).stream()
                .filter(i -> i.getEventIds().contains(event.getId()))
                .findFirst();
    }

    private static String sourceComponent(SecurityViolation violation) {
        return violation.getSource() == null ? ViolationMapper.SOURCE_FRAMEWORK : violation.getSource();
    }

    // ==================== 报告 ====================

    public FrameworkReport generateSecurityReport(ReportPeriod period) {
        InvalidArgumentException.requireNonNull(period, "period");
        List<SecurityViolation> inPeriod = history.stream()
                .filter(h -> period.contains(h.at()))
                .map(HandledViolation::violation)
                .collect(Collectors.toList());

        Map<ViolationType, Long> byType = new EnumMap<>(ViolationType.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (SecurityViolation v : inPeriod) {
            byType.merge(v.getType(), 1L, Long::sum);
            bySeverity.merge(v.getSeverity(), 1L, Long::sum);
        }
        long critical = bySeverity.getOrDefault(Severity.CRITICAL, 0L);
        long high = bySeverity.getOrDefault(Severity.HIGH, 0L);
        int score = (int) Math.max(0, 100 - 20 * critical - 10 * high);

        return FrameworkReport.builder()
                .period(period)
                .generatedAt(clock.instant())
                .totalViolations(inPeriod.size())
                .violationsByType(byType)
                .violationsBySeverity(bySeverity)
                .complianceScore(score)
                .status(ComplianceStatus.of(score))
                .activeSandboxes((int) sandboxes.values().stream()
                        .filter(m -> m.sandbox().getState().isRunning()).count())
                .metrics(metrics.snapshot())
                .recommendations(byType.keySet().stream()
                        .map(SecurityFramework::recommendationFor)
                        .distinct()
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * 指定插件在区间内处置过的违规
     */
    public List<SecurityViolation> violationsFor(String pluginId, ReportPeriod period) {
        return history.stream()
                .filter(h -> period.contains(h.at()))
                .map(HandledViolation::violation)
                .filter(v -> pluginId.equals(v.getPluginId()))
                .collect(Collectors.toList());
    }

    public static String recommendationFor(ViolationType type) {
        switch (type) {
            case RESOURCE_EXHAUSTION:
                return "Review resource limits and optimise plugin resource consumption";
            case NETWORK_VIOLATION:
                return "Restrict plugin network destinations to the documented allow-list";
            case FILESYSTEM_VIOLATION:
                return "Confine plugin file access to its workspace and declared storage paths";
            case PERMISSION_DENIED:
            case PRIVILEGE_ESCALATION:
                return "Audit declared permissions and remove privileges the plugin does not need";
            case DATA_EXFILTRATION:
                return "Investigate outbound data transfers and enable data loss prevention controls";
            case MALICIOUS_BEHAVIOR:
            case ATTACK_SIGNATURE:
                return "Quarantine the plugin and perform a forensic review of its activity";
            case VULNERABLE_DEPENDENCY:
                return "Upgrade vulnerable dependencies to patched versions";
            case STATIC_ANALYSIS:
            case CODE_INJECTION:
                return "Fix reported code vulnerabilities and re-run static analysis";
            case SIGNATURE_VERIFICATION:
                return "Re-sign the plugin with a certificate issued by a registered trust anchor";
            default:
                return "Review security policy configuration for plugin " + type.name().toLowerCase(Locale.ROOT) + " findings";
        }
    }

    // ==================== 保留期 ====================

    /**
     * 清理超过保留期的审计事件与违规历史
     *
     * @return 删除的审计事件与历史条目总数
     */
    public int enforceRetention() {
        int history = trimHistory(retentionCutoff(clock.instant()));
        int events = audit.purgeExpired();
        if (history > 0) {
            log.info("Dropped {} handled violation(s) beyond the retention window", history);
        }
        return history + events;
    }

    private Instant retentionCutoff(Instant now) {
        return now.minus(Duration.ofDays(config.getAudit().getRetentionDays()));
    }

    private int trimHistory(Instant cutoff) {
        int removed = 0;
        HandledViolation head;
        while ((head = history.peekFirst()) != null && head.at().isBefore(cutoff)) {
            if (history.remove(head)) {
                removed++;
            }
        }
        return removed;
    }

    // ==================== 生命周期 ====================

    /**
     * 启动周期性保留期清理与可疑行为检测
     */
    public synchronized void start() {
        if (retentionTask == null) {
            long retention = config.getAudit().getRetentionIntervalMs();
            retentionTask = scheduler.scheduleAtFixedRate(this::runRetentionCycle, retention, retention,
                    TimeUnit.MILLISECONDS);
            log.info("Retention cleanup scheduled every {} ms", retention);
        }
        LingShieldConfig.ThreatDetection detection = config.getThreatDetection();
        if (!detection.isEnabled() || detectionTask != null) {
            return;
        }
        long interval = detection.getDetectionIntervalMs();
        detectionTask = scheduler.scheduleAtFixedRate(this::runDetectionCycle, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Threat detection scheduled every {} ms", interval);
    }

    private void runRetentionCycle() {
        try {
            enforceRetention();
        } catch (Exception e) {
            log.error("Retention cleanup failed", e);
        }
    }

    public void shutdown() {
        log.info("Shutting down SecurityFramework...");
        for (ScheduledFuture<?> task : new ScheduledFuture<?>[]{detectionTask, retentionTask}) {
            if (task != null) {
                task.cancel(false);
            }
        }
        for (ManagedSandbox managed : sandboxes.values()) {
            try {
                managed.sandbox().stop();
            } catch (Exception e) {
                log.error("Error stopping sandbox: {}", managed.sandbox().getId(), e);
            }
        }
        sandboxes.clear();
        shutdownExecutorNow(scheduler);
    }

    public Collection<Sandbox> activeSandboxes() {
        return Collections.unmodifiableList(sandboxes.values().stream()
                .map(ManagedSandbox::sandbox)
                .filter(s -> s.getState().isRunning())
                .collect(Collectors.toList()));
    }

    // ==================== 基础设施 ====================

    private ManagedSandbox require(String sandboxId) {
        ManagedSandbox managed = sandboxId == null ? null : sandboxes.get(sandboxId);
        if (managed == null) {
            throw new SandboxException(sandboxId, "Sandbox not found: " + sandboxId);
        }
        return managed;
    }

    private String resolvePolicyId(String policyId) {
        return policyId == null || policyId.isBlank() ? config.getDefaultPolicyId() : policyId;
    }

    private static IsolationProvider createIsolationProvider(LingShieldConfig.RuntimeProtection runtime) {
        if (ProcessIsolationProvider.NAME.equals(runtime.getIsolation())) {
            return new ProcessIsolationProvider(runtime.getLauncherCommand());
        }
        return new InProcessIsolationProvider();
    }

    private ScheduledExecutorService createScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "lingshield-monitor-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(
                    (thread, e) -> log.error("Scheduler thread {} error: {}", thread.getName(), e.getMessage()));
            return t;
        });
    }

    private void shutdownExecutorNow(ScheduledExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate during shutdownNow");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 沙箱违规写入审计
     */
    private final class AuditingListener implements SandboxListener {

        private final SecurityContext context;

        private AuditingListener(SecurityContext context) {
            this.context = context;
        }

        @Override
        public void onViolation(Sandbox sandbox, SecurityViolation violation) {
            handleSecurityViolation(violation, context);
        }
    }
}
