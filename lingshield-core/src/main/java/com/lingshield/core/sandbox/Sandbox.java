package com.lingshield.core.sandbox;

import com.lingshield.api.security.Severity;
import com.lingshield.core.event.EventBus;
import com.lingshield.core.event.ShieldEvents;
import com.lingshield.core.exception.ExecutionRejectedException;
import com.lingshield.core.exception.SandboxCancelledException;
import com.lingshield.core.exception.SandboxException;
import com.lingshield.core.exception.SandboxTimeoutException;
import com.lingshield.core.spi.ExecutionRequest;
import com.lingshield.core.spi.ExecutionUnit;
import com.lingshield.core.spi.IsolationProvider;
import com.lingshield.core.spi.ResourceSample;
import com.lingshield.core.util.FileUtils;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 插件沙箱
 * <p>
 * 每个运行中的插件对应一个实例，负责：
 * <ul>
 * <li>为隔离单元准备工作目录并下发资源、网络、文件限制</li>
 * <li>带关联 ID 与超时的代码执行</li>
 * <li>周期采样资源指标，越限转为 RESOURCE_EXHAUSTION 违规</li>
 * <li>违规处置：CRITICAL 停止，HIGH 降级，其余仅记录</li>
 * </ul>
 * 停止操作幂等，工作目录清理失败只记录日志。
 */
@Slf4j
public class Sandbox {

    /**
     * CPU 硬上限（百分比），超过视为不健康
     */
    public static final double HARD_CPU_CEILING = 90.0;

    /**
     * 降级后连续多少次无越限采样即恢复
     */
    static final int CLEAN_SAMPLES_TO_RESTORE = 3;

    @Getter
    private final String id;
    @Getter
    private final SandboxConfig config;
    @Getter
    private final Instant createdAt;

    private final Clock clock;
    private final IsolationProvider provider;
    private final ScheduledExecutorService scheduler;
    private final EventBus eventBus;
    private final CodeGuard guard = new CodeGuard();

    private final AtomicReference<SandboxState> state = new AtomicReference<>(SandboxState.CREATED);
    private final SandboxMetrics metrics = new SandboxMetrics();
    private final List<SecurityViolation> violations = new CopyOnWriteArrayList<>();
    private final List<SandboxListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();

    // 当前生效的越限项，仅在新出现时产生违规
    private final Set<String> activeBreaches = ConcurrentHashMap.newKeySet();
    private final AtomicInteger cleanSamples = new AtomicInteger();

    private volatile SandboxConfig.ResourceLimits currentLimits;
    private volatile ExecutionUnit unit;
    private volatile Path workspace;
    private volatile ScheduledFuture<?> monitorTask;

    public Sandbox(SandboxConfig config, IsolationProvider provider, ScheduledExecutorService scheduler) {
        this("sbx-" + UUID.randomUUID(), config, provider, scheduler, null);
    }

    public Sandbox(String id, SandboxConfig config, IsolationProvider provider,
                   ScheduledExecutorService scheduler, EventBus eventBus) {
        this(id, config, provider, scheduler, eventBus, Clock.systemUTC());
    }

    public Sandbox(String id, SandboxConfig config, IsolationProvider provider,
                   ScheduledExecutorService scheduler, EventBus eventBus, Clock clock) {
        this.id = id;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.config = config;
        this.provider = provider;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.currentLimits = config.getLimits();
    }

    public String getPluginId() {
        return config.getPluginId();
    }

    public SandboxState getState() {
        return state.get();
    }

    public SandboxMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    public List<SecurityViolation> getViolations() {
        return List.copyOf(violations);
    }

    public SandboxConfig.ResourceLimits getCurrentLimits() {
        return currentLimits;
    }

    public Optional<Path> getWorkspace() {
        return Optional.ofNullable(workspace);
    }

    public void addListener(SandboxListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SandboxListener listener) {
        listeners.remove(listener);
    }

    // ==================== 生命周期 ====================

    /**
     * 启动沙箱，任一步骤失败都会清理并进入 TERMINATED
     */
    public void start() {
        if (!transition(SandboxState.CREATED, SandboxState.STARTING)) {
            throw new SandboxException(id, "Sandbox cannot start from state " + state.get());
        }
        log.info("[{}] Starting sandbox for plugin {}", id, getPluginId());
        try {
            workspace = createWorkspace();
            ExecutionUnit created = provider.create(id, config);
            unit = created;
            created.applyLimits(currentLimits);
            created.applyNetworkRules(config.getNetwork());
            created.mountFilesystem(workspace, config.getFilesystem().toBuilder()
                    .writablePath(workspace.toString())
                    .build());
            created.launch();

            SandboxConfig.MonitoringConfig monitoring = config.getMonitoring();
            if (monitoring.isEnabled() && monitoring.getIntervalMs() > 0) {
                monitorTask = scheduler.scheduleAtFixedRate(this::sampleQuietly,
                        monitoring.getIntervalMs(), monitoring.getIntervalMs(), TimeUnit.MILLISECONDS);
            }
        } catch (Exception e) {
            log.error("[{}] Sandbox start failed: {}", id, e.getMessage(), e);
            transition(SandboxState.STARTING, SandboxState.STOPPING);
            release(false);
            transition(SandboxState.STOPPING, SandboxState.TERMINATED);
            throw e instanceof SandboxException ? (SandboxException) e
                    : new SandboxException(id, "Sandbox start failed: " + e.getMessage(), e);
        }
        if (!transition(SandboxState.STARTING, SandboxState.ACTIVE)) {
            // 启动期间被并发停止
            throw new SandboxException(id, "Sandbox stopped during start");
        }
        log.info("[{}] Sandbox active, workspace={}", id, workspace);
    }

    /**
     * 停止沙箱（幂等）
     * <p>
     * 取消采样与未完成的执行，优雅终止隔离单元，超过宽限期强制终止，最后删除工作目录。
     */
    public void stop() {
        while (true) {
            SandboxState current = state.get();
            if (current == SandboxState.STOPPING || current == SandboxState.TERMINATED) {
                return;
            }
            if (current == SandboxState.CREATED) {
                if (transition(current, SandboxState.TERMINATED)) {
                    return;
                }
                continue;
            }
            if (transition(current, SandboxState.STOPPING)) {
                break;
            }
        }
        log.info("[{}] Stopping sandbox", id);
        release(true);
        transition(SandboxState.STOPPING, SandboxState.TERMINATED);
        log.info("[{}] Sandbox terminated", id);
    }

    private void release(boolean graceful) {
        ScheduledFuture<?> task = monitorTask;
        if (task != null) {
            task.cancel(false);
        }
        pending.forEach((correlationId, future) ->
                future.completeExceptionally(new SandboxCancelledException(id, correlationId)));

        ExecutionUnit current = unit;
        if (current != null) {
            try {
                if (graceful) {
                    current.terminate();
                    if (!current.awaitTermination(config.getGracePeriodMs())) {
                        log.warn("[{}] Grace period of {}ms elapsed, killing execution unit", id, config.getGracePeriodMs());
                        current.kill();
                    }
                } else {
                    current.kill();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                current.kill();
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to terminate execution unit: {}", id, e.getMessage());
                current.kill();
            }
        }

        Path dir = workspace;
        if (dir != null) {
            try {
                FileUtils.deleteRecursively(dir);
            } catch (IOException e) {
                log.warn("[{}] Failed to remove workspace {}: {}", id, dir, e.getMessage());
            }
        }
    }

    private Path createWorkspace() throws IOException {
        Path root = config.getWorkspaceRoot();
        Path dir;
        if (root != null) {
            Files.createDirectories(root);
            dir = Files.createTempDirectory(root, "sandbox-" + id + "-");
        } else {
            dir = Files.createTempDirectory("lingshield-sandbox-");
        }
        FileUtils.restrictToOwner(dir);
        Files.createDirectories(dir.resolve("workspace"));
        Files.createDirectories(dir.resolve("temp"));
        Files.createDirectories(dir.resolve("logs"));
        return dir;
    }

    // ==================== 执行 ====================

    /**
     * 同步执行，阻塞到结果返回或超时
     *
     * @param timeoutMs 小于等于 0 时使用配置的执行超时
     * @throws ExecutionRejectedException 状态不允许或未通过执行前检查
     * @throws SandboxTimeoutException    超时
     * @throws SandboxCancelledException  执行期间沙箱被停止
     */
    public Object execute(String code, Map<String, Object> context, long timeoutMs) {
        try {
            return executeAsync(code, context, timeoutMs).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SandboxException) {
                throw (SandboxException) cause;
            }
            throw new SandboxException(id, "Execution failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException(id, "Execution interrupted", e);
        }
    }

    /**
     * 异步执行，超时以 {@link SandboxTimeoutException} 结束
     */
    public CompletableFuture<Object> executeAsync(String code, Map<String, Object> context, long timeoutMs) {
        SandboxState current = state.get();
        if (!current.isRunning()) {
            throw new ExecutionRejectedException(id, "Sandbox is not running: " + current);
        }
        Optional<CodeGuard.Rejection> rejection = guard.check(code, context);
        if (rejection.isPresent()) {
            CodeGuard.Rejection r = rejection.get();
            if (r.isDeniedPrimitive()) {
                handleViolation(SecurityViolation.builder()
                        .type(ViolationType.CODE_INJECTION)
                        .severity(Severity.MEDIUM)
                        .description("Execution rejected: " + r.reason())
                        .pluginId(getPluginId())
                        .sandboxId(id)
                        .blocked(true)
                        .source("sandbox")
                        .timestamp(clock.instant())
                        .detail("primitive", r.primitive())
                        .build());
            }
            log.warn("[{}] Execution rejected: {}", id, r.reason());
            throw new ExecutionRejectedException(id, r.reason());
        }

        long timeout = timeoutMs > 0 ? timeoutMs : config.getExecutionTimeoutMs();
        String correlationId = UUID.randomUUID().toString();
        long startedAt = System.nanoTime();

        CompletableFuture<Object> call = new CompletableFuture<>();
        pending.put(correlationId, call);
        CompletableFuture<Object> dispatched;
        try {
            dispatched = unit.dispatch(new ExecutionRequest(correlationId, code, context, timeout));
        } catch (RuntimeException e) {
            pending.remove(correlationId);
            throw new SandboxException(id, "Dispatch failed: " + e.getMessage(), e);
        }

        ScheduledFuture<?> timer = scheduler.schedule(
                () -> call.completeExceptionally(new SandboxTimeoutException(id, timeout)),
                timeout, TimeUnit.MILLISECONDS);
        dispatched.whenComplete((value, error) -> {
            if (error == null) {
                call.complete(value);
            } else {
                call.completeExceptionally(unwrap(error));
            }
        });
        call.whenComplete((value, error) -> {
            timer.cancel(false);
            pending.remove(correlationId);
            if (!dispatched.isDone()) {
                dispatched.cancel(true);
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            metrics.recordExecution(elapsedMs, error == null);
            if (error != null) {
                log.debug("[{}] Execution {} failed after {}ms: {}", id, correlationId, elapsedMs, error.getMessage());
            }
        });
        return call;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // ==================== 监控 ====================

    private void sampleQuietly() {
        try {
            collectMetrics();
        } catch (Exception e) {
            log.warn("[{}] Metrics sampling failed: {}", id, e.getMessage());
        }
    }

    /**
     * 采样一次并检查告警阈值
     */
    public void collectMetrics() {
        ExecutionUnit current = unit;
        if (current == null || !state.get().isRunning()) {
            return;
        }
        ResourceSample sample = current.sample();
        metrics.record(sample);
        evaluate(sample);
    }

    private void evaluate(ResourceSample sample) {
        SandboxConfig.ResourceLimits limits = config.getLimits();
        SandboxConfig.MonitoringConfig thresholds = config.getMonitoring();
        SandboxMetrics.Snapshot totals = metrics.snapshot();
        List<Breach> breaches = new ArrayList<>();

        long memoryAlert = (long) (limits.getMemoryBytes() * thresholds.getMemoryPercentThreshold() / 100.0);
        if (sample.memoryBytes() > limits.getMemoryBytes()) {
            breaches.add(new Breach("memory.limit", Severity.HIGH,
                    "Memory usage " + sample.memoryBytes() + " exceeds limit " + limits.getMemoryBytes(),
                    "memoryBytes", sample.memoryBytes()));
        } else if (sample.memoryBytes() > memoryAlert) {
            breaches.add(new Breach("memory.threshold", Severity.LOW,
                    "Memory usage " + sample.memoryBytes() + " above alert threshold " + memoryAlert,
                    "memoryBytes", sample.memoryBytes()));
        }

        if (sample.cpuPercent() >= HARD_CPU_CEILING) {
            breaches.add(new Breach("cpu.ceiling", Severity.HIGH,
                    String.format("CPU usage %.1f%% reached hard ceiling", sample.cpuPercent()),
                    "cpuPercent", sample.cpuPercent()));
        } else if (sample.cpuPercent() > thresholds.getCpuPercentThreshold()) {
            breaches.add(new Breach("cpu.threshold", Severity.LOW,
                    String.format("CPU usage %.1f%% above alert threshold", sample.cpuPercent()),
                    "cpuPercent", sample.cpuPercent()));
        }

        if (totals.getCpuTimeMs() > limits.getCpuTimeMs()) {
            breaches.add(new Breach("cpu.time", Severity.HIGH,
                    "CPU time " + totals.getCpuTimeMs() + "ms exceeds budget " + limits.getCpuTimeMs() + "ms",
                    "cpuTimeMs", totals.getCpuTimeMs()));
        }
        if (sample.processes() > limits.getMaxProcesses()) {
            breaches.add(new Breach("processes", Severity.HIGH,
                    "Process count " + sample.processes() + " exceeds limit " + limits.getMaxProcesses(),
                    "processes", sample.processes()));
        }
        if (sample.openConnections() > limits.getMaxConnections()) {
            breaches.add(new Breach("connections", Severity.MEDIUM,
                    "Open connections " + sample.openConnections() + " exceed limit " + limits.getMaxConnections(),
                    "openConnections", sample.openConnections()));
        }
        if (totals.getDiskWriteBytes() > limits.getDiskBytes()) {
            breaches.add(new Breach("disk", Severity.HIGH,
                    "Disk usage " + totals.getDiskWriteBytes() + " exceeds quota " + limits.getDiskBytes(),
                    "diskWriteBytes", totals.getDiskWriteBytes()));
        }
        double intervalSec = Math.max(1, thresholds.getIntervalMs()) / 1000.0;
        SandboxConfig.ResourceLimits effective = currentLimits;
        long io = sample.diskReadBytes() + sample.diskWriteBytes();
        if (io > effective.getIoBytesPerSec() * intervalSec) {
            breaches.add(new Breach("io.rate", Severity.MEDIUM,
                    "Disk I/O " + io + " bytes exceeds rate limit", "ioBytes", io));
        }
        long net = sample.networkInBytes() + sample.networkOutBytes();
        if (net > effective.getNetworkBytesPerSec() * intervalSec) {
            breaches.add(new Breach("network.rate", Severity.MEDIUM,
                    "Network traffic " + net + " bytes exceeds bandwidth limit", "networkBytes", net));
        }
        if (totals.getErrors() > thresholds.getErrorCountThreshold()) {
            breaches.add(new Breach("errors", Severity.LOW,
                    "Execution errors " + totals.getErrors() + " above threshold " + thresholds.getErrorCountThreshold(),
                    "errors", totals.getErrors()));
        }

        Set<String> seen = new HashSet<>();
        boolean severe = false;
        for (Breach breach : breaches) {
            seen.add(breach.key());
            severe |= breach.severity().isAtLeast(Severity.HIGH);
            if (activeBreaches.add(breach.key())) {
                handleViolation(SecurityViolation.builder()
                        .type(ViolationType.RESOURCE_EXHAUSTION)
                        .severity(breach.severity())
                        .description(breach.description())
                        .pluginId(getPluginId())
                        .sandboxId(id)
                        .blocked(false)
                        .source("sandbox")
                        .timestamp(clock.instant())
                        .detail("metric", breach.metric())
                        .detail("value", breach.value())
                        .build());
            }
        }
        activeBreaches.retainAll(seen);

        if (state.get() == SandboxState.THROTTLED) {
            if (severe) {
                cleanSamples.set(0);
            } else if (cleanSamples.incrementAndGet() >= CLEAN_SAMPLES_TO_RESTORE) {
                restore();
            }
        }
    }

    private record Breach(String key, Severity severity, String description, String metric, Object value) {
    }

    /**
     * 纯判断：运行中、内存低于限额、CPU 低于硬上限、隔离单元仍有响应
     */
    public boolean isHealthy() {
        ExecutionUnit current = unit;
        return state.get().isRunning()
                && metrics.getMemoryBytes() < config.getLimits().getMemoryBytes()
                && metrics.getCpuPercent() < HARD_CPU_CEILING
                && current != null
                && current.isResponsive();
    }

    // ==================== 违规处置 ====================

    /**
     * 处置违规：CRITICAL 停止沙箱，HIGH 降级，其余仅记录；处置后通知监听器
     */
    public void handleViolation(SecurityViolation violation) {
        violations.add(violation);
        metrics.recordWarning();
        log.warn("[{}] Violation {} ({}): {}", id, violation.getType(), violation.getSeverity(), violation.getDescription());

        if (violation.getSeverity() == Severity.CRITICAL) {
            stop();
        } else if (violation.getSeverity() == Severity.HIGH) {
            throttle();
        }

        for (SandboxListener listener : listeners) {
            try {
                listener.onViolation(this, violation);
            } catch (Exception e) {
                log.warn("[{}] Sandbox listener failed on violation: {}", id, e.getMessage(), e);
            }
        }
        if (eventBus != null) {
            eventBus.publish(new ShieldEvents.ViolationDetected(getPluginId(), id, violation));
        }
    }

    /**
     * 降级：CPU、IO、网络预算减半
     */
    public void throttle() {
        cleanSamples.set(0);
        if (!transition(SandboxState.ACTIVE, SandboxState.THROTTLED)) {
            return;
        }
        SandboxConfig.ResourceLimits degraded = config.getLimits().throttled();
        currentLimits = degraded;
        unit.applyLimits(degraded);
        log.info("[{}] Sandbox throttled: cpuCores={}, io={}B/s, network={}B/s", id,
                degraded.getCpuCores(), degraded.getIoBytesPerSec(), degraded.getNetworkBytesPerSec());
    }

    private void restore() {
        if (!transition(SandboxState.THROTTLED, SandboxState.ACTIVE)) {
            return;
        }
        cleanSamples.set(0);
        currentLimits = config.getLimits();
        unit.applyLimits(currentLimits);
        log.info("[{}] Sandbox limits restored", id);
    }

    // ==================== 状态 ====================

    private boolean transition(SandboxState from, SandboxState to) {
        if (!from.canTransitionTo(to) || !state.compareAndSet(from, to)) {
            return false;
        }
        log.debug("[{}] State {} -> {}", id, from, to);
        for (SandboxListener listener : listeners) {
            try {
                listener.onStateChanged(this, from, to);
            } catch (Exception e) {
                log.warn("[{}] Sandbox listener failed on state change: {}", id, e.getMessage(), e);
            }
        }
        if (eventBus != null) {
            eventBus.publish(new ShieldEvents.SandboxStateChanged(id, getPluginId(), from, to));
        }
        return true;
    }

    @Override
    public String toString() {
        return "Sandbox{id=" + id + ", plugin=" + getPluginId() + ", state=" + state.get() + "}";
    }
}
