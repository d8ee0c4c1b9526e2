package com.lingshield.core.sandbox;

import com.lingshield.api.security.Severity;
import com.lingshield.core.exception.ExecutionRejectedException;
import com.lingshield.core.exception.SandboxCancelledException;
import com.lingshield.core.exception.SandboxException;
import com.lingshield.core.exception.SandboxTimeoutException;
import com.lingshield.core.spi.ResourceSample;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sandbox 单元测试")
class SandboxTest {

    private static final long MB = 1024L * 1024;

    @TempDir
    Path tempDir;

    private ScheduledExecutorService scheduler;
    private FakeIsolationProvider provider;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        provider = new FakeIsolationProvider();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private SandboxConfig.SandboxConfigBuilder baseConfig() {
        return SandboxConfig.builder()
                .pluginId("demo-plugin")
                .policyId("default-security-policy")
                .workspaceRoot(tempDir)
                .gracePeriodMs(100)
                .monitoring(SandboxConfig.MonitoringConfig.builder().enabled(false).build());
    }

    private Sandbox startedSandbox() {
        Sandbox sandbox = new Sandbox(baseConfig().build(), provider, scheduler);
        sandbox.start();
        return sandbox;
    }

    private static SecurityViolation violation(Severity severity) {
        return SecurityViolation.builder()
                .type(ViolationType.NETWORK_VIOLATION)
                .severity(severity)
                .description("connect to 169.254.169.254")
                .pluginId("demo-plugin")
                .source("test")
                .build();
    }

    @Nested
    @DisplayName("生命周期")
    class LifecycleTests {

        @Test
        @DisplayName("启动后进入 ACTIVE 并下发限制")
        void startShouldActivate() {
            Sandbox sandbox = startedSandbox();

            assertEquals(SandboxState.ACTIVE, sandbox.getState());
            Path workspace = sandbox.getWorkspace().orElseThrow();
            assertTrue(Files.isDirectory(workspace.resolve("workspace")));
            assertTrue(Files.isDirectory(workspace.resolve("logs")));
            assertEquals(512 * MB, provider.unit.appliedLimits.get(0).getMemoryBytes());
            assertTrue(provider.unit.filesystem.isWritable(workspace.resolve("workspace").toString()));
            assertTrue(sandbox.isHealthy());
        }

        @Test
        @DisplayName("停止是幂等的，并清理工作目录")
        void stopShouldBeIdempotent() {
            Sandbox sandbox = startedSandbox();
            Path workspace = sandbox.getWorkspace().orElseThrow();
            List<SandboxState> transitions = new CopyOnWriteArrayList<>();
            sandbox.addListener(new SandboxListener() {
                @Override
                public void onStateChanged(Sandbox s, SandboxState from, SandboxState to) {
                    transitions.add(to);
                }
            });

            sandbox.stop();
            sandbox.stop();

            assertEquals(SandboxState.TERMINATED, sandbox.getState());
            assertEquals(List.of(SandboxState.STOPPING, SandboxState.TERMINATED), transitions);
            assertTrue(provider.unit.terminated);
            assertFalse(provider.unit.killed);
            assertFalse(Files.exists(workspace));
            assertFalse(sandbox.isHealthy());
        }

        @Test
        @DisplayName("宽限期内未退出时强制终止")
        void shouldKillAfterGracePeriod() {
            Sandbox sandbox = startedSandbox();
            provider.unit.exitsGracefully = false;

            sandbox.stop();

            assertTrue(provider.unit.killed);
            assertEquals(SandboxState.TERMINATED, sandbox.getState());
        }

        @Test
        @DisplayName("未启动的沙箱可直接终止")
        void stopFromCreated() {
            Sandbox sandbox = new Sandbox(baseConfig().build(), provider, scheduler);

            sandbox.stop();

            assertEquals(SandboxState.TERMINATED, sandbox.getState());
            assertThrows(SandboxException.class, sandbox::start);
        }

        @Test
        @DisplayName("启动失败时清理并进入 TERMINATED")
        void failedStartShouldCleanUp() throws Exception {
            provider.unit.failLaunch = true;
            Sandbox sandbox = new Sandbox(baseConfig().build(), provider, scheduler);

            assertThrows(SandboxException.class, sandbox::start);

            assertEquals(SandboxState.TERMINATED, sandbox.getState());
            assertTrue(provider.unit.killed);
            try (var entries = Files.list(tempDir)) {
                assertEquals(0, entries.count());
            }
        }
    }

    @Nested
    @DisplayName("执行")
    class ExecutionTests {

        @Test
        @DisplayName("正常执行返回结果并携带关联 ID")
        void shouldExecute() {
            Sandbox sandbox = startedSandbox();

            Object result = sandbox.execute("return 1 + 1", Map.of("user", "alice"), 1000);

            assertEquals("ok", result);
            assertEquals(1, provider.unit.requests.size());
            assertNotNull(provider.unit.requests.get(0).correlationId());
            assertEquals("alice", provider.unit.requests.get(0).context().get("user"));
            assertEquals(1, sandbox.getMetrics().getExecutions());
        }

        @Test
        @DisplayName("超时抛出 SandboxTimeoutException")
        void shouldTimeout() {
            provider.unit.handler = request -> new CompletableFuture<>();
            Sandbox sandbox = startedSandbox();

            SandboxTimeoutException e = assertThrows(SandboxTimeoutException.class,
                    () -> sandbox.execute("while (true) {}", Map.of(), 100));

            assertEquals(100, e.getTimeoutMs());
            await().atMost(Duration.ofSeconds(1)).until(() -> sandbox.getMetrics().getErrors() == 1);
        }

        @Test
        @DisplayName("未启动时拒绝执行")
        void shouldRejectWhenNotRunning() {
            Sandbox sandbox = new Sandbox(baseConfig().build(), provider, scheduler);

            assertThrows(ExecutionRejectedException.class, () -> sandbox.execute("1", Map.of(), 100));
            assertTrue(provider.unit.requests.isEmpty());
        }

        @Test
        @DisplayName("禁用原语被拒绝并记录 MEDIUM 代码注入违规")
        void deniedPrimitiveShouldBeRecorded() {
            Sandbox sandbox = startedSandbox();

            assertThrows(ExecutionRejectedException.class,
                    () -> sandbox.execute("require('child_process').exec('rm -rf /')", Map.of(), 100));

            assertTrue(provider.unit.requests.isEmpty());
            List<SecurityViolation> violations = sandbox.getViolations();
            assertEquals(1, violations.size());
            assertEquals(ViolationType.CODE_INJECTION, violations.get(0).getType());
            assertEquals(Severity.MEDIUM, violations.get(0).getSeverity());
            assertEquals(SandboxState.ACTIVE, sandbox.getState());
        }

        @Test
        @DisplayName("代码超过 1MB 被拒绝")
        void oversizedCodeShouldBeRejected() {
            Sandbox sandbox = startedSandbox();
            String code = "x".repeat(CodeGuard.MAX_CODE_BYTES + 1);

            assertThrows(ExecutionRejectedException.class, () -> sandbox.execute(code, Map.of(), 100));
            assertTrue(sandbox.getViolations().isEmpty());
        }

        @Test
        @DisplayName("停止时未完成的执行以取消异常结束")
        void stopShouldCancelPendingExecutions() {
            provider.unit.handler = request -> new CompletableFuture<>();
            Sandbox sandbox = startedSandbox();
            CompletableFuture<Object> future = sandbox.executeAsync("work()", Map.of(), 60_000);

            sandbox.stop();

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
            assertInstanceOf(SandboxCancelledException.class, e.getCause());
        }

        @Test
        @DisplayName("隔离单元的失败包装为 SandboxException")
        void unitFailureShouldBeWrapped() {
            provider.unit.handler = request -> CompletableFuture.failedFuture(new IllegalStateException("boom"));
            Sandbox sandbox = startedSandbox();

            SandboxException e = assertThrows(SandboxException.class, () -> sandbox.execute("x()", Map.of(), 1000));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("监控与违规处置")
    class MonitoringTests {

        @Test
        @DisplayName("内存超限产生 HIGH 资源耗尽违规并进入 THROTTLED")
        void memoryOverLimitShouldThrottle() {
            Sandbox sandbox = startedSandbox();
            provider.unit.nextSample.set(ResourceSample.of(20, 600 * MB));

            sandbox.collectMetrics();

            assertEquals(SandboxState.THROTTLED, sandbox.getState());
            SecurityViolation v = sandbox.getViolations().get(0);
            assertEquals(ViolationType.RESOURCE_EXHAUSTION, v.getType());
            assertEquals(Severity.HIGH, v.getSeverity());
            SandboxConfig.ResourceLimits applied = provider.unit.appliedLimits.get(provider.unit.appliedLimits.size() - 1);
            assertEquals(0.5, applied.getCpuCores());
            assertEquals(512 * MB, applied.getMemoryBytes());
        }

        @Test
        @DisplayName("降级后连续三次正常采样恢复 ACTIVE")
        void shouldRestoreAfterCleanSamples() {
            Sandbox sandbox = startedSandbox();
            provider.unit.nextSample.set(ResourceSample.of(20, 600 * MB));
            sandbox.collectMetrics();
            assertEquals(SandboxState.THROTTLED, sandbox.getState());

            provider.unit.nextSample.set(ResourceSample.of(20, 100 * MB));
            sandbox.collectMetrics();
            sandbox.collectMetrics();
            assertEquals(SandboxState.THROTTLED, sandbox.getState());
            sandbox.collectMetrics();

            assertEquals(SandboxState.ACTIVE, sandbox.getState());
            assertEquals(1.0, sandbox.getCurrentLimits().getCpuCores());
        }

        @Test
        @DisplayName("持续越限只记录一次违规")
        void sustainedBreachShouldBeRecordedOnce() {
            Sandbox sandbox = startedSandbox();
            provider.unit.nextSample.set(ResourceSample.of(20, 450 * MB));

            sandbox.collectMetrics();
            sandbox.collectMetrics();

            assertEquals(1, sandbox.getViolations().size());
            assertEquals(Severity.LOW, sandbox.getViolations().get(0).getSeverity());
            assertEquals(SandboxState.ACTIVE, sandbox.getState());
        }

        @Test
        @DisplayName("周期采样自动触发降级")
        void scheduledSamplingShouldThrottle() {
            Sandbox sandbox = new Sandbox(baseConfig()
                    .monitoring(SandboxConfig.MonitoringConfig.builder().intervalMs(50).build())
                    .build(), provider, scheduler);
            provider.unit.nextSample.set(ResourceSample.of(10, 600 * MB));
            sandbox.start();

            await().atMost(Duration.ofSeconds(3)).until(() -> sandbox.getState() == SandboxState.THROTTLED);
            sandbox.stop();
        }

        @Test
        @DisplayName("HIGH 违规降级但资源正常时仍然健康")
        void highViolationShouldKeepHealthy() {
            Sandbox sandbox = startedSandbox();

            sandbox.handleViolation(violation(Severity.HIGH));

            assertEquals(SandboxState.THROTTLED, sandbox.getState());
            assertTrue(sandbox.isHealthy());
        }

        @Test
        @DisplayName("CRITICAL 违规立即终止，监听器在处置后收到通知")
        void criticalViolationShouldTerminate() {
            Sandbox sandbox = startedSandbox();
            List<SandboxState> observed = new CopyOnWriteArrayList<>();
            sandbox.addListener(new SandboxListener() {
                @Override
                public void onViolation(Sandbox s, SecurityViolation v) {
                    observed.add(s.getState());
                }
            });

            sandbox.handleViolation(violation(Severity.CRITICAL));

            assertEquals(SandboxState.TERMINATED, sandbox.getState());
            assertFalse(sandbox.isHealthy());
            assertEquals(List.of(SandboxState.TERMINATED), observed);
        }

        @Test
        @DisplayName("低级别违规只记录")
        void lowViolationShouldOnlyRecord() {
            Sandbox sandbox = startedSandbox();

            sandbox.handleViolation(violation(Severity.LOW));

            assertEquals(SandboxState.ACTIVE, sandbox.getState());
            assertEquals(1, sandbox.getViolations().size());
            assertEquals(1, sandbox.getMetrics().getWarnings());
        }

        @Test
        @DisplayName("隔离单元无响应时不健康")
        void unresponsiveUnitIsUnhealthy() {
            Sandbox sandbox = startedSandbox();
            provider.unit.responsive = false;

            assertFalse(sandbox.isHealthy());
        }
    }
}
