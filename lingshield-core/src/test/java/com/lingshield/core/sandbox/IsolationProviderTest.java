package com.lingshield.core.sandbox;

import com.lingshield.core.exception.SandboxException;
import com.lingshield.core.exception.SandboxTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("隔离提供者测试")
class IsolationProviderTest {

    @TempDir
    Path tempDir;

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private SandboxConfig config() {
        return SandboxConfig.builder()
                .pluginId("demo-plugin")
                .workspaceRoot(tempDir)
                .gracePeriodMs(2000)
                .monitoring(SandboxConfig.MonitoringConfig.builder().enabled(false).build())
                .build();
    }

    @Nested
    @DisplayName("进程内隔离")
    class InProcessTests {

        @Test
        @DisplayName("求值器看到上下文与工作目录")
        void shouldEvaluateWithScope() {
            InProcessIsolationProvider provider = new InProcessIsolationProvider(
                    (code, context, scope) -> code + ":" + context.get("name") + ":" + Files.isDirectory(scope.workspace()));
            Sandbox sandbox = new Sandbox(config(), provider, scheduler);
            sandbox.start();

            Object result = sandbox.execute("greet", Map.of("name", "bob"), 2000);

            assertEquals("greet:bob:true", result);
            sandbox.collectMetrics();
            assertEquals(1, sandbox.getMetrics().getSamples());
            sandbox.stop();
        }

        @Test
        @DisplayName("长时间运行的求值被超时中断")
        void shouldTimeoutLongEvaluation() {
            InProcessIsolationProvider provider = new InProcessIsolationProvider((code, context, scope) -> {
                Thread.sleep(10_000);
                return null;
            });
            Sandbox sandbox = new Sandbox(config(), provider, scheduler);
            sandbox.start();

            assertThrows(SandboxTimeoutException.class, () -> sandbox.execute("sleep", Map.of(), 100));
            sandbox.stop();
            assertEquals(SandboxState.TERMINATED, sandbox.getState());
        }

        @Test
        @DisplayName("未配置求值器时执行失败")
        void shouldFailWithoutEvaluator() {
            Sandbox sandbox = new Sandbox(config(), new InProcessIsolationProvider(), scheduler);
            sandbox.start();

            SandboxException e = assertThrows(SandboxException.class, () -> sandbox.execute("1", Map.of(), 1000));
            assertInstanceOf(UnsupportedOperationException.class, e.getCause());
            sandbox.stop();
        }
    }

    @Nested
    @DisplayName("进程隔离")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class ProcessTests {

        private static final String ECHO_LAUNCHER =
                "while IFS= read -r line; do "
                        + "id=$(printf '%s' \"$line\" | sed -n 's/.*\"requestId\":\"\\([^\"]*\\)\".*/\\1/p'); "
                        + "if [ -n \"$id\" ]; then printf '{\"requestId\":\"%s\",\"success\":true,\"result\":\"pong\"}\\n' \"$id\"; fi; "
                        + "done";

        @Test
        @DisplayName("通过 JSON Lines 与子进程交换请求")
        void shouldRoundTripThroughProcess() {
            ProcessIsolationProvider provider = new ProcessIsolationProvider(List.of("sh", "-c", ECHO_LAUNCHER));
            Sandbox sandbox = new Sandbox(config(), provider, scheduler);
            sandbox.start();
            Path workspace = sandbox.getWorkspace().orElseThrow();

            assertTrue(Files.exists(workspace.resolve(ProcessIsolationProvider.CONFIG_FILE)));
            assertEquals("pong", sandbox.execute("ping()", Map.of("n", 1), 5000));
            assertTrue(sandbox.isHealthy());

            sandbox.stop();
            assertFalse(Files.exists(workspace));
        }

        @Test
        @DisplayName("命令模板替换占位符")
        void shouldResolvePlaceholders() {
            ProcessIsolationProvider.ProcessUnit unit = new ProcessIsolationProvider.ProcessUnit(
                    "sbx-1", "demo-plugin", List.of("launcher", "--mem=${memoryLimitBytes}", "--id=${sandboxId}"));
            unit.applyLimits(SandboxConfig.ResourceLimits.builder().memoryBytes(1024).build());
            unit.mountFilesystem(tempDir, SandboxConfig.FilesystemConfig.defaults());

            List<String> command = unit.resolveCommand(tempDir.resolve("sandbox.json"));

            assertEquals(List.of("launcher", "--mem=1024", "--id=sbx-1"), command);
        }
    }
}
