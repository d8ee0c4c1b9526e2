package com.lingshield.core.sandbox;

import com.lingshield.core.spi.ExecutionRequest;
import com.lingshield.core.spi.ExecutionUnit;
import com.lingshield.core.spi.IsolationProvider;
import com.lingshield.core.spi.ResourceSample;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 进程内隔离：每个沙箱一个专用守护线程
 * <p>
 * 资源采样基于 JMX 线程 CPU 时间与线程分配字节数；
 * 进程内无法统计常驻内存，memoryBytes 取采样周期内的分配量。
 */
@Slf4j
public class InProcessIsolationProvider implements IsolationProvider {

    public static final String NAME = "in-process";

    private final CodeEvaluator evaluator;

    public InProcessIsolationProvider() {
        this(CodeEvaluator.UNSUPPORTED);
    }

    public InProcessIsolationProvider(CodeEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionUnit create(String sandboxId, SandboxConfig config) {
        return new InProcessUnit(sandboxId, evaluator);
    }

    static class InProcessUnit implements ExecutionUnit {

        private final String sandboxId;
        private final CodeEvaluator evaluator;

        private volatile SandboxConfig.ResourceLimits limits;
        private volatile SandboxConfig.NetworkConfig network;
        private volatile SandboxConfig.FilesystemConfig filesystem;
        private volatile Path workspace;

        private volatile ExecutorService worker;
        private volatile Thread workerThread;

        // 采样基线
        private long lastCpuNanos;
        private long lastAllocatedBytes;
        private long lastWallNanos;

        InProcessUnit(String sandboxId, CodeEvaluator evaluator) {
            this.sandboxId = sandboxId;
            this.evaluator = evaluator;
        }

        @Override
        public void applyLimits(SandboxConfig.ResourceLimits limits) {
            this.limits = limits;
        }

        @Override
        public void applyNetworkRules(SandboxConfig.NetworkConfig network) {
            this.network = network;
        }

        @Override
        public void mountFilesystem(Path workspace, SandboxConfig.FilesystemConfig filesystem) {
            this.workspace = workspace;
            this.filesystem = filesystem;
        }

        @Override
        public void launch() {
            this.worker = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "lingshield-sandbox-" + sandboxId);
                t.setDaemon(true);
                workerThread = t;
                return t;
            });
            this.lastWallNanos = System.nanoTime();
            log.debug("[{}] In-process execution unit launched", sandboxId);
        }

        @Override
        public CompletableFuture<Object> dispatch(ExecutionRequest request) {
            CompletableFuture<Object> result = new CompletableFuture<>();
            CodeEvaluator.EvaluationScope scope =
                    new CodeEvaluator.EvaluationScope(sandboxId, workspace, limits, network, filesystem);
            Future<?> task = worker.submit(() -> {
                try {
                    result.complete(evaluator.evaluate(request.code(), request.context(), scope));
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
            // 调用方取消（超时 / 停止）时中断工作线程
            result.whenComplete((value, error) -> {
                if (result.isCancelled() || result.isCompletedExceptionally()) {
                    task.cancel(true);
                }
            });
            return result;
        }

        @Override
        public synchronized ResourceSample sample() {
            Thread t = workerThread;
            if (t == null) {
                return ResourceSample.EMPTY;
            }
            ThreadMXBean mx = ManagementFactory.getThreadMXBean();
            long cpuNanos = mx.isThreadCpuTimeSupported() ? Math.max(0, mx.getThreadCpuTime(t.getId())) : 0;
            long allocated = 0;
            if (mx instanceof com.sun.management.ThreadMXBean) {
                allocated = Math.max(0, ((com.sun.management.ThreadMXBean) mx).getThreadAllocatedBytes(t.getId()));
            }
            long now = System.nanoTime();
            long wallDelta = now - lastWallNanos;
            long cpuDelta = Math.max(0, cpuNanos - lastCpuNanos);
            long allocatedDelta = Math.max(0, allocated - lastAllocatedBytes);
            lastWallNanos = now;
            lastCpuNanos = cpuNanos;
            lastAllocatedBytes = allocated;

            double cores = limits == null || limits.getCpuCores() <= 0 ? 1.0 : limits.getCpuCores();
            double cpuPercent = wallDelta <= 0 ? 0 : Math.min(100.0, cpuDelta * 100.0 / wallDelta / cores);
            return new ResourceSample(cpuPercent, allocatedDelta, TimeUnit.NANOSECONDS.toMillis(cpuDelta),
                    0, 0, 0, 0, 0, 1);
        }

        @Override
        public boolean isResponsive() {
            ExecutorService w = worker;
            Thread t = workerThread;
            return w != null && !w.isShutdown() && (t == null || t.isAlive());
        }

        @Override
        public void terminate() {
            if (worker != null) {
                worker.shutdown();
            }
        }

        @Override
        public boolean awaitTermination(long timeoutMs) throws InterruptedException {
            return worker == null || worker.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        }

        @Override
        public void kill() {
            if (worker != null) {
                worker.shutdownNow();
                log.warn("[{}] In-process execution unit killed", sandboxId);
            }
        }
    }
}
