package com.lingshield.core.sandbox;

import com.lingshield.core.spi.ExecutionRequest;
import com.lingshield.core.spi.ExecutionUnit;
import com.lingshield.core.spi.IsolationProvider;
import com.lingshield.core.spi.ResourceSample;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 可控的测试隔离单元
 */
class FakeIsolationProvider implements IsolationProvider {

    final FakeUnit unit = new FakeUnit();

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public ExecutionUnit create(String sandboxId, SandboxConfig config) {
        return unit;
    }

    static class FakeUnit implements ExecutionUnit {

        final List<SandboxConfig.ResourceLimits> appliedLimits = new CopyOnWriteArrayList<>();
        final AtomicReference<ResourceSample> nextSample = new AtomicReference<>(ResourceSample.EMPTY);
        final List<ExecutionRequest> requests = new CopyOnWriteArrayList<>();

        volatile Function<ExecutionRequest, CompletableFuture<Object>> handler =
                request -> CompletableFuture.completedFuture("ok");
        volatile boolean failLaunch;
        volatile boolean exitsGracefully = true;
        volatile boolean responsive = true;

        volatile SandboxConfig.NetworkConfig network;
        volatile Path workspace;
        volatile SandboxConfig.FilesystemConfig filesystem;
        volatile boolean launched;
        volatile boolean terminated;
        volatile boolean killed;

        @Override
        public void applyLimits(SandboxConfig.ResourceLimits limits) {
            appliedLimits.add(limits);
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
            if (failLaunch) {
                throw new IllegalStateException("launcher unavailable");
            }
            launched = true;
        }

        @Override
        public CompletableFuture<Object> dispatch(ExecutionRequest request) {
            requests.add(request);
            return handler.apply(request);
        }

        @Override
        public ResourceSample sample() {
            return nextSample.get();
        }

        @Override
        public boolean isResponsive() {
            return responsive && launched && !killed;
        }

        @Override
        public void terminate() {
            terminated = true;
        }

        @Override
        public boolean awaitTermination(long timeoutMs) {
            return exitsGracefully;
        }

        @Override
        public void kill() {
            killed = true;
        }
    }
}
