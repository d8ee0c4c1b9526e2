package com.lingshield.core.spi;

import com.lingshield.core.sandbox.SandboxConfig;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * 隔离执行单元
 * <p>
 * 由 {@link IsolationProvider} 创建，沙箱按以下顺序驱动：
 * applyLimits → applyNetworkRules → mountFilesystem → launch，
 * 之后可多次 dispatch / sample，最后 terminate → awaitTermination → kill。
 */
public interface ExecutionUnit {

    /**
     * 应用资源限额，启动后再次调用表示调整（降级 / 恢复）
     */
    void applyLimits(SandboxConfig.ResourceLimits limits);

    void applyNetworkRules(SandboxConfig.NetworkConfig network);

    /**
     * 挂载受限文件视图：系统路径只读，工作目录可写
     */
    void mountFilesystem(Path workspace, SandboxConfig.FilesystemConfig filesystem);

    void launch();

    /**
     * 异步执行，结果或异常通过 future 返回
     */
    CompletableFuture<Object> dispatch(ExecutionRequest request);

    ResourceSample sample();

    boolean isResponsive();

    /**
     * 发送优雅终止信号
     */
    void terminate();

    /**
     * @return 在期限内退出返回 true
     */
    boolean awaitTermination(long timeoutMs) throws InterruptedException;

    /**
     * 强制终止
     */
    void kill();
}
