package com.lingshield.core.spi;

import com.lingshield.core.sandbox.SandboxConfig;

/**
 * 隔离能力提供者 SPI
 */
public interface IsolationProvider {

    /**
     * 提供者名称，对应配置 runtimeProtection.isolation
     */
    String name();

    /**
     * 创建执行单元
     *
     * @param sandboxId 沙箱ID
     * @param config    沙箱配置
     * @return 尚未启动的执行单元
     */
    ExecutionUnit create(String sandboxId, SandboxConfig config);
}
