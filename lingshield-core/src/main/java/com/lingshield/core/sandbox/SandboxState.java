package com.lingshield.core.sandbox;

import java.util.EnumSet;
import java.util.Set;

/**
 * 沙箱状态
 * <p>
 * CREATED → STARTING → ACTIVE ⇄ THROTTLED → STOPPING → TERMINATED
 */
public enum SandboxState {
    CREATED, // 已创建
    STARTING, // 启动中
    ACTIVE, // 运行中
    THROTTLED, // 降级运行
    STOPPING, // 停止中
    TERMINATED; // 已终止

    public Set<SandboxState> next() {
        switch (this) {
            case CREATED:
                return EnumSet.of(STARTING, TERMINATED);
            case STARTING:
                return EnumSet.of(ACTIVE, STOPPING);
            case ACTIVE:
                return EnumSet.of(THROTTLED, STOPPING);
            case THROTTLED:
                return EnumSet.of(ACTIVE, STOPPING);
            case STOPPING:
                return EnumSet.of(TERMINATED);
            default:
                return EnumSet.noneOf(SandboxState.class);
        }
    }

    public boolean canTransitionTo(SandboxState target) {
        return next().contains(target);
    }

    /**
     * 是否可以接收执行请求
     */
    public boolean isRunning() {
        return this == ACTIVE || this == THROTTLED;
    }
}
