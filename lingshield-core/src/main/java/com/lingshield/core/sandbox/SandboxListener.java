package com.lingshield.core.sandbox;

import com.lingshield.core.violation.SecurityViolation;

/**
 * 沙箱观察者
 * <p>
 * 在触发线程中按注册顺序同步回调；违规回调发生在处置动作（停止 / 降级）完成之后。
 */
public interface SandboxListener {

    default void onStateChanged(Sandbox sandbox, SandboxState from, SandboxState to) {
    }

    default void onViolation(Sandbox sandbox, SecurityViolation violation) {
    }
}
