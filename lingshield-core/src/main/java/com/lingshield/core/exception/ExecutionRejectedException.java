package com.lingshield.core.exception;

/**
 * 执行请求在派发前被拒绝（代码过大、命中禁用原语、上下文超限、状态不允许）
 */
public class ExecutionRejectedException extends SandboxException {

    public ExecutionRejectedException(String sandboxId, String message) {
        super(sandboxId, message);
    }
}
