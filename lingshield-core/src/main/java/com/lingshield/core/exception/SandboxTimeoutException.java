package com.lingshield.core.exception;

/**
 * 沙箱内执行超时
 */
public class SandboxTimeoutException extends SandboxException {

    private final long timeoutMs;

    public SandboxTimeoutException(String sandboxId, long timeoutMs) {
        super(sandboxId, "Execution timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
