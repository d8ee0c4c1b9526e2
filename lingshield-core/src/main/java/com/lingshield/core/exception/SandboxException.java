package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 沙箱异常基类
 */
public class SandboxException extends LingShieldException {

    private final String sandboxId;

    public SandboxException(String sandboxId, String message) {
        super(message);
        this.sandboxId = sandboxId;
    }

    public SandboxException(String sandboxId, String message, Throwable cause) {
        super(message, cause);
        this.sandboxId = sandboxId;
    }

    public String getSandboxId() {
        return sandboxId;
    }
}
