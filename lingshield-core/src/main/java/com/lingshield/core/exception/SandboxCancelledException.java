package com.lingshield.core.exception;

/**
 * 沙箱停止时，尚未完成的执行请求以该异常结束
 */
public class SandboxCancelledException extends SandboxException {

    public SandboxCancelledException(String sandboxId, String correlationId) {
        super(sandboxId, "Execution " + correlationId + " cancelled: sandbox stopped");
    }
}
