package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 审计数据导出失败
 */
public class AuditExportException extends LingShieldException {

    public AuditExportException(String message) {
        super(message);
    }

    public AuditExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
