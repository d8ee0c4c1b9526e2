package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 静态分析超出时间预算
 */
public class AnalysisTimeoutException extends LingShieldException {

    private final long timeoutMs;

    public AnalysisTimeoutException(long timeoutMs) {
        super("Analysis exceeded time budget of " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
