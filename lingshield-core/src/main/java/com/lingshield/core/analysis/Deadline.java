package com.lingshield.core.analysis;

import com.lingshield.core.exception.AnalysisTimeoutException;

/**
 * 分析时间预算，各阶段在文件/方法粒度上检查
 */
public final class Deadline {

    private final long timeoutMs;
    private final long deadlineNanos;

    private Deadline(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        this.deadlineNanos = System.nanoTime() + timeoutMs * 1_000_000L;
    }

    public static Deadline after(long timeoutMs) {
        return new Deadline(timeoutMs);
    }

    public void check() {
        if (System.nanoTime() - deadlineNanos >= 0) {
            throw new AnalysisTimeoutException(timeoutMs);
        }
    }
}
