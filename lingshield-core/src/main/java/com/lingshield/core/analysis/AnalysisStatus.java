package com.lingshield.core.analysis;

public enum AnalysisStatus {
    COMPLETED,
    /**
     * 超出时间预算，结果整体作废
     */
    TIMEOUT,
    FAILED
}
