package com.lingshield.core.analysis;

/**
 * 产生发现的检测阶段
 */
public enum AnalysisPass {
    PATTERN,
    CONFIGURATION,
    STRUCTURAL,
    DATA_FLOW,
    TAINT_PROPAGATION
}
