package com.lingshield.core.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * 代码质量指标
 */
@Value
@Builder
public class QualityMetrics {

    public static final QualityMetrics EMPTY = QualityMetrics.builder().build();

    int files;
    int linesOfCode;
    int commentLines;
    int classes;
    int methods;
    /**
     * 全部方法圈复杂度之和
     */
    int cyclomaticComplexity;
    int maxMethodComplexity;
    int maxNestingDepth;

    public double commentRatio() {
        int total = linesOfCode + commentLines;
        return total == 0 ? 0.0 : (double) commentLines / total;
    }
}
