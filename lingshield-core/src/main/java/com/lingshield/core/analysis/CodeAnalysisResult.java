package com.lingshield.core.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 静态分析结果
 */
@Value
@Builder
public class CodeAnalysisResult {

    AnalysisStatus status;

    /**
     * 无 CRITICAL / HIGH 发现
     */
    boolean safe;

    /**
     * 0..100
     */
    int score;

    /**
     * 已去重，CRITICAL 在前
     */
    @Singular
    List<SecurityVulnerability> vulnerabilities;

    QualityMetrics qualityMetrics;

    @Singular
    List<SecurityRecommendation> recommendations;

    /**
     * 内容寻址签名，用于变更检测
     */
    String signature;

    int filesAnalyzed;

    int filesSkipped;

    long durationMs;

    /**
     * 失败原因，仅 TIMEOUT / FAILED 时有值
     */
    String error;

    public boolean isCompleted() {
        return status == AnalysisStatus.COMPLETED;
    }

    public static CodeAnalysisResult failed(AnalysisStatus status, String error, long durationMs) {
        return CodeAnalysisResult.builder()
                .status(status)
                .safe(false)
                .score(0)
                .qualityMetrics(QualityMetrics.EMPTY)
                .error(error)
                .durationMs(durationMs)
                .build();
    }
}
