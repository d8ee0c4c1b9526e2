package com.lingshield.core.analysis;

import com.lingshield.core.config.LingShieldConfig;
import lombok.Builder;
import lombok.Value;

/**
 * 单次分析参数
 */
@Value
@Builder(toBuilder = true)
public class AnalysisOptions {

    @Builder.Default
    boolean includeTests = false;

    @Builder.Default
    int maxDepth = 10;

    @Builder.Default
    long timeoutMs = 300_000;

    @Builder.Default
    long maxFileSizeBytes = 10L * 1024 * 1024;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }

    public static AnalysisOptions from(LingShieldConfig.StaticAnalysis config) {
        return AnalysisOptions.builder()
                .includeTests(config.isIncludeTests())
                .maxDepth(config.getMaxDepth())
                .timeoutMs(config.getTimeoutMs())
                .maxFileSizeBytes(config.getMaxFileSizeBytes())
                .build();
    }
}
