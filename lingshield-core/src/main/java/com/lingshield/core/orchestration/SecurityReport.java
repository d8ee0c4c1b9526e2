package com.lingshield.core.orchestration;

import com.lingshield.core.audit.ReportPeriod;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 安全报告
 * <p>
 * sections 的内容随报告类型变化，键名见 {@link SecurityReportGenerator}。
 */
@Value
@Builder
public class SecurityReport {

    String id;

    ReportType type;

    ReportPeriod period;

    Instant generatedAt;

    Summary summary;

    @Singular
    Map<String, Object> sections;

    @Value
    @Builder
    public static class Summary {
        /**
         * 0..100
         */
        int overallScore;
        RiskTrend riskTrend;
        @Singular
        List<String> keyFindings;
        @Singular
        List<String> criticalIssues;
    }
}
