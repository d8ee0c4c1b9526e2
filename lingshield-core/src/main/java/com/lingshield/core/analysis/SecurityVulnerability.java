package com.lingshield.core.analysis;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 静态分析发现的漏洞（不可变，归属于产生它的那次分析）
 */
@Value
@Builder
public class SecurityVulnerability {

    @NonNull
    VulnerabilityType type;

    @NonNull
    Severity severity;

    @NonNull
    String title;

    String description;

    @NonNull
    SourceLocation location;

    /**
     * 命中的代码片段或调用签名
     */
    String evidence;

    String remediation;

    @NonNull
    AnalysisPass pass;

    /**
     * 去重键：同一文件同一行同一类型只保留一条
     */
    public String dedupKey() {
        return location.file() + ":" + location.line() + ":" + type;
    }
}
