package com.lingshield.core.analysis;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 面向插件作者的整改建议
 */
@Value
@Builder
public class SecurityRecommendation {
    String category;
    Severity priority;
    String title;
    String description;
    @Singular
    List<String> actions;
}
