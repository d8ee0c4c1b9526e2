package com.lingshield.core.violation;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 安全违规记录（不可变）
 */
@Value
@Builder(toBuilder = true)
public class SecurityViolation {

    @NonNull
    @Builder.Default
    String id = UUID.randomUUID().toString();

    @NonNull
    ViolationType type;

    @NonNull
    Severity severity;

    @NonNull
    String description;

    String pluginId;

    String sandboxId;

    /**
     * 操作是否已被拦截
     */
    boolean blocked;

    @NonNull
    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * 产生来源：static-analysis / signature / sandbox / framework / orchestration
     */
    String source;

    @Singular("detail")
    Map<String, Object> details;

    public boolean isAtLeast(Severity other) {
        return severity.isAtLeast(other);
    }
}
