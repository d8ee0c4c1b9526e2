package com.lingshield.core.audit;

import com.lingshield.api.context.SecurityContext;
import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * 安全事件（不可变，只追加）
 * <p>
 * id、timestamp 与 sequence 由 {@link AuditSystem#recordEvent} 填充；
 * 事件解决后以新实例替换原记录。
 */
@Value
@Builder(toBuilder = true)
public class SecurityEvent {

    String id;

    Instant timestamp;

    /**
     * 进程内全局顺序号
     */
    long sequence;

    @NonNull
    @Builder.Default
    SecurityEventType type = SecurityEventType.SUSPICIOUS_ACTIVITY;

    @NonNull
    @Builder.Default
    Severity severity = Severity.MEDIUM;

    @NonNull
    @Builder.Default
    EventSource source = EventSource.UNKNOWN;

    String pluginId;
    String sandboxId;
    String userId;
    String sessionId;
    String requestId;

    @NonNull
    @Builder.Default
    String ipAddress = "0.0.0.0";

    String userAgent;

    @NonNull
    @Builder.Default
    String description = "";

    @Singular("detail")
    Map<String, Object> details;

    @Singular
    Set<String> tags;

    String correlationId;

    boolean resolved;
    Instant resolvedAt;
    String resolvedBy;
    String mitigation;

    public static class SecurityEventBuilder {

        /**
         * 透传接入层上下文
         */
        public SecurityEventBuilder context(SecurityContext context) {
            if (context == null) {
                return this;
            }
            requestId(context.getRequestId());
            userId(context.getUserId());
            ipAddress(context.getSourceIp());
            userAgent(context.getUserAgent());
            return this;
        }
    }
}
