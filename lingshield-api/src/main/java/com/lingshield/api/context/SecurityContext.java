package com.lingshield.api.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * 安全上下文
 * <p>
 * 由接入层（HTTP / 管理端）构造，原样写入每一条审计记录。
 */
@Value
@Builder(toBuilder = true)
public class SecurityContext {

    @NonNull
    String requestId;

    String userId;

    @NonNull
    @Builder.Default
    Instant timestamp = Instant.now();

    @NonNull
    @Builder.Default
    String sourceIp = "0.0.0.0";

    String userAgent;

    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> userAgent() {
        return Optional.ofNullable(userAgent);
    }

    /**
     * 系统内部发起的操作（定时检测、自动响应）使用的上下文
     */
    public static SecurityContext system() {
        return SecurityContext.builder()
                .requestId("system-" + UUID.randomUUID())
                .userId("system")
                .sourceIp("127.0.0.1")
                .userAgent("lingshield")
                .build();
    }
}
