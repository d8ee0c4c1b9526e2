package com.lingshield.core.spi;

import java.util.Map;

/**
 * 发往隔离单元的执行请求
 */
public record ExecutionRequest(String correlationId, String code, Map<String, Object> context, long timeoutMs) {

    public ExecutionRequest {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
