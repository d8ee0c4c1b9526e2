package com.lingshield.core.framework;

import com.lingshield.core.audit.SecurityEvent;

import java.util.Optional;

/**
 * 违规处置结果
 *
 * @param event      写入审计的事件
 * @param contained  是否已停止相关沙箱
 * @param incidentId 关联的事件单，可能为空
 */
public record ViolationResponse(SecurityEvent event, boolean contained, String incidentId) {

    public Optional<String> incident() {
        return Optional.ofNullable(incidentId);
    }
}
