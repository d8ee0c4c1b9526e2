package com.lingshield.core.event;

import com.lingshield.api.event.ShieldEvent;
import com.lingshield.api.security.RiskLevel;
import com.lingshield.api.security.Severity;
import com.lingshield.core.audit.IncidentStatus;
import com.lingshield.core.sandbox.SandboxState;
import com.lingshield.core.violation.SecurityViolation;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * 安全通知事件集合
 */
public class ShieldEvents {

    @Getter
    public abstract static class BaseEvent implements ShieldEvent {
        private final Instant occurredAt = Instant.now();

        @Override
        public Instant occurredAt() {
            return occurredAt;
        }
    }

    /**
     * 检测到违规（沙箱或运行时策略）
     */
    @Getter
    @RequiredArgsConstructor
    public static class ViolationDetected extends BaseEvent {
        private final String pluginId;
        private final String sandboxId; // 可能为空：安装阶段的违规没有沙箱
        private final SecurityViolation violation;
    }

    @Getter
    @RequiredArgsConstructor
    public static class SandboxStateChanged extends BaseEvent {
        private final String sandboxId;
        private final String pluginId;
        private final SandboxState from;
        private final SandboxState to;
    }

    @Getter
    @RequiredArgsConstructor
    public static class IncidentOpened extends BaseEvent {
        private final String incidentId;
        private final String title;
        private final Severity severity;
    }

    @Getter
    @RequiredArgsConstructor
    public static class IncidentEscalated extends BaseEvent {
        private final String incidentId;
        private final String assignee;
        private final Severity severity;
    }

    @Getter
    @RequiredArgsConstructor
    public static class IncidentStatusChanged extends BaseEvent {
        private final String incidentId;
        private final IncidentStatus from;
        private final IncidentStatus to;
        private final String actor;
    }

    /**
     * 安装裁决结果，供管理端推送
     */
    @Getter
    @RequiredArgsConstructor
    public static class InstallationDecided extends BaseEvent {
        private final String pluginId;
        private final boolean allowed;
        private final RiskLevel riskLevel;
    }
}
