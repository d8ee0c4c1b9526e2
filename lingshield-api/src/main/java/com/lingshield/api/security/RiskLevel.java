package com.lingshield.api.security;

/**
 * 插件风险级别
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(RiskLevel other) {
        return this.ordinal() >= other.ordinal();
    }
}
