package com.lingshield.api.security;

/**
 * 严重级别
 * <p>
 * 级别：INFO(0) < LOW(1) < MEDIUM(2) < HIGH(3) < CRITICAL(4)
 * </p>
 * 分析发现、沙箱违规、审计事件与事件单共用该等级。
 */
public enum Severity {

    INFO(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAtLeast(Severity other) {
        return this.level >= other.level;
    }

    /**
     * 是否为阻断级别（HIGH 及以上）
     */
    public boolean isBlocking() {
        return isAtLeast(HIGH);
    }

    public Severity max(Severity other) {
        return this.level >= other.level ? this : other;
    }
}
