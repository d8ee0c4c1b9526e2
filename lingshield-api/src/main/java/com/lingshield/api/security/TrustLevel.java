package com.lingshield.api.security;

/**
 * 信任级别
 * <p>
 * 由证书链终止处的信任锚决定：UNTRUSTED < LOW < MEDIUM < HIGH < ENTERPRISE < SYSTEM
 * </p>
 */
public enum TrustLevel {

    /**
     * 无可匹配的信任锚
     */
    UNTRUSTED(0),

    LOW(1),

    MEDIUM(2),

    HIGH(3),

    /**
     * 企业内部 CA 签发
     */
    ENTERPRISE(4),

    /**
     * 平台自身组件
     */
    SYSTEM(5);

    private final int level;

    TrustLevel(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAtLeast(TrustLevel other) {
        return this.level >= other.level;
    }

    public TrustLevel min(TrustLevel other) {
        return this.level <= other.level ? this : other;
    }
}
