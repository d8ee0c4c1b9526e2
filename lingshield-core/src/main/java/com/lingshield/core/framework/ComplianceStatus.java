package com.lingshield.core.framework;

/**
 * 策略合规状态
 */
public enum ComplianceStatus {
    COMPLIANT, // 得分 >= 95
    REQUIRES_ATTENTION, // 得分 >= 80
    NON_COMPLIANT;

    public static ComplianceStatus of(int score) {
        if (score >= 95) {
            return COMPLIANT;
        }
        return score >= 80 ? REQUIRES_ATTENTION : NON_COMPLIANT;
    }
}
