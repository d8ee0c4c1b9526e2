package com.lingshield.core.audit;

/**
 * 安全事件类型
 */
public enum SecurityEventType {
    LOGIN_SUCCESS(false),
    LOGIN_FAILED(true),
    PERMISSION_DENIED(true),
    PLUGIN_INSTALL(false),
    PLUGIN_UNINSTALL(false),
    PLUGIN_ENABLE(false),
    PLUGIN_DISABLE(false),
    PLUGIN_OPERATION(false),
    RUNTIME_VIOLATION(true),
    POLICY_VIOLATION(true),
    SUSPICIOUS_ACTIVITY(true),
    DATA_ACCESS(false),
    DATA_EXFILTRATION(true),
    MALWARE_DETECTED(true),
    INTRUSION_ATTEMPT(true),
    BRUTE_FORCE_ATTACK(true),
    CONFIGURATION_CHANGE(false),
    CERTIFICATE_EVENT(false),
    COMPLIANCE_VIOLATION(true);

    private final boolean securityRelevant;

    SecurityEventType(boolean securityRelevant) {
        this.securityRelevant = securityRelevant;
    }

    /**
     * 是否参与按插件 + 类型的关联分析
     */
    public boolean isSecurityRelevant() {
        return securityRelevant;
    }
}
