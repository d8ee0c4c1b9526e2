package com.lingshield.core.analysis;

/**
 * 漏洞分类
 */
public enum VulnerabilityType {
    SQL_INJECTION(true),
    COMMAND_INJECTION(true),
    CODE_INJECTION(true),
    PATH_TRAVERSAL(true),
    HARD_CODED_SECRET(false),
    WEAK_CRYPTOGRAPHY(false),
    UNSAFE_DESERIALIZATION(false),
    INSECURE_CONFIGURATION(false),
    INSECURE_RANDOM(false),
    PRIVILEGE_ESCALATION(false),
    DYNAMIC_CODE_LOADING(false),
    NATIVE_CODE(false),
    DENIAL_OF_SERVICE(false);

    private final boolean injection;

    VulnerabilityType(boolean injection) {
        this.injection = injection;
    }

    /**
     * 是否属于注入类（外部输入进入敏感操作）
     */
    public boolean isInjection() {
        return injection;
    }
}
