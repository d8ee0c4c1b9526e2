package com.lingshield.core.violation;

/**
 * 违规类型
 */
public enum ViolationType {
    RESOURCE_EXHAUSTION,
    NETWORK_VIOLATION,
    FILESYSTEM_VIOLATION,
    CODE_INJECTION,
    PERMISSION_DENIED,
    PRIVILEGE_ESCALATION,
    DATA_EXFILTRATION,
    MALICIOUS_BEHAVIOR,
    ATTACK_SIGNATURE,
    POLICY_VIOLATION,
    /**
     * 静态分析发现的漏洞
     */
    STATIC_ANALYSIS,
    SIGNATURE_VERIFICATION,
    VULNERABLE_DEPENDENCY,
    /**
     * 管线内部故障转换而来
     */
    INTERNAL_ERROR
}
