package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 安全策略异常：策略不存在、插件未获准运行等
 */
public class SecurityPolicyException extends LingShieldException {

    private final String policyId;

    public SecurityPolicyException(String policyId, String message) {
        super(message);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
