package com.lingshield.core.audit;

/**
 * 威胁情报指标类型
 */
public enum IndicatorType {
    IP_ADDRESS,
    DOMAIN,
    FILE_HASH,
    USER_AGENT,
    CERTIFICATE_FINGERPRINT
}
