package com.lingshield.core.signature;

/**
 * 验证状态机的步骤，按声明顺序执行；出现 FATAL 错误后跳过剩余步骤
 */
public enum VerificationStep {
    LOAD_MANIFEST,
    CHECK_SIGNATURE,
    PARSE_CERT,
    BUILD_CHAIN,
    CHECK_TIME_VALIDITY,
    CHECK_REVOCATION,
    VALIDATE_TRUST,
    VERIFY_CONTENT_HASH,
    VALIDATE_PERMISSIONS,
    WARNINGS,
    DONE
}
