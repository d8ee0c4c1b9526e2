package com.lingshield.core.signature;

public enum VerificationWarningCode {
    CERTIFICATE_EXPIRING_SOON,
    WEAK_ALGORITHM,
    SELF_SIGNED_CERTIFICATE,
    EXCESSIVE_PERMISSIONS,
    UNKNOWN_ISSUER,
    LONG_CERTIFICATE_CHAIN
}
