package com.lingshield.core.signature;

public enum VerificationErrorCode {
    SIGNATURE_INVALID,
    CERTIFICATE_EXPIRED,
    CERTIFICATE_REVOKED,
    CHAIN_INCOMPLETE,
    TRUST_ANCHOR_NOT_FOUND,
    ALGORITHM_NOT_SUPPORTED,
    HASH_MISMATCH,
    MANIFEST_INVALID,
    PERMISSION_MISMATCH,
    TIME_VALIDATION_FAILED
}
