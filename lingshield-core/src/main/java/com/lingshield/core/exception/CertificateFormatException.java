package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 证书或密钥编码无法解析
 */
public class CertificateFormatException extends LingShieldException {

    public CertificateFormatException(String message) {
        super(message);
    }

    public CertificateFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
