package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 签名或证书签发失败
 */
public class SigningException extends LingShieldException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
