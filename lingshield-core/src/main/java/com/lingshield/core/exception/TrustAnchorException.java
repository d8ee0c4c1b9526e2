package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 信任锚注册失败
 */
public class TrustAnchorException extends LingShieldException {

    public TrustAnchorException(String message) {
        super(message);
    }

    public TrustAnchorException(String message, Throwable cause) {
        super(message, cause);
    }
}
