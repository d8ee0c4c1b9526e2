package com.lingshield.api.exception;

/**
 * LingShield 异常基类
 * <p>
 * 所有安全管线抛出的异常均为非受检异常，调用方按需捕获。
 */
public class LingShieldException extends RuntimeException {

    public LingShieldException(String message) {
        super(message);
    }

    public LingShieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
