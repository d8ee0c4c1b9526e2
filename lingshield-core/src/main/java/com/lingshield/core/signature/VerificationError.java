package com.lingshield.core.signature;

import lombok.Value;

/**
 * 验证错误
 */
@Value
public class VerificationError {

    public enum Level {
        /**
         * 降低信任但不单独否决
         */
        ERROR,
        /**
         * 使验证结果无效
         */
        FATAL
    }

    VerificationErrorCode code;
    String message;
    Level level;
    VerificationStep step;

    public boolean isFatal() {
        return level == Level.FATAL;
    }
}
