package com.lingshield.api.exception;

/**
 * 无效参数异常
 * 当传入的参数不满足业务要求时抛出此异常。
 */
public class InvalidArgumentException extends LingShieldException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, Object invalidValue, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }

    /**
     * 参数非空校验
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new InvalidArgumentException(paramName, paramName + " must not be null");
        }
        return value;
    }

    /**
     * 字符串非空白校验
     */
    public static String requireText(String value, String paramName) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(paramName, value, paramName + " must not be blank");
        }
        return value;
    }
}
