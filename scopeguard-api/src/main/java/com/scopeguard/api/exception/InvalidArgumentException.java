package com.scopeguard.api.exception;

/**
 * 无效参数异常
 * 当传入的参数不满足构造要求时抛出此异常，例如权限的 resource/action 为空。
 */
public class InvalidArgumentException extends ScopeGuardException {

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
}
