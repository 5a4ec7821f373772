package com.hookvisor.api.exception;

/**
 * 无效参数异常
 * 当传入的参数不满足要求时抛出此异常。
 */
public class InvalidArgumentException extends PluginException {

    private final String paramName;

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
    }

    public String getParamName() {
        return paramName;
    }
}
