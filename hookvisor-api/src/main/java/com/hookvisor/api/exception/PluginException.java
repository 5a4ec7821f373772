package com.hookvisor.api.exception;

/**
 * HookVisor 异常基类
 * <p>
 * 所有框架异常均为非受检异常，由调用方按需捕获。
 */
public class PluginException extends RuntimeException {

    public PluginException(String message) {
        super(message);
    }

    public PluginException(String message, Throwable cause) {
        super(message, cause);
    }
}
