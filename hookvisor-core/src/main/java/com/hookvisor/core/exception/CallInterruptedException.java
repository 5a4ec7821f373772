package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;

/**
 * 等待远端响应时调用线程被中断
 */
public class CallInterruptedException extends PluginException {

    public CallInterruptedException(String method, InterruptedException cause) {
        super("Interrupted while waiting for " + method, cause);
    }
}
