package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;

import java.time.Duration;

/**
 * 握手超时
 * <p>
 * 抛出前已强制杀死本次创建的进程。
 */
public class StartTimeoutException extends PluginException {

    private final String pluginId;
    private final Duration timeout;

    public StartTimeoutException(String pluginId, Duration timeout) {
        super("[" + pluginId + "] Plugin did not complete handshake within " + timeout.toMillis() + "ms");
        this.pluginId = pluginId;
        this.timeout = timeout;
    }

    public String getPluginId() {
        return pluginId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
