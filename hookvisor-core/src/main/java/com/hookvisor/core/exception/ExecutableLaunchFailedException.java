package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;

/**
 * 插件进程启动失败
 * <p>
 * 可执行文件不存在、不可执行，或进程在握手完成前退出。
 */
public class ExecutableLaunchFailedException extends PluginException {

    private final String pluginId;

    public ExecutableLaunchFailedException(String pluginId, String message, Throwable cause) {
        super("[" + pluginId + "] " + message, cause);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
