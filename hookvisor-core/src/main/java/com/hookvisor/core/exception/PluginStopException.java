package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;

/**
 * 停止异常
 * <p>
 * 宽限期和强杀之后仍无法确认进程退出。宿主侧资源此时已经释放。
 */
public class PluginStopException extends PluginException {

    private final String pluginId;
    private final long pid;

    public PluginStopException(String pluginId, long pid) {
        super("[" + pluginId + "] Could not confirm exit of plugin process " + pid);
        this.pluginId = pluginId;
        this.pid = pid;
    }

    public String getPluginId() {
        return pluginId;
    }

    public long getPid() {
        return pid;
    }
}
