package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;
import com.hookvisor.core.enums.SupervisorState;

/**
 * 插件尚未启动或已停止
 */
public class PluginNotRunningException extends PluginException {

    private final String pluginId;
    private final SupervisorState state;

    public PluginNotRunningException(String pluginId, SupervisorState state) {
        super("Plugin " + pluginId + " is not running (state=" + state + ")");
        this.pluginId = pluginId;
        this.state = state;
    }

    public String getPluginId() {
        return pluginId;
    }

    public SupervisorState getState() {
        return state;
    }
}
