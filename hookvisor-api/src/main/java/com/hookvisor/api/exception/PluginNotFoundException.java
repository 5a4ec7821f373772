package com.hookvisor.api.exception;

/**
 * 插件未找到异常
 */
public class PluginNotFoundException extends PluginException {

    private final String pluginId;

    public PluginNotFoundException(String pluginId) {
        super("Plugin not found: " + pluginId);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
