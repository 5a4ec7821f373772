package com.hookvisor.api.event.lifecycle;

/**
 * 崩溃后重启成功事件
 */
public class PluginRelaunchedEvent extends PluginLifecycleEvent {
    public PluginRelaunchedEvent(String pluginId, int generation) {
        super(pluginId, generation);
    }
}
