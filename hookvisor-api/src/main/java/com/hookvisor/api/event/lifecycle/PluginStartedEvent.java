package com.hookvisor.api.event.lifecycle;

/**
 * 启动完成事件
 * 场景：握手完成、宿主能力已注入
 */
public class PluginStartedEvent extends PluginLifecycleEvent {
    public PluginStartedEvent(String pluginId, int generation) {
        super(pluginId, generation);
    }
}
