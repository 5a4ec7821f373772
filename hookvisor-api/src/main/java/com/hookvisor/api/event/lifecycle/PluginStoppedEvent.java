package com.hookvisor.api.event.lifecycle;

/**
 * 停止完成事件
 * 场景：资源回收、监控上报
 */
public class PluginStoppedEvent extends PluginLifecycleEvent {
    public PluginStoppedEvent(String pluginId, int generation) {
        super(pluginId, generation);
    }
}
