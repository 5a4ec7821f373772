package com.hookvisor.api.event.lifecycle;

import lombok.Getter;

/**
 * 崩溃事件
 * 场景：进程意外退出或通道断开
 */
@Getter
public class PluginCrashedEvent extends PluginLifecycleEvent {

    /**
     * 进程退出码，进程仍存活（仅通道断开）时为 null
     */
    private final Integer exitCode;

    public PluginCrashedEvent(String pluginId, int generation, Integer exitCode) {
        super(pluginId, generation);
        this.exitCode = exitCode;
    }
}
