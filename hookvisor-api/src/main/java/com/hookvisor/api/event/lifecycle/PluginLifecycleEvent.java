package com.hookvisor.api.event.lifecycle;

import com.hookvisor.api.event.AbstractPluginEvent;
import lombok.Getter;

/**
 * 插件生命周期事件基类
 * <p>
 * generation 为进程代数：首次启动为 1，每次崩溃重启成功后加 1。
 */
@Getter
public abstract class PluginLifecycleEvent extends AbstractPluginEvent {
    private final String pluginId;
    private final int generation;

    public PluginLifecycleEvent(String pluginId, int generation) {
        super();
        this.pluginId = pluginId;
        this.generation = generation;
    }

    @Override
    public String toString() {
        return super.toString() + " source=" + pluginId + "#" + generation;
    }
}
