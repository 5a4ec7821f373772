package com.hookvisor.api.event;

/**
 * 框架事件标记接口
 */
public interface PluginEvent {

    /**
     * 事件发生时间（毫秒）
     */
    long getTimestamp();
}
