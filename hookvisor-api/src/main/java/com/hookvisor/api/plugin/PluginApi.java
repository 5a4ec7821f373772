package com.hookvisor.api.plugin;

import com.hookvisor.api.model.Command;
import com.hookvisor.api.model.LogLevel;

import java.util.Map;

/**
 * 宿主能力接口
 * <p>
 * 宿主在插件激活时注入。插件进程内拿到的是远程代理，调用会回到宿主执行；
 * 宿主实现抛出的异常在插件侧表现为 {@link com.hookvisor.api.exception.HookInvocationException}。
 */
public interface PluginApi {

    /**
     * 读取宿主为该插件保存的配置
     */
    Map<String, Object> getPluginConfiguration();

    void registerCommand(Command command);

    void unregisterCommand(String teamId, String trigger);

    /**
     * 插件私有 KV 存储
     */
    void kvSet(String key, byte[] value);

    /**
     * @return 不存在时返回 null
     */
    byte[] kvGet(String key);

    void kvDelete(String key);

    /**
     * 写入宿主日志
     */
    void logMessage(LogLevel level, String message);
}
