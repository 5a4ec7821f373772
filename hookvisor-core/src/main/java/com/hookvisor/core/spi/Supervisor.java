package com.hookvisor.core.spi;

import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.api.plugin.PluginHooks;
import com.hookvisor.core.enums.SupervisorState;

/**
 * 插件监督器 SPI
 * 一个实例负责一个插件后端的完整生命周期
 */
public interface Supervisor {

    String getPluginId();

    /**
     * 启动插件并注入宿主能力，阻塞至握手完成、启动失败或超时
     *
     * @param hostApi 宿主能力，重启时会自动重新注入
     */
    void start(PluginApi hostApi);

    /**
     * 绑定到该监督器的钩子代理
     */
    PluginHooks hooks();

    /**
     * 停止插件，可重复调用
     */
    void stop();

    SupervisorState getState();
}
