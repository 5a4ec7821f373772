package com.hookvisor.api.plugin;

import com.hookvisor.api.model.CommandArgs;
import com.hookvisor.api.model.CommandResponse;
import com.hookvisor.api.model.HttpRequestData;
import com.hookvisor.api.model.HttpResponseData;

/**
 * 插件钩子接口
 * <p>
 * 插件后端的主入口类实现此接口，只需覆盖关心的钩子。
 * 宿主侧通过 {@code PluginSupervisor#hooks()} 拿到同一接口的远程代理，
 * 每次调用都会跨进程转发给插件。
 * <p>
 * 未覆盖的钩子在握手时不会上报，宿主直接返回这里的默认值，不产生跨进程调用。
 */
public interface PluginHooks {

    /**
     * 插件激活
     * <p>
     * 每个插件进程只调用一次；插件崩溃重启后会在新进程里再次调用。
     *
     * @param api 宿主注入的能力集合
     */
    default void onActivate(PluginApi api) {
        // Default empty implementation
    }

    /**
     * 插件停用
     */
    default void onDeactivate() {
        // Default empty implementation
    }

    /**
     * 插件配置变更通知
     */
    default void onConfigurationChange() {
        // Default empty implementation
    }

    /**
     * 执行插件注册的斜杠命令
     *
     * @return 命令响应，未实现时为 null
     */
    default CommandResponse executeCommand(CommandArgs args) {
        return null;
    }

    /**
     * 处理转发给插件的 HTTP 请求
     */
    default HttpResponseData serveHttp(HttpRequestData request) {
        return HttpResponseData.notFound();
    }
}
