package com.hookvisor.core.rpc;

import java.util.Arrays;
import java.util.Optional;

/**
 * 插件回调宿主的远程方法表，与 {@link com.hookvisor.api.plugin.PluginApi} 一一对应
 */
public enum ApiMethod {

    GET_PLUGIN_CONFIGURATION("API.GetPluginConfiguration"),
    REGISTER_COMMAND("API.RegisterCommand"),
    UNREGISTER_COMMAND("API.UnregisterCommand"),
    KV_SET("API.KvSet"),
    KV_GET("API.KvGet"),
    KV_DELETE("API.KvDelete"),
    LOG_MESSAGE("API.LogMessage");

    private final String wireName;

    ApiMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ApiMethod> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(wireName)).findFirst();
    }
}
