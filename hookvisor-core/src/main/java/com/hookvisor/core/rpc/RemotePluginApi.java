package com.hookvisor.core.rpc;

import com.hookvisor.api.model.Command;
import com.hookvisor.api.model.LogLevel;
import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.core.channel.CallChannel;

import java.util.Map;

/**
 * 插件侧的宿主能力代理：每个方法转发为一次对宿主的远程调用
 */
public class RemotePluginApi implements PluginApi {

    private final CallChannel channel;

    public RemotePluginApi(CallChannel channel) {
        this.channel = channel;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> getPluginConfiguration() {
        return channel.invoke(ApiMethod.GET_PLUGIN_CONFIGURATION.wireName(), Map.class);
    }

    @Override
    public void registerCommand(Command command) {
        channel.invoke(ApiMethod.REGISTER_COMMAND.wireName(), Void.class, command);
    }

    @Override
    public void unregisterCommand(String teamId, String trigger) {
        channel.invoke(ApiMethod.UNREGISTER_COMMAND.wireName(), Void.class, teamId, trigger);
    }

    @Override
    public void kvSet(String key, byte[] value) {
        channel.invoke(ApiMethod.KV_SET.wireName(), Void.class, key, value);
    }

    @Override
    public byte[] kvGet(String key) {
        return channel.invoke(ApiMethod.KV_GET.wireName(), byte[].class, key);
    }

    @Override
    public void kvDelete(String key) {
        channel.invoke(ApiMethod.KV_DELETE.wireName(), Void.class, key);
    }

    @Override
    public void logMessage(LogLevel level, String message) {
        channel.invoke(ApiMethod.LOG_MESSAGE.wireName(), Void.class, level, message);
    }
}
