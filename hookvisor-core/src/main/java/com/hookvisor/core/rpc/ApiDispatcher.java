package com.hookvisor.core.rpc;

import com.hookvisor.api.model.Command;
import com.hookvisor.api.model.LogLevel;
import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.core.channel.CallArguments;
import com.hookvisor.core.channel.CallHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * 宿主侧入站调用处理：把插件的 API 回调分派给宿主的 {@link PluginApi} 实现
 */
@Slf4j
public class ApiDispatcher implements CallHandler {

    private final String pluginId;
    private final PluginApi api;

    public ApiDispatcher(String pluginId, PluginApi api) {
        this.pluginId = pluginId;
        this.api = api;
    }

    @Override
    public Object handle(String method, CallArguments args) {
        ApiMethod apiMethod = ApiMethod.fromWireName(method)
                .orElseThrow(() -> new UnsupportedOperationException("Unknown API method: " + method));
        if (api == null) {
            throw new IllegalStateException("No host API was supplied to plugin " + pluginId);
        }

        log.trace("[{}] API call {}", pluginId, method);
        switch (apiMethod) {
            case GET_PLUGIN_CONFIGURATION:
                return api.getPluginConfiguration();
            case REGISTER_COMMAND:
                api.registerCommand(args.get(0, Command.class));
                return null;
            case UNREGISTER_COMMAND:
                api.unregisterCommand(args.get(0, String.class), args.get(1, String.class));
                return null;
            case KV_SET:
                api.kvSet(args.get(0, String.class), args.get(1, byte[].class));
                return null;
            case KV_GET:
                return api.kvGet(args.get(0, String.class));
            case KV_DELETE:
                api.kvDelete(args.get(0, String.class));
                return null;
            case LOG_MESSAGE:
                api.logMessage(args.get(0, LogLevel.class), args.get(1, String.class));
                return null;
            default:
                throw new UnsupportedOperationException("Unhandled API method: " + method);
        }
    }
}
