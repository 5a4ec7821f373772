package com.hookvisor.core.rpc;

import com.hookvisor.api.model.CommandArgs;
import com.hookvisor.api.model.CommandResponse;
import com.hookvisor.api.model.HttpRequestData;
import com.hookvisor.api.model.HttpResponseData;
import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.api.plugin.PluginHooks;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Optional;

/**
 * 宿主调用插件的远程方法表
 * <p>
 * 每个 {@link PluginHooks} 方法对应一个远程方法；HANDSHAKE 与 SHUTDOWN 是协议自身的控制调用。
 */
public enum HookMethod {

    HANDSHAKE("Plugin.Handshake", null, HandshakeResponse.class, HandshakeRequest.class),
    ON_ACTIVATE("Plugin.OnActivate", "onActivate", Void.class, PluginApi.class),
    ON_DEACTIVATE("Plugin.OnDeactivate", "onDeactivate", Void.class),
    ON_CONFIGURATION_CHANGE("Plugin.OnConfigurationChange", "onConfigurationChange", Void.class),
    EXECUTE_COMMAND("Plugin.ExecuteCommand", "executeCommand", CommandResponse.class, CommandArgs.class),
    SERVE_HTTP("Plugin.ServeHttp", "serveHttp", HttpResponseData.class, HttpRequestData.class),
    SHUTDOWN("Plugin.Shutdown", null, Void.class);

    /**
     * 默认钩子实现，用于插件未实现某个钩子时就地给出结果
     */
    private static final PluginHooks DEFAULT_HOOKS = new PluginHooks() {
    };

    private final String wireName;
    private final String javaName;
    private final Class<?> resultType;
    private final Class<?>[] parameterTypes;

    HookMethod(String wireName, String javaName, Class<?> resultType, Class<?>... parameterTypes) {
        this.wireName = wireName;
        this.javaName = javaName;
        this.resultType = resultType;
        this.parameterTypes = parameterTypes;
    }

    public String wireName() {
        return wireName;
    }

    public Class<?> resultType() {
        return resultType;
    }

    /**
     * 是否为 {@link PluginHooks} 上的钩子（而非协议控制调用）
     */
    public boolean isHook() {
        return javaName != null;
    }

    /**
     * 插件实现类是否覆盖了该钩子
     */
    public boolean isOverriddenBy(PluginHooks implementation) {
        if (!isHook()) {
            return false;
        }
        try {
            Method method = implementation.getClass().getMethod(javaName, parameterTypes);
            return method.getDeclaringClass() != PluginHooks.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    /**
     * 调用默认实现得到结果
     */
    public Object defaultResult(Object... args) {
        if (!isHook()) {
            throw new IllegalStateException(wireName + " has no default result");
        }
        try {
            return PluginHooks.class.getMethod(javaName, parameterTypes).invoke(DEFAULT_HOOKS, args);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Default implementation of " + javaName + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot resolve default implementation of " + javaName, e);
        }
    }

    public static Optional<HookMethod> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(wireName)).findFirst();
    }

    /**
     * 按 {@link PluginHooks} 的 Java 方法查找
     */
    public static Optional<HookMethod> fromJavaMethod(Method method) {
        return Arrays.stream(values())
                .filter(m -> m.isHook()
                        && m.javaName.equals(method.getName())
                        && Arrays.equals(m.parameterTypes, method.getParameterTypes()))
                .findFirst();
    }
}
