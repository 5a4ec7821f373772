package com.hookvisor.core.rpc;

import com.hookvisor.api.plugin.PluginHooks;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 钩子代理
 * <p>
 * {@link PluginHooks} 的每个方法映射到一个 {@link HookMethod}，交给 {@link HookInvoker} 转发。
 * 不包含任何重启逻辑。
 */
public class RemoteHookProxy implements InvocationHandler {

    private static final ConcurrentHashMap<Method, HookMethod> METHOD_CACHE = new ConcurrentHashMap<>();

    private final String pluginId;
    private final HookInvoker invoker;

    private RemoteHookProxy(String pluginId, HookInvoker invoker) {
        this.pluginId = pluginId;
        this.invoker = invoker;
    }

    public static PluginHooks create(String pluginId, HookInvoker invoker) {
        return (PluginHooks) Proxy.newProxyInstance(
                PluginHooks.class.getClassLoader(),
                new Class<?>[]{PluginHooks.class},
                new RemoteHookProxy(pluginId, invoker));
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }

        HookMethod hook = METHOD_CACHE.computeIfAbsent(method, m -> HookMethod.fromJavaMethod(m)
                .orElseThrow(() -> new UnsupportedOperationException("Unmapped hook: " + m.getName())));

        if (hook == HookMethod.ON_ACTIVATE) {
            // 激活由监督器在握手时完成，宿主能力在每次重启后自动重新注入
            throw new UnsupportedOperationException("Plugin " + pluginId + " is activated by its supervisor");
        }
        return invoker.invokeHook(hook, args != null ? args : new Object[0]);
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            default:
                return "RemoteHookProxy{plugin=" + pluginId + "}";
        }
    }
}
