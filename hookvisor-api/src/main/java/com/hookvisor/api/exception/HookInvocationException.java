package com.hookvisor.api.exception;

/**
 * 远端调用异常
 * <p>
 * 对端（插件或宿主）的实现返回了业务错误。消息原样透传，进程不受影响。
 */
public class HookInvocationException extends PluginException {

    private final String method;
    private final String remoteType;

    public HookInvocationException(String method, String remoteType, String message) {
        super(message);
        this.method = method;
        this.remoteType = remoteType;
    }

    /**
     * 出错的远端方法名，例如 Plugin.ExecuteCommand
     */
    public String getMethod() {
        return method;
    }

    /**
     * 对端抛出的异常类型全名
     */
    public String getRemoteType() {
        return remoteType;
    }
}
