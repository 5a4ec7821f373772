package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;

/**
 * 通道断开异常
 * <p>
 * 对端进程退出、管道关闭或帧格式错误。与 {@link com.hookvisor.api.exception.HookInvocationException}
 * 区分开："插件返回了错误" 与 "插件已经不在了" 是两种情况，后者会触发重启。
 */
public class ChannelBrokenException extends PluginException {

    private final String channel;

    public ChannelBrokenException(String channel, String message) {
        super("Channel broken [" + channel + "]: " + message);
        this.channel = channel;
    }

    public ChannelBrokenException(String channel, String message, Throwable cause) {
        super("Channel broken [" + channel + "]: " + message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
