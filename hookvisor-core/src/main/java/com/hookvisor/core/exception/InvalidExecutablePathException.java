package com.hookvisor.core.exception;

import com.hookvisor.api.exception.PluginException;

/**
 * 可执行文件路径非法
 * <p>
 * 路径解析后逃逸出插件根目录。构造期抛出，此时没有任何进程被创建。
 */
public class InvalidExecutablePathException extends PluginException {

    private final String pluginId;
    private final String executable;

    public InvalidExecutablePathException(String pluginId, String executable, String reason) {
        super("Invalid executable path for plugin " + pluginId + ": '" + executable + "' " + reason);
        this.pluginId = pluginId;
        this.executable = executable;
    }

    public String getPluginId() {
        return pluginId;
    }

    public String getExecutable() {
        return executable;
    }
}
