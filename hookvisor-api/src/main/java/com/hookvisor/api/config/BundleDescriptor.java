package com.hookvisor.api.config;

import com.hookvisor.api.exception.InvalidArgumentException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;

/**
 * 插件包描述
 * <p>
 * 由清单解析方产出：插件标识、磁盘根目录、后端可执行文件的相对路径。
 * 构造后不可变。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BundleDescriptor {

    /**
     * 插件唯一标识
     */
    String id;

    /**
     * 插件根目录，进程工作目录也设置为此目录
     */
    Path rootDir;

    /**
     * 后端可执行文件，相对于 rootDir
     */
    String executable;

    public static BundleDescriptor of(String id, Path rootDir, String executable) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidArgumentException("id", "Plugin id cannot be blank");
        }
        if (rootDir == null) {
            throw new InvalidArgumentException("rootDir", "Plugin root directory is required");
        }
        if (executable == null || executable.trim().isEmpty()) {
            throw new InvalidArgumentException("executable", "Backend executable cannot be blank");
        }
        return new BundleDescriptor(id, rootDir, executable);
    }

    @Override
    public String toString() {
        return String.format("BundleDescriptor{id='%s', rootDir='%s', executable='%s'}", id, rootDir, executable);
    }
}
