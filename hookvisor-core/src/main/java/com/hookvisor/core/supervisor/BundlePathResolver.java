package com.hookvisor.core.supervisor;

import com.hookvisor.api.config.BundleDescriptor;
import com.hookvisor.core.exception.InvalidExecutablePathException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 可执行文件路径解析
 * <p>
 * 相对路径总是拼接在插件根目录之下（即使以分隔符开头），规范化后必须是根目录的后代。
 * 路径上的每个符号链接（包括悬空链接）展开后也必须留在根目录内，目标文件本身不要求存在。
 */
public final class BundlePathResolver {

    private static final int MAX_LINK_HOPS = 40;

    private BundlePathResolver() {
    }

    public static Path resolveExecutable(BundleDescriptor bundle) {
        String pluginId = bundle.getId();
        String executable = bundle.getExecutable();

        Path root = bundle.getRootDir().toAbsolutePath().normalize();
        String relative = stripLeadingSeparators(executable);
        if (relative.isEmpty()) {
            throw new InvalidExecutablePathException(pluginId, executable, "does not name a file");
        }

        Path candidate;
        try {
            candidate = root.resolve(relative).normalize();
        } catch (RuntimeException e) {
            throw new InvalidExecutablePathException(pluginId, executable, "is not a valid path: " + e.getMessage());
        }
        if (!candidate.startsWith(root) || candidate.equals(root)) {
            throw new InvalidExecutablePathException(pluginId, executable, "escapes plugin root " + root);
        }

        checkSymlinks(pluginId, executable, root, candidate);
        return candidate;
    }

    private static void checkSymlinks(String pluginId, String executable, Path root, Path candidate) {
        if (!Files.exists(root)) {
            return;
        }
        try {
            Path realRoot = root.toRealPath();
            Path realCandidate = followLinks(candidate, 0);
            if (!realCandidate.startsWith(realRoot) || realCandidate.equals(realRoot)) {
                throw new InvalidExecutablePathException(pluginId, executable,
                        "resolves through a symbolic link outside plugin root " + realRoot);
            }
        } catch (IOException e) {
            throw new InvalidExecutablePathException(pluginId, executable, "cannot be resolved: " + e.getMessage());
        }
    }

    /**
     * 逐段展开符号链接，悬空链接同样按其目标计算，不存在的部分保持字面值
     */
    private static Path followLinks(Path path, int hops) throws IOException {
        Path resolved = path.getRoot();
        for (Path name : path) {
            Path next;
            if ("..".equals(name.toString())) {
                next = resolved.getParent() != null ? resolved.getParent() : resolved;
            } else {
                next = resolved.resolve(name.toString());
            }
            if (Files.isSymbolicLink(next)) {
                if (hops >= MAX_LINK_HOPS) {
                    throw new IOException("Too many levels of symbolic links at " + next);
                }
                Path target = Files.readSymbolicLink(next);
                next = followLinks(resolved.resolve(target).normalize(), hops + 1);
            }
            resolved = next;
        }
        return resolved;
    }

    private static String stripLeadingSeparators(String path) {
        int i = 0;
        while (i < path.length() && (path.charAt(i) == '/' || path.charAt(i) == '\\')) {
            i++;
        }
        return path.substring(i).trim();
    }
}
