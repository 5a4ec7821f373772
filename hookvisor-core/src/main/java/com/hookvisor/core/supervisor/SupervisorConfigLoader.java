package com.hookvisor.core.supervisor;

import com.hookvisor.api.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * 从 hookvisor.yml 加载监督器配置
 * <p>
 * 示例：
 *
 * <pre>
 * supervisor:
 *   startup-timeout-ms: 5000
 *   stop-grace-period-ms: 2000
 *   kill-timeout-ms: 5000
 *   max-frame-bytes: 16777216
 * </pre>
 * <p>
 * 缺省项使用 {@link SupervisorConfig#defaults()} 的值。
 */
@Slf4j
public class SupervisorConfigLoader {

    public static final String DEFAULT_FILE_NAME = "hookvisor.yml";

    private static final String ROOT_KEY = "supervisor";

    public static SupervisorConfig load(Path file) {
        try (InputStream is = Files.newInputStream(file)) {
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /**
     * 从类路径加载，不存在时返回默认配置
     */
    public static SupervisorConfig loadFromClasspath(ClassLoader classLoader) {
        InputStream is = classLoader.getResourceAsStream(DEFAULT_FILE_NAME);
        if (is == null) {
            log.debug("No {} on classpath, using defaults", DEFAULT_FILE_NAME);
            return SupervisorConfig.defaults();
        }
        try (InputStream in = is) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_FILE_NAME, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static SupervisorConfig load(InputStream inputStream) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object document = yaml.load(inputStream);

        SupervisorConfig.SupervisorConfigBuilder builder = SupervisorConfig.builder();
        if (!(document instanceof Map)) {
            return builder.build();
        }
        Object section = ((Map<String, Object>) document).get(ROOT_KEY);
        if (!(section instanceof Map)) {
            return builder.build();
        }

        Map<String, Object> values = (Map<String, Object>) section;
        Long startup = readLong(values, "startup-timeout-ms");
        if (startup != null) {
            builder.startupTimeout(Duration.ofMillis(startup));
        }
        Long grace = readLong(values, "stop-grace-period-ms");
        if (grace != null) {
            builder.stopGracePeriod(Duration.ofMillis(grace));
        }
        Long kill = readLong(values, "kill-timeout-ms");
        if (kill != null) {
            builder.killTimeout(Duration.ofMillis(kill));
        }
        Long maxFrame = readLong(values, "max-frame-bytes");
        if (maxFrame != null) {
            builder.maxFrameBytes(Math.toIntExact(maxFrame));
        }

        SupervisorConfig config = builder.build();
        log.info("Loaded {}", config);
        return config;
    }

    private static Long readLong(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new InvalidArgumentException(key, "Expected a number for " + key + " but got '" + value + "'");
        }
        long number = ((Number) value).longValue();
        if (number <= 0) {
            throw new InvalidArgumentException(key, key + " must be positive");
        }
        return number;
    }
}
