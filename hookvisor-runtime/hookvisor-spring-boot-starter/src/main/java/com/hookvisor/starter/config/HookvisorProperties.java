package com.hookvisor.starter.config;

import com.hookvisor.core.channel.FrameCodec;
import com.hookvisor.core.supervisor.SupervisorConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * HookVisor 配置属性
 * <p>
 * 示例：
 *
 * <pre>
 * hookvisor:
 *   startup-timeout: 5s
 *   stop-grace-period: 2s
 *   kill-timeout: 5s
 *   max-frame-bytes: 16777216
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "hookvisor")
public class HookvisorProperties {

    /**
     * 是否启用插件宿主。
     */
    private boolean enabled = true;

    /**
     * 启动/重启超时，覆盖创建进程、握手和激活。
     * 不带单位时按毫秒解析。
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration startupTimeout = Duration.ofSeconds(5);

    /**
     * 停止时等待插件自行退出的宽限期。
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration stopGracePeriod = Duration.ofSeconds(2);

    /**
     * 强杀后等待进程回收的时长。
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration killTimeout = Duration.ofSeconds(5);

    /**
     * 单帧最大字节数。
     */
    private int maxFrameBytes = FrameCodec.DEFAULT_MAX_FRAME_BYTES;

    public SupervisorConfig toSupervisorConfig() {
        return SupervisorConfig.builder()
                .startupTimeout(startupTimeout)
                .stopGracePeriod(stopGracePeriod)
                .killTimeout(killTimeout)
                .maxFrameBytes(maxFrameBytes)
                .build();
    }
}
