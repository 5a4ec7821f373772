package com.hookvisor.core.supervisor;

import com.hookvisor.core.channel.FrameCodec;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * 监督器配置
 */
@Getter
@Builder(toBuilder = true)
public class SupervisorConfig {

    // ==================== 启动 ====================

    /**
     * 启动/重启超时
     * 从创建进程到握手、激活全部完成的总时长，超时后强制杀死进程
     */
    @Builder.Default
    private Duration startupTimeout = Duration.ofSeconds(5);

    // ==================== 停止 ====================

    /**
     * 优雅停止宽限期
     * 发送停机信号并关闭通道后，等待进程自行退出的时长
     */
    @Builder.Default
    private Duration stopGracePeriod = Duration.ofSeconds(2);

    /**
     * 强杀后等待进程回收的时长
     */
    @Builder.Default
    private Duration killTimeout = Duration.ofSeconds(5);

    // ==================== 通道 ====================

    /**
     * 单帧最大字节数
     */
    @Builder.Default
    private int maxFrameBytes = FrameCodec.DEFAULT_MAX_FRAME_BYTES;

    // ==================== 工厂方法 ====================

    /**
     * 默认配置
     */
    public static SupervisorConfig defaults() {
        return SupervisorConfig.builder().build();
    }

    /**
     * 开发模式配置（更宽松，方便调试插件）
     */
    public static SupervisorConfig development() {
        return SupervisorConfig.builder()
                .startupTimeout(Duration.ofSeconds(60))
                .stopGracePeriod(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "SupervisorConfig{startup=%dms, grace=%dms, kill=%dms, maxFrame=%d}",
                startupTimeout.toMillis(), stopGracePeriod.toMillis(), killTimeout.toMillis(), maxFrameBytes
        );
    }
}
