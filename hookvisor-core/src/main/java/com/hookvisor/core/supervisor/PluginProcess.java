package com.hookvisor.core.supervisor;

import com.hookvisor.api.exception.PluginException;
import com.hookvisor.core.channel.CallChannel;
import com.hookvisor.core.channel.CallHandler;
import com.hookvisor.core.channel.FrameCodec;
import com.hookvisor.core.exception.ExecutableLaunchFailedException;
import com.hookvisor.core.rpc.HandshakeRequest;
import com.hookvisor.core.rpc.HandshakeResponse;
import com.hookvisor.core.rpc.HookMethod;
import com.hookvisor.core.rpc.Protocol;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 插件进程的一代
 * <p>
 * 持有进程句柄、该进程独占的调用通道以及标准错误转发线程。
 * 崩溃重启时整代丢弃，新进程对应新的一代。
 */
@Slf4j
public class PluginProcess {

    private final String pluginId;
    private final int generation;
    private final Process process;
    private final CallChannel channel;

    private final AtomicBoolean expectedExit = new AtomicBoolean(false);
    private final AtomicBoolean crashed = new AtomicBoolean(false);
    private volatile Set<String> implementedHooks = Collections.emptySet();

    private PluginProcess(String pluginId, int generation, Process process, CallChannel channel) {
        this.pluginId = pluginId;
        this.generation = generation;
        this.process = process;
        this.channel = channel;
    }

    /**
     * 创建进程并建立通道，工作目录为插件根目录
     *
     * @throws ExecutableLaunchFailedException 可执行文件无法启动
     */
    public static PluginProcess spawn(String pluginId, int generation, Path executable, Path workDir,
                                      CallHandler apiHandler, FrameCodec codec) {
        ProcessBuilder builder = new ProcessBuilder(executable.toString())
                .directory(workDir.toFile());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutableLaunchFailedException(pluginId, "Cannot launch " + executable, e);
        }
        log.info("[{}] Spawned plugin process pid={} (generation {})", pluginId, process.pid(), generation);

        CallChannel channel = new CallChannel(pluginId + "#" + generation,
                process.getInputStream(), process.getOutputStream(), codec, apiHandler);
        PluginProcess pluginProcess = new PluginProcess(pluginId, generation, process, channel);
        pluginProcess.startStderrPump();
        channel.start();
        return pluginProcess;
    }

    /**
     * 握手并激活插件，两步共享同一截止时间
     *
     * @param deadlineNanos {@link System#nanoTime()} 基准的截止时刻
     */
    public void handshake(long deadlineNanos) throws TimeoutException {
        HandshakeResponse response = channel.invokeWithin(remaining(deadlineNanos),
                HookMethod.HANDSHAKE.wireName(), HandshakeResponse.class,
                new HandshakeRequest(Protocol.VERSION, pluginId));
        if (response == null || response.getProtocolVersion() != Protocol.VERSION) {
            throw new ExecutableLaunchFailedException(pluginId, "Protocol version mismatch: plugin speaks "
                    + (response != null ? response.getProtocolVersion() : null)
                    + ", host speaks " + Protocol.VERSION, null);
        }
        if (response.getImplementedHooks() != null) {
            implementedHooks = Collections.unmodifiableSet(new HashSet<>(response.getImplementedHooks()));
        }

        // 注入宿主能力
        channel.invokeWithin(remaining(deadlineNanos), HookMethod.ON_ACTIVATE.wireName(), Void.class);
    }

    /**
     * 优雅停止：停机信号 + 关闭通道，宽限期后逐级升级为 SIGTERM / SIGKILL
     *
     * @return 是否确认进程已退出
     */
    public boolean shutdown(Duration gracePeriod, Duration killTimeout) {
        expectedExit.set(true);
        if (channel.isOpen() && process.isAlive()) {
            try {
                channel.invokeWithin(gracePeriod, HookMethod.SHUTDOWN.wireName(), Void.class);
            } catch (TimeoutException e) {
                log.warn("[{}] Plugin did not acknowledge shutdown within {}ms", pluginId, gracePeriod.toMillis());
            } catch (PluginException e) {
                log.debug("[{}] Shutdown signal not delivered: {}", pluginId, e.getMessage());
            }
        }
        channel.close();
        if (awaitExit(gracePeriod)) {
            return true;
        }

        log.warn("[{}] Plugin process {} still alive after {}ms, terminating",
                pluginId, process.pid(), gracePeriod.toMillis());
        process.destroy();
        if (awaitExit(gracePeriod)) {
            return true;
        }
        return kill(killTimeout);
    }

    /**
     * 强制杀死进程（含子进程）并等待回收
     *
     * @return 是否确认进程已退出
     */
    public boolean kill(Duration timeout) {
        expectedExit.set(true);
        channel.close();
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        boolean exited = awaitExit(timeout);
        if (!exited) {
            log.error("[{}] Plugin process {} survived forced kill", pluginId, process.pid());
        }
        return exited;
    }

    private boolean awaitExit(Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    private void startStderrPump() {
        Thread pump = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("[{}] {}", pluginId, line);
                }
            } catch (IOException e) {
                log.debug("[{}] Stderr pump stopped: {}", pluginId, e.getMessage());
            }
        }, "hookvisor-stderr-" + pluginId + "-" + generation);
        pump.setDaemon(true);
        pump.start();
    }

    private static Duration remaining(long deadlineNanos) throws TimeoutException {
        long left = deadlineNanos - System.nanoTime();
        if (left <= 0) {
            throw new TimeoutException("Startup deadline elapsed");
        }
        return Duration.ofNanos(left);
    }

    /**
     * 标记崩溃，只有第一次标记返回 true
     */
    public boolean markCrashed() {
        return crashed.compareAndSet(false, true);
    }

    public boolean isExpectedExit() {
        return expectedExit.get();
    }

    public boolean isImplemented(HookMethod method) {
        return implementedHooks.contains(method.wireName());
    }

    public Set<String> getImplementedHooks() {
        return implementedHooks;
    }

    public CompletableFuture<Process> onExit() {
        return process.onExit();
    }

    /**
     * @return 进程仍存活时为 null
     */
    public Integer exitCode() {
        return process.isAlive() ? null : process.exitValue();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public long pid() {
        return process.pid();
    }

    public int getGeneration() {
        return generation;
    }

    public CallChannel getChannel() {
        return channel;
    }
}
