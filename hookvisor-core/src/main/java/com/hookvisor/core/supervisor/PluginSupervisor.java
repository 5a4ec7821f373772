package com.hookvisor.core.supervisor;

import com.hookvisor.api.config.BundleDescriptor;
import com.hookvisor.api.event.PluginEvent;
import com.hookvisor.api.event.lifecycle.PluginCrashedEvent;
import com.hookvisor.api.event.lifecycle.PluginRelaunchedEvent;
import com.hookvisor.api.event.lifecycle.PluginStartedEvent;
import com.hookvisor.api.event.lifecycle.PluginStoppedEvent;
import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.api.plugin.PluginHooks;
import com.hookvisor.core.channel.FrameCodec;
import com.hookvisor.core.enums.SupervisorState;
import com.hookvisor.core.event.EventBus;
import com.hookvisor.core.exception.ChannelBrokenException;
import com.hookvisor.core.exception.ExecutableLaunchFailedException;
import com.hookvisor.core.exception.PluginNotRunningException;
import com.hookvisor.core.exception.PluginStopException;
import com.hookvisor.core.exception.StartTimeoutException;
import com.hookvisor.core.rpc.ApiDispatcher;
import com.hookvisor.core.rpc.HookInvoker;
import com.hookvisor.core.rpc.HookMethod;
import com.hookvisor.core.rpc.RemoteHookProxy;
import com.hookvisor.core.spi.Supervisor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collections;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 插件进程监督器
 * <p>
 * 职责：路径校验、进程创建、限时握手、钩子转发、崩溃检测与重启、优雅/强制停止。
 * <p>
 * 崩溃恢复是被动的：由钩子调用驱动，不存在后台重启循环。
 * <ul>
 *     <li>观察到通道断开的那次调用会同步尝试一次重启，然后仍以 {@link ChannelBrokenException} 失败</li>
 *     <li>重启失败后保持 CRASHED，下一次调用再尝试重启</li>
 *     <li>同一时刻只有一个重启在进行；等待锁的调用方直接采用那次尝试的结果，不会再拉起进程</li>
 * </ul>
 * 每次启动/重启都受同一个启动超时约束，超时的进程在返回前被强制杀死。
 */
@Slf4j
public class PluginSupervisor implements Supervisor, HookInvoker {

    private final String pluginId;
    private final Path executable;
    private final Path workDir;
    private final SupervisorConfig config;
    private final EventBus eventBus;
    private final FrameCodec codec;
    private final PluginHooks hooks;

    // 进程存活监控，每个监督器一个线程（首次使用时创建）
    private final ExecutorService monitor;

    // 串行化 start / relaunch / stop
    private final ReentrantLock stateLock = new ReentrantLock();

    // 已结束的启动尝试次数（无论成败），用于让并发的崩溃观察者共享同一次重启的结果，持锁修改
    private long completedAttempts;

    // 状态、当前进程与尝试次数作为一个整体发布，调用方无锁读取时看到的总是同一时刻的组合
    private volatile Snapshot view = new Snapshot(SupervisorState.CREATED, null, 0);

    // 成功启动的次数，即当前进程的代数
    private volatile int launches;

    // 首次启动时保存，每次重启重新注入
    private PluginApi hostApi;

    public PluginSupervisor(BundleDescriptor bundle, SupervisorConfig config, EventBus eventBus) {
        this.pluginId = bundle.getId();
        this.executable = BundlePathResolver.resolveExecutable(bundle);
        this.workDir = bundle.getRootDir().toAbsolutePath().normalize();
        this.config = config;
        this.eventBus = eventBus;
        this.codec = new FrameCodec(config.getMaxFrameBytes());
        this.hooks = RemoteHookProxy.create(pluginId, this);
        this.monitor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hookvisor-monitor-" + pluginId);
            t.setDaemon(true);
            return t;
        });
        log.debug("[{}] Supervisor created for {} ({})", pluginId, executable, config);
    }

    /**
     * 使用类路径上 hookvisor.yml 的配置创建，没有该文件时使用默认配置
     */
    public static PluginSupervisor create(BundleDescriptor bundle) {
        return new PluginSupervisor(bundle,
                SupervisorConfigLoader.loadFromClasspath(PluginSupervisor.class.getClassLoader()), null);
    }

    // ==================== 生命周期 ====================

    @Override
    public void start(PluginApi hostApi) {
        stateLock.lock();
        try {
            if (state() != SupervisorState.CREATED) {
                throw new IllegalStateException("Plugin " + pluginId + " cannot be started in state " + state());
            }
            this.hostApi = hostApi;
            transition(SupervisorState.STARTING, null);
            log.info("[{}] Starting plugin: {}", pluginId, executable);

            try {
                PluginProcess process = launch();
                transition(SupervisorState.RUNNING, process);
                publish(new PluginStartedEvent(pluginId, process.getGeneration()));
                log.info("[{}] Plugin started (pid={})", pluginId, process.pid());
            } catch (RuntimeException e) {
                // 启动失败不残留进程，允许调用方修正后重试
                transition(SupervisorState.CREATED, null);
                log.error("[{}] Failed to start plugin: {}", pluginId, e.getMessage());
                throw e;
            }
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void stop() {
        stateLock.lock();
        try {
            if (state() == SupervisorState.STOPPED) {
                return;
            }
            PluginProcess process = current();
            transition(SupervisorState.STOPPED, null);

            boolean exited = true;
            if (process != null) {
                log.info("[{}] Stopping plugin (pid={})", pluginId, process.pid());
                exited = process.shutdown(config.getStopGracePeriod(), config.getKillTimeout());
                publish(new PluginStoppedEvent(pluginId, process.getGeneration()));
            }
            monitor.shutdownNow();

            if (!exited) {
                throw new PluginStopException(pluginId, process.pid());
            }
            log.info("[{}] Plugin stopped", pluginId);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public PluginHooks hooks() {
        return hooks;
    }

    // ==================== 钩子转发 ====================

    @Override
    public Object invokeHook(HookMethod method, Object... args) {
        Snapshot observed = view;

        if (observed.getState() == SupervisorState.RUNNING && observed.getProcess() != null) {
            return forward(observed, method, args);
        }
        if (observed.getState() == SupervisorState.CRASHED || observed.getState() == SupervisorState.RESTARTING) {
            return forward(recover(observed.getAttempts()), method, args);
        }
        throw new PluginNotRunningException(pluginId, observed.getState());
    }

    private Object forward(Snapshot observed, HookMethod method, Object[] args) {
        PluginProcess process = observed.getProcess();
        if (!process.isImplemented(method)) {
            return method.defaultResult(args);
        }
        try {
            return process.getChannel().invoke(method.wireName(), method.resultType(), args);
        } catch (ChannelBrokenException e) {
            RuntimeException relaunchFailure = handleCrash(process, observed.getAttempts());
            if (relaunchFailure != null) {
                e.addSuppressed(relaunchFailure);
            }
            // 观察到崩溃的这次调用不重试，由后续调用享受恢复结果
            throw e;
        }
    }

    /**
     * 调用方观察到通道断开
     *
     * @return 本调用方发起的重启失败时返回失败原因
     */
    private RuntimeException handleCrash(PluginProcess process, long observed) {
        stateLock.lock();
        try {
            if (state() == SupervisorState.STOPPED || process.isExpectedExit()) {
                return null;
            }
            if (completedAttempts != observed) {
                // 别的调用方已经完成了一次重启尝试
                return null;
            }
            markCrashed(process);
            return relaunch();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 调用方发现插件处于崩溃状态，尝试恢复后返回可用进程的快照
     */
    private Snapshot recover(long observed) {
        stateLock.lock();
        try {
            if (state() == SupervisorState.RUNNING && current() != null) {
                return view;
            }
            if (state() != SupervisorState.CRASHED) {
                throw new PluginNotRunningException(pluginId, state());
            }
            if (completedAttempts != observed) {
                throw new ChannelBrokenException(pluginId, "plugin is down, the last relaunch attempt failed");
            }
            RuntimeException failure = relaunch();
            if (failure != null) {
                throw new ChannelBrokenException(pluginId, "plugin is down and relaunch failed", failure);
            }
            return view;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 持锁调用
     *
     * @return 失败原因，成功时为 null
     */
    private RuntimeException relaunch() {
        PluginProcess previous = current();
        if (previous != null) {
            // 通道断开但进程可能仍存活（例如协议错误），重启前确保旧进程已回收
            previous.kill(config.getKillTimeout());
        }
        transition(SupervisorState.RESTARTING, null);
        log.info("[{}] Relaunching plugin", pluginId);

        try {
            PluginProcess process = launch();
            transition(SupervisorState.RUNNING, process);
            publish(new PluginRelaunchedEvent(pluginId, process.getGeneration()));
            log.info("[{}] Plugin relaunched (pid={}, generation {})", pluginId, process.pid(), process.getGeneration());
            return null;
        } catch (RuntimeException e) {
            transition(SupervisorState.CRASHED, null);
            log.error("[{}] Relaunch failed: {}", pluginId, e.getMessage());
            return e;
        }
    }

    /**
     * 持锁调用：创建进程、握手、注入宿主能力，失败时保证进程已被杀死
     */
    private PluginProcess launch() {
        try {
            int generation = launches + 1;
            PluginProcess process = PluginProcess.spawn(pluginId, generation, executable, workDir,
                    new ApiDispatcher(pluginId, hostApi), codec);

            long deadline = System.nanoTime() + config.getStartupTimeout().toNanos();
            try {
                process.handshake(deadline);
            } catch (TimeoutException e) {
                process.kill(config.getKillTimeout());
                throw new StartTimeoutException(pluginId, config.getStartupTimeout());
            } catch (ChannelBrokenException e) {
                process.kill(config.getKillTimeout());
                throw new ExecutableLaunchFailedException(pluginId,
                        "Plugin process exited during handshake (exit code " + process.exitCode() + ")", e);
            } catch (RuntimeException e) {
                process.kill(config.getKillTimeout());
                throw e;
            }

            launches = generation;
            watch(process);
            return process;
        } finally {
            completedAttempts++;
        }
    }

    private void watch(PluginProcess process) {
        process.onExit().thenRunAsync(() -> onProcessExit(process), monitor);
    }

    private void onProcessExit(PluginProcess process) {
        if (process.isExpectedExit()) {
            log.debug("[{}] Plugin process {} exited", pluginId, process.pid());
            return;
        }
        log.warn("[{}] Plugin process {} exited unexpectedly with code {}",
                pluginId, process.pid(), process.exitCode());
        // 让进行中的调用立即失败
        process.getChannel().close();

        stateLock.lock();
        try {
            if (current() == process && state() == SupervisorState.RUNNING) {
                markCrashed(process);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void markCrashed(PluginProcess process) {
        transition(SupervisorState.CRASHED, current());
        if (process.markCrashed()) {
            log.warn("[{}] Plugin crashed (generation {})", pluginId, process.getGeneration());
            publish(new PluginCrashedEvent(pluginId, process.getGeneration(), process.exitCode()));
        }
    }

    private void publish(PluginEvent event) {
        if (eventBus == null) {
            return;
        }
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.warn("[{}] Event listener failed for {}", pluginId, event, e);
        }
    }

    /**
     * 持锁调用
     */
    private void transition(SupervisorState state, PluginProcess process) {
        view = new Snapshot(state, process, completedAttempts);
    }

    private SupervisorState state() {
        return view.getState();
    }

    private PluginProcess current() {
        return view.getProcess();
    }

    @Value
    private static class Snapshot {
        SupervisorState state;
        PluginProcess process;
        long attempts;
    }

    // ==================== 状态查询 ====================

    @Override
    public String getPluginId() {
        return pluginId;
    }

    @Override
    public SupervisorState getState() {
        return state();
    }

    /**
     * 当前进程的代数：首次启动为 1，每次成功重启加 1
     */
    public int getGeneration() {
        return launches;
    }

    public OptionalLong getPid() {
        PluginProcess process = current();
        return process != null ? OptionalLong.of(process.pid()) : OptionalLong.empty();
    }

    /**
     * 当前进程握手时上报的已实现钩子
     */
    public Set<String> implementedHooks() {
        PluginProcess process = current();
        return process != null ? process.getImplementedHooks() : Collections.emptySet();
    }

    public Path getExecutable() {
        return executable;
    }

    public SupervisorConfig getConfig() {
        return config;
    }
}
