package com.hookvisor.core.host;

import com.hookvisor.api.config.BundleDescriptor;
import com.hookvisor.api.exception.PluginException;
import com.hookvisor.api.exception.PluginNotFoundException;
import com.hookvisor.api.plugin.PluginApi;
import com.hookvisor.api.plugin.PluginHooks;
import com.hookvisor.core.event.EventBus;
import com.hookvisor.core.spi.Supervisor;
import com.hookvisor.core.spi.SupervisorProvider;
import com.hookvisor.core.supervisor.ProcessSupervisorProvider;
import com.hookvisor.core.supervisor.SupervisorConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 插件宿主
 * <p>
 * 职责：
 * 1. 插件的激活 (Activate)：创建监督器并启动进程
 * 2. 插件的停用 (Deactivate)：通知插件后停止进程
 * 3. 钩子查找：按插件 ID 获取钩子代理
 * 4. 全局停止 (Shutdown)
 */
@Slf4j
public class PluginHost {

    /**
     * 监督器表：Key=PluginId
     */
    private final Map<String, Supervisor> supervisors = new ConcurrentHashMap<>();

    // 串行化激活与停用，避免同一插件被并发拉起两次
    private final ReentrantLock registryLock = new ReentrantLock();

    private final SupervisorProvider supervisorProvider;
    private final EventBus eventBus;

    public PluginHost(SupervisorProvider supervisorProvider, EventBus eventBus) {
        this.supervisorProvider = supervisorProvider;
        this.eventBus = eventBus;
    }

    /**
     * 使用默认进程监督器
     */
    public PluginHost(SupervisorConfig config, EventBus eventBus) {
        this(new ProcessSupervisorProvider(config, eventBus), eventBus);
    }

    /**
     * 使用默认进程监督器，配置取自类路径上的 hookvisor.yml
     */
    public PluginHost(EventBus eventBus) {
        this(ProcessSupervisorProvider.fromClasspath(eventBus), eventBus);
    }

    // ==================== 激活 / 停用 ====================

    /**
     * 启动插件，阻塞至插件可用
     *
     * @return 插件的钩子代理
     */
    public PluginHooks activate(BundleDescriptor bundle, PluginApi api) {
        String pluginId = bundle.getId();
        registryLock.lock();
        try {
            if (supervisors.containsKey(pluginId)) {
                throw new PluginException("Plugin already active: " + pluginId);
            }
            log.info("[{}] Activating plugin", pluginId);

            Supervisor supervisor = supervisorProvider.create(bundle);
            supervisor.start(api);
            supervisors.put(pluginId, supervisor);

            log.info("[{}] Plugin activated", pluginId);
            return supervisor.hooks();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * 通知插件停用并停止进程
     */
    public void deactivate(String pluginId) {
        registryLock.lock();
        try {
            Supervisor supervisor = supervisors.remove(pluginId);
            if (supervisor == null) {
                throw new PluginNotFoundException(pluginId);
            }
            log.info("[{}] Deactivating plugin", pluginId);

            try {
                supervisor.hooks().onDeactivate();
            } catch (PluginException e) {
                // 插件拒绝或已崩溃都不影响停止
                log.warn("[{}] onDeactivate failed: {}", pluginId, e.getMessage());
            }
            try {
                supervisor.stop();
            } finally {
                if (eventBus != null) {
                    eventBus.unsubscribeAll(pluginId);
                }
            }
            log.info("[{}] Plugin deactivated", pluginId);
        } finally {
            registryLock.unlock();
        }
    }

    // ==================== 查询 ====================

    /**
     * @throws PluginNotFoundException 插件未激活
     */
    public PluginHooks hooks(String pluginId) {
        Supervisor supervisor = supervisors.get(pluginId);
        if (supervisor == null) {
            throw new PluginNotFoundException(pluginId);
        }
        return supervisor.hooks();
    }

    public Supervisor getSupervisor(String pluginId) {
        return supervisors.get(pluginId);
    }

    public boolean isActive(String pluginId) {
        return supervisors.containsKey(pluginId);
    }

    public Set<String> getActivePluginIds() {
        return Collections.unmodifiableSet(new TreeSet<>(supervisors.keySet()));
    }

    // ==================== 全局停止 ====================

    /**
     * 停止所有插件，单个插件失败不影响其余插件
     */
    public void shutdown() {
        log.info("Shutting down PluginHost...");
        registryLock.lock();
        try {
            for (Supervisor supervisor : supervisors.values()) {
                try {
                    supervisor.stop();
                } catch (Exception e) {
                    log.error("[{}] Error stopping plugin", supervisor.getPluginId(), e);
                }
            }
            supervisors.clear();
        } finally {
            registryLock.unlock();
        }
        log.info("PluginHost shutdown complete.");
    }
}
