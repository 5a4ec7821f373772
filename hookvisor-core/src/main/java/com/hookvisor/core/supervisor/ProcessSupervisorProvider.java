package com.hookvisor.core.supervisor;

import com.hookvisor.api.config.BundleDescriptor;
import com.hookvisor.core.event.EventBus;
import com.hookvisor.core.spi.Supervisor;
import com.hookvisor.core.spi.SupervisorProvider;
import lombok.Getter;

/**
 * 默认监督器工厂：每个插件一个独立进程
 */
public class ProcessSupervisorProvider implements SupervisorProvider {

    @Getter
    private final SupervisorConfig config;
    private final EventBus eventBus;

    public ProcessSupervisorProvider(SupervisorConfig config, EventBus eventBus) {
        this.config = config;
        this.eventBus = eventBus;
    }

    /**
     * 配置取自类路径上的 hookvisor.yml，不存在时使用默认值
     */
    public static ProcessSupervisorProvider fromClasspath(EventBus eventBus) {
        return new ProcessSupervisorProvider(
                SupervisorConfigLoader.loadFromClasspath(ProcessSupervisorProvider.class.getClassLoader()), eventBus);
    }

    @Override
    public Supervisor create(BundleDescriptor bundle) {
        return new PluginSupervisor(bundle, config, eventBus);
    }
}
