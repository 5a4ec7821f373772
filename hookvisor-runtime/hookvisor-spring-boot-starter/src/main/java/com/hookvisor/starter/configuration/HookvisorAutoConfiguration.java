package com.hookvisor.starter.configuration;

import com.hookvisor.core.event.EventBus;
import com.hookvisor.core.host.PluginHost;
import com.hookvisor.core.spi.SupervisorProvider;
import com.hookvisor.core.supervisor.ProcessSupervisorProvider;
import com.hookvisor.core.supervisor.SupervisorConfig;
import com.hookvisor.starter.config.HookvisorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(HookvisorProperties.class)
@ConditionalOnProperty(prefix = "hookvisor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HookvisorAutoConfiguration {

    // 1. 监督器配置
    @Bean
    @ConditionalOnMissingBean
    public SupervisorConfig supervisorConfig(HookvisorProperties properties) {
        SupervisorConfig config = properties.toSupervisorConfig();
        log.info("HookVisor {}", config);
        return config;
    }

    // 2. 事件总线，宿主可自行提供
    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus() {
        return new EventBus();
    }

    // 3. 监督器工厂，默认每个插件一个进程
    @Bean
    @ConditionalOnMissingBean
    public SupervisorProvider supervisorProvider(SupervisorConfig supervisorConfig, EventBus eventBus) {
        return new ProcessSupervisorProvider(supervisorConfig, eventBus);
    }

    // 4. 插件宿主，容器关闭时停止所有插件进程
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public PluginHost pluginHost(SupervisorProvider supervisorProvider, EventBus eventBus) {
        return new PluginHost(supervisorProvider, eventBus);
    }
}
