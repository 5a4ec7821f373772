package com.hookvisor.core.spi;

import com.hookvisor.api.config.BundleDescriptor;

/**
 * 监督器工厂 SPI
 */
@FunctionalInterface
public interface SupervisorProvider {

    /**
     * 创建监督器，此时只做路径校验，不创建进程
     */
    Supervisor create(BundleDescriptor bundle);
}
