package com.hookvisor.api.event;

import lombok.Getter;

@Getter
public abstract class AbstractPluginEvent implements PluginEvent {

    private final long timestamp;

    protected AbstractPluginEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + timestamp;
    }
}
