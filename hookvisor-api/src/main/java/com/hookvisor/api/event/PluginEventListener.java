package com.hookvisor.api.event;

@FunctionalInterface
public interface PluginEventListener<E extends PluginEvent> {

    void onEvent(E event);
}
