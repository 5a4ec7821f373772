package com.hookvisor.core.event;

import com.hookvisor.api.event.PluginEvent;
import com.hookvisor.api.event.PluginEventListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 宿主事件总线
 * <p>
 * 同步投递。订阅某个事件类型也会收到它的子类型事件，
 * 例如订阅 {@code PluginLifecycleEvent} 可以收到全部生命周期事件。
 */
@Slf4j
public class EventBus {

    private final Map<Class<?>, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

    @Value
    private static class Subscription {
        String ownerId;
        PluginEventListener<? extends PluginEvent> listener;
    }

    public <E extends PluginEvent> void subscribe(String ownerId, Class<E> eventType, PluginEventListener<E> listener) {
        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(new Subscription(ownerId, listener));
        log.debug("{} subscribed to {}", ownerId, eventType.getSimpleName());
    }

    /**
     * 移除某订阅方的全部监听器，插件停用时调用
     */
    public void unsubscribeAll(String ownerId) {
        int removed = 0;
        for (List<Subscription> list : subscriptions.values()) {
            int before = list.size();
            list.removeIf(s -> s.getOwnerId().equals(ownerId));
            removed += before - list.size();
        }
        if (removed > 0) {
            log.info("Removed {} event listener(s) of {}", removed, ownerId);
        }
    }

    /**
     * 先投递给具体类型的监听器，再沿父类向上。
     * 监听器抛出的运行时异常直接传播给发布方，后续监听器不再收到该事件。
     */
    public <E extends PluginEvent> void publish(E event) {
        for (Class<?> type = event.getClass(); type != null && PluginEvent.class.isAssignableFrom(type);
             type = type.getSuperclass()) {
            dispatch(type, event);
        }
    }

    private <E extends PluginEvent> void dispatch(Class<?> type, E event) {
        List<Subscription> list = subscriptions.get(type);
        if (list == null) {
            return;
        }
        for (Subscription subscription : list) {
            @SuppressWarnings("unchecked")
            PluginEventListener<E> listener = (PluginEventListener<E>) subscription.getListener();
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener of {} failed on {}: {}", subscription.getOwnerId(),
                        event.getClass().getSimpleName(), e.getMessage());
                throw e;
            }
        }
    }

    public boolean hasSubscribers(Class<? extends PluginEvent> eventType) {
        List<Subscription> list = subscriptions.get(eventType);
        return list != null && !list.isEmpty();
    }
}
