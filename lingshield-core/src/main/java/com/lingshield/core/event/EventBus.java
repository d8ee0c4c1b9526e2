package com.lingshield.core.event;

import com.lingshield.api.event.ShieldEvent;
import com.lingshield.api.event.ShieldEventListener;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 安全通知总线
 * <p>
 * 投递语义：在发布线程中同步执行，同一事件类型的监听器按注册顺序依次调用；
 * 单个监听器抛出的异常只记录日志，不影响后续监听器与发布方。
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends ShieldEvent>, List<ListenerWrapper>> listeners =
            new ConcurrentHashMap<>();

    // 包装器，记录监听器归属的订阅方
    @Value
    private static class ListenerWrapper {
        String ownerId;
        ShieldEventListener<? extends ShieldEvent> listener;
    }

    /**
     * 注册监听器
     */
    public <E extends ShieldEvent> void subscribe(String ownerId, Class<E> eventType, ShieldEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(new ListenerWrapper(ownerId, listener));
    }

    /**
     * 移除订阅方注册的所有监听器
     */
    public void unsubscribeAll(String ownerId) {
        for (List<ListenerWrapper> list : listeners.values()) {
            list.removeIf(wrapper -> {
                boolean match = wrapper.getOwnerId().equals(ownerId);
                if (match) {
                    log.debug("[{}] Removed listener: {}", ownerId, wrapper.getListener().getClass().getName());
                }
                return match;
            });
        }
    }

    public <E extends ShieldEvent> void publish(E event) {
        List<ListenerWrapper> wrappers = listeners.get(event.getClass());
        if (wrappers == null) return;
        for (ListenerWrapper wrapper : wrappers) {
            try {
                @SuppressWarnings("unchecked")
                ShieldEventListener<E> castListener = (ShieldEventListener<E>) wrapper.getListener();
                castListener.onEvent(event);
            } catch (Exception e) {
                log.warn("[{}] Listener failed on {}: {}", wrapper.getOwnerId(),
                        event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
