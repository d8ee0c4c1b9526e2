package com.lingshield.api.event;

/**
 * 安全通知监听器
 * <p>
 * 监听器在发布线程中同步执行，按注册顺序依次投递。
 *
 * @param <E> 关注的事件类型
 */
@FunctionalInterface
public interface ShieldEventListener<E extends ShieldEvent> {

    void onEvent(E event);
}
