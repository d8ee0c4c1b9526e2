package com.lingshield.api.event;

import java.time.Instant;

/**
 * 安全通知事件标记接口
 */
public interface ShieldEvent {

    /**
     * 事件发生时间
     */
    Instant occurredAt();
}
