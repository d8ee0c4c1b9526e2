package com.lingshield.core.audit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 事件关联
 * <p>
 * 时间窗口内满足以下任一条件的事件归为一组：
 * 显式关联 ID 相同；或同一插件、同一安全相关类型。
 */
class EventCorrelator {

    private final Duration window;

    EventCorrelator(Duration window) {
        this.window = window;
    }

    /**
     * 关联分组键，不参与关联的事件返回空
     */
    Optional<String> groupKey(SecurityEvent event) {
        if (event.getCorrelationId() != null) {
            return Optional.of("cid:" + event.getCorrelationId());
        }
        if (event.getPluginId() != null && event.getType().isSecurityRelevant()) {
            return Optional.of("plugin:" + event.getPluginId() + ":" + event.getType());
        }
        return Optional.empty();
    }

    /**
     * 查找与新事件同组的窗口内事件（含自身），按记录顺序排列
     */
    List<SecurityEvent> correlate(SecurityEvent event, Collection<SecurityEvent> recent) {
        Optional<String> key = groupKey(event);
        if (key.isEmpty()) {
            return List.of(event);
        }
        Instant since = event.getTimestamp().minus(window);
        List<SecurityEvent> group = new ArrayList<>();
        for (SecurityEvent candidate : recent) {
            if (candidate.getTimestamp().isBefore(since) || candidate.getSequence() > event.getSequence()) {
                continue;
            }
            if (Objects.equals(groupKey(candidate).orElse(null), key.get())) {
                group.add(candidate);
            }
        }
        if (group.stream().noneMatch(e -> e.getId().equals(event.getId()))) {
            group.add(event);
        }
        return group;
    }

    Duration getWindow() {
        return window;
    }
}
