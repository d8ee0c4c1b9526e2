package com.lingshield.core.audit;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * 突发异常检测
 * <p>
 * 以 (插件, 类型) 为维度，比较检测窗口内的事件数与基线期的平均速率。
 * 窗口内事件数低于突发下限时得分为 0。
 */
class AnomalyDetector {

    private final Duration window;
    private final Duration baseline;
    private final int burstSize;

    AnomalyDetector(Duration window, Duration baseline, int burstSize) {
        this.window = window;
        this.baseline = baseline;
        this.burstSize = burstSize;
    }

    /**
     * @return 0..1 的异常分数
     */
    double score(SecurityEvent event, Collection<SecurityEvent> history) {
        if (event.getPluginId() == null) {
            return 0;
        }
        Instant now = event.getTimestamp();
        Instant windowStart = now.minus(window);
        Instant baselineStart = now.minus(baseline);
        long observed = 0;
        long baselineCount = 0;
        for (SecurityEvent e : history) {
            if (e.getType() != event.getType() || !Objects.equals(e.getPluginId(), event.getPluginId())) {
                continue;
            }
            Instant t = e.getTimestamp();
            if (t.isAfter(now)) {
                continue;
            }
            if (!t.isBefore(windowStart)) {
                observed++;
            } else if (!t.isBefore(baselineStart)) {
                baselineCount++;
            }
        }
        if (observed < burstSize) {
            return 0;
        }
        long baselineSpanMs = Math.max(1, baseline.toMillis() - window.toMillis());
        double expected = baselineCount * (double) window.toMillis() / baselineSpanMs;
        double score = 1.0 - (expected + 1.0) / observed;
        return Math.max(0, Math.min(1, score));
    }
}
