package com.lingshield.core.framework;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个沙箱的操作记录，供周期性威胁检测使用
 * <p>
 * 容量有界，超出后丢弃最旧的记录。各检测器通过水位线只处理尚未报告过的记录。
 */
class ActivityLog {

    static final int DEFAULT_CAPACITY = 1000;

    record Entry(long sequence, Instant timestamp, PluginOperation operation, boolean allowed) {
    }

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private final Map<String, Long> watermarks = new HashMap<>();
    private long sequence;

    ActivityLog() {
        this(DEFAULT_CAPACITY);
    }

    ActivityLog(int capacity) {
        this.capacity = capacity;
    }

    synchronized Entry record(PluginOperation operation, boolean allowed, Instant at) {
        Entry entry = new Entry(++sequence, at, operation, allowed);
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        return entry;
    }

    /**
     * 指定检测器水位线之后、且不早于 since 的记录
     */
    synchronized List<Entry> pending(String detector, Instant since) {
        long mark = watermarks.getOrDefault(detector, 0L);
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.sequence() > mark && !entry.timestamp().isBefore(since)) {
                result.add(entry);
            }
        }
        return result;
    }

    synchronized void advance(String detector, long sequence) {
        watermarks.merge(detector, sequence, Math::max);
    }

    synchronized int size() {
        return entries.size();
    }
}
