package com.lingshield.core.sandbox;

import com.lingshield.core.spi.ResourceSample;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 沙箱运行指标
 * <p>
 * 计数器在沙箱存活期间单调累加，只随沙箱销毁而释放。
 */
public class SandboxMetrics {

    private volatile double cpuPercent;
    private volatile long memoryBytes;
    private volatile int openConnections;
    private volatile int processes;
    private volatile Instant lastSampleAt;

    private final AtomicLong peakMemoryBytes = new AtomicLong();
    private final AtomicLong cpuTimeMs = new AtomicLong();
    private final AtomicLong diskReadBytes = new AtomicLong();
    private final AtomicLong diskWriteBytes = new AtomicLong();
    private final AtomicLong networkInBytes = new AtomicLong();
    private final AtomicLong networkOutBytes = new AtomicLong();
    private final AtomicLong samples = new AtomicLong();
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong executionTimeMs = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong warnings = new AtomicLong();

    void record(ResourceSample sample) {
        cpuPercent = sample.cpuPercent();
        memoryBytes = sample.memoryBytes();
        openConnections = sample.openConnections();
        processes = sample.processes();
        peakMemoryBytes.accumulateAndGet(sample.memoryBytes(), Math::max);
        cpuTimeMs.addAndGet(Math.max(0, sample.cpuTimeMs()));
        diskReadBytes.addAndGet(Math.max(0, sample.diskReadBytes()));
        diskWriteBytes.addAndGet(Math.max(0, sample.diskWriteBytes()));
        networkInBytes.addAndGet(Math.max(0, sample.networkInBytes()));
        networkOutBytes.addAndGet(Math.max(0, sample.networkOutBytes()));
        samples.incrementAndGet();
        lastSampleAt = Instant.now();
    }

    void recordExecution(long durationMs, boolean success) {
        executions.incrementAndGet();
        executionTimeMs.addAndGet(durationMs);
        if (!success) {
            errors.incrementAndGet();
        }
    }

    void recordWarning() {
        warnings.incrementAndGet();
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public long getMemoryBytes() {
        return memoryBytes;
    }

    public long getErrors() {
        return errors.get();
    }

    public Snapshot snapshot() {
        return Snapshot.builder()
                .cpuPercent(cpuPercent)
                .memoryBytes(memoryBytes)
                .peakMemoryBytes(peakMemoryBytes.get())
                .cpuTimeMs(cpuTimeMs.get())
                .diskReadBytes(diskReadBytes.get())
                .diskWriteBytes(diskWriteBytes.get())
                .networkInBytes(networkInBytes.get())
                .networkOutBytes(networkOutBytes.get())
                .openConnections(openConnections)
                .processes(processes)
                .samples(samples.get())
                .executions(executions.get())
                .executionTimeMs(executionTimeMs.get())
                .errors(errors.get())
                .warnings(warnings.get())
                .lastSampleAt(lastSampleAt)
                .build();
    }

    /**
     * 指标快照（不可变）
     */
    @Value
    @Builder
    public static class Snapshot {
        double cpuPercent;
        long memoryBytes;
        long peakMemoryBytes;
        long cpuTimeMs;
        long diskReadBytes;
        long diskWriteBytes;
        long networkInBytes;
        long networkOutBytes;
        int openConnections;
        int processes;
        long samples;
        long executions;
        long executionTimeMs;
        long errors;
        long warnings;
        Instant lastSampleAt;
    }
}
