package com.lingshield.core.framework;

import lombok.Builder;
import lombok.Value;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 安全框架累计计数
 */
public class FrameworkMetrics {

    private final AtomicLong validations = new AtomicLong();
    private final AtomicLong validationsRejected = new AtomicLong();
    private final AtomicLong sandboxesCreated = new AtomicLong();
    private final AtomicLong operationsMonitored = new AtomicLong();
    private final AtomicLong operationsDenied = new AtomicLong();
    private final AtomicLong operationsThrottled = new AtomicLong();
    private final AtomicLong threatsDetected = new AtomicLong();
    private final AtomicLong violationsHandled = new AtomicLong();
    private final AtomicLong containments = new AtomicLong();

    void recordValidation(boolean valid) {
        validations.incrementAndGet();
        if (!valid) {
            validationsRejected.incrementAndGet();
        }
    }

    void recordSandboxCreated() {
        sandboxesCreated.incrementAndGet();
    }

    void recordOperation(MonitorResult result) {
        operationsMonitored.incrementAndGet();
        if (!result.allowed()) {
            operationsDenied.incrementAndGet();
        } else if (result.violation() != null) {
            operationsThrottled.incrementAndGet();
        }
    }

    void recordThreats(int count) {
        threatsDetected.addAndGet(count);
    }

    void recordViolation(boolean contained) {
        violationsHandled.incrementAndGet();
        if (contained) {
            containments.incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        return Snapshot.builder()
                .validations(validations.get())
                .validationsRejected(validationsRejected.get())
                .sandboxesCreated(sandboxesCreated.get())
                .operationsMonitored(operationsMonitored.get())
                .operationsDenied(operationsDenied.get())
                .operationsThrottled(operationsThrottled.get())
                .threatsDetected(threatsDetected.get())
                .violationsHandled(violationsHandled.get())
                .containments(containments.get())
                .build();
    }

    @Value
    @Builder
    public static class Snapshot {
        long validations;
        long validationsRejected;
        long sandboxesCreated;
        long operationsMonitored;
        long operationsDenied;
        long operationsThrottled;
        long threatsDetected;
        long violationsHandled;
        long containments;
    }
}
