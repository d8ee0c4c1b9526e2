package com.lingshield.core.audit;

import com.lingshield.api.exception.InvalidArgumentException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 报告统计区间（闭区间）
 */
public record ReportPeriod(Instant start, Instant end) {

    public ReportPeriod {
        InvalidArgumentException.requireNonNull(start, "start");
        InvalidArgumentException.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new InvalidArgumentException("end", end, "Period end must not precede start");
        }
    }

    public static ReportPeriod lastDays(Clock clock, int days) {
        Instant now = clock.instant();
        return new ReportPeriod(now.minus(Duration.ofDays(days)), now);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
