package com.lingshield.core.audit;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class ThreatIndicator {

    @NonNull
    @Builder.Default
    String id = UUID.randomUUID().toString();

    @NonNull
    IndicatorType type;

    @NonNull
    String value;

    String description;

    /**
     * 置信度 0..1
     */
    @Builder.Default
    double confidence = 1.0;

    String source;

    @Builder.Default
    Instant firstSeen = Instant.now();

    @Builder.Default
    boolean active = true;
}
