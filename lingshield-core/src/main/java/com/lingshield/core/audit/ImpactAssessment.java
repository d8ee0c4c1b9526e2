package com.lingshield.core.audit;

import com.lingshield.api.security.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 影响评估
 */
@Value
@Builder(toBuilder = true)
public class ImpactAssessment {

    public static final ImpactAssessment NONE = ImpactAssessment.builder().build();

    boolean dataExposed;

    @Singular("systemAffected")
    List<String> systemsAffected;

    int usersAffected;

    /**
     * 涉及数据量（字节）
     */
    long dataVolume;

    @Builder.Default
    Severity reputationImpact = Severity.LOW;

    @Singular("complianceImpact")
    List<String> complianceImpact;

    @Builder.Default
    Availability availabilityImpact = Availability.NONE;

    public enum Availability {
        NONE, MINOR, MAJOR, CRITICAL
    }
}
