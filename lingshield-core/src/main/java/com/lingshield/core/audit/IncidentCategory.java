package com.lingshield.core.audit;

public enum IncidentCategory {
    SECURITY,
    COMPLIANCE,
    OPERATIONAL,
    PRIVACY,
    AVAILABILITY;

    public static IncidentCategory of(SecurityEventType type) {
        switch (type) {
            case DATA_EXFILTRATION:
            case DATA_ACCESS:
                return PRIVACY;
            case COMPLIANCE_VIOLATION:
                return COMPLIANCE;
            case RUNTIME_VIOLATION:
                return OPERATIONAL;
            default:
                return SECURITY;
        }
    }
}
