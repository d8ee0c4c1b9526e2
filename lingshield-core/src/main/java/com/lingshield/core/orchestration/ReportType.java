package com.lingshield.core.orchestration;

public enum ReportType {
    VULNERABILITY,
    COMPLIANCE,
    INCIDENT,
    TREND,
    EXECUTIVE
}
