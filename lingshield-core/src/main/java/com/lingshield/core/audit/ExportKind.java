package com.lingshield.core.audit;

public enum ExportKind {
    EVENTS,
    INCIDENTS,
    METRICS,
    COMPLIANCE
}
