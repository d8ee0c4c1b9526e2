package com.lingshield.core.audit;

public enum ExportFormat {
    JSON,
    CSV,
    XML
}
