package com.lingshield.core.audit.compliance;

public enum ControlStatus {
    COMPLIANT,
    PARTIALLY_COMPLIANT,
    NON_COMPLIANT,
    NOT_ASSESSED
}
