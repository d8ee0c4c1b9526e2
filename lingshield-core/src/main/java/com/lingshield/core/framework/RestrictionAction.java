package com.lingshield.core.framework;

public enum RestrictionAction {
    ALLOW,
    DENY,
    LIMIT,
    MONITOR,
    QUARANTINE
}
