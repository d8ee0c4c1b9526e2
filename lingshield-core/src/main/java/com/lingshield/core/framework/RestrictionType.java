package com.lingshield.core.framework;

public enum RestrictionType {
    NETWORK,
    FILESYSTEM,
    PROCESS,
    MEMORY,
    API,
    DATA
}
