package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 事件单状态迁移非法
 */
public class IncidentTransitionException extends LingShieldException {

    private final String incidentId;

    public IncidentTransitionException(String incidentId, String message) {
        super(message);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
