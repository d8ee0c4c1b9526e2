package com.lingshield.core.audit;

import java.util.EnumSet;
import java.util.Set;

/**
 * 事件单状态
 * <p>
 * OPEN → IN_PROGRESS → RESOLVED → CLOSED；
 * ESCALATED 仅对 CRITICAL 事件单开放，可从 OPEN 或 IN_PROGRESS 进入。
 * CLOSED 只能由 RESOLVED 到达。
 */
public enum IncidentStatus {
    OPEN,
    IN_PROGRESS,
    ESCALATED,
    RESOLVED,
    CLOSED;

    public Set<IncidentStatus> next() {
        switch (this) {
            case OPEN:
                return EnumSet.of(IN_PROGRESS, ESCALATED);
            case IN_PROGRESS:
                return EnumSet.of(RESOLVED, ESCALATED);
            case ESCALATED:
                return EnumSet.of(IN_PROGRESS, RESOLVED);
            case RESOLVED:
                // 重新打开
                return EnumSet.of(CLOSED, IN_PROGRESS);
            default:
                return EnumSet.noneOf(IncidentStatus.class);
        }
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return next().contains(target);
    }

    /**
     * 仍需处理
     */
    public boolean isActive() {
        return this == OPEN || this == IN_PROGRESS || this == ESCALATED;
    }
}
