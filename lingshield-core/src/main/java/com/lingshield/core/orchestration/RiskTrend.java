package com.lingshield.core.orchestration;

/**
 * 与上一个等长区间相比的风险走向
 */
public enum RiskTrend {
    IMPROVING,
    STABLE,
    DEGRADING;

    static RiskTrend compare(int previousScore, int currentScore) {
        if (currentScore > previousScore) {
            return IMPROVING;
        }
        return currentScore < previousScore ? DEGRADING : STABLE;
    }
}
