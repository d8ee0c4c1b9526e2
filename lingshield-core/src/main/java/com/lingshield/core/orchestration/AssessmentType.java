package com.lingshield.core.orchestration;

public enum AssessmentType {
    INSTALLATION,
    /**
     * 安装流程内部故障，按拒绝记录
     */
    FAILED_INSTALLATION
}
