package com.lingshield.core.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * LingShield 全局配置
 * <p>
 * 对应 lingshield.yml 的根节点。配置对象由宿主显式构造并传入各服务，不存在进程级单例。
 */
@Data
public class LingShieldConfig {

    private StaticAnalysis staticAnalysis = new StaticAnalysis();

    private SignatureVerification signatureVerification = new SignatureVerification();

    private RuntimeProtection runtimeProtection = new RuntimeProtection();

    private Audit audit = new Audit();

    private Compliance compliance = new Compliance();

    private ThreatDetection threatDetection = new ThreatDetection();

    private IncidentResponse incidentResponse = new IncidentResponse();

    /**
     * 新建沙箱时绑定的默认策略
     */
    private String defaultPolicyId = "default-security-policy";

    // ==================== 工厂方法 ====================

    /**
     * 默认配置
     */
    public static LingShieldConfig defaults() {
        return new LingShieldConfig();
    }

    /**
     * 开发环境配置：关闭严格模式，缩短采样周期
     */
    public static LingShieldConfig development() {
        LingShieldConfig config = new LingShieldConfig();
        config.getStaticAnalysis().setStrictMode(false);
        config.getRuntimeProtection().setMetricsIntervalMs(1000);
        config.getThreatDetection().setDetectionIntervalMs(5000);
        return config;
    }

    // ==================== 配置分段 ====================

    @Data
    public static class StaticAnalysis {
        private boolean enabled = true;
        private long timeoutMs = 300_000;
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private int maxDepth = 10;
        /**
         * 严格模式：评分低于 50 直接拒绝安装
         */
        private boolean strictMode = true;
        private boolean includeTests = false;
    }

    @Data
    public static class SignatureVerification {
        private boolean enabled = true;
        private boolean requireSignature = false;
        private long cacheTtlMs = 5 * 60 * 1000L;
        private int expiryWarningDays = 30;
        private int maxChainLength = 5;
        private String manifestName = "plugin.json";
    }

    @Data
    public static class RuntimeProtection {
        private boolean enabled = true;
        private boolean sandboxing = true;
        private long metricsIntervalMs = 5000;
        private long gracePeriodMs = 5000;
        private long executionTimeoutMs = 300_000;
        private String isolation = "in-process";
        /**
         * 进程隔离模式下的启动命令模板，支持 ${sandboxId} ${memoryLimitBytes} 等占位符
         */
        private List<String> launcherCommand = new ArrayList<>();
        /**
         * 沙箱工作目录的父目录，为空时使用系统临时目录
         */
        private String workspaceRoot;
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
        private int retentionDays = 365;
        /**
         * 过期事件与违规历史的清理周期
         */
        private long retentionIntervalMs = 3_600_000;
        private long correlationWindowMs = 300_000;
        private int correlationThreshold = 3;
        private double anomalyThreshold = 0.8;
        private long anomalyWindowMs = 60_000;
        private long anomalyBaselineMs = 3_600_000;
        private int anomalyBurstSize = 20;
    }

    @Data
    public static class Compliance {
        private List<String> frameworks = new ArrayList<>(Arrays.asList("ISO27001", "SOC2"));
        private int reviewIntervalDays = 90;
    }

    @Data
    public static class ThreatDetection {
        private boolean enabled = true;
        private long detectionIntervalMs = 30_000;
        private long behaviorWindowMs = 60_000;
        private int deniedOperationBurst = 5;
        private long exfiltrationBytes = 50L * 1024 * 1024;
        private int exfiltrationDistinctHosts = 10;
    }

    @Data
    public static class IncidentResponse {
        private boolean autoResponse = true;
        private int escalationThreshold = 3;
        private String escalationAssignee = "security-oncall";
    }
}
