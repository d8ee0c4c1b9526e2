package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 可疑行为检测，与逐次操作监控相互独立
 * <ul>
 * <li>行为模式：窗口内被拒绝的操作达到阈值</li>
 * <li>攻击特征：操作目标与参数中的已知攻击载荷</li>
 * <li>数据外泄：出站流量、目标主机数量，或读取敏感文件后向外发送</li>
 * </ul>
 */
@Slf4j
class ThreatDetector {

    static final String BEHAVIOR = "behavior";
    static final String SIGNATURE = "signature";
    static final String EXFILTRATION = "exfiltration";

    private static final List<String> SENSITIVE_PATHS = List.of(
            "/etc/passwd", "/etc/shadow", "/.ssh/", "/.aws/credentials", "/.kube/config", "/.gnupg/", ".env");

    private final LingShieldConfig.ThreatDetection config;
    private final Clock clock;

    ThreatDetector(LingShieldConfig.ThreatDetection config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    List<SecurityViolation> detect(String pluginId, String sandboxId, ActivityLog activity) {
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofMillis(config.getBehaviorWindowMs()));
        List<SecurityViolation> findings = new ArrayList<>();
        analyzeBehavior(pluginId, sandboxId, activity, windowStart, findings);
        checkAttackSignatures(pluginId, sandboxId, activity, findings);
        checkExfiltration(pluginId, sandboxId, activity, windowStart, findings);
        if (!findings.isEmpty()) {
            log.warn("[{}] Threat detection produced {} finding(s)", sandboxId, findings.size());
        }
        return findings;
    }

    private void analyzeBehavior(String pluginId, String sandboxId, ActivityLog activity, Instant since,
                                 List<SecurityViolation> out) {
        List<ActivityLog.Entry> denied = activity.pending(BEHAVIOR, since).stream()
                .filter(e -> !e.allowed())
                .collect(Collectors.toList());
        if (denied.size() < config.getDeniedOperationBurst()) {
            return;
        }
        Set<OperationType> kinds = EnumSet.noneOf(OperationType.class);
        denied.forEach(e -> kinds.add(e.operation().getType()));
        out.add(finding(pluginId, sandboxId, ViolationType.MALICIOUS_BEHAVIOR, Severity.HIGH,
                "Suspicious behavior pattern: " + denied.size() + " denied operations within "
                        + config.getBehaviorWindowMs() + " ms")
                .detail("deniedOperations", denied.size())
                .detail("operationTypes", kinds.toString())
                .build());
        activity.advance(BEHAVIOR, last(denied));
    }

    private void checkAttackSignatures(String pluginId, String sandboxId, ActivityLog activity,
                                       List<SecurityViolation> out) {
        List<ActivityLog.Entry> pending = activity.pending(SIGNATURE, Instant.MIN);
        if (pending.isEmpty()) {
            return;
        }
        Set<AttackSignature> matched = EnumSet.noneOf(AttackSignature.class);
        for (ActivityLog.Entry entry : pending) {
            List<String> texts = new ArrayList<>();
            texts.add(entry.operation().getTarget());
            entry.operation().getArguments().values().forEach(v -> texts.add(String.valueOf(v)));
            for (AttackSignature signature : AttackSignature.values()) {
                if (texts.stream().anyMatch(signature::matches)) {
                    matched.add(signature);
                }
            }
        }
        activity.advance(SIGNATURE, last(pending));
        if (!matched.isEmpty()) {
            out.add(finding(pluginId, sandboxId, ViolationType.ATTACK_SIGNATURE, Severity.CRITICAL,
                    "Attack pattern detected: " + matched.stream().map(Enum::name).collect(Collectors.joining(", ")))
                    .detail("signatures", matched.toString())
                    .build());
        }
    }

    private void checkExfiltration(String pluginId, String sandboxId, ActivityLog activity, Instant since,
                                   List<SecurityViolation> out) {
        List<ActivityLog.Entry> pending = activity.pending(EXFILTRATION, since);
        long outbound = 0;
        Set<String> hosts = new HashSet<>();
        boolean sensitiveRead = false;
        String reason = null;
        for (ActivityLog.Entry entry : pending) {
            PluginOperation op = entry.operation();
            if (op.getType() == OperationType.FILE_READ && isSensitive(op.getTarget())) {
                sensitiveRead = true;
            } else if (op.getType() == OperationType.NETWORK_CONNECT) {
                outbound += Math.max(0, op.getBytes());
                hosts.add(op.getTarget().toLowerCase(Locale.ROOT));
                if (sensitiveRead && op.getBytes() > 0) {
                    reason = "sensitive file read followed by outbound transfer to " + op.getTarget();
                }
            }
        }
        if (reason == null && outbound > config.getExfiltrationBytes()) {
            reason = "outbound volume " + outbound + " bytes exceeds " + config.getExfiltrationBytes();
        }
        if (reason == null && hosts.size() > config.getExfiltrationDistinctHosts()) {
            reason = hosts.size() + " distinct destination hosts";
        }
        if (reason == null) {
            return;
        }
        out.add(finding(pluginId, sandboxId, ViolationType.DATA_EXFILTRATION, Severity.CRITICAL,
                "Data exfiltration attempt detected: " + reason)
                .detail("outboundBytes", outbound)
                .detail("destinations", hosts.size())
                .build());
        activity.advance(EXFILTRATION, last(pending));
    }

    static boolean isSensitive(String path) {
        String p = path.replace('\\', '/');
        return SENSITIVE_PATHS.stream().anyMatch(p::contains);
    }

    private static long last(List<ActivityLog.Entry> entries) {
        return entries.get(entries.size() - 1).sequence();
    }

    private SecurityViolation.SecurityViolationBuilder finding(String pluginId, String sandboxId,
                                                               ViolationType type, Severity severity,
                                                               String description) {
        return SecurityViolation.builder()
                .type(type)
                .severity(severity)
                .description(description)
                .pluginId(pluginId)
                .sandboxId(sandboxId)
                .blocked(false)
                .source(ViolationMapper.SOURCE_FRAMEWORK)
                .timestamp(clock.instant());
    }
}
