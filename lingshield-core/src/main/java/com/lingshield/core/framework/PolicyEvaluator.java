package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.signature.PluginManifest;
import com.lingshield.core.util.PermissionMatcher;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 执行前的策略检查：依赖漏洞、权限声明、资源需求
 */
@Slf4j
class PolicyEvaluator {

    /**
     * 申请未授予的这类权限视为提权
     */
    private static final List<String> PRIVILEGED_PREFIXES = List.of("system.", "admin.", "security.", "process.");

    private final VulnerableDependencyCatalog dependencies;
    private final Clock clock;

    PolicyEvaluator(VulnerableDependencyCatalog dependencies) {
        this(dependencies, Clock.systemUTC());
    }

    PolicyEvaluator(VulnerableDependencyCatalog dependencies, Clock clock) {
        this.dependencies = dependencies;
        this.clock = clock;
    }

    List<SecurityViolation> evaluate(String pluginId, PluginManifest manifest, SecurityPolicy policy) {
        List<SecurityViolation> violations = new ArrayList<>();
        if (manifest == null) {
            return violations;
        }
        scanDependencies(pluginId, manifest, violations);
        validatePermissions(pluginId, manifest, policy, violations);
        validateResources(pluginId, manifest, policy, violations);
        log.debug("[{}] Policy {} evaluation produced {} violation(s)", pluginId, policy.getId(), violations.size());
        return violations;
    }

    private void scanDependencies(String pluginId, PluginManifest manifest, List<SecurityViolation> out) {
        for (Map.Entry<String, String> dependency : manifest.getDependencies().entrySet()) {
            Optional<VulnerableDependencyCatalog.Advisory> hit =
                    dependencies.find(dependency.getKey(), dependency.getValue());
            if (hit.isEmpty()) {
                continue;
            }
            VulnerableDependencyCatalog.Advisory advisory = hit.get();
            out.add(violation(pluginId, ViolationType.VULNERABLE_DEPENDENCY, advisory.getSeverity(),
                    "Vulnerable dependency " + dependency.getKey() + "@" + dependency.getValue()
                            + (advisory.getAdvisory() != null ? " (" + advisory.getAdvisory() + ")" : ""))
                    .detail("dependency", dependency.getKey())
                    .detail("version", dependency.getValue())
                    .detail("fixedIn", String.valueOf(advisory.getFixedIn()))
                    .build());
        }
    }

    private void validatePermissions(String pluginId, PluginManifest manifest, SecurityPolicy policy,
                                     List<SecurityViolation> out) {
        for (String permission : manifest.getPermissions()) {
            if (PermissionMatcher.grants(policy.getPermissions(), permission)) {
                continue;
            }
            boolean privileged = isPrivileged(permission);
            out.add(violation(pluginId,
                    privileged ? ViolationType.PRIVILEGE_ESCALATION : ViolationType.PERMISSION_DENIED,
                    privileged ? Severity.HIGH : Severity.MEDIUM,
                    "Permission " + permission + " is not granted by policy " + policy.getId())
                    .detail("permission", permission)
                    .build());
        }
    }

    private void validateResources(String pluginId, PluginManifest manifest, SecurityPolicy policy,
                                   List<SecurityViolation> out) {
        PluginManifest.Resources requested = manifest.getResources();
        if (requested == null) {
            return;
        }
        checkLimit(pluginId, "memoryBytes", requested.getMemoryBytes(), policy.getExecution().getMaxMemoryBytes(), out);
        checkLimit(pluginId, "cpuTimeMs", requested.getCpuTimeMs(), policy.getExecution().getMaxCpuTimeMs(), out);
        checkLimit(pluginId, "processes", requested.getProcesses(), policy.getExecution().getMaxProcesses(), out);
        checkLimit(pluginId, "diskBytes", requested.getDiskBytes(), policy.getFilesystem().getMaxDiskUsageBytes(), out);
        checkLimit(pluginId, "connections", requested.getConnections(), policy.getNetwork().getMaxConnections(), out);
    }

    private void checkLimit(String pluginId, String resource, long requested, long limit, List<SecurityViolation> out) {
        if (requested > limit) {
            out.add(violation(pluginId, ViolationType.POLICY_VIOLATION, Severity.MEDIUM,
                    "Requested " + resource + " " + requested + " exceeds policy limit " + limit)
                    .detail("resource", resource)
                    .detail("requested", requested)
                    .detail("limit", limit)
                    .build());
        }
    }

    static boolean isPrivileged(String permission) {
        return permission.equals("*") || PRIVILEGED_PREFIXES.stream().anyMatch(permission::startsWith);
    }

    private SecurityViolation.SecurityViolationBuilder violation(String pluginId, ViolationType type,
                                                                 Severity severity, String description) {
        return SecurityViolation.builder()
                .type(type)
                .severity(severity)
                .description(description)
                .pluginId(pluginId)
                .blocked(severity.isBlocking())
                .source(ViolationMapper.SOURCE_FRAMEWORK)
                .timestamp(clock.instant());
    }
}
