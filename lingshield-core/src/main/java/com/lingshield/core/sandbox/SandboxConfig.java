package com.lingshield.core.sandbox;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 沙箱配置（创建时确定，之后只读）
 */
@Value
@Builder(toBuilder = true)
public class SandboxConfig {

    @NonNull
    String pluginId;

    /**
     * 绑定的安全策略
     */
    String policyId;

    @NonNull
    @Builder.Default
    ResourceLimits limits = ResourceLimits.builder().build();

    @NonNull
    @Builder.Default
    NetworkConfig network = NetworkConfig.builder().build();

    @NonNull
    @Builder.Default
    FilesystemConfig filesystem = FilesystemConfig.builder().build();

    @NonNull
    @Builder.Default
    MonitoringConfig monitoring = MonitoringConfig.builder().build();

    @Builder.Default
    long executionTimeoutMs = 300_000;

    /**
     * 优雅停止等待时间，超时后强制终止
     */
    @Builder.Default
    long gracePeriodMs = 5000;

    /**
     * 工作目录的父目录，为空时使用系统临时目录
     */
    Path workspaceRoot;

    // ==================== 分段 ====================

    @Value
    @Builder(toBuilder = true)
    public static class ResourceLimits {
        @Builder.Default
        double cpuCores = 1.0;
        @Builder.Default
        long cpuTimeMs = 300_000;
        @Builder.Default
        long memoryBytes = 512L * 1024 * 1024;
        @Builder.Default
        long diskBytes = 1024L * 1024 * 1024;
        @Builder.Default
        long ioBytesPerSec = 10L * 1024 * 1024;
        @Builder.Default
        long networkBytesPerSec = 1024L * 1024;
        @Builder.Default
        int maxConnections = 10;
        @Builder.Default
        int maxProcesses = 5;

        /**
         * 降级后的限额：CPU、磁盘 IO、网络带宽减半
         */
        public ResourceLimits throttled() {
            return toBuilder()
                    .cpuCores(cpuCores / 2)
                    .ioBytesPerSec(ioBytesPerSec / 2)
                    .networkBytesPerSec(networkBytesPerSec / 2)
                    .build();
        }
    }

    @Value
    @Builder(toBuilder = true)
    public static class NetworkConfig {
        /**
         * 为空表示不限制目标主机；支持 *.example.com
         */
        @Singular
        List<String> allowedHosts;
        /**
         * 主机名、IPv4 CIDR，或 * 表示全部
         */
        @Singular
        List<String> blockedHosts;
        /**
         * 为空表示不限制端口
         */
        @Singular
        Set<Integer> allowedPorts;
        @Builder.Default
        int maxConnections = 10;

        public boolean isAllowed(String host, int port) {
            String target = host.toLowerCase(Locale.ROOT);
            for (String blocked : blockedHosts) {
                if (hostMatches(blocked, target)) {
                    return false;
                }
            }
            if (!allowedPorts.isEmpty() && !allowedPorts.contains(port)) {
                return false;
            }
            if (allowedHosts.isEmpty()) {
                return true;
            }
            return allowedHosts.stream().anyMatch(allowed -> hostMatches(allowed, target));
        }

        static boolean hostMatches(String rule, String host) {
            String r = rule.toLowerCase(Locale.ROOT);
            if (r.equals("*")) {
                return true;
            }
            if (r.contains("/")) {
                return Cidr.parse(r).contains(host);
            }
            if (r.startsWith("*.")) {
                return host.endsWith(r.substring(1));
            }
            return r.equals(host);
        }
    }

    @Value
    @Builder(toBuilder = true)
    public static class FilesystemConfig {
        @Singular
        List<String> readOnlyPaths;
        /**
         * 除工作目录外额外允许写入的路径
         */
        @Singular
        List<String> writablePaths;
        @Singular
        List<String> blockedPaths;
        @Builder.Default
        long maxFileSizeBytes = 100L * 1024 * 1024;

        public static FilesystemConfig defaults() {
            return FilesystemConfig.builder()
                    .readOnlyPath("/usr").readOnlyPath("/lib").readOnlyPath("/bin").readOnlyPath("/etc")
                    .build();
        }

        public boolean isBlocked(String path) {
            return blockedPaths.stream().anyMatch(p -> isUnder(path, p));
        }

        public boolean isWritable(String path) {
            return !isBlocked(path) && writablePaths.stream().anyMatch(p -> isUnder(path, p));
        }

        static boolean isUnder(String path, String root) {
            String normalizedRoot = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
            return path.equals(normalizedRoot) || path.startsWith(normalizedRoot + "/");
        }
    }

    @Value
    @Builder(toBuilder = true)
    public static class MonitoringConfig {
        @Builder.Default
        boolean enabled = true;
        @Builder.Default
        long intervalMs = 5000;
        /**
         * CPU 使用率告警阈值（百分比）
         */
        @Builder.Default
        double cpuPercentThreshold = 80;
        /**
         * 内存告警阈值（占限额的百分比）
         */
        @Builder.Default
        double memoryPercentThreshold = 80;
        @Builder.Default
        long errorCountThreshold = 10;
    }
}
