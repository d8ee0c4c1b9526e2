package com.lingshield.core.framework;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 安全策略（不可变）
 * <p>
 * 沙箱创建时按策略生成配置快照，策略更新只影响之后创建的沙箱。
 */
@Value
@Builder(toBuilder = true)
public class SecurityPolicy {

    public static final String DEFAULT_POLICY_ID = "default-security-policy";

    @NonNull
    String id;

    String name;

    /**
     * 每次更新递增
     */
    @Builder.Default
    int version = 1;

    String description;

    /**
     * 允许插件使用的权限，支持 storage.* 与 *
     */
    @Singular
    Set<String> permissions;

    @NonNull
    @Builder.Default
    NetworkPolicy network = NetworkPolicy.builder().build();

    @NonNull
    @Builder.Default
    FilesystemPolicy filesystem = FilesystemPolicy.builder().build();

    @NonNull
    @Builder.Default
    ExecutionPolicy execution = ExecutionPolicy.builder().build();

    @NonNull
    @Builder.Default
    DataAccessPolicy dataAccess = DataAccessPolicy.builder().build();

    // ==================== 默认策略 ====================

    public static SecurityPolicy defaultPolicy() {
        return SecurityPolicy.builder()
                .id(DEFAULT_POLICY_ID)
                .name("Default Security Policy")
                .description("Baseline policy applied to plugins without a dedicated policy")
                .permission("storage.read")
                .permission("network.https")
                .network(NetworkPolicy.builder()
                        .allowedHost("api.example.com")
                        .allowedHost("cdn.example.com")
                        .blockedHost("0.0.0.0/8")
                        .blockedHost("169.254.0.0/16")
                        .allowedPort(443)
                        .allowedPort(80)
                        .maxConnections(10)
                        .build())
                .filesystem(FilesystemPolicy.builder()
                        .allowedPath("/tmp/plugin-storage")
                        .allowedPath("/var/log/plugin")
                        .blockedPath("/etc")
                        .blockedPath("/usr/bin")
                        .blockedPath("/root")
                        .blockedPath("/home")
                        .build())
                .build();
    }

    // ==================== 分段 ====================

    @Value
    @Builder(toBuilder = true)
    public static class NetworkPolicy {
        @Singular
        List<String> allowedHosts;
        @Singular
        List<String> blockedHosts;
        @Singular
        Set<Integer> allowedPorts;
        @Builder.Default
        int maxConnections = 10;
    }

    @Value
    @Builder(toBuilder = true)
    public static class FilesystemPolicy {
        /**
         * 可读写路径
         */
        @Singular
        List<String> allowedPaths;
        @Singular
        List<String> blockedPaths;
        @Builder.Default
        long maxFileSizeBytes = 100L * 1024 * 1024;
        @Builder.Default
        long maxDiskUsageBytes = 1024L * 1024 * 1024;
    }

    @Value
    @Builder(toBuilder = true)
    public static class ExecutionPolicy {
        @Builder.Default
        long maxCpuTimeMs = 300_000;
        @Builder.Default
        long maxMemoryBytes = 512L * 1024 * 1024;
        @Builder.Default
        int maxProcesses = 5;
        /**
         * 允许启动的可执行文件名，为空表示禁止派生进程
         */
        @Singular
        Set<String> allowedExecutables;
    }

    @Value
    @Builder(toBuilder = true)
    public static class DataAccessPolicy {
        /**
         * 为空表示不限制
         */
        @Singular
        Set<String> allowedDatabases;
        @Singular
        Set<String> allowedTables;
        @Builder.Default
        long maxQueryTimeMs = 30_000;
        @Builder.Default
        long maxResultSizeBytes = 10L * 1024 * 1024;
    }
}
