package com.lingshield.core.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SandboxConfig 单元测试")
class SandboxConfigTest {

    @Test
    @DisplayName("网络规则：黑名单网段优先，白名单支持通配")
    void networkRules() {
        SandboxConfig.NetworkConfig network = SandboxConfig.NetworkConfig.builder()
                .allowedHost("api.example.com")
                .allowedHost("*.cdn.example.com")
                .allowedHost("169.254.10.1")
                .blockedHost("169.254.0.0/16")
                .allowedPort(443)
                .build();

        assertTrue(network.isAllowed("api.example.com", 443));
        assertTrue(network.isAllowed("img.cdn.example.com", 443));
        assertFalse(network.isAllowed("api.example.com", 80));
        assertFalse(network.isAllowed("evil.com", 443));
        assertFalse(network.isAllowed("169.254.10.1", 443));
    }

    @Test
    @DisplayName("通配黑名单拒绝全部出站")
    void denyAllNetwork() {
        SandboxConfig.NetworkConfig network = SandboxConfig.NetworkConfig.builder()
                .allowedHost("api.example.com")
                .blockedHost("*")
                .build();

        assertFalse(network.isAllowed("api.example.com", 443));
        assertFalse(network.isAllowed("10.0.0.1", 80));
    }

    @Test
    @DisplayName("降级限额只减半 CPU、IO 与网络")
    void throttledLimits() {
        SandboxConfig.ResourceLimits limits = SandboxConfig.ResourceLimits.builder().build();
        SandboxConfig.ResourceLimits throttled = limits.throttled();

        assertEquals(limits.getCpuCores() / 2, throttled.getCpuCores());
        assertEquals(limits.getIoBytesPerSec() / 2, throttled.getIoBytesPerSec());
        assertEquals(limits.getNetworkBytesPerSec() / 2, throttled.getNetworkBytesPerSec());
        assertEquals(limits.getMemoryBytes(), throttled.getMemoryBytes());
    }

    @Test
    @DisplayName("文件规则：黑名单路径不可写")
    void filesystemRules() {
        SandboxConfig.FilesystemConfig fs = SandboxConfig.FilesystemConfig.builder()
                .writablePath("/tmp/plugin-storage")
                .blockedPath("/tmp/plugin-storage/secret")
                .build();

        assertTrue(fs.isWritable("/tmp/plugin-storage/data.json"));
        assertFalse(fs.isWritable("/tmp/plugin-storage/secret/key"));
        assertFalse(fs.isWritable("/tmp/plugin-storage-other"));
    }
}
