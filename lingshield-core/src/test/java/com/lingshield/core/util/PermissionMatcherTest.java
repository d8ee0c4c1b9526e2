package com.lingshield.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PermissionMatcher 单元测试")
class PermissionMatcherTest {

    @Test
    @DisplayName("支持精确、全局与前缀通配")
    void wildcards() {
        assertTrue(PermissionMatcher.grants(List.of("storage.*"), "storage.read"));
        assertTrue(PermissionMatcher.grants(List.of("*"), "network.https"));
        assertTrue(PermissionMatcher.grants(List.of("network.https"), "network.https"));
        assertFalse(PermissionMatcher.grants(List.of("storage.*"), "network.https"));
        assertFalse(PermissionMatcher.grants(List.of("storage.read"), "storage.write"));
        assertFalse(PermissionMatcher.grants(List.of(), "storage.read"));
    }
}
