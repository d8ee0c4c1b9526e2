package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.signature.PluginManifest;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("执行前策略检查")
class PolicyEvaluatorTest {

    private static final long MB = 1024L * 1024;

    private VulnerableDependencyCatalog catalog;
    private PolicyEvaluator evaluator;
    private SecurityPolicy policy;

    @BeforeEach
    void setUp() {
        catalog = VulnerableDependencyCatalog.loadDefault();
        evaluator = new PolicyEvaluator(catalog);
        policy = SecurityPolicy.defaultPolicy();
    }

    private static PluginManifest manifest() {
        PluginManifest manifest = new PluginManifest();
        manifest.setId("demo-plugin");
        manifest.setVersion("1.0.0");
        return manifest;
    }

    @Nested
    @DisplayName("漏洞依赖清单")
    class CatalogTests {

        @Test
        @DisplayName("比较式版本范围")
        void comparisonRange() {
            assertEquals(Severity.CRITICAL,
                    catalog.find("org.apache.logging.log4j:log4j-core", "2.14.1").orElseThrow().getSeverity());
            assertTrue(catalog.find("org.apache.logging.log4j:log4j-core", "2.17.1").isEmpty());
            assertTrue(catalog.find("commons-collections:commons-collections", "3.2.1").isPresent());
            assertTrue(catalog.find("commons-collections:commons-collections", "3.2.2").isEmpty());
        }

        @Test
        @DisplayName("npm 风格的版本前缀会被去掉")
        void versionPrefixes() {
            assertEquals("4.17.20", VulnerableDependencyCatalog.normalize("^4.17.20"));
            assertEquals("1.2.3", VulnerableDependencyCatalog.normalize("v1.2.3-SNAPSHOT"));
            assertTrue(catalog.find("lodash", "~4.17.20").isPresent());
        }

        @Test
        @DisplayName("精确版本与通配")
        void exactAndWildcard() {
            assertTrue(catalog.find("event-stream", "3.3.6").isPresent());
            assertTrue(catalog.find("event-stream", "3.3.5").isEmpty());
            assertTrue(VulnerableDependencyCatalog.matches("1.4.*", "1.4.2"));
            assertFalse(VulnerableDependencyCatalog.matches("1.4.*", "1.5.0"));
            assertTrue(VulnerableDependencyCatalog.matches("*", "0.0.1"));
        }

        @Test
        @DisplayName("版本号按数值逐段比较")
        void numericComparison() {
            assertTrue(VulnerableDependencyCatalog.compareVersions("2.9.10.8", "2.9.10") > 0);
            assertTrue(VulnerableDependencyCatalog.compareVersions("2.10", "2.9") > 0);
            assertEquals(0, VulnerableDependencyCatalog.compareVersions("2.0", "2.0.0"));
        }

        @Test
        @DisplayName("缺少 advisories 节点时为空清单")
        void missingAdvisories() {
            VulnerableDependencyCatalog empty = VulnerableDependencyCatalog.load(
                    new ByteArrayInputStream("other: 1\n".getBytes(StandardCharsets.UTF_8)));

            assertTrue(empty.advisories().isEmpty());
        }
    }

    @Nested
    @DisplayName("清单检查")
    class ManifestTests {

        @Test
        @DisplayName("无清单时不产生违规")
        void nullManifest() {
            assertTrue(evaluator.evaluate("demo-plugin", null, policy).isEmpty());
        }

        @Test
        @DisplayName("策略内的权限与资源不产生违规")
        void compliantManifest() {
            PluginManifest manifest = manifest();
            manifest.setPermissions(List.of("storage.read", "network.https"));
            manifest.getResources().setMemoryBytes(256 * MB);

            assertTrue(evaluator.evaluate("demo-plugin", manifest, policy).isEmpty());
        }

        @Test
        @DisplayName("未授予的普通权限为 MEDIUM，特权权限视为提权")
        void permissions() {
            PluginManifest manifest = manifest();
            manifest.setPermissions(List.of("storage.write", "system.exec"));

            List<SecurityViolation> violations = evaluator.evaluate("demo-plugin", manifest, policy);

            assertEquals(2, violations.size());
            assertEquals(ViolationType.PERMISSION_DENIED, violations.get(0).getType());
            assertEquals(Severity.MEDIUM, violations.get(0).getSeverity());
            assertEquals(ViolationType.PRIVILEGE_ESCALATION, violations.get(1).getType());
            assertEquals(Severity.HIGH, violations.get(1).getSeverity());
            assertTrue(violations.get(1).isBlocked());
            assertEquals(ViolationMapper.SOURCE_FRAMEWORK, violations.get(1).getSource());
        }

        @Test
        @DisplayName("资源需求超出策略上限")
        void resources() {
            PluginManifest manifest = manifest();
            manifest.getResources().setMemoryBytes(1024 * MB);
            manifest.getResources().setProcesses(2);

            List<SecurityViolation> violations = evaluator.evaluate("demo-plugin", manifest, policy);

            assertEquals(1, violations.size());
            assertEquals(ViolationType.POLICY_VIOLATION, violations.get(0).getType());
            assertEquals("memoryBytes", violations.get(0).getDetails().get("resource"));
            assertEquals(512 * MB, violations.get(0).getDetails().get("limit"));
        }

        @Test
        @DisplayName("依赖命中公告时按公告级别报告")
        void dependencies() {
            PluginManifest manifest = manifest();
            manifest.getDependencies().put("minimist", "1.2.5");
            manifest.getDependencies().put("org.apache.logging.log4j:log4j-core", "2.14.1");
            manifest.getDependencies().put("com.google.guava:guava", "33.0.0");

            List<SecurityViolation> violations = evaluator.evaluate("demo-plugin", manifest, policy);

            assertEquals(2, violations.size());
            assertEquals(Severity.MEDIUM, violations.get(0).getSeverity());
            assertEquals(Severity.CRITICAL, violations.get(1).getSeverity());
            assertTrue(violations.get(1).getDescription().contains("CVE-2021-44228"));
        }
    }
}
