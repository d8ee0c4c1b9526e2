package com.lingshield.core.analysis.source;

import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.VulnerabilityType;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * 已知反模式的正则目录
 */
public enum VulnerabilityPattern {

    HARD_CODED_CREDENTIAL(VulnerabilityType.HARD_CODED_SECRET, Severity.HIGH,
            "(?i)\\b(password|passwd|pwd|secret|api[_-]?key|access[_-]?token|auth[_-]?token|client[_-]?secret)\\b\\s*[:=]\\s*[\"'][^\"'\\s$]{4,}[\"']",
            "Hard-coded credential",
            "Load credentials from a secret store or environment-provided configuration"),

    PRIVATE_KEY_MATERIAL(VulnerabilityType.HARD_CODED_SECRET, Severity.CRITICAL,
            "-----BEGIN (RSA |EC |DSA |OPENSSH |ENCRYPTED )?PRIVATE KEY-----",
            "Embedded private key",
            "Remove the key from the plugin and rotate it"),

    CLOUD_ACCESS_KEY(VulnerabilityType.HARD_CODED_SECRET, Severity.HIGH,
            "\\bAKIA[0-9A-Z]{16}\\b",
            "Cloud access key id",
            "Revoke the key and inject credentials at runtime"),

    DYNAMIC_EVALUATION(VulnerabilityType.CODE_INJECTION, Severity.CRITICAL,
            "(?<![\\w.$])eval\\s*\\(|new\\s+Function\\s*\\(",
            "Dynamic code evaluation",
            "Never evaluate strings as code; use a parser or a fixed dispatch table",
            "js", "ts", "py", "sh"),

    SCRIPT_ENGINE_EVALUATION(VulnerabilityType.CODE_INJECTION, Severity.HIGH,
            "\\.eval\\s*\\(",
            "Script engine evaluation",
            "Restrict script evaluation to trusted, static scripts",
            "java", "kt", "groovy"),

    COMMAND_EXECUTION(VulnerabilityType.COMMAND_INJECTION, Severity.HIGH,
            "Runtime\\.getRuntime\\(\\)\\s*\\.exec\\s*\\(|new\\s+ProcessBuilder\\s*\\(|child_process|\\bexecSync\\s*\\(|\\bos\\.system\\s*\\(",
            "Operating system command execution",
            "Avoid spawning processes; if unavoidable, use a fixed executable and validated arguments"),

    SQL_CONCATENATION(VulnerabilityType.SQL_INJECTION, Severity.HIGH,
            "(?i)[\"'](SELECT|INSERT|UPDATE|DELETE)\\b[^\"']*[\"']\\s*\\+",
            "SQL built by string concatenation",
            "Use parameterized queries"),

    UNSAFE_DESERIALIZATION(VulnerabilityType.UNSAFE_DESERIALIZATION, Severity.HIGH,
            "new\\s+ObjectInputStream\\s*\\(|new\\s+XMLDecoder\\s*\\(|\\.readObject\\s*\\(\\s*\\)",
            "Java native deserialization",
            "Deserialize with an allow-list filter or use a data-only format such as JSON"),

    WEAK_HASH(VulnerabilityType.WEAK_CRYPTOGRAPHY, Severity.MEDIUM,
            "(?i)(getInstance|createHash)\\s*\\(\\s*[\"'](MD5|MD2|SHA-?1)[\"']",
            "Weak hash algorithm",
            "Use SHA-256 or stronger"),

    WEAK_CIPHER(VulnerabilityType.WEAK_CRYPTOGRAPHY, Severity.MEDIUM,
            "(?i)getInstance\\s*\\(\\s*\"(DES|DESede|RC4|RC2|Blowfish|[^\"]*/ECB/[^\"]*)\"",
            "Weak cipher or mode",
            "Use AES-GCM or ChaCha20-Poly1305"),

    INSECURE_RANDOM(VulnerabilityType.INSECURE_RANDOM, Severity.LOW,
            "new\\s+Random\\s*\\(|Math\\.random\\s*\\(",
            "Non-cryptographic random generator",
            "Use SecureRandom for security-sensitive values"),

    TLS_VERIFICATION_DISABLED(VulnerabilityType.INSECURE_CONFIGURATION, Severity.HIGH,
            "setHostnameVerifier|ALLOW_ALL_HOSTNAME_VERIFIER|NoopHostnameVerifier|TrustAllStrategy|rejectUnauthorized\\s*:\\s*false",
            "TLS verification disabled",
            "Keep certificate and hostname verification enabled"),

    PATH_TRAVERSAL_LITERAL(VulnerabilityType.PATH_TRAVERSAL, Severity.MEDIUM,
            "[\"'][^\"'\\n]*\\.\\.[/\\\\][^\"'\\n]*[\"']",
            "Relative parent path literal",
            "Resolve paths against the plugin workspace and reject parent references");

    private final VulnerabilityType type;
    private final Severity severity;
    private final Pattern pattern;
    private final String title;
    private final String remediation;
    // 为空表示适用于所有源码类型
    private final Set<String> extensions;

    VulnerabilityPattern(VulnerabilityType type, Severity severity, String regex, String title, String remediation,
                         String... extensions) {
        this.type = type;
        this.severity = severity;
        this.pattern = Pattern.compile(regex);
        this.title = title;
        this.remediation = remediation;
        this.extensions = Set.of(extensions);
    }

    public boolean appliesTo(String extension) {
        return extensions.isEmpty() || extensions.contains(extension);
    }

    public VulnerabilityType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getTitle() {
        return title;
    }

    public String getRemediation() {
        return remediation;
    }
}
