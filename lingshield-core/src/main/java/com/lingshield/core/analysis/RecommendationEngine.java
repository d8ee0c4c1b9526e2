package com.lingshield.core.analysis;

import com.lingshield.api.security.Severity;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 由发现与质量指标生成整改建议
 */
public class RecommendationEngine {

    private static final int REFACTOR_COMPLEXITY = 50;

    private static final Set<VulnerabilityType> PRIVILEGED = EnumSet.of(
            VulnerabilityType.DYNAMIC_CODE_LOADING, VulnerabilityType.NATIVE_CODE,
            VulnerabilityType.PRIVILEGE_ESCALATION, VulnerabilityType.DENIAL_OF_SERVICE);

    public List<SecurityRecommendation> recommend(List<SecurityVulnerability> findings, QualityMetrics metrics) {
        List<SecurityRecommendation> recommendations = new ArrayList<>();

        add(recommendations, findings, v -> v.getType().isInjection(), "input-validation",
                "Validate and sanitize untrusted input",
                "Untrusted data reaches sensitive operations.",
                "Validate input against an allow-list", "Use parameterized queries",
                "Never pass user input to process or script execution");
        add(recommendations, findings, v -> v.getType() == VulnerabilityType.HARD_CODED_SECRET, "secret-management",
                "Move secrets out of the plugin",
                "Credentials or keys are embedded in the plugin package.",
                "Rotate the exposed secrets", "Inject secrets through host-provided configuration");
        add(recommendations, findings, v -> v.getType() == VulnerabilityType.WEAK_CRYPTOGRAPHY, "cryptography",
                "Upgrade cryptographic algorithms",
                "Deprecated hash or cipher algorithms are in use.",
                "Use SHA-256 or stronger for hashing", "Use AES-GCM for encryption");
        add(recommendations, findings, v -> v.getType() == VulnerabilityType.UNSAFE_DESERIALIZATION, "deserialization",
                "Harden deserialization",
                "Native deserialization of untrusted data allows gadget-chain attacks.",
                "Configure an ObjectInputFilter allow-list", "Prefer JSON with explicit types");
        add(recommendations, findings, v -> PRIVILEGED.contains(v.getType()), "privileged-api",
                "Remove privileged platform APIs",
                "The plugin uses APIs that bypass sandbox limits.",
                "Remove native, reflective and class-loading code paths");
        add(recommendations, findings, v -> v.getType() == VulnerabilityType.INSECURE_CONFIGURATION, "configuration",
                "Harden plugin configuration",
                "Configuration disables security checks or uses cleartext endpoints.",
                "Enable TLS verification", "Disable debug flags in releases");

        if (metrics.getCyclomaticComplexity() > REFACTOR_COMPLEXITY) {
            recommendations.add(SecurityRecommendation.builder()
                    .category("maintainability")
                    .priority(Severity.LOW)
                    .title("Reduce code complexity")
                    .description("Cyclomatic complexity " + metrics.getCyclomaticComplexity()
                            + " makes security review harder.")
                    .action("Split large methods")
                    .action("Extract decision logic into small, testable units")
                    .build());
        }
        return recommendations;
    }

    private void add(List<SecurityRecommendation> recommendations, List<SecurityVulnerability> findings,
                     Predicate<SecurityVulnerability> filter, String category, String title, String description,
                     String... actions) {
        Severity priority = null;
        int count = 0;
        for (SecurityVulnerability finding : findings) {
            if (filter.test(finding)) {
                priority = priority == null ? finding.getSeverity() : priority.max(finding.getSeverity());
                count++;
            }
        }
        if (priority == null) {
            return;
        }
        SecurityRecommendation.SecurityRecommendationBuilder builder = SecurityRecommendation.builder()
                .category(category)
                .priority(priority)
                .title(title)
                .description(description + " (" + count + " finding(s))");
        for (String action : actions) {
            builder.action(action);
        }
        recommendations.add(builder.build());
    }
}
