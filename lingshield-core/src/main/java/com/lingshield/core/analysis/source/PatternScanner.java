package com.lingshield.core.analysis.source;

import com.lingshield.core.analysis.AnalysisPass;
import com.lingshield.core.analysis.Deadline;
import com.lingshield.core.analysis.SecurityVulnerability;
import com.lingshield.core.analysis.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * 第一阶段：逐行正则扫描
 */
public class PatternScanner {

    private static final int MAX_EVIDENCE = 120;

    public List<SecurityVulnerability> scan(SourceFile file, Deadline deadline) {
        List<SecurityVulnerability> findings = new ArrayList<>();
        List<String> lines = file.lines();
        boolean inBlockComment = false;
        for (int i = 0; i < lines.size(); i++) {
            if (i % 500 == 0) {
                deadline.check();
            }
            String line = lines.get(i);
            String trimmed = line.trim();
            // 跳过注释行，块注释只做粗略跟踪
            if (inBlockComment) {
                if (trimmed.contains("*/")) {
                    inBlockComment = false;
                }
                continue;
            }
            if (trimmed.startsWith("/*")) {
                inBlockComment = !trimmed.contains("*/");
                continue;
            }
            if (trimmed.startsWith("//") || trimmed.startsWith("*") || trimmed.startsWith("#")) {
                continue;
            }
            for (VulnerabilityPattern pattern : VulnerabilityPattern.values()) {
                if (!pattern.appliesTo(file.extension())) {
                    continue;
                }
                Matcher matcher = pattern.getPattern().matcher(line);
                if (matcher.find()) {
                    findings.add(SecurityVulnerability.builder()
                            .type(pattern.getType())
                            .severity(pattern.getSeverity())
                            .title(pattern.getTitle())
                            .description(pattern.getTitle() + " detected in " + file.relativePath())
                            .location(SourceLocation.of(file.relativePath(), i + 1))
                            .evidence(abbreviate(trimmed))
                            .remediation(pattern.getRemediation())
                            .pass(AnalysisPass.PATTERN)
                            .build());
                }
            }
        }
        return findings;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_EVIDENCE ? text : text.substring(0, MAX_EVIDENCE) + "...";
    }
}
