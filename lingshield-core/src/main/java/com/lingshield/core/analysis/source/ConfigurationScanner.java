package com.lingshield.core.analysis.source;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.AnalysisPass;
import com.lingshield.core.analysis.SecurityVulnerability;
import com.lingshield.core.analysis.SourceLocation;
import com.lingshield.core.analysis.VulnerabilityType;
import com.lingshield.core.util.JsonSupport;
import com.lingshield.core.util.YamlCompatUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 配置文件结构化检查：按键值对而非整行判断
 */
@Slf4j
public class ConfigurationScanner {

    private static final Pattern SECRET_KEY =
            Pattern.compile("(?i).*(password|passwd|secret|token|api[-_.]?key|credential|private[-_.]?key).*");
    private static final Pattern PLACEHOLDER =
            Pattern.compile("^(\\$\\{.*}|\\{\\{.*}}|<.*>|ENC\\(.*\\)|\\*+)$");
    private static final Pattern TLS_KEY = Pattern.compile("(?i).*(ssl|tls|certificate|cert).*");
    private static final Pattern CHECK_KEY = Pattern.compile("(?i).*(enabled|verify|validat|check).*");
    private static final Pattern XML_ELEMENT =
            Pattern.compile("<([\\w.-]*(?i:password|secret|token)[\\w.-]*)>([^<]+)</");
    private static final Pattern XML_ATTRIBUTE =
            Pattern.compile("([\\w.-]*(?i:password|secret|token)[\\w.-]*)\\s*=\\s*\"([^\"]+)\"");

    private record Entry(String key, String value, int line) {
    }

    public List<SecurityVulnerability> scan(SourceFile file) {
        List<Entry> entries;
        try {
            switch (file.extension()) {
                case "yml":
                case "yaml":
                    entries = yamlEntries(file);
                    break;
                case "json":
                    entries = jsonEntries(file);
                    break;
                case "properties":
                    entries = propertyEntries(file);
                    break;
                case "xml":
                    entries = xmlEntries(file);
                    break;
                default:
                    return List.of();
            }
        } catch (IOException | YAMLException e) {
            log.warn("Skipping unparseable config {}: {}", file.relativePath(), e.getMessage());
            return List.of();
        }

        List<SecurityVulnerability> findings = new ArrayList<>();
        for (Entry entry : entries) {
            check(file, entry, findings);
        }
        return findings;
    }

    private void check(SourceFile file, Entry entry, List<SecurityVulnerability> findings) {
        String key = entry.key();
        String value = entry.value() == null ? "" : entry.value().trim();
        String lower = value.toLowerCase(Locale.ROOT);
        String leaf = key.contains(".") ? key.substring(key.lastIndexOf('.') + 1) : key;

        if (SECRET_KEY.matcher(key).matches() && value.length() >= 4
                && !PLACEHOLDER.matcher(value).matches()
                && !"true".equals(lower) && !"false".equals(lower)) {
            findings.add(finding(file, entry, VulnerabilityType.HARD_CODED_SECRET, Severity.HIGH,
                    "Hard-coded secret in configuration",
                    "Reference the secret through an environment placeholder instead of a literal"));
        }
        if (("debug".equalsIgnoreCase(leaf) || "devMode".equalsIgnoreCase(leaf) || "dev-mode".equalsIgnoreCase(leaf))
                && "true".equals(lower)) {
            findings.add(finding(file, entry, VulnerabilityType.INSECURE_CONFIGURATION, Severity.LOW,
                    "Debug mode enabled", "Disable debug settings in released plugins"));
        }
        boolean tlsCheckDisabled = TLS_KEY.matcher(key).matches() && CHECK_KEY.matcher(key).matches() && "false".equals(lower);
        boolean insecureSkip = key.toLowerCase(Locale.ROOT).contains("insecure") && "true".equals(lower);
        if (tlsCheckDisabled || insecureSkip) {
            findings.add(finding(file, entry, VulnerabilityType.INSECURE_CONFIGURATION, Severity.MEDIUM,
                    "Transport security check disabled", "Keep TLS and certificate validation enabled"));
        }
        if (lower.startsWith("http://") && !lower.startsWith("http://localhost") && !lower.startsWith("http://127.0.0.1")) {
            findings.add(finding(file, entry, VulnerabilityType.INSECURE_CONFIGURATION, Severity.LOW,
                    "Cleartext transport endpoint", "Use https endpoints"));
        }
    }

    private SecurityVulnerability finding(SourceFile file, Entry entry, VulnerabilityType type, Severity severity,
                                          String title, String remediation) {
        return SecurityVulnerability.builder()
                .type(type)
                .severity(severity)
                .title(title)
                .description(title + " (key '" + entry.key() + "')")
                .location(SourceLocation.of(file.relativePath(), entry.line()))
                .evidence(entry.key())
                .remediation(remediation)
                .pass(AnalysisPass.CONFIGURATION)
                .build();
    }

    // ==================== 解析 ====================

    private List<Entry> yamlEntries(SourceFile file) {
        List<Entry> entries = new ArrayList<>();
        for (Node document : YamlCompatUtils.createSafeYaml().composeAll(new StringReader(file.text()))) {
            walkYaml(document, "", entries);
        }
        return entries;
    }

    private void walkYaml(Node node, String path, List<Entry> entries) {
        if (node instanceof MappingNode) {
            for (NodeTuple tuple : ((MappingNode) node).getValue()) {
                if (!(tuple.getKeyNode() instanceof ScalarNode)) {
                    continue;
                }
                String key = ((ScalarNode) tuple.getKeyNode()).getValue();
                String childPath = path.isEmpty() ? key : path + "." + key;
                Node valueNode = tuple.getValueNode();
                if (valueNode instanceof ScalarNode) {
                    entries.add(new Entry(childPath, ((ScalarNode) valueNode).getValue(),
                            valueNode.getStartMark().getLine() + 1));
                } else {
                    walkYaml(valueNode, childPath, entries);
                }
            }
        } else if (node instanceof SequenceNode) {
            for (Node child : ((SequenceNode) node).getValue()) {
                walkYaml(child, path, entries);
            }
        }
    }

    private List<Entry> jsonEntries(SourceFile file) throws IOException {
        List<Entry> entries = new ArrayList<>();
        try (JsonParser parser = JsonSupport.mapper().getFactory().createParser(file.content())) {
            String field = null;
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                if (token == JsonToken.FIELD_NAME) {
                    field = parser.currentName();
                } else if (token.isScalarValue() && field != null) {
                    entries.add(new Entry(field, parser.getText(), parser.getTokenLocation().getLineNr()));
                    field = null;
                } else {
                    field = null;
                }
            }
        }
        return entries;
    }

    private List<Entry> propertyEntries(SourceFile file) {
        List<Entry> entries = new ArrayList<>();
        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("!")) {
                continue;
            }
            int sep = indexOfSeparator(line);
            if (sep > 0) {
                entries.add(new Entry(line.substring(0, sep).trim(), line.substring(sep + 1).trim(), i + 1));
            }
        }
        return entries;
    }

    private static int indexOfSeparator(String line) {
        int eq = line.indexOf('=');
        int colon = line.indexOf(':');
        if (eq < 0) return colon;
        if (colon < 0) return eq;
        return Math.min(eq, colon);
    }

    private List<Entry> xmlEntries(SourceFile file) {
        List<Entry> entries = new ArrayList<>();
        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher element = XML_ELEMENT.matcher(line);
            while (element.find()) {
                entries.add(new Entry(element.group(1), element.group(2), i + 1));
            }
            Matcher attribute = XML_ATTRIBUTE.matcher(line);
            while (attribute.find()) {
                entries.add(new Entry(attribute.group(1), attribute.group(2), i + 1));
            }
        }
        return entries;
    }
}
