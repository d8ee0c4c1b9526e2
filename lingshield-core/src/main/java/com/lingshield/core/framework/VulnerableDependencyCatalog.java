package com.lingshield.core.framework;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lingshield.api.security.Severity;
import com.lingshield.core.util.JsonSupport;
import com.lingshield.core.util.YamlCompatUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 已知漏洞依赖清单
 * <p>
 * 受影响版本表达式：精确版本、前缀通配 1.4.*、或比较式 &lt;2.17.1 / &lt;=1.2.3。
 */
@Slf4j
public class VulnerableDependencyCatalog {

    public static final String DEFAULT_RESOURCE = "vulnerable-dependencies.yml";

    private final List<Advisory> advisories;

    public VulnerableDependencyCatalog(List<Advisory> advisories) {
        this.advisories = List.copyOf(advisories);
    }

    public static VulnerableDependencyCatalog loadDefault() {
        InputStream is = VulnerableDependencyCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (is == null) {
            log.warn("Vulnerable dependency list not found on classpath: {}", DEFAULT_RESOURCE);
            return new VulnerableDependencyCatalog(List.of());
        }
        return load(is);
    }

    public static VulnerableDependencyCatalog load(InputStream inputStream) {
        Object entries = YamlCompatUtils.loadMap(inputStream).get("advisories");
        if (entries == null) {
            return new VulnerableDependencyCatalog(List.of());
        }
        List<Advisory> parsed = JsonSupport.mapper().convertValue(entries, new TypeReference<List<Advisory>>() {
        });
        log.debug("Loaded {} dependency advisories", parsed.size());
        return new VulnerableDependencyCatalog(parsed);
    }

    /**
     * 查找命中的公告
     */
    public Optional<Advisory> find(String name, String version) {
        String normalized = normalize(version);
        for (Advisory advisory : advisories) {
            if (!advisory.getName().equalsIgnoreCase(name)) {
                continue;
            }
            for (String expression : advisory.getAffected()) {
                if (matches(expression.trim(), normalized)) {
                    return Optional.of(advisory);
                }
            }
        }
        return Optional.empty();
    }

    public List<Advisory> advisories() {
        return advisories;
    }

    static boolean matches(String expression, String version) {
        if (expression.equals("*")) {
            return true;
        }
        if (expression.startsWith("<=")) {
            return compareVersions(version, expression.substring(2).trim()) <= 0;
        }
        if (expression.startsWith("<")) {
            return compareVersions(version, expression.substring(1).trim()) < 0;
        }
        if (expression.endsWith(".*")) {
            return version.startsWith(expression.substring(0, expression.length() - 1));
        }
        return expression.equals(version);
    }

    /**
     * 去掉 ^ ~ = v 等前缀，以及 -SNAPSHOT 之类的后缀
     */
    static String normalize(String version) {
        String v = version == null ? "" : version.trim().toLowerCase(Locale.ROOT);
        while (!v.isEmpty() && "^~=v>".indexOf(v.charAt(0)) >= 0) {
            v = v.substring(1);
        }
        int suffix = v.indexOf('-');
        return suffix > 0 ? v.substring(0, suffix) : v;
    }

    static int compareVersions(String v1, String v2) {
        String[] parts1 = v1.split("\\.");
        String[] parts2 = v2.split("\\.");
        for (int i = 0; i < Math.max(parts1.length, parts2.length); i++) {
            int p1 = i < parts1.length ? numericPart(parts1[i]) : 0;
            int p2 = i < parts2.length ? numericPart(parts2[i]) : 0;
            if (p1 != p2) {
                return Integer.compare(p1, p2);
            }
        }
        return 0;
    }

    private static int numericPart(String part) {
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        return end == 0 ? 0 : Integer.parseInt(part.substring(0, end));
    }

    @Data
    public static class Advisory {
        private String name;
        private List<String> affected = new ArrayList<>();
        private Severity severity = Severity.HIGH;
        private String advisory;
        private String fixedIn;
        private String summary;
    }
}
