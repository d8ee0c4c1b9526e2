package com.lingshield.core.audit.compliance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lingshield.api.security.Severity;
import com.lingshield.core.audit.SecurityEventType;
import com.lingshield.core.util.JsonSupport;
import com.lingshield.core.util.YamlCompatUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 合规控制项目录，来自 compliance-controls.yml
 */
@Slf4j
public class ComplianceCatalog {

    public static final String DEFAULT_RESOURCE = "compliance-controls.yml";

    private final Map<ComplianceFramework, List<ControlDefinition>> controls;

    public ComplianceCatalog(Map<ComplianceFramework, List<ControlDefinition>> controls) {
        this.controls = new EnumMap<>(ComplianceFramework.class);
        controls.forEach((framework, list) -> this.controls.put(framework, List.copyOf(list)));
    }

    public static ComplianceCatalog loadDefault() {
        InputStream is = ComplianceCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (is == null) {
            throw new IllegalStateException("Compliance catalog not found on classpath: " + DEFAULT_RESOURCE);
        }
        return load(is);
    }

    public static ComplianceCatalog load(InputStream inputStream) {
        Map<String, Object> root = YamlCompatUtils.loadMap(inputStream);
        Object frameworks = root.get("frameworks");
        if (frameworks == null) {
            return new ComplianceCatalog(Map.of());
        }
        Map<ComplianceFramework, List<ControlDefinition>> parsed = JsonSupport.mapper().convertValue(frameworks,
                new TypeReference<Map<ComplianceFramework, List<ControlDefinition>>>() {
                });
        log.debug("Loaded compliance catalog: {}", parsed.keySet());
        return new ComplianceCatalog(parsed);
    }

    public List<ControlDefinition> controls(ComplianceFramework framework) {
        return controls.getOrDefault(framework, List.of());
    }

    /**
     * 控制项定义
     */
    @Data
    public static class ControlDefinition {
        private String id;
        private String name;
        private String description;
        private String category;
        private String owner = "security-team";
        /**
         * 需监测的事件类型，期间内出现即扣分
         */
        private List<SecurityEventType> eventTypes = new ArrayList<>();
        private Severity minSeverity = Severity.MEDIUM;
        private String remediation;
    }
}
