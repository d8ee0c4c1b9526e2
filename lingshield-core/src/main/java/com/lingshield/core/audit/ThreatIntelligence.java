package com.lingshield.core.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 威胁情报库：维护指标并匹配事件
 */
@Slf4j
public class ThreatIntelligence {

    private final Map<String, ThreatIndicator> indicators = new ConcurrentHashMap<>();

    public ThreatIndicator add(ThreatIndicator indicator) {
        indicators.put(indicator.getId(), indicator);
        log.info("[{}] Threat indicator added: {}={}", indicator.getId(), indicator.getType(), indicator.getValue());
        return indicator;
    }

    public boolean remove(String indicatorId) {
        return indicators.remove(indicatorId) != null;
    }

    public List<ThreatIndicator> list() {
        return List.copyOf(indicators.values());
    }

    /**
     * 返回事件命中的有效指标
     */
    public List<ThreatIndicator> match(SecurityEvent event) {
        List<ThreatIndicator> hits = new ArrayList<>();
        for (ThreatIndicator indicator : indicators.values()) {
            if (indicator.isActive() && matches(indicator, event)) {
                hits.add(indicator);
            }
        }
        return hits;
    }

    private static boolean matches(ThreatIndicator indicator, SecurityEvent event) {
        String value = indicator.getValue().toLowerCase(Locale.ROOT);
        switch (indicator.getType()) {
            case IP_ADDRESS:
                return value.equals(event.getIpAddress()) || value.equals(detail(event, "remoteAddress"));
            case DOMAIN:
                String host = detail(event, "host");
                return host != null && (host.equals(value) || host.endsWith("." + value));
            case FILE_HASH:
                return value.equals(detail(event, "fileHash")) || value.equals(detail(event, "contentHash"));
            case USER_AGENT:
                return event.getUserAgent() != null
                        && event.getUserAgent().toLowerCase(Locale.ROOT).contains(value);
            case CERTIFICATE_FINGERPRINT:
                return value.equals(detail(event, "fingerprint"));
            default:
                return false;
        }
    }

    private static String detail(SecurityEvent event, String key) {
        Object v = event.getDetails().get(key);
        return v == null ? null : v.toString().toLowerCase(Locale.ROOT);
    }
}
