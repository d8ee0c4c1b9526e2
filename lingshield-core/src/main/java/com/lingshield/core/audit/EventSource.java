package com.lingshield.core.audit;

/**
 * 事件来源
 *
 * @param kind      来源类别
 * @param component 组件名
 * @param instance  实例标识（插件ID、沙箱ID等）
 */
public record EventSource(Kind kind, String component, String instance) {

    public static final EventSource UNKNOWN = new EventSource(Kind.PLUGIN, "unknown", "unknown");

    public enum Kind {
        PLUGIN, SYSTEM, USER, NETWORK, APPLICATION, EXTERNAL
    }

    public static EventSource plugin(String component, String pluginId) {
        return new EventSource(Kind.PLUGIN, component, pluginId);
    }

    public static EventSource system(String component) {
        return new EventSource(Kind.SYSTEM, component, "lingshield");
    }
}
