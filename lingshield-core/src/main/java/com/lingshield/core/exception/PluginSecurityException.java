package com.lingshield.core.exception;

import com.lingshield.api.exception.LingShieldException;

/**
 * 插件安全异常
 * <p>
 * 用于插件安全校验不通过、策略拒绝等场景
 */
public class PluginSecurityException extends LingShieldException {

    private final String pluginId;

    public PluginSecurityException(String pluginId, String message) {
        super(message);
        this.pluginId = pluginId;
    }

    public PluginSecurityException(String pluginId, String message, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
    }

    public String getPluginId() {
        return pluginId;
    }
}
