package com.lingshield.core.framework;

import java.util.regex.Pattern;

/**
 * 运行期操作参数中的攻击特征
 */
enum AttackSignature {

    SQL_INJECTION("(?i)(['\"]\\s*or\\s+['\"]?\\d+['\"]?\\s*=\\s*['\"]?\\d+)|\\bunion\\s+(all\\s+)?select\\b|;\\s*drop\\s+table\\b"),

    PATH_TRAVERSAL("(\\.\\./|\\.\\.\\\\){2,}|(?i)%2e%2e(%2f|/)"),

    COMMAND_INJECTION("(;|&&|\\|\\|)\\s*(rm|curl|wget|nc|bash|sh|chmod)\\b|\\$\\(|`[^`]+`"),

    JNDI_LOOKUP("(?i)\\$\\{\\s*jndi:"),

    CLOUD_METADATA("169\\.254\\.169\\.254|(?i)metadata\\.google\\.internal"),

    SCRIPT_INJECTION("(?i)<script\\b|javascript:");

    private final Pattern pattern;

    AttackSignature(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
