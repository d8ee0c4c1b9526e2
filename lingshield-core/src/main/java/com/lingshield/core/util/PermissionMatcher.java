package com.lingshield.core.util;

import java.util.Collection;

/**
 * 权限匹配：精确、全局通配 * 或前缀通配 storage.*
 */
public final class PermissionMatcher {

    private PermissionMatcher() {
    }

    public static boolean grants(Collection<String> granted, String permission) {
        for (String grant : granted) {
            if (grant.equals("*") || grant.equals(permission)) {
                return true;
            }
            if (grant.endsWith(".*") && permission.startsWith(grant.substring(0, grant.length() - 1))) {
                return true;
            }
        }
        return false;
    }
}
