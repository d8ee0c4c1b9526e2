package com.lingshield.core.framework;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 附加限制，叠加在策略之上生效，不替换策略默认值
 */
@Value
@Builder
public class SecurityRestriction {

    @NonNull
    RestrictionType type;

    /**
     * 作用范围：* 、主机、路径前缀等
     */
    @NonNull
    String scope;

    @NonNull
    RestrictionAction action;

    @Singular
    Map<String, Object> parameters;

    String reason;

    public static SecurityRestriction denyAllNetwork(String reason) {
        return SecurityRestriction.builder()
                .type(RestrictionType.NETWORK)
                .scope("*")
                .action(RestrictionAction.DENY)
                .reason(reason)
                .build();
    }

    public static List<SecurityRestriction> denyPaths(List<String> roots, String reason) {
        return roots.stream()
                .map(root -> SecurityRestriction.builder()
                        .type(RestrictionType.FILESYSTEM)
                        .scope(root)
                        .action(RestrictionAction.DENY)
                        .reason(reason)
                        .build())
                .collect(Collectors.toList());
    }
}
