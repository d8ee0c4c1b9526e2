package com.lingshield.core.framework;

import com.lingshield.core.exception.SecurityPolicyException;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 策略存储
 * <p>
 * 读多写少，写入后立即对后续读取可见。
 */
@Slf4j
public class PolicyStore {

    private final Map<String, SecurityPolicy> policies = new ConcurrentHashMap<>();

    public PolicyStore() {
        SecurityPolicy defaults = SecurityPolicy.defaultPolicy();
        policies.put(defaults.getId(), defaults);
    }

    /**
     * @throws SecurityPolicyException 策略不存在
     */
    public SecurityPolicy get(String policyId) {
        SecurityPolicy policy = policies.get(policyId);
        if (policy == null) {
            throw new SecurityPolicyException(policyId, "Security policy not found: " + policyId);
        }
        return policy;
    }

    public boolean contains(String policyId) {
        return policies.containsKey(policyId);
    }

    /**
     * 新增或更新策略，已存在时版本号在原有基础上递增
     */
    public SecurityPolicy put(SecurityPolicy policy) {
        SecurityPolicy stored = policies.compute(policy.getId(), (id, existing) -> existing == null
                ? policy
                : policy.toBuilder().version(existing.getVersion() + 1).build());
        log.info("[{}] Security policy stored, version={}", stored.getId(), stored.getVersion());
        return stored;
    }

    /**
     * @throws SecurityPolicyException 试图删除默认策略
     */
    public boolean remove(String policyId) {
        if (SecurityPolicy.DEFAULT_POLICY_ID.equals(policyId)) {
            throw new SecurityPolicyException(policyId, "The default security policy cannot be removed");
        }
        boolean removed = policies.remove(policyId) != null;
        if (removed) {
            log.info("[{}] Security policy removed", policyId);
        }
        return removed;
    }

    public List<SecurityPolicy> list() {
        return policies.values().stream()
                .sorted(Comparator.comparing(SecurityPolicy::getId))
                .collect(Collectors.toList());
    }
}
