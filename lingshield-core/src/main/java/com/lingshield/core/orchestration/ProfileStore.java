package com.lingshield.core.orchestration;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * 安全档案存储
 * <p>
 * 同一插件的写入按版本比较并交换，冲突时基于最新版本重试，不会丢失并发更新。
 */
@Slf4j
public class ProfileStore {

    private final Map<String, SecurityProfile> profiles = new ConcurrentHashMap<>();
    private final AtomicLong conflicts = new AtomicLong();

    public Optional<SecurityProfile> get(String pluginId) {
        return Optional.ofNullable(profiles.get(pluginId));
    }

    public List<SecurityProfile> list() {
        return profiles.values().stream()
                .sorted(Comparator.comparing(SecurityProfile::getPluginId))
                .collect(Collectors.toList());
    }

    /**
     * 仅当当前版本等于 expectedVersion 时写入，插件不存在时当前版本视为 0
     */
    public boolean compareAndSet(String pluginId, long expectedVersion, SecurityProfile next) {
        boolean[] applied = {false};
        profiles.compute(pluginId, (id, existing) -> {
            long actual = existing == null ? 0 : existing.getVersion();
            if (actual != expectedVersion) {
                return existing;
            }
            applied[0] = true;
            return next;
        });
        return applied[0];
    }

    /**
     * 基于最新版本计算新档案并写入，版本号由存储分配
     *
     * @param mutation 入参可能为空（首次评估），可能被多次调用，不应有副作用
     */
    public SecurityProfile update(String pluginId, UnaryOperator<SecurityProfile> mutation) {
        while (true) {
            SecurityProfile current = profiles.get(pluginId);
            long expected = current == null ? 0 : current.getVersion();
            SecurityProfile next = mutation.apply(current).toBuilder().version(expected + 1).build();
            if (compareAndSet(pluginId, expected, next)) {
                return next;
            }
            conflicts.incrementAndGet();
            log.debug("[{}] Profile version conflict at v{}, retrying", pluginId, expected);
        }
    }

    /**
     * 因版本冲突而重试的次数
     */
    public long conflictCount() {
        return conflicts.get();
    }
}
