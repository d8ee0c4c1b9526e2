package com.lingshield.core.analysis.bytecode;

import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Value;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 带污点来源集合的抽象值
 * <p>
 * 来源标签：src:接口名（外部输入）、call:方法键（返回污点的插件方法）、param:序号（方法参数）
 */
final class TaintValue implements Value {

    static final String SOURCE_PREFIX = "src:";
    static final String CALL_PREFIX = "call:";
    static final String PARAM_PREFIX = "param:";

    private final BasicValue basic;
    private final Set<String> origins;

    TaintValue(BasicValue basic, Set<String> origins) {
        this.basic = basic;
        this.origins = origins.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(origins);
    }

    static TaintValue clean(BasicValue basic) {
        return new TaintValue(basic, Collections.emptySet());
    }

    BasicValue basic() {
        return basic;
    }

    Set<String> origins() {
        return origins;
    }

    boolean isTainted() {
        return !origins.isEmpty();
    }

    static Set<String> union(Set<String> a, Set<String> b) {
        if (b.isEmpty()) return a;
        if (a.isEmpty()) return b;
        Set<String> merged = new HashSet<>(a);
        merged.addAll(b);
        return merged;
    }

    @Override
    public int getSize() {
        return basic.getSize();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaintValue)) return false;
        TaintValue that = (TaintValue) o;
        return basic.equals(that.basic) && origins.equals(that.origins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(basic, origins);
    }

    @Override
    public String toString() {
        return origins.isEmpty() ? basic.toString() : basic + origins.toString();
    }
}
