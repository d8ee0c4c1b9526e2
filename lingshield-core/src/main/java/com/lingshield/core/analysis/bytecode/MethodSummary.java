package com.lingshield.core.analysis.bytecode;

import com.lingshield.core.analysis.bytecode.TaintSpecification.SinkCategory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 方法污点摘要，用于跨方法传播
 *
 * @param returnsTaint       返回值携带外部输入
 * @param passthroughParams  返回值携带的参数序号
 * @param sinkParams         流入敏感汇点的参数序号及汇点类别
 */
record MethodSummary(boolean returnsTaint, Set<Integer> passthroughParams, Map<Integer, SinkCategory> sinkParams) {

    static final MethodSummary EMPTY = new MethodSummary(false, Collections.emptySet(), Collections.emptyMap());

    static String key(String owner, String name, String desc) {
        return owner + "." + name + desc;
    }

    static String displayName(String key) {
        int paren = key.indexOf('(');
        String ownerAndName = paren < 0 ? key : key.substring(0, paren);
        int dot = ownerAndName.lastIndexOf('.');
        return ownerAndName.substring(0, dot).replace('/', '.') + "#" + ownerAndName.substring(dot + 1);
    }
}
