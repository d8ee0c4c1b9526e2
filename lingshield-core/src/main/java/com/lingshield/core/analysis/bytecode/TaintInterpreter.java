package com.lingshield.core.analysis.bytecode;

import com.lingshield.core.analysis.bytecode.TaintSpecification.SinkCategory;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicInterpreter;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个方法的污点解释器
 * <p>
 * 值的类型推导委托给 {@link BasicInterpreter}，本类只维护来源标签，并在遇到汇点时记录命中。
 */
class TaintInterpreter extends Interpreter<TaintValue> {

    /**
     * 汇点命中
     *
     * @param via 经由的插件方法键，直接调用库汇点时为空
     */
    record SinkHit(AbstractInsnNode insn, String sink, SinkCategory category, Set<String> origins, String via) {
    }

    private record HitKey(AbstractInsnNode insn, String via) {
    }

    private final BasicInterpreter basic = new BasicInterpreter();
    private final TaintSpecification spec;
    private final Map<String, MethodSummary> summaries;
    private final Map<Integer, Integer> paramIndexBySlot = new HashMap<>();
    private final Map<HitKey, SinkHit> hits = new LinkedHashMap<>();
    private final Set<String> returnOrigins = new HashSet<>();

    TaintInterpreter(MethodNode method, TaintSpecification spec, Map<String, MethodSummary> summaries) {
        super(Opcodes.ASM9);
        this.spec = spec;
        this.summaries = summaries;
        int slot = (method.access & Opcodes.ACC_STATIC) != 0 ? 0 : 1;
        Type[] args = Type.getArgumentTypes(method.desc);
        for (int i = 0; i < args.length; i++) {
            paramIndexBySlot.put(slot, i);
            slot += args[i].getSize();
        }
    }

    List<SinkHit> hits() {
        return new ArrayList<>(hits.values());
    }

    Set<String> returnOrigins() {
        return returnOrigins;
    }

    // ==================== 值构造 ====================

    @Override
    public TaintValue newValue(Type type) {
        BasicValue value = basic.newValue(type);
        return value == null ? null : TaintValue.clean(value);
    }

    @Override
    public TaintValue newParameterValue(boolean isInstanceMethod, int local, Type type) {
        BasicValue value = basic.newValue(type);
        Integer index = paramIndexBySlot.get(local);
        if (index == null) {
            return TaintValue.clean(value);
        }
        return new TaintValue(value, Collections.singleton(TaintValue.PARAM_PREFIX + index));
    }

    @Override
    public TaintValue newOperation(AbstractInsnNode insn) throws AnalyzerException {
        return TaintValue.clean(basic.newOperation(insn));
    }

    @Override
    public TaintValue copyOperation(AbstractInsnNode insn, TaintValue value) throws AnalyzerException {
        return value;
    }

    @Override
    public TaintValue unaryOperation(AbstractInsnNode insn, TaintValue value) throws AnalyzerException {
        BasicValue result = basic.unaryOperation(insn, value.basic());
        if (result == null) {
            return null;
        }
        switch (insn.getOpcode()) {
            case Opcodes.GETFIELD:
            case Opcodes.ARRAYLENGTH:
            case Opcodes.INSTANCEOF:
                return TaintValue.clean(result);
            default:
                return new TaintValue(result, value.origins());
        }
    }

    @Override
    public TaintValue binaryOperation(AbstractInsnNode insn, TaintValue value1, TaintValue value2)
            throws AnalyzerException {
        BasicValue result = basic.binaryOperation(insn, value1.basic(), value2.basic());
        if (result == null) {
            return null;
        }
        return new TaintValue(result, TaintValue.union(value1.origins(), value2.origins()));
    }

    @Override
    public TaintValue ternaryOperation(AbstractInsnNode insn, TaintValue value1, TaintValue value2,
                                       TaintValue value3) throws AnalyzerException {
        BasicValue result = basic.ternaryOperation(insn, value1.basic(), value2.basic(), value3.basic());
        return result == null ? null : TaintValue.clean(result);
    }

    @Override
    public TaintValue naryOperation(AbstractInsnNode insn, List<? extends TaintValue> values)
            throws AnalyzerException {
        List<BasicValue> basics = new ArrayList<>(values.size());
        Set<String> all = Collections.emptySet();
        for (TaintValue value : values) {
            basics.add(value.basic());
            all = TaintValue.union(all, value.origins());
        }
        BasicValue result = basic.naryOperation(insn, basics);

        if (!(insn instanceof MethodInsnNode)) {
            // invokedynamic（字符串拼接、lambda 捕获）与多维数组：来源取并集
            return result == null ? null : new TaintValue(result, all);
        }

        MethodInsnNode call = (MethodInsnNode) insn;
        int argStart = insn.getOpcode() == Opcodes.INVOKESTATIC ? 0 : 1;
        String key = MethodSummary.key(call.owner, call.name, call.desc);
        MethodSummary summary = summaries.get(key);

        spec.sink(call).ifPresent(category -> {
            Set<String> argOrigins = Collections.emptySet();
            for (int i = argStart; i < values.size(); i++) {
                argOrigins = TaintValue.union(argOrigins, values.get(i).origins());
            }
            record(insn, call.owner.replace('/', '.') + "." + call.name, category, argOrigins, null);
        });
        if (summary != null) {
            for (Map.Entry<Integer, SinkCategory> entry : summary.sinkParams().entrySet()) {
                int position = argStart + entry.getKey();
                if (position < values.size()) {
                    record(insn, MethodSummary.displayName(key), entry.getValue(),
                            values.get(position).origins(), key);
                }
            }
        }

        if (result == null) {
            return null;
        }
        if (spec.isSanitizer(call)) {
            return TaintValue.clean(result);
        }
        if (spec.sourceLabel(call).isPresent()) {
            return new TaintValue(result, Collections.singleton(TaintValue.SOURCE_PREFIX + spec.sourceLabel(call).get()));
        }
        if (summary != null) {
            Set<String> origins = new HashSet<>();
            if (summary.returnsTaint()) {
                origins.add(TaintValue.CALL_PREFIX + key);
            }
            for (Integer param : summary.passthroughParams()) {
                int position = argStart + param;
                if (position < values.size()) {
                    origins.addAll(values.get(position).origins());
                }
            }
            return new TaintValue(result, origins);
        }
        // 未知库方法：保守传播接收者与参数的来源
        return new TaintValue(result, all);
    }

    @Override
    public void returnOperation(AbstractInsnNode insn, TaintValue value, TaintValue expected) {
        returnOrigins.addAll(value.origins());
    }

    @Override
    public TaintValue merge(TaintValue value1, TaintValue value2) {
        BasicValue merged = basic.merge(value1.basic(), value2.basic());
        Set<String> origins = TaintValue.union(value1.origins(), value2.origins());
        if (merged.equals(value1.basic()) && origins.equals(value1.origins())) {
            return value1;
        }
        return new TaintValue(merged, origins);
    }

    private void record(AbstractInsnNode insn, String sink, SinkCategory category, Set<String> origins, String via) {
        if (origins.isEmpty()) {
            return;
        }
        hits.merge(new HitKey(insn, via), new SinkHit(insn, sink, category, origins, via),
                (old, fresh) -> new SinkHit(insn, sink, category, TaintValue.union(old.origins(), fresh.origins()), via));
    }
}
