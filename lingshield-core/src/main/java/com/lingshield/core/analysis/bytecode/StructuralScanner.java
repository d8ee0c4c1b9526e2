package com.lingshield.core.analysis.bytecode;

import com.lingshield.core.analysis.AnalysisPass;
import com.lingshield.core.analysis.Deadline;
import com.lingshield.core.analysis.SecurityVulnerability;
import com.lingshield.core.analysis.SourceLocation;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LineNumberNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 第二阶段：结构规则扫描
 * <p>
 * 每个节点只访问一次，按 {@link NodeKind} 分派给对应规则。
 */
public class StructuralScanner {

    private final Map<NodeKind, List<StructuralRule>> registry = new EnumMap<>(NodeKind.class);

    public StructuralScanner() {
        for (StructuralRule rule : StructuralRule.values()) {
            registry.computeIfAbsent(rule.getKind(), k -> new ArrayList<>()).add(rule);
        }
    }

    public List<SecurityVulnerability> scan(ParsedClass parsed, Deadline deadline) {
        List<SecurityVulnerability> findings = new ArrayList<>();
        dispatch(parsed, new StructuralNode(NodeKind.CLASS_DECLARATION, parsed.node(), null, null, 0), findings);

        for (MethodNode method : parsed.node().methods) {
            deadline.check();
            dispatch(parsed, new StructuralNode(NodeKind.METHOD_DECLARATION, parsed.node(), method, null, 0), findings);

            int line = 0;
            for (AbstractInsnNode insn : method.instructions) {
                if (insn instanceof LineNumberNode) {
                    line = ((LineNumberNode) insn).line;
                    continue;
                }
                NodeKind kind = kindOf(insn);
                if (kind != null) {
                    dispatch(parsed, new StructuralNode(kind, parsed.node(), method, insn, line), findings);
                }
            }
        }
        return findings;
    }

    private void dispatch(ParsedClass parsed, StructuralNode node, List<SecurityVulnerability> findings) {
        for (StructuralRule rule : registry.getOrDefault(node.kind(), Collections.emptyList())) {
            if (rule.matches(node)) {
                findings.add(SecurityVulnerability.builder()
                        .type(rule.getType())
                        .severity(rule.getSeverity())
                        .title(rule.getTitle())
                        .description(rule.getTitle() + ": " + node.describe())
                        .location(new SourceLocation(parsed.relativePath(), node.line(),
                                node.method() != null ? parsed.member(node.method()) : parsed.className()))
                        .evidence(node.describe())
                        .remediation(rule.getRemediation())
                        .pass(AnalysisPass.STRUCTURAL)
                        .build());
            }
        }
    }

    private static NodeKind kindOf(AbstractInsnNode insn) {
        if (insn instanceof MethodInsnNode) {
            return NodeKind.METHOD_CALL;
        }
        if (insn instanceof TypeInsnNode && insn.getOpcode() == Opcodes.NEW) {
            return NodeKind.TYPE_INSTANTIATION;
        }
        if (insn instanceof LdcInsnNode) {
            return NodeKind.CONSTANT;
        }
        if (insn instanceof FieldInsnNode) {
            return NodeKind.FIELD_ACCESS;
        }
        if (insn instanceof InvokeDynamicInsnNode) {
            return NodeKind.DYNAMIC_CALL;
        }
        return null;
    }
}
