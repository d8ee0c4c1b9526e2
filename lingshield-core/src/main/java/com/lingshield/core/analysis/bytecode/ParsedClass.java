package com.lingshield.core.analysis.bytecode;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.LineNumberNode;
import org.objectweb.asm.tree.MethodNode;

/**
 * 已解析为语法树的类
 *
 * @param relativePath 类文件在插件中的位置
 * @param node         ASM 树
 */
public record ParsedClass(String relativePath, ClassNode node) {

    public String className() {
        return node.name.replace('/', '.');
    }

    public String member(MethodNode method) {
        return className() + "#" + method.name;
    }

    /**
     * 向前查找最近的行号节点
     */
    public static int lineOf(AbstractInsnNode insn) {
        for (AbstractInsnNode n = insn; n != null; n = n.getPrevious()) {
            if (n instanceof LineNumberNode) {
                return ((LineNumberNode) n).line;
            }
        }
        return 0;
    }
}
