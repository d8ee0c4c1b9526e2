package com.lingshield.core.analysis.bytecode;

import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TypeInsnNode;

/**
 * 规则检查的单个节点视图
 *
 * @param method 类声明节点时为空
 * @param insn   声明类节点时为空
 */
public record StructuralNode(NodeKind kind, ClassNode owner, MethodNode method, AbstractInsnNode insn, int line) {

    public MethodInsnNode call() {
        return (MethodInsnNode) insn;
    }

    public TypeInsnNode type() {
        return (TypeInsnNode) insn;
    }

    public LdcInsnNode constant() {
        return (LdcInsnNode) insn;
    }

    public FieldInsnNode field() {
        return (FieldInsnNode) insn;
    }

    public InvokeDynamicInsnNode dynamic() {
        return (InvokeDynamicInsnNode) insn;
    }

    public boolean isCall(String owner, String... names) {
        MethodInsnNode call = call();
        if (!call.owner.equals(owner)) {
            return false;
        }
        for (String name : names) {
            if (call.name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 调用签名，用作发现的证据
     */
    public String describe() {
        switch (kind) {
            case METHOD_CALL:
                return call().owner.replace('/', '.') + "." + call().name + call().desc;
            case TYPE_INSTANTIATION:
                return "new " + type().desc.replace('/', '.');
            case CONSTANT:
                return String.valueOf(constant().cst);
            case FIELD_ACCESS:
                return field().owner.replace('/', '.') + "." + field().name;
            case DYNAMIC_CALL:
                return "invokedynamic " + dynamic().bsm.getOwner().replace('/', '.') + "." + dynamic().bsm.getName();
            case METHOD_DECLARATION:
                return owner.name.replace('/', '.') + "#" + method.name + method.desc;
            default:
                return owner.name.replace('/', '.');
        }
    }
}
