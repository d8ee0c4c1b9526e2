package com.lingshield.core.analysis.bytecode;

/**
 * 结构规则关注的语法节点种类
 */
public enum NodeKind {
    CLASS_DECLARATION,
    METHOD_DECLARATION,
    METHOD_CALL,
    TYPE_INSTANTIATION,
    CONSTANT,
    FIELD_ACCESS,
    DYNAMIC_CALL
}
