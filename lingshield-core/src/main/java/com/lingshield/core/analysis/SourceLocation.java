package com.lingshield.core.analysis;

/**
 * 发现所在位置
 *
 * @param file   相对插件根目录的路径，jar 内条目形如 lib/a.jar!/com/x/Y.class
 * @param line   行号，未知时为 0
 * @param member 所在类/方法，文本文件为空
 */
public record SourceLocation(String file, int line, String member) {

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line, null);
    }

    @Override
    public String toString() {
        return member == null ? file + ":" + line : file + ":" + line + " (" + member + ")";
    }
}
