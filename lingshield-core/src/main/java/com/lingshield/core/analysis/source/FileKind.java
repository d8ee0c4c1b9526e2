package com.lingshield.core.analysis.source;

import java.util.Locale;
import java.util.Optional;

/**
 * 参与分析的文件类别
 */
public enum FileKind {
    /**
     * 文本源码：逐行模式扫描 + 嵌套深度统计
     */
    SOURCE,
    /**
     * 配置文件：结构化检查
     */
    CONFIG,
    CLASS,
    ARCHIVE;

    public static Optional<FileKind> of(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        switch (name.substring(dot + 1)) {
            case "java":
            case "kt":
            case "groovy":
            case "js":
            case "ts":
            case "sh":
            case "py":
                return Optional.of(SOURCE);
            case "yml":
            case "yaml":
            case "json":
            case "properties":
            case "xml":
                return Optional.of(CONFIG);
            case "class":
                return Optional.of(CLASS);
            case "jar":
                return Optional.of(ARCHIVE);
            default:
                return Optional.empty();
        }
    }
}
