package com.lingshield.core.analysis.source;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 已读入内存的插件文件
 */
public record SourceFile(String relativePath, FileKind kind, byte[] content) {

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public List<String> lines() {
        return Arrays.asList(text().split("\\R", -1));
    }

    public String extension() {
        int dot = relativePath.lastIndexOf('.');
        return dot < 0 ? "" : relativePath.substring(dot + 1).toLowerCase();
    }
}
