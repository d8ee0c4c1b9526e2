package com.lingshield.core.analysis;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 测试用插件目录构造工具
 */
public final class PluginTrees {

    private PluginTrees() {
    }

    /**
     * 将已编译的测试类复制到插件目录，保持包路径
     */
    public static Path copyClass(Path root, Class<?> type) {
        String resource = type.getName().replace('.', '/') + ".class";
        Path target = root.resolve("classes").resolve(resource);
        try (InputStream in = type.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Class file not found: " + resource);
            }
            Files.createDirectories(target.getParent());
            Files.write(target, in.readAllBytes());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path write(Path root, String relativePath, String content) {
        Path target = root.resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content.getBytes(StandardCharsets.UTF_8));
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
