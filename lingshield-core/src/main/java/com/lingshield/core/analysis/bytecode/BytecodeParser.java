package com.lingshield.core.analysis.bytecode;

import com.lingshield.core.analysis.Deadline;
import com.lingshield.core.analysis.source.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarInputStream;

/**
 * 将 .class 文件与 jar 中的类条目解析为 ASM 树
 * <p>
 * 单个类解析失败只记录告警，不影响其余文件
 */
@Slf4j
public class BytecodeParser {

    private int failures;

    public List<ParsedClass> parse(SourceFile file, Deadline deadline) {
        List<ParsedClass> classes = new ArrayList<>();
        switch (file.kind()) {
            case CLASS:
                parseClass(file.relativePath(), file.content()).ifPresent(classes::add);
                break;
            case ARCHIVE:
                parseArchive(file, deadline, classes);
                break;
            default:
                break;
        }
        return classes;
    }

    /**
     * 解析失败的类数量
     */
    public int getFailures() {
        return failures;
    }

    private void parseArchive(SourceFile file, Deadline deadline, List<ParsedClass> classes) {
        try (JarInputStream jar = new JarInputStream(new ByteArrayInputStream(file.content()))) {
            JarEntry entry;
            while ((entry = jar.getNextJarEntry()) != null) {
                deadline.check();
                if (entry.isDirectory() || !entry.getName().endsWith(".class")
                        || entry.getName().endsWith("module-info.class")) {
                    continue;
                }
                byte[] bytes = jar.readAllBytes();
                parseClass(file.relativePath() + "!/" + entry.getName(), bytes).ifPresent(classes::add);
            }
        } catch (IOException e) {
            failures++;
            log.warn("Skipping unreadable archive {}: {}", file.relativePath(), e.getMessage());
        }
    }

    private Optional<ParsedClass> parseClass(String path, byte[] bytes) {
        try {
            ClassReader reader = new ClassReader(bytes);
            ClassNode node = new ClassNode();
            reader.accept(node, ClassReader.SKIP_FRAMES);
            return Optional.of(new ParsedClass(path, node));
        } catch (RuntimeException e) {
            // ASM 对损坏的字节码抛出 IllegalArgumentException / ArrayIndexOutOfBoundsException
            failures++;
            log.warn("Skipping unparseable class {}: {}", path, e.toString());
            return Optional.empty();
        }
    }
}
