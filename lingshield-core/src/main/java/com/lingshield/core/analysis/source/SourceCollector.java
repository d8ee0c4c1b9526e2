package com.lingshield.core.analysis.source;

import com.lingshield.core.analysis.AnalysisOptions;
import com.lingshield.core.analysis.Deadline;
import com.lingshield.core.util.ContentHasher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 遍历插件目录，收集待分析文件
 */
@Slf4j
public class SourceCollector {

    private static final Set<String> EXCLUDED_DIRS = Set.of(
            ".git", ".svn", ".hg", ".idea", ".vscode", "node_modules",
            "target", "build", "dist", "coverage", "out", ".gradle");

    private static final Set<String> TEST_DIRS = Set.of("test", "tests", "__tests__");

    /**
     * 收集结果
     *
     * @param files   按相对路径排序
     * @param skipped 因过大或不可读被跳过的文件数
     */
    public record Collected(List<SourceFile> files, int skipped) {
    }

    public Collected collect(Path root, AnalysisOptions options, Deadline deadline) throws IOException {
        List<SourceFile> files = new ArrayList<>();
        int[] skipped = {0};

        if (Files.isRegularFile(root)) {
            readFile(root, root.getFileName().toString(), options, files, skipped);
            return new Collected(files, skipped[0]);
        }

        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), options.getMaxDepth(),
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        deadline.check();
                        if (dir.equals(root)) {
                            return FileVisitResult.CONTINUE;
                        }
                        String name = dir.getFileName().toString();
                        if (EXCLUDED_DIRS.contains(name)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        if (!options.isIncludeTests() && TEST_DIRS.contains(name)) {
                            log.debug("Skipping test directory {}", dir);
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        deadline.check();
                        if (attrs.isRegularFile()) {
                            readFile(file, ContentHasher.relativize(root, file), options, files, skipped);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                        skipped[0]++;
                        return FileVisitResult.CONTINUE;
                    }
                });

        files.sort(Comparator.comparing(SourceFile::relativePath));
        return new Collected(files, skipped[0]);
    }

    private void readFile(Path file, String relativePath, AnalysisOptions options,
                          List<SourceFile> files, int[] skipped) {
        Optional<FileKind> kind = FileKind.of(relativePath);
        if (kind.isEmpty()) {
            return;
        }
        try {
            long size = Files.size(file);
            if (size > options.getMaxFileSizeBytes()) {
                log.warn("Skipping {}: {} bytes exceeds limit {}", relativePath, size, options.getMaxFileSizeBytes());
                skipped[0]++;
                return;
            }
            files.add(new SourceFile(relativePath, kind.get(), Files.readAllBytes(file)));
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", relativePath, e.getMessage());
            skipped[0]++;
        }
    }
}
