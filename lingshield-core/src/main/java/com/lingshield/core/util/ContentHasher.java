package com.lingshield.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 插件目录内容摘要
 * <p>
 * 按相对路径（统一使用 / 分隔）排序后，依次摘要"路径字节 + 文件内容"，保证跨平台稳定。
 */
public final class ContentHasher {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private ContentHasher() {
    }

    public static String hashTree(Path root) throws IOException {
        return hashTree(root, DEFAULT_ALGORITHM, p -> true);
    }

    /**
     * @param include 针对相对路径的过滤条件
     */
    public static String hashTree(Path root, String algorithm, Predicate<String> include) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        if (Files.isRegularFile(root)) {
            digestFile(digest, root.getFileName().toString(), root);
            return HexFormat.of().formatHex(digest.digest());
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> include.test(relativize(root, p)))
                    .sorted((a, b) -> relativize(root, a).compareTo(relativize(root, b)))
                    .collect(Collectors.toList());
        }
        for (Path file : files) {
            digestFile(digest, relativize(root, file), file);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * 对已读入内存的 (路径, 内容) 对计算摘要，输入需已排序
     */
    public static String hashEntries(List<Entry> entries) {
        MessageDigest digest = newDigest(DEFAULT_ALGORITHM);
        for (Entry entry : entries) {
            digest.update(entry.relativePath().getBytes(StandardCharsets.UTF_8));
            digest.update(entry.content());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String sha256Hex(byte[] data) {
        return HexFormat.of().formatHex(newDigest(DEFAULT_ALGORITHM).digest(data));
    }

    public static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static void digestFile(MessageDigest digest, String relativePath, Path file) throws IOException {
        digest.update(relativePath.getBytes(StandardCharsets.UTF_8));
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported hash algorithm: " + algorithm, e);
        }
    }

    public record Entry(String relativePath, byte[] content) {
    }
}
