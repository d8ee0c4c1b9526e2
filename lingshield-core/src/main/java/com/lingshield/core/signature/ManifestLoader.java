package com.lingshield.core.signature;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lingshield.core.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * plugin.json 读写
 */
@Slf4j
public class ManifestLoader {

    public static final String DEFAULT_MANIFEST = "plugin.json";

    private final String manifestName;

    public ManifestLoader() {
        this(DEFAULT_MANIFEST);
    }

    public ManifestLoader(String manifestName) {
        this.manifestName = manifestName;
    }

    /**
     * 显式路径优先，否则取插件目录下的默认清单
     */
    public Path resolve(Path pluginPath, Path manifestPath) {
        if (manifestPath != null) {
            return manifestPath;
        }
        return Files.isDirectory(pluginPath) ? pluginPath.resolve(manifestName) : pluginPath.resolveSibling(manifestName);
    }

    public PluginManifest load(Path manifestFile) throws IOException {
        PluginManifest manifest = JsonSupport.mapper().readValue(manifestFile.toFile(), PluginManifest.class);
        log.debug("Loaded manifest {} from {}", manifest, manifestFile);
        return manifest;
    }

    /**
     * 将签名块写入清单，保留清单中的其他字段
     */
    public void writeSignature(Path manifestFile, PluginSignature signature) throws IOException {
        ObjectNode root = Files.exists(manifestFile)
                ? (ObjectNode) JsonSupport.mapper().readTree(manifestFile.toFile())
                : JsonSupport.mapper().createObjectNode();
        root.set("signature", JsonSupport.mapper().valueToTree(signature));
        JsonSupport.mapper().writerWithDefaultPrettyPrinter().writeValue(manifestFile.toFile(), root);
        log.info("Signature written to {}", manifestFile);
    }
}
