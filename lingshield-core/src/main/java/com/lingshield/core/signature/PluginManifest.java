package com.lingshield.core.signature;

import com.lingshield.api.exception.InvalidArgumentException;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对应 plugin.json 的根节点
 */
@Getter
@Setter
public class PluginManifest {

    // === 基础元数据 ===
    private String id;
    private String name;
    private String version;
    private String description;
    private String author;
    private String homepage;
    private String repository;
    private String license;

    private String main;

    // === 安全声明 ===
    private List<String> permissions = new ArrayList<>();
    private Map<String, String> dependencies = new LinkedHashMap<>();
    private Resources resources = new Resources();

    private PluginSignature signature;

    private Map<String, Object> metadata = new HashMap<>();

    /**
     * 插件声明的资源需求，0 表示未声明
     */
    @Getter
    @Setter
    public static class Resources {
        private long memoryBytes;
        private long cpuTimeMs;
        private long diskBytes;
        private int processes;
        private int connections;
    }

    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidArgumentException("id", "Plugin id cannot be blank");
        }
        if (version == null || version.trim().isEmpty()) {
            throw new InvalidArgumentException("version", "Plugin version cannot be blank");
        }
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{id='%s', version='%s'}", id, version);
    }
}
