package com.lingshield.core.config;

import com.lingshield.core.util.YamlCompatUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从 lingshield.yml 加载配置，未声明的字段保持默认值
 */
@Slf4j
public class LingShieldConfigLoader {

    public static final String DEFAULT_RESOURCE = "lingshield.yml";

    public static LingShieldConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.info("Config file {} not found, using defaults", path);
            return LingShieldConfig.defaults();
        }
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config: " + path, e);
        }
    }

    /**
     * 从 classpath 加载，资源不存在时返回默认配置
     */
    public static LingShieldConfig loadFromClasspath(String resource) {
        InputStream is = LingShieldConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            log.info("Config resource {} not found on classpath, using defaults", resource);
            return LingShieldConfig.defaults();
        }
        return load(is);
    }

    public static LingShieldConfig load(InputStream inputStream) {
        Yaml yaml = YamlCompatUtils.createLoaderYaml(LingShieldConfig.class);
        try (InputStream is = inputStream) {
            LingShieldConfig config = yaml.loadAs(is, LingShieldConfig.class);
            return config != null ? config : LingShieldConfig.defaults();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load YAML configuration", e);
        }
    }
}
