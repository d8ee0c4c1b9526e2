package com.lingshield.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Map;

/**
 * YAML 工具类
 * <p>
 * SnakeYAML 2.x 默认禁止 !! 全局标签，这里只放行 com.lingshield.* 包下的类型。
 */
public class YamlCompatUtils {

    private static final String TRUSTED_PACKAGE = "com.lingshield.";

    /**
     * 创建绑定到指定根类型的加载器
     */
    public static Yaml createLoaderYaml(Class<?> rootType) {
        LoaderOptions loaderOptions = createLoaderOptions();
        return new Yaml(new Constructor(rootType, loaderOptions));
    }

    /**
     * 创建只产出基础类型（Map / List / 标量）的安全加载器
     */
    public static Yaml createSafeYaml() {
        return new Yaml(new SafeConstructor(createLoaderOptions()));
    }

    /**
     * 读取为 Map，空文档返回空 Map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadMap(InputStream inputStream) {
        try (InputStream is = inputStream) {
            Object loaded = createSafeYaml().load(is);
            if (loaded instanceof Map) {
                return (Map<String, Object>) loaded;
            }
            return Collections.emptyMap();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load YAML document", e);
        }
    }

    private static LoaderOptions createLoaderOptions() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setTagInspector(tag -> tag.getClassName().startsWith(TRUSTED_PACKAGE));
        loaderOptions.setAllowDuplicateKeys(false);
        return loaderOptions;
    }
}
