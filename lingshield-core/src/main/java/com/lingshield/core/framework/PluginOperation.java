package com.lingshield.core.framework;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 插件发起的单次操作
 * <p>
 * target 的含义随类型变化：主机名、文件路径、可执行文件、数据库.表、权限名或 API 名。
 */
@Value
@Builder(toBuilder = true)
public class PluginOperation {

    @NonNull
    OperationType type;

    @NonNull
    String target;

    /**
     * 仅 NETWORK_CONNECT
     */
    int port;

    /**
     * 传输或写入的字节数
     */
    long bytes;

    /**
     * DATA_QUERY 的执行耗时
     */
    long durationMs;

    /**
     * 声明所需的权限，API_CALL 可选
     */
    String permission;

    /**
     * 操作参数，用于攻击特征匹配
     */
    @Singular
    Map<String, Object> arguments;

    public static PluginOperation connect(String host, int port, long bytes) {
        return PluginOperation.builder().type(OperationType.NETWORK_CONNECT).target(host).port(port).bytes(bytes).build();
    }

    public static PluginOperation read(String path) {
        return PluginOperation.builder().type(OperationType.FILE_READ).target(path).build();
    }

    public static PluginOperation write(String path, long bytes) {
        return PluginOperation.builder().type(OperationType.FILE_WRITE).target(path).bytes(bytes).build();
    }
}
