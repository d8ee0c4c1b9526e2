package com.lingshield.core.framework;

/**
 * 运行期受监控的插件操作
 */
public enum OperationType {
    NETWORK_CONNECT,
    FILE_READ,
    FILE_WRITE,
    PROCESS_SPAWN,
    DATA_QUERY,
    PERMISSION_USE,
    API_CALL
}
