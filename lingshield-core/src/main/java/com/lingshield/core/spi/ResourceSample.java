package com.lingshield.core.spi;

/**
 * 一次资源采样
 * <p>
 * cpuPercent / memoryBytes / openConnections / processes 为瞬时值，
 * 其余 IO 计数为距上次采样的增量。
 *
 * @param cpuPercent      CPU 使用率（0-100，按分配核数折算）
 * @param memoryBytes     内存占用
 * @param cpuTimeMs       本周期消耗的 CPU 时间
 * @param diskReadBytes   本周期磁盘读
 * @param diskWriteBytes  本周期磁盘写
 * @param networkInBytes  本周期网络入流量
 * @param networkOutBytes 本周期网络出流量
 * @param openConnections 当前连接数
 * @param processes       当前进程数
 */
public record ResourceSample(double cpuPercent,
                             long memoryBytes,
                             long cpuTimeMs,
                             long diskReadBytes,
                             long diskWriteBytes,
                             long networkInBytes,
                             long networkOutBytes,
                             int openConnections,
                             int processes) {

    public static final ResourceSample EMPTY = new ResourceSample(0, 0, 0, 0, 0, 0, 0, 0, 0);

    public static ResourceSample of(double cpuPercent, long memoryBytes) {
        return new ResourceSample(cpuPercent, memoryBytes, 0, 0, 0, 0, 0, 0, 0);
    }
}
