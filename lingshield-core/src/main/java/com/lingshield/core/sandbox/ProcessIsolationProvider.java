package com.lingshield.core.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lingshield.api.exception.InvalidArgumentException;
import com.lingshield.core.exception.SandboxException;
import com.lingshield.core.spi.ExecutionRequest;
import com.lingshield.core.spi.ExecutionUnit;
import com.lingshield.core.spi.IsolationProvider;
import com.lingshield.core.spi.ResourceSample;
import com.lingshield.core.util.JsonSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 进程隔离：每个沙箱启动一个外部进程
 * <p>
 * 启动命令来自模板，支持占位符：
 * <ul>
 * <li>${sandboxId} ${pluginId} ${workspace} ${config}</li>
 * <li>${memoryLimitBytes} ${cpuCores} ${maxProcesses}</li>
 * </ul>
 * 宿主与子进程通过标准输入输出交换 JSON Lines：
 * 请求 {"type":"execute","requestId":..,"code":..,"context":..,"timeoutMs":..}，
 * 响应 {"requestId":..,"success":true|false,"result":..,"error":..}。
 * 限额、网络与文件规则在启动前写入工作目录下的 sandbox.json。
 */
@Slf4j
public class ProcessIsolationProvider implements IsolationProvider {

    public static final String NAME = "process";

    static final String CONFIG_FILE = "sandbox.json";

    private final List<String> commandTemplate;

    public ProcessIsolationProvider(List<String> commandTemplate) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new InvalidArgumentException("launcherCommand", "Launcher command must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionUnit create(String sandboxId, SandboxConfig config) {
        return new ProcessUnit(sandboxId, config.getPluginId(), commandTemplate);
    }

    static class ProcessUnit implements ExecutionUnit {

        private final String sandboxId;
        private final String pluginId;
        private final List<String> commandTemplate;
        private final ObjectMapper mapper = JsonSupport.mapper();
        private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();

        private volatile SandboxConfig.ResourceLimits limits;
        private volatile SandboxConfig.NetworkConfig network;
        private volatile SandboxConfig.FilesystemConfig filesystem;
        private volatile Path workspace;

        private volatile Process process;
        private BufferedWriter stdin;

        private Duration lastCpu = Duration.ZERO;
        private long lastWallNanos;

        ProcessUnit(String sandboxId, String pluginId, List<String> commandTemplate) {
            this.sandboxId = sandboxId;
            this.pluginId = pluginId;
            this.commandTemplate = commandTemplate;
        }

        @Override
        public void applyLimits(SandboxConfig.ResourceLimits limits) {
            this.limits = limits;
            if (process != null) {
                ObjectNode message = mapper.createObjectNode();
                message.put("type", "limits");
                message.set("limits", mapper.valueToTree(limits));
                send(message);
            }
        }

        @Override
        public void applyNetworkRules(SandboxConfig.NetworkConfig network) {
            this.network = network;
        }

        @Override
        public void mountFilesystem(Path workspace, SandboxConfig.FilesystemConfig filesystem) {
            this.workspace = workspace;
            this.filesystem = filesystem;
        }

        @Override
        public void launch() {
            try {
                Path configFile = workspace.resolve(CONFIG_FILE);
                Map<String, Object> descriptor = new LinkedHashMap<>();
                descriptor.put("sandboxId", sandboxId);
                descriptor.put("pluginId", pluginId);
                descriptor.put("limits", limits);
                descriptor.put("network", network);
                descriptor.put("filesystem", filesystem);
                mapper.writeValue(configFile.toFile(), descriptor);

                List<String> command = resolveCommand(configFile);
                Path logs = Files.createDirectories(workspace.resolve("logs"));
                ProcessBuilder builder = new ProcessBuilder(command)
                        .directory(workspace.toFile())
                        .redirectError(logs.resolve("stderr.log").toFile());
                process = builder.start();
                stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
                lastWallNanos = System.nanoTime();

                Thread reader = new Thread(this::readResponses, "lingshield-sandbox-io-" + sandboxId);
                reader.setDaemon(true);
                reader.start();
                log.info("[{}] Isolated process started: pid={}", sandboxId, process.pid());
            } catch (IOException e) {
                throw new SandboxException(sandboxId, "Failed to launch isolated process", e);
            }
        }

        List<String> resolveCommand(Path configFile) {
            List<String> command = new ArrayList<>(commandTemplate.size());
            for (String part : commandTemplate) {
                command.add(part
                        .replace("${sandboxId}", sandboxId)
                        .replace("${pluginId}", pluginId)
                        .replace("${workspace}", workspace.toString())
                        .replace("${config}", configFile.toString())
                        .replace("${memoryLimitBytes}", String.valueOf(limits.getMemoryBytes()))
                        .replace("${cpuCores}", String.valueOf(limits.getCpuCores()))
                        .replace("${maxProcesses}", String.valueOf(limits.getMaxProcesses())));
            }
            return command;
        }

        @Override
        public CompletableFuture<Object> dispatch(ExecutionRequest request) {
            CompletableFuture<Object> result = new CompletableFuture<>();
            pending.put(request.correlationId(), result);
            result.whenComplete((value, error) -> pending.remove(request.correlationId()));

            ObjectNode message = mapper.createObjectNode();
            message.put("type", "execute");
            message.put("requestId", request.correlationId());
            message.put("code", request.code());
            message.set("context", mapper.valueToTree(request.context()));
            message.put("timeoutMs", request.timeoutMs());
            if (!send(message)) {
                result.completeExceptionally(new SandboxException(sandboxId, "Isolated process is not accepting requests"));
            }
            return result;
        }

        private synchronized boolean send(ObjectNode message) {
            if (stdin == null || process == null || !process.isAlive()) {
                return false;
            }
            try {
                stdin.write(mapper.writeValueAsString(message));
                stdin.newLine();
                stdin.flush();
                return true;
            } catch (IOException e) {
                log.warn("[{}] Failed to write to isolated process: {}", sandboxId, e.getMessage());
                return false;
            }
        }

        private void readResponses() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handleResponse(line);
                }
            } catch (IOException e) {
                log.debug("[{}] Isolated process stream closed: {}", sandboxId, e.getMessage());
            }
            SandboxException exited = new SandboxException(sandboxId, "Isolated process exited");
            pending.values().forEach(f -> f.completeExceptionally(exited));
        }

        void handleResponse(String line) {
            if (line.isBlank()) {
                return;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (IOException e) {
                log.warn("[{}] Malformed response from isolated process: {}", sandboxId, e.getMessage());
                return;
            }
            String requestId = node.path("requestId").asText(null);
            CompletableFuture<Object> future = requestId == null ? null : pending.get(requestId);
            if (future == null) {
                log.debug("[{}] Response for unknown request: {}", sandboxId, requestId);
                return;
            }
            if (node.path("success").asBoolean(false)) {
                try {
                    future.complete(mapper.treeToValue(node.get("result"), Object.class));
                } catch (IOException e) {
                    future.completeExceptionally(new SandboxException(sandboxId, "Unreadable result", e));
                }
            } else {
                String error = node.path("error").asText("unknown error");
                future.completeExceptionally(new SandboxException(sandboxId, "Execution failed: " + error));
            }
        }

        @Override
        public synchronized ResourceSample sample() {
            Process p = process;
            if (p == null || !p.isAlive()) {
                return ResourceSample.EMPTY;
            }
            ProcessHandle handle = p.toHandle();
            Duration cpu = handle.info().totalCpuDuration().orElse(lastCpu);
            long now = System.nanoTime();
            long cpuDeltaNanos = Math.max(0, cpu.minus(lastCpu).toNanos());
            long wallDelta = now - lastWallNanos;
            lastCpu = cpu;
            lastWallNanos = now;

            double cores = limits == null || limits.getCpuCores() <= 0 ? 1.0 : limits.getCpuCores();
            double cpuPercent = wallDelta <= 0 ? 0 : Math.min(100.0, cpuDeltaNanos * 100.0 / wallDelta / cores);
            int processes = 1 + (int) handle.descendants().count();
            return new ResourceSample(cpuPercent, residentBytes(p.pid()),
                    TimeUnit.NANOSECONDS.toMillis(cpuDeltaNanos), 0, 0, 0, 0, 0, processes);
        }

        /**
         * Linux 下读取 /proc/[pid]/status 的 VmRSS，其他平台返回 0
         */
        private long residentBytes(long pid) {
            Path status = Path.of("/proc", String.valueOf(pid), "status");
            if (!Files.isReadable(status)) {
                return 0;
            }
            try {
                for (String line : Files.readAllLines(status, StandardCharsets.UTF_8)) {
                    if (line.startsWith("VmRSS:")) {
                        String[] parts = line.substring(6).trim().split("\\s+");
                        return Long.parseLong(parts[0]) * 1024;
                    }
                }
            } catch (IOException | NumberFormatException e) {
                log.debug("[{}] Cannot read resident memory: {}", sandboxId, e.getMessage());
            }
            return 0;
        }

        @Override
        public boolean isResponsive() {
            Process p = process;
            return p != null && p.isAlive();
        }

        @Override
        public void terminate() {
            Process p = process;
            if (p != null && p.isAlive()) {
                ObjectNode message = mapper.createObjectNode();
                message.put("type", "shutdown");
                send(message);
                p.destroy();
            }
        }

        @Override
        public boolean awaitTermination(long timeoutMs) throws InterruptedException {
            Process p = process;
            return p == null || p.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        }

        @Override
        public void kill() {
            Process p = process;
            if (p != null) {
                p.descendants().forEach(ProcessHandle::destroyForcibly);
                p.destroyForcibly();
                log.warn("[{}] Isolated process killed: pid={}", sandboxId, p.pid());
            }
        }
    }
}
