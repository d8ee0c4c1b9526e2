package com.lingshield.core.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lingshield.core.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 执行前静态检查：在派发到隔离单元之前拒绝越界请求
 */
public class CodeGuard {

    public static final int MAX_CODE_BYTES = 1024 * 1024;
    public static final int MAX_CONTEXT_BYTES = 10 * 1024;

    /**
     * 禁用原语：创建进程、退出虚拟机、动态求值
     */
    private static final List<DeniedPrimitive> DENY_LIST = List.of(
            new DeniedPrimitive("process-spawn", Pattern.compile(
                    "Runtime\\s*\\.\\s*getRuntime\\s*\\(\\s*\\)\\s*\\.\\s*exec|new\\s+ProcessBuilder\\b"
                            + "|\\bchild_process\\b|\\bspawnSync?\\s*\\(|\\bexecSync\\s*\\(|\\bsubprocess\\.|\\bos\\.system\\s*\\(")),
            new DeniedPrimitive("vm-exit", Pattern.compile(
                    "System\\s*\\.\\s*exit\\s*\\(|Runtime\\s*\\.\\s*getRuntime\\s*\\(\\s*\\)\\s*\\.\\s*(halt|exit)\\s*\\("
                            + "|\\bprocess\\s*\\.\\s*(exit|abort|kill)\\s*\\(")),
            new DeniedPrimitive("dynamic-eval", Pattern.compile(
                    "(?<![\\w.])eval\\s*\\(|new\\s+Function\\s*\\(|\\bScriptEngineManager\\b|\\bdefineClass\\s*\\("))
    );

    /**
     * @return 被拒绝时返回原因
     */
    public Optional<Rejection> check(String code, Map<String, Object> context) {
        if (code == null || code.isBlank()) {
            return Optional.of(new Rejection("Code must not be blank", null));
        }
        int codeBytes = code.getBytes(StandardCharsets.UTF_8).length;
        if (codeBytes > MAX_CODE_BYTES) {
            return Optional.of(new Rejection("Code size " + codeBytes + " exceeds limit " + MAX_CODE_BYTES, null));
        }
        if (context != null && !context.isEmpty()) {
            int contextBytes;
            try {
                contextBytes = JsonSupport.mapper().writeValueAsBytes(context).length;
            } catch (JsonProcessingException e) {
                return Optional.of(new Rejection("Context is not serializable: " + e.getOriginalMessage(), null));
            }
            if (contextBytes > MAX_CONTEXT_BYTES) {
                return Optional.of(new Rejection(
                        "Context size " + contextBytes + " exceeds limit " + MAX_CONTEXT_BYTES, null));
            }
        }
        for (DeniedPrimitive primitive : DENY_LIST) {
            if (primitive.pattern().matcher(code).find()) {
                return Optional.of(new Rejection("Denied primitive: " + primitive.name(), primitive.name()));
            }
        }
        return Optional.empty();
    }

    private record DeniedPrimitive(String name, Pattern pattern) {
    }

    /**
     * 拒绝结果
     *
     * @param reason    原因
     * @param primitive 命中的禁用原语，尺寸类拒绝为空
     */
    public record Rejection(String reason, String primitive) {

        public boolean isDeniedPrimitive() {
            return primitive != null;
        }
    }
}
