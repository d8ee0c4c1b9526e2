package com.lingshield.core.sandbox;

import java.nio.file.Path;
import java.util.Map;

/**
 * 进程内隔离模式下的代码求值器，由宿主提供
 */
@FunctionalInterface
public interface CodeEvaluator {

    /**
     * 未配置求值器时拒绝一切执行
     */
    CodeEvaluator UNSUPPORTED = (code, context, scope) -> {
        throw new UnsupportedOperationException("No code evaluator configured for sandbox " + scope.sandboxId());
    };

    Object evaluate(String code, Map<String, Object> context, EvaluationScope scope) throws Exception;

    /**
     * 求值时可见的沙箱边界
     */
    record EvaluationScope(String sandboxId,
                           Path workspace,
                           SandboxConfig.ResourceLimits limits,
                           SandboxConfig.NetworkConfig network,
                           SandboxConfig.FilesystemConfig filesystem) {
    }
}
