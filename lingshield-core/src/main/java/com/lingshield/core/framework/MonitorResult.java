package com.lingshield.core.framework;

import com.lingshield.core.violation.SecurityViolation;

import java.util.Optional;

/**
 * 运行期监控结论
 * <p>
 * 资源越限时 allowed 仍为 true，同时携带违规记录。
 *
 * @param allowed   操作是否放行
 * @param violation 产生的违规，可能为空
 */
public record MonitorResult(boolean allowed, SecurityViolation violation) {

    public static final MonitorResult ALLOWED = new MonitorResult(true, null);

    public static MonitorResult denied(SecurityViolation violation) {
        return new MonitorResult(false, violation);
    }

    public static MonitorResult throttled(SecurityViolation violation) {
        return new MonitorResult(true, violation);
    }

    public Optional<SecurityViolation> violationOpt() {
        return Optional.ofNullable(violation);
    }
}
