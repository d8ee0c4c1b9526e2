package com.lingshield.core.signature;

import com.lingshield.api.security.TrustLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 签名验证结果
 * <p>
 * 任一 FATAL 错误即无效；非 FATAL 错误与警告只影响信任级别与策略判断。
 */
@Value
@Builder
public class VerificationResult {

    boolean valid;

    @Builder.Default
    TrustLevel trustLevel = TrustLevel.UNTRUSTED;

    @Builder.Default
    CertificateChain chain = CertificateChain.EMPTY;

    @Singular
    List<VerificationError> errors;

    @Singular
    List<VerificationWarning> warnings;

    PluginCertificate certificate;

    PluginManifest manifest;

    /**
     * 最后执行的步骤，FATAL 短路时停在出错步骤
     */
    VerificationStep completedStep;

    Instant verifiedAt;

    public Optional<PluginCertificate> certificate() {
        return Optional.ofNullable(certificate);
    }

    public boolean hasError(VerificationErrorCode code) {
        return errors.stream().anyMatch(e -> e.getCode() == code);
    }

    public boolean hasWarning(VerificationWarningCode code) {
        return warnings.stream().anyMatch(w -> w.getCode() == code);
    }

    public boolean hasFatalError() {
        return errors.stream().anyMatch(VerificationError::isFatal);
    }
}
