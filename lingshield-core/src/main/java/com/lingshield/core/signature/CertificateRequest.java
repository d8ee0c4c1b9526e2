package com.lingshield.core.signature;

import com.lingshield.api.security.TrustLevel;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.security.PublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 证书签发请求
 */
@Value
@Builder
public class CertificateRequest {

    @NonNull
    String subject;

    @NonNull
    PublicKey publicKey;

    String pluginId;

    /**
     * 为空时使用签发时刻
     */
    Instant validFrom;

    @Builder.Default
    Duration validity = Duration.ofDays(365);

    @Singular
    List<String> permissions;

    @Builder.Default
    TrustLevel trustLevel = TrustLevel.MEDIUM;

    /**
     * 是否允许继续签发下级证书
     */
    boolean ca;

    /**
     * 为空时随机生成
     */
    String serialNumber;
}
