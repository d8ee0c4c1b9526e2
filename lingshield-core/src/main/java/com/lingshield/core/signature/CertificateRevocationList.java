package com.lingshield.core.signature;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 单个签发者的吊销列表
 */
@Value
@Builder(toBuilder = true)
public class CertificateRevocationList {

    @NonNull
    String issuer;

    @NonNull
    Instant thisUpdate;

    Instant nextUpdate;

    @Singular("revoked")
    List<RevokedCertificate> revokedCertificates;

    public Optional<RevokedCertificate> find(String serialNumber) {
        return revokedCertificates.stream()
                .filter(r -> r.serialNumber().equals(serialNumber))
                .findFirst();
    }
}
