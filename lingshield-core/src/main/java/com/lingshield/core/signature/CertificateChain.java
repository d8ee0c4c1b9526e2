package com.lingshield.core.signature;

import java.util.List;
import java.util.Optional;

/**
 * 构建后的证书链：叶子在前，信任锚（若找到）在末尾
 *
 * @param anchorId 终止该链的信任锚，链不完整时为空
 */
public record CertificateChain(List<PluginCertificate> certificates, String anchorId, boolean complete) {

    public static final CertificateChain EMPTY = new CertificateChain(List.of(), null, false);

    public CertificateChain {
        certificates = List.copyOf(certificates);
    }

    public int length() {
        return certificates.size();
    }

    public Optional<PluginCertificate> leaf() {
        return certificates.isEmpty() ? Optional.empty() : Optional.of(certificates.get(0));
    }

    public Optional<String> anchor() {
        return Optional.ofNullable(anchorId);
    }
}
