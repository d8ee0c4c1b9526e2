package com.lingshield.core.signature;

import com.lingshield.api.security.TrustLevel;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 信任锚：显式登记的自签名根证书及其信任级别
 */
@Value
@Builder(toBuilder = true)
public class TrustAnchor {

    @NonNull
    String id;

    String name;

    @NonNull
    PluginCertificate certificate;

    @NonNull
    TrustLevel trustLevel;

    @Builder.Default
    boolean enabled = true;

    String crlUrl;
}
