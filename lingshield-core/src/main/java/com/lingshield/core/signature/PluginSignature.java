package com.lingshield.core.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lingshield.core.exception.SigningException;
import com.lingshield.core.util.JsonSupport;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 嵌入在插件清单中的签名块，创建后不再修改
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PluginSignature {

    SignatureAlgorithm algorithm;

    /**
     * Base64 签名值
     */
    String signatureValue;

    Instant signingTime;

    /**
     * PEM 形式的签名者证书
     */
    String signerCertificate;

    /**
     * 签名者之上的中间证书，由近及远
     */
    @Singular("chainCertificate")
    List<String> certificateChain;

    String contentHash;

    @Builder.Default
    String hashAlgorithm = "SHA-256";

    @Singular
    List<SignedAttribute> signedAttributes;

    public Optional<SignedAttribute> attribute(String oid) {
        return signedAttributes.stream().filter(a -> oid.equals(a.oid())).findFirst();
    }

    /**
     * 实际参与签名的规范化字节：算法、摘要与全部签名属性
     */
    public byte[] signedPayload() {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("algorithm", algorithm == null ? null : algorithm.name());
        payload.put("contentHash", contentHash);
        payload.put("hashAlgorithm", hashAlgorithm);
        payload.put("signedAttributes", signedAttributes);
        try {
            return JsonSupport.canonical().writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new SigningException("Failed to serialize signed payload", e);
        }
    }
}
