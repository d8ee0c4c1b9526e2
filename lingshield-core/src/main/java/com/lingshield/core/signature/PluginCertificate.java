package com.lingshield.core.signature;

import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.exception.CertificateFormatException;
import com.lingshield.core.util.ContentHasher;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;

import javax.security.auth.x500.X500Principal;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 插件证书：X.509 证书及其插件授权扩展
 * <p>
 * 插件 ID 取自 SubjectAltName 的 dNSName；权限与信任级别取自 {@link #AUTHORIZATION_EXTENSION}。
 * 内容不可变，仅吊销状态会在验证过程中被标记。
 */
@Slf4j
public class PluginCertificate {

    /**
     * 插件授权扩展：SEQUENCE { trustLevel UTF8String, permissions SEQUENCE OF UTF8String }
     */
    public static final ASN1ObjectIdentifier AUTHORIZATION_EXTENSION = new ASN1ObjectIdentifier("1.3.6.1.4.1.59173.1.1");

    private final X509Certificate certificate;
    private final String encoded;
    private final String fingerprint;
    private final String pluginId;
    private final List<String> permissions;
    private final TrustLevel trustLevel;

    private volatile boolean revoked;
    private volatile Instant revokedAt;
    private volatile String revocationReason;

    PluginCertificate(X509Certificate certificate, String encoded) {
        this.certificate = certificate;
        this.encoded = encoded;
        try {
            this.fingerprint = ContentHasher.sha256Hex(certificate.getEncoded());
        } catch (CertificateEncodingException e) {
            throw new CertificateFormatException("Certificate cannot be re-encoded: " + e.getMessage(), e);
        }
        this.pluginId = readPluginId(certificate);
        List<String> granted = new ArrayList<>();
        this.trustLevel = readAuthorization(certificate, granted);
        this.permissions = Collections.unmodifiableList(granted);
    }

    // ==================== 属性 ====================

    /**
     * 十六进制序列号
     */
    public String getSerialNumber() {
        return certificate.getSerialNumber().toString(16);
    }

    public String getSubject() {
        return certificate.getSubjectX500Principal().getName(X500Principal.RFC2253);
    }

    public String getIssuer() {
        return certificate.getIssuerX500Principal().getName(X500Principal.RFC2253);
    }

    public Optional<String> getPluginId() {
        return Optional.ofNullable(pluginId);
    }

    public Instant getValidFrom() {
        return certificate.getNotBefore().toInstant();
    }

    public Instant getValidTo() {
        return certificate.getNotAfter().toInstant();
    }

    public List<String> getPermissions() {
        return permissions;
    }

    public TrustLevel getTrustLevel() {
        return trustLevel;
    }

    public boolean isCa() {
        return certificate.getBasicConstraints() >= 0;
    }

    public PublicKey getPublicKey() {
        return certificate.getPublicKey();
    }

    public X509Certificate getX509Certificate() {
        return certificate;
    }

    /**
     * PEM 形式的完整证书
     */
    public String getEncoded() {
        return encoded;
    }

    /**
     * DER 编码的 SHA-256 指纹（十六进制）
     */
    public String getFingerprint() {
        return fingerprint;
    }

    // ==================== 校验 ====================

    /**
     * 证书签名能否被给定公钥验证
     */
    public boolean isSignedBy(PublicKey issuerKey) {
        try {
            certificate.verify(issuerKey);
            return true;
        } catch (GeneralSecurityException e) {
            log.debug("[{}] Certificate signature check failed: {}", getSubject(), e.getMessage());
            return false;
        }
    }

    public boolean isIssuedBy(PluginCertificate issuer) {
        return certificate.getIssuerX500Principal().equals(issuer.certificate.getSubjectX500Principal())
                && isSignedBy(issuer.getPublicKey());
    }

    public boolean isSelfSigned() {
        return certificate.getIssuerX500Principal().equals(certificate.getSubjectX500Principal())
                && isSignedBy(certificate.getPublicKey());
    }

    public boolean isValidAt(Instant instant) {
        return !instant.isBefore(getValidFrom()) && !instant.isAfter(getValidTo());
    }

    /**
     * RSA 模长；非 RSA 密钥返回 -1
     */
    public int rsaKeySize() {
        PublicKey key = certificate.getPublicKey();
        return key instanceof RSAKey ? ((RSAKey) key).getModulus().bitLength() : -1;
    }

    // ==================== 吊销 ====================

    public boolean isRevoked() {
        return revoked;
    }

    public Optional<Instant> getRevokedAt() {
        return Optional.ofNullable(revokedAt);
    }

    public Optional<String> getRevocationReason() {
        return Optional.ofNullable(revocationReason);
    }

    void markRevoked(Instant at, String reason) {
        this.revokedAt = at;
        this.revocationReason = reason;
        this.revoked = true;
    }

    // ==================== 扩展解析 ====================

    private static String readPluginId(X509Certificate certificate) {
        byte[] raw = certificate.getExtensionValue(Extension.subjectAlternativeName.getId());
        if (raw == null) {
            return null;
        }
        try {
            for (GeneralName name : GeneralNames.getInstance(JcaX509ExtensionUtils.parseExtensionValue(raw)).getNames()) {
                if (name.getTagNo() == GeneralName.dNSName) {
                    return ((ASN1String) name.getName()).getString();
                }
            }
            return null;
        } catch (IOException | IllegalArgumentException e) {
            throw new CertificateFormatException("Malformed subjectAltName extension: " + e.getMessage(), e);
        }
    }

    private static TrustLevel readAuthorization(X509Certificate certificate, List<String> permissions) {
        byte[] raw = certificate.getExtensionValue(AUTHORIZATION_EXTENSION.getId());
        if (raw == null) {
            return TrustLevel.UNTRUSTED;
        }
        try {
            ASN1Sequence authorization = ASN1Sequence.getInstance(JcaX509ExtensionUtils.parseExtensionValue(raw));
            TrustLevel level = TrustLevel.valueOf(((ASN1String) authorization.getObjectAt(0)).getString());
            for (ASN1Encodable permission : ASN1Sequence.getInstance(authorization.getObjectAt(1))) {
                permissions.add(((ASN1String) permission).getString());
            }
            return level;
        } catch (IOException | IllegalArgumentException | ClassCastException | IndexOutOfBoundsException e) {
            throw new CertificateFormatException("Malformed plugin authorization extension: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginCertificate)) return false;
        return fingerprint.equals(((PluginCertificate) o).fingerprint);
    }

    @Override
    public int hashCode() {
        return fingerprint.hashCode();
    }

    @Override
    public String toString() {
        return String.format("PluginCertificate{subject='%s', issuer='%s', serial='%s'}",
                getSubject(), getIssuer(), getSerialNumber());
    }
}
