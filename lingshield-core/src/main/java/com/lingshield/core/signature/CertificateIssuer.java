package com.lingshield.core.signature;

import com.lingshield.core.exception.SigningException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.DERUTF8String;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.IOException;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * X.509 证书签发
 * <p>
 * 生成自签名根证书，或使用签发者私钥签发中间/叶子证书。叶子证书带 codeSigning 用途，
 * 插件 ID 写入 SubjectAltName，权限与信任级别写入插件授权扩展。
 */
@Slf4j
public class CertificateIssuer {

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public CertificateIssuer() {
        this(Clock.systemUTC());
    }

    public CertificateIssuer(Clock clock) {
        this.clock = clock;
    }

    /**
     * 自签名根证书，主体即签发者
     */
    public PluginCertificate selfSigned(CertificateRequest request, KeyPair keyPair) {
        X500Name subject = new X500Name(request.getSubject());
        Instant validFrom = validFrom(request);
        return sign(request, subject, validFrom, validFrom.plus(request.getValidity()), keyPair.getPrivate());
    }

    /**
     * 由 issuer 签发下级证书，有效期不超过签发者
     */
    public PluginCertificate issue(CertificateRequest request, PluginCertificate issuer, PrivateKey issuerKey) {
        if (!issuer.isCa()) {
            throw new SigningException("Certificate '" + issuer.getSubject() + "' is not allowed to issue certificates");
        }
        X500Name issuerName = X500Name.getInstance(issuer.getX509Certificate().getSubjectX500Principal().getEncoded());
        Instant validFrom = validFrom(request);
        Instant validTo = validFrom.plus(request.getValidity());
        if (validTo.isAfter(issuer.getValidTo())) {
            validTo = issuer.getValidTo();
        }
        return sign(request, issuerName, validFrom, validTo, issuerKey);
    }

    private PluginCertificate sign(CertificateRequest request, X500Name issuer, Instant validFrom, Instant validTo,
                                   PrivateKey issuerKey) {
        try {
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(issuer, serial(request),
                    Date.from(validFrom), Date.from(validTo), new X500Name(request.getSubject()), request.getPublicKey());
            addExtensions(builder, request);

            String algorithm = SignatureAlgorithm.defaultFor(issuerKey).certificateSignatureName();
            ContentSigner signer = new JcaContentSignerBuilder(algorithm).build(issuerKey);
            X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(builder.build(signer));

            PluginCertificate issued = CertificateCodec.fromX509(certificate);
            log.info("[{}] Certificate issued by '{}', serial={}, validTo={}",
                    issued.getSubject(), issued.getIssuer(), issued.getSerialNumber(), issued.getValidTo());
            return issued;
        } catch (OperatorCreationException | CertificateException | IOException | IllegalArgumentException e) {
            throw new SigningException("Failed to sign certificate for '" + request.getSubject() + "'", e);
        }
    }

    private static void addExtensions(X509v3CertificateBuilder builder, CertificateRequest request) throws IOException {
        if (request.isCa()) {
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
            builder.addExtension(Extension.keyUsage, true,
                    new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature));
        } else {
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_codeSigning));
        }
        if (request.getPluginId() != null) {
            builder.addExtension(Extension.subjectAlternativeName, false,
                    new GeneralNames(new GeneralName(GeneralName.dNSName, request.getPluginId())));
        }
        ASN1Encodable[] permissions = request.getPermissions().stream()
                .map(DERUTF8String::new)
                .toArray(ASN1Encodable[]::new);
        builder.addExtension(PluginCertificate.AUTHORIZATION_EXTENSION, false, new DERSequence(new ASN1Encodable[]{
                new DERUTF8String(request.getTrustLevel().name()),
                new DERSequence(permissions)
        }));
    }

    private Instant validFrom(CertificateRequest request) {
        return (request.getValidFrom() != null ? request.getValidFrom() : clock.instant()).truncatedTo(ChronoUnit.SECONDS);
    }

    private BigInteger serial(CertificateRequest request) {
        if (request.getSerialNumber() != null) {
            return new BigInteger(request.getSerialNumber(), 16);
        }
        return new BigInteger(63, random).add(BigInteger.ONE);
    }
}
