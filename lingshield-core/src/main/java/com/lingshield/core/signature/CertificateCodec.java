package com.lingshield.core.signature;

import com.lingshield.core.exception.CertificateFormatException;
import com.lingshield.core.exception.SigningException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.PKCS8Generator;
import org.bouncycastle.openssl.jcajce.JcaMiscPEMGenerator;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8EncryptorBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.OutputEncryptor;
import org.bouncycastle.pkcs.PKCSException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.util.io.pem.PemObjectGenerator;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;

/**
 * X.509 证书与 PKCS#8 私钥的 PEM 编解码
 */
public final class CertificateCodec {

    static final String CERTIFICATE_HEADER = "-----BEGIN CERTIFICATE-----";

    private static final Provider PROVIDER = new BouncyCastleProvider();
    private static final int KEY_ENCRYPTION_ITERATIONS = 10_000;
    private static final String[] KEY_ALGORITHMS = {"RSA", "EC", "Ed25519"};

    private CertificateCodec() {
    }

    // ==================== 证书 ====================

    public static PluginCertificate decode(String pem) {
        if (pem == null || !pem.contains(CERTIFICATE_HEADER)) {
            throw new CertificateFormatException("No CERTIFICATE block present");
        }
        Certificate certificate;
        try {
            certificate = CertificateFactory.getInstance("X.509")
                    .generateCertificate(new ByteArrayInputStream(pem.trim().getBytes(StandardCharsets.US_ASCII)));
        } catch (CertificateException e) {
            throw new CertificateFormatException("Malformed X.509 certificate: " + e.getMessage(), e);
        }
        if (!(certificate instanceof X509Certificate)) {
            throw new CertificateFormatException("Not an X.509 certificate: " + certificate.getType());
        }
        return new PluginCertificate((X509Certificate) certificate, encode(certificate));
    }

    public static PluginCertificate fromX509(X509Certificate certificate) {
        return new PluginCertificate(certificate, encode(certificate));
    }

    static String encode(Certificate certificate) {
        try {
            return write(new JcaMiscPEMGenerator(certificate));
        } catch (IOException e) {
            throw new CertificateFormatException("Failed to encode certificate: " + e.getMessage(), e);
        }
    }

    // ==================== 私钥 ====================

    public static String encodePrivateKey(PrivateKey key) {
        try {
            return write(new JcaPKCS8Generator(key, null));
        } catch (IOException e) {
            throw new SigningException("Failed to encode private key", e);
        }
    }

    /**
     * 以口令加密为 PKCS#8 EncryptedPrivateKeyInfo（AES-256-CBC）
     */
    public static String encodePrivateKey(PrivateKey key, char[] passphrase) {
        try {
            OutputEncryptor encryptor = new JceOpenSSLPKCS8EncryptorBuilder(PKCS8Generator.AES_256_CBC)
                    .setProvider(PROVIDER)
                    .setRandom(new SecureRandom())
                    .setIterationCount(KEY_ENCRYPTION_ITERATIONS)
                    .setPassword(passphrase)
                    .build();
            return write(new JcaPKCS8Generator(key, encryptor));
        } catch (OperatorCreationException | IOException e) {
            throw new SigningException("Failed to encrypt private key", e);
        }
    }

    /**
     * 解析 PEM 私钥；加密私钥需要口令
     */
    public static PrivateKey decodePrivateKey(String pem, char[] passphrase) {
        Object parsed;
        try (PEMParser parser = new PEMParser(new StringReader(pem == null ? "" : pem))) {
            parsed = parser.readObject();
        } catch (IOException e) {
            throw new SigningException("Unreadable private key PEM: " + e.getMessage(), e);
        }

        PrivateKeyInfo info;
        if (parsed instanceof PKCS8EncryptedPrivateKeyInfo) {
            if (passphrase == null) {
                throw new SigningException("Private key is encrypted but no passphrase was supplied");
            }
            try {
                info = ((PKCS8EncryptedPrivateKeyInfo) parsed).decryptPrivateKeyInfo(
                        new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(PROVIDER).build(passphrase));
            } catch (OperatorCreationException | PKCSException e) {
                throw new SigningException("Failed to decrypt private key", e);
            }
        } else if (parsed instanceof PrivateKeyInfo) {
            info = (PrivateKeyInfo) parsed;
        } else {
            throw new SigningException("No PKCS#8 private key block present");
        }

        PKCS8EncodedKeySpec spec;
        try {
            spec = new PKCS8EncodedKeySpec(info.getEncoded());
        } catch (IOException e) {
            throw new SigningException("Failed to re-encode private key", e);
        }
        GeneralSecurityException last = null;
        for (String algorithm : KEY_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePrivate(spec);
            } catch (GeneralSecurityException e) {
                last = e;
            }
        }
        throw new SigningException("Unsupported private key type", last);
    }

    private static String write(PemObjectGenerator generator) throws IOException {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(generator);
        }
        return out.toString();
    }
}
