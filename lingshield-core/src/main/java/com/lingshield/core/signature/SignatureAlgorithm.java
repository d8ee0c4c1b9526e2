package com.lingshield.core.signature;

import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;

/**
 * 支持的签名算法
 */
public enum SignatureAlgorithm {

    RSA_PSS("RSASSA-PSS", "RSA", "SHA256withRSA"),
    RSA_PKCS1("SHA256withRSA", "RSA", "SHA256withRSA"),
    ECDSA("SHA256withECDSA", "EC", "SHA256withECDSA"),
    EDDSA("Ed25519", "EdDSA", "Ed25519");

    private static final int RSA_KEY_SIZE = 2048;

    private final String jcaName;
    private final String keyAlgorithm;
    private final String certificateSignatureName;

    SignatureAlgorithm(String jcaName, String keyAlgorithm, String certificateSignatureName) {
        this.jcaName = jcaName;
        this.keyAlgorithm = keyAlgorithm;
        this.certificateSignatureName = certificateSignatureName;
    }

    public String getKeyAlgorithm() {
        return keyAlgorithm;
    }

    /**
     * 签发 X.509 证书时使用的算法名
     */
    public String certificateSignatureName() {
        return certificateSignatureName;
    }

    public Signature newSignature() throws GeneralSecurityException {
        Signature signature = Signature.getInstance(jcaName);
        if (this == RSA_PSS) {
            signature.setParameter(new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1));
        }
        return signature;
    }

    public KeyPair generateKeyPair() throws GeneralSecurityException {
        switch (this) {
            case ECDSA: {
                KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
                generator.initialize(new ECGenParameterSpec("secp256r1"));
                return generator.generateKeyPair();
            }
            case EDDSA:
                return KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
            default: {
                KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
                generator.initialize(RSA_KEY_SIZE);
                return generator.generateKeyPair();
            }
        }
    }

    /**
     * 按密钥类型选择默认算法：RSA 使用 PSS
     */
    public static SignatureAlgorithm defaultFor(Key key) {
        String algorithm = key.getAlgorithm();
        if ("EC".equals(algorithm)) {
            return ECDSA;
        }
        if ("EdDSA".equals(algorithm) || "Ed25519".equals(algorithm)) {
            return EDDSA;
        }
        if ("RSA".equals(algorithm)) {
            return RSA_PSS;
        }
        throw new IllegalArgumentException("Unsupported key algorithm: " + algorithm);
    }

    public boolean supports(Key key) {
        String algorithm = key.getAlgorithm();
        return keyAlgorithm.equals(algorithm) || (this == EDDSA && "Ed25519".equals(algorithm));
    }
}
