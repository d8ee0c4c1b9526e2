package com.lingshield.core.signature;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.lingshield.api.exception.InvalidArgumentException;
import com.lingshield.api.security.Severity;
import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.exception.CertificateFormatException;
import com.lingshield.core.exception.SigningException;
import com.lingshield.core.util.ContentHasher;
import com.lingshield.core.util.PermissionMatcher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 插件签名验证与签名
 * <p>
 * 验证按 {@link VerificationStep} 顺序推进，FATAL 错误短路剩余步骤，但已累积的错误与警告照常返回。
 * 验证本身从不抛出异常。完整执行的结果按 (插件路径, 清单路径) 缓存，TTL 内不感知 CRL 变化；
 * 信任锚增删会清空缓存。
 */
@Slf4j
public class SignatureVerifier {

    private static final Set<String> HASH_ALGORITHMS = Set.of("SHA-256", "SHA-384", "SHA-512");
    private static final Set<String> KNOWN_ATTRIBUTES = Set.of(
            SignedAttribute.SIGNING_TIME, SignedAttribute.CONTENT_TYPE, SignedAttribute.MESSAGE_DIGEST);
    private static final int MIN_RSA_BITS = 2048;

    private final LingShieldConfig.SignatureVerification config;
    private final TrustAnchorStore trustAnchors;
    private final RevocationRegistry revocations;
    private final ManifestLoader manifestLoader;
    private final Clock clock;
    private final Cache<String, VerificationResult> cache;

    public SignatureVerifier(LingShieldConfig.SignatureVerification config) {
        this(config, new TrustAnchorStore(), new RevocationRegistry(), Clock.systemUTC(), Ticker.systemTicker());
    }

    public SignatureVerifier(LingShieldConfig.SignatureVerification config, TrustAnchorStore trustAnchors,
                             RevocationRegistry revocations, Clock clock, Ticker ticker) {
        this.config = config;
        this.trustAnchors = trustAnchors;
        this.revocations = revocations;
        this.manifestLoader = new ManifestLoader(config.getManifestName());
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(config.getCacheTtlMs()))
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    // ==================== 验证 ====================

    public VerificationResult verify(Path pluginPath) {
        return verify(pluginPath, null);
    }

    public VerificationResult verify(Path pluginPath, Path manifestPath) {
        InvalidArgumentException.requireNonNull(pluginPath, "pluginPath");
        String cacheKey = cacheKey(pluginPath, manifestPath);
        VerificationResult cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("[{}] Using cached verification result", pluginPath.getFileName());
            return cached;
        }

        Verification verification = new Verification(pluginPath, manifestLoader.resolve(pluginPath, manifestPath));
        log.info("[{}] Verifying plugin signature", pluginPath.getFileName());
        VerificationResult result;
        try {
            result = verification.run();
        } catch (Exception e) {
            log.error("[{}] Signature verification failed unexpectedly", pluginPath.getFileName(), e);
            verification.fatal(VerificationErrorCode.SIGNATURE_INVALID, "Verification failed: " + e.getMessage());
            result = verification.toResult();
        }
        if (result.getCompletedStep() == VerificationStep.DONE) {
            cache.put(cacheKey, result);
        }
        log.info("[{}] Verification complete: valid={}, trustLevel={}, errors={}, warnings={}",
                pluginPath.getFileName(), result.isValid(), result.getTrustLevel(),
                result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    public void invalidateCache() {
        cache.invalidateAll();
    }

    // ==================== 信任锚与吊销 ====================

    public void addTrustAnchor(TrustAnchor anchor) {
        trustAnchors.add(anchor);
        invalidateCache();
    }

    public boolean removeTrustAnchor(String anchorId) {
        boolean removed = trustAnchors.remove(anchorId);
        if (removed) {
            invalidateCache();
        }
        return removed;
    }

    public List<TrustAnchor> listTrustAnchors() {
        return trustAnchors.list();
    }

    public RevocationRegistry getRevocationRegistry() {
        return revocations;
    }

    // ==================== 签名 ====================

    public PluginSignature sign(Path pluginPath, List<PluginCertificate> chain, PrivateKey key) {
        return sign(pluginPath, null, chain, key);
    }

    /**
     * 使用 PEM 私钥签名，加密私钥需提供口令
     */
    public PluginSignature sign(Path pluginPath, List<PluginCertificate> chain, String privateKeyPem, char[] passphrase) {
        return sign(pluginPath, null, chain, CertificateCodec.decodePrivateKey(privateKeyPem, passphrase));
    }

    /**
     * @param chain 叶子证书在前，随后为中间证书
     */
    public PluginSignature sign(Path pluginPath, Path manifestPath, List<PluginCertificate> chain, PrivateKey key) {
        if (chain == null || chain.isEmpty()) {
            throw new SigningException("A signer certificate is required");
        }
        PluginCertificate signer = chain.get(0);
        SignatureAlgorithm algorithm = SignatureAlgorithm.defaultFor(key);
        if (!algorithm.supports(signer.getPublicKey())) {
            throw new SigningException("Private key does not match signer certificate " + signer.getSubject());
        }
        Path manifestFile = manifestLoader.resolve(pluginPath, manifestPath);
        String contentHash;
        try {
            contentHash = contentHash(pluginPath, manifestFile, ContentHasher.DEFAULT_ALGORITHM);
        } catch (IOException e) {
            throw new SigningException("Failed to hash plugin content: " + pluginPath, e);
        }

        Instant signingTime = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        PluginSignature.PluginSignatureBuilder builder = PluginSignature.builder()
                .algorithm(algorithm)
                .signingTime(signingTime)
                .signerCertificate(signer.getEncoded())
                .contentHash(contentHash)
                .hashAlgorithm(ContentHasher.DEFAULT_ALGORITHM)
                .signedAttribute(new SignedAttribute(SignedAttribute.SIGNING_TIME, signingTime.toString(), false))
                .signedAttribute(new SignedAttribute(SignedAttribute.CONTENT_TYPE, SignedAttribute.PLUGIN_CONTENT_TYPE, true))
                .signedAttribute(new SignedAttribute(SignedAttribute.MESSAGE_DIGEST, contentHash, true));
        chain.stream().skip(1).map(PluginCertificate::getEncoded).forEach(builder::chainCertificate);
        PluginSignature unsigned = builder.build();

        try {
            Signature engine = algorithm.newSignature();
            engine.initSign(key);
            engine.update(unsigned.signedPayload());
            PluginSignature signature = builder.signatureValue(Base64.getEncoder().encodeToString(engine.sign())).build();
            log.info("[{}] Plugin signed by '{}' using {}", pluginPath.getFileName(), signer.getSubject(), algorithm);
            return signature;
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to sign plugin " + pluginPath, e);
        }
    }

    /**
     * 签名并写入插件清单
     */
    public PluginSignature signAndEmbed(Path pluginPath, List<PluginCertificate> chain, PrivateKey key) {
        PluginSignature signature = sign(pluginPath, null, chain, key);
        Path manifestFile = manifestLoader.resolve(pluginPath, null);
        try {
            manifestLoader.writeSignature(manifestFile, signature);
        } catch (IOException e) {
            throw new SigningException("Failed to write signature into " + manifestFile, e);
        }
        cache.invalidate(cacheKey(pluginPath, null));
        return signature;
    }

    // ==================== 内部 ====================

    private static String contentHash(Path pluginPath, Path manifestFile, String algorithm) throws IOException {
        Path root = pluginPath.toAbsolutePath().normalize();
        Path manifest = manifestFile.toAbsolutePath().normalize();
        String excluded = manifest.startsWith(root) ? ContentHasher.relativize(root, manifest) : null;
        return ContentHasher.hashTree(root, algorithm, relative -> !relative.equals(excluded));
    }

    private static String cacheKey(Path pluginPath, Path manifestPath) {
        return pluginPath.toAbsolutePath().normalize() + "|"
                + (manifestPath == null ? "default" : manifestPath.toAbsolutePath().normalize().toString());
    }

    /**
     * 单次验证的状态
     */
    private final class Verification {

        private final Path pluginPath;
        private final Path manifestFile;
        private final String name;
        private final Instant now = clock.instant();
        private final List<VerificationError> errors = new ArrayList<>();
        private final List<VerificationWarning> warnings = new ArrayList<>();

        private VerificationStep step = VerificationStep.LOAD_MANIFEST;
        private PluginManifest manifest;
        private PluginSignature signature;
        private PluginCertificate signer;
        private CertificateChain chain = CertificateChain.EMPTY;
        private TrustAnchor anchor;
        private TrustLevel trustLevel = TrustLevel.UNTRUSTED;

        Verification(Path pluginPath, Path manifestFile) {
            this.pluginPath = pluginPath;
            this.manifestFile = manifestFile;
            this.name = String.valueOf(pluginPath.getFileName());
        }

        VerificationResult run() {
            for (VerificationStep next : VerificationStep.values()) {
                step = next;
                log.debug("[{}] Verification step {}", name, next);
                switch (next) {
                    case LOAD_MANIFEST:
                        loadManifest();
                        break;
                    case CHECK_SIGNATURE:
                        checkSignature();
                        break;
                    case PARSE_CERT:
                        parseCertificate();
                        break;
                    case BUILD_CHAIN:
                        buildChain();
                        break;
                    case CHECK_TIME_VALIDITY:
                        checkTimeValidity();
                        break;
                    case CHECK_REVOCATION:
                        checkRevocation();
                        break;
                    case VALIDATE_TRUST:
                        validateTrust();
                        break;
                    case VERIFY_CONTENT_HASH:
                        verifyContentHash();
                        break;
                    case VALIDATE_PERMISSIONS:
                        validatePermissions();
                        break;
                    case WARNINGS:
                        collectWarnings();
                        break;
                    default:
                        break;
                }
                if (errors.stream().anyMatch(VerificationError::isFatal)) {
                    break;
                }
            }
            return toResult();
        }

        private void loadManifest() {
            if (!Files.exists(pluginPath)) {
                fatal(VerificationErrorCode.MANIFEST_INVALID, "Plugin path does not exist: " + pluginPath);
                return;
            }
            try {
                manifest = manifestLoader.load(manifestFile);
            } catch (IOException e) {
                fatal(VerificationErrorCode.MANIFEST_INVALID, "Failed to load plugin manifest: " + e.getMessage());
            }
        }

        private void checkSignature() {
            signature = manifest.getSignature();
            if (signature == null) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID, "Plugin manifest missing signature");
                return;
            }
            if (signature.getAlgorithm() == null) {
                fatal(VerificationErrorCode.ALGORITHM_NOT_SUPPORTED, "Signature block does not name an algorithm");
                return;
            }
            if (!HASH_ALGORITHMS.contains(signature.getHashAlgorithm())) {
                fatal(VerificationErrorCode.ALGORITHM_NOT_SUPPORTED,
                        "Unsupported hash algorithm: " + signature.getHashAlgorithm());
                return;
            }
            if (signature.getSignatureValue() == null || signature.getContentHash() == null) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID, "Signature block is incomplete");
                return;
            }
            for (SignedAttribute attribute : signature.getSignedAttributes()) {
                if (attribute.critical() && !KNOWN_ATTRIBUTES.contains(attribute.oid())) {
                    fatal(VerificationErrorCode.SIGNATURE_INVALID, "Unrecognized critical attribute " + attribute.oid());
                    return;
                }
            }
            Optional<SignedAttribute> contentType = signature.attribute(SignedAttribute.CONTENT_TYPE);
            if (contentType.isPresent() && !SignedAttribute.PLUGIN_CONTENT_TYPE.equals(contentType.get().value())) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID, "Unexpected content type " + contentType.get().value());
                return;
            }
            Optional<SignedAttribute> digest = signature.attribute(SignedAttribute.MESSAGE_DIGEST);
            if (digest.isPresent() && !signature.getContentHash().equals(digest.get().value())) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID, "Message digest attribute does not match content hash");
                return;
            }
            try {
                signer = CertificateCodec.decode(signature.getSignerCertificate());
            } catch (CertificateFormatException e) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID, "Signer certificate is unreadable: " + e.getMessage());
                return;
            }
            if (!signature.getAlgorithm().supports(signer.getPublicKey())) {
                fatal(VerificationErrorCode.ALGORITHM_NOT_SUPPORTED, signature.getAlgorithm()
                        + " cannot be used with a " + signer.getPublicKey().getAlgorithm() + " key");
                return;
            }
            boolean verified;
            try {
                Signature verifier = signature.getAlgorithm().newSignature();
                verifier.initVerify(signer.getPublicKey());
                verifier.update(signature.signedPayload());
                verified = verifier.verify(Base64.getDecoder().decode(signature.getSignatureValue()));
            } catch (GeneralSecurityException | IllegalArgumentException e) {
                log.debug("[{}] Signature check raised {}", name, e.toString());
                verified = false;
            }
            if (!verified) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID, "Plugin signature verification failed");
            }
        }

        private void parseCertificate() {
            Optional<String> boundPlugin = signer.getPluginId();
            if (boundPlugin.isPresent() && manifest.getId() != null && !boundPlugin.get().equals(manifest.getId())) {
                fatal(VerificationErrorCode.SIGNATURE_INVALID,
                        "Certificate was issued for plugin '" + boundPlugin.get() + "', not '" + manifest.getId() + "'");
            }
        }

        private void buildChain() {
            List<PluginCertificate> certificates = new ArrayList<>();
            certificates.add(signer);
            for (String pem : signature.getCertificateChain()) {
                try {
                    certificates.add(CertificateCodec.decode(pem));
                } catch (CertificateFormatException e) {
                    error(VerificationErrorCode.CHAIN_INCOMPLETE, "Unreadable chain certificate: " + e.getMessage());
                    chain = new CertificateChain(certificates, null, false);
                    return;
                }
            }

            boolean linked = true;
            for (int i = 0; i < certificates.size(); i++) {
                PluginCertificate current = certificates.get(i);
                Optional<TrustAnchor> match = trustAnchors.findByCertificate(current);
                if (match.isPresent()) {
                    anchor = match.get();
                    certificates = certificates.subList(0, i + 1);
                    break;
                }
                if (i + 1 < certificates.size()) {
                    PluginCertificate issuer = certificates.get(i + 1);
                    if (!issuer.isCa() || !current.isIssuedBy(issuer)) {
                        error(VerificationErrorCode.CHAIN_INCOMPLETE, "Certificate '" + current.getSubject()
                                + "' is not issued by '" + issuer.getSubject() + "'");
                        linked = false;
                        break;
                    }
                } else {
                    Optional<TrustAnchor> issuerAnchor = trustAnchors.findIssuerOf(current);
                    if (issuerAnchor.isPresent()) {
                        anchor = issuerAnchor.get();
                        certificates = new ArrayList<>(certificates);
                        certificates.add(anchor.getCertificate());
                    }
                }
            }

            boolean complete = linked && anchor != null;
            if (!linked) {
                anchor = null;
            } else if (!complete) {
                error(VerificationErrorCode.CHAIN_INCOMPLETE, "Certificate chain is incomplete");
            }
            chain = new CertificateChain(certificates, anchor == null ? null : anchor.getId(), complete);
        }

        private void checkTimeValidity() {
            for (PluginCertificate certificate : chain.certificates()) {
                if (now.isBefore(certificate.getValidFrom())) {
                    error(VerificationErrorCode.TIME_VALIDATION_FAILED,
                            "Certificate '" + certificate.getSubject() + "' is not yet valid");
                } else if (now.isAfter(certificate.getValidTo())) {
                    error(VerificationErrorCode.CERTIFICATE_EXPIRED,
                            "Certificate '" + certificate.getSubject() + "' expired at " + certificate.getValidTo());
                }
            }
        }

        private void checkRevocation() {
            for (PluginCertificate certificate : chain.certificates()) {
                Optional<RevokedCertificate> revoked =
                        revocations.lookup(certificate.getIssuer(), certificate.getSerialNumber());
                if (revoked.isPresent()) {
                    RevokedCertificate entry = revoked.get();
                    certificate.markRevoked(entry.revocationDate(), entry.reason().name());
                    fatal(VerificationErrorCode.CERTIFICATE_REVOKED,
                            "Certificate revoked: " + certificate.getSubject() + " (" + entry.reason() + ")");
                }
            }
        }

        private void validateTrust() {
            if (chain.complete()) {
                trustLevel = anchor.getTrustLevel();
            } else {
                error(VerificationErrorCode.TRUST_ANCHOR_NOT_FOUND,
                        "Certificate chain does not terminate in a trusted anchor");
                trustLevel = TrustLevel.UNTRUSTED;
            }
        }

        private void verifyContentHash() {
            try {
                String actual = contentHash(pluginPath, manifestFile, signature.getHashAlgorithm());
                if (!actual.equals(signature.getContentHash())) {
                    fatal(VerificationErrorCode.HASH_MISMATCH, "Plugin content hash does not match signature");
                }
            } catch (IOException e) {
                fatal(VerificationErrorCode.HASH_MISMATCH, "Plugin content could not be hashed: " + e.getMessage());
            }
        }

        private void validatePermissions() {
            List<String> excessive = manifest.getPermissions().stream()
                    .filter(p -> !PermissionMatcher.grants(signer.getPermissions(), p))
                    .collect(Collectors.toList());
            if (!excessive.isEmpty()) {
                error(VerificationErrorCode.PERMISSION_MISMATCH,
                        "Plugin permissions exceed certificate permissions: " + excessive);
            }
        }

        private void collectWarnings() {
            long daysLeft = Duration.between(now, signer.getValidTo()).toDays();
            if (daysLeft >= 0 && daysLeft < config.getExpiryWarningDays()) {
                warn(VerificationWarningCode.CERTIFICATE_EXPIRING_SOON,
                        "Certificate expires in " + daysLeft + " days", Severity.HIGH);
            }
            if (signer.isSelfSigned()) {
                warn(VerificationWarningCode.SELF_SIGNED_CERTIFICATE, "Signer certificate is self-signed", Severity.MEDIUM);
            }
            if (chain.length() > config.getMaxChainLength()) {
                warn(VerificationWarningCode.LONG_CERTIFICATE_CHAIN,
                        "Certificate chain is " + chain.length() + " certificates long", Severity.LOW);
            }
            for (PluginCertificate certificate : chain.certificates()) {
                int bits = certificate.rsaKeySize();
                if (bits > 0 && bits < MIN_RSA_BITS) {
                    warn(VerificationWarningCode.WEAK_ALGORITHM,
                            "Certificate '" + certificate.getSubject() + "' uses a " + bits + "-bit RSA key", Severity.MEDIUM);
                }
            }
            if (signer.getPermissions().contains("*")) {
                warn(VerificationWarningCode.EXCESSIVE_PERMISSIONS, "Signer certificate grants all permissions", Severity.MEDIUM);
            }
            if (!chain.complete() && !signer.isSelfSigned()) {
                warn(VerificationWarningCode.UNKNOWN_ISSUER, "Issuer '" + signer.getIssuer() + "' is not known", Severity.LOW);
            }
        }

        void fatal(VerificationErrorCode code, String message) {
            log.warn("[{}] {} at {}: {}", name, code, step, message);
            errors.add(new VerificationError(code, message, VerificationError.Level.FATAL, step));
        }

        private void error(VerificationErrorCode code, String message) {
            log.debug("[{}] {} at {}: {}", name, code, step, message);
            errors.add(new VerificationError(code, message, VerificationError.Level.ERROR, step));
        }

        private void warn(VerificationWarningCode code, String message, Severity severity) {
            warnings.add(new VerificationWarning(code, message, severity));
        }

        VerificationResult toResult() {
            boolean valid = errors.stream().noneMatch(VerificationError::isFatal);
            return VerificationResult.builder()
                    .valid(valid)
                    .trustLevel(valid ? trustLevel : TrustLevel.UNTRUSTED)
                    .chain(chain)
                    .errors(errors)
                    .warnings(warnings)
                    .certificate(signer)
                    .manifest(manifest)
                    .completedStep(step)
                    .verifiedAt(now)
                    .build();
        }
    }
}
