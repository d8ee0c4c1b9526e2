package com.lingshield.core.signature;

import com.lingshield.api.security.TrustLevel;
import com.lingshield.core.config.LingShieldConfig;
import com.lingshield.core.exception.SigningException;
import com.lingshield.core.exception.TrustAnchorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SignatureVerifier 单元测试")
class SignatureVerifierTest {

    @TempDir
    Path pluginDir;

    private final CertificateIssuer issuer = new CertificateIssuer();
    private final AtomicLong nanos = new AtomicLong();

    private SignatureVerifier verifier;
    private KeyPair rootKeys;
    private PluginCertificate root;
    private KeyPair leafKeys;
    private PluginCertificate leaf;

    @BeforeEach
    void setUp() throws Exception {
        verifier = new SignatureVerifier(new LingShieldConfig.SignatureVerification(), new TrustAnchorStore(),
                new RevocationRegistry(), Clock.systemUTC(), nanos::get);

        rootKeys = SignatureAlgorithm.ECDSA.generateKeyPair();
        root = issuer.selfSigned(CertificateRequest.builder()
                .subject("CN=LingShield Test Root")
                .publicKey(rootKeys.getPublic())
                .ca(true)
                .trustLevel(TrustLevel.ENTERPRISE)
                .build(), rootKeys);

        leafKeys = SignatureAlgorithm.ECDSA.generateKeyPair();
        leaf = issueLeaf(Instant.now(), Duration.ofDays(180));

        writeManifest("[\"storage.read\"]");
        Files.write(pluginDir.resolve("index.js"), "module.exports = {};\n".getBytes(StandardCharsets.UTF_8));
    }

    private PluginCertificate issueLeaf(Instant validFrom, Duration validity) {
        return issuer.issue(CertificateRequest.builder()
                .subject("CN=demo-plugin")
                .pluginId("demo-plugin")
                .publicKey(leafKeys.getPublic())
                .permission("storage.*")
                .validFrom(validFrom)
                .validity(validity)
                .build(), root, rootKeys.getPrivate());
    }

    private void writeManifest(String permissions) throws Exception {
        Files.write(pluginDir.resolve("plugin.json"), ("{\"id\":\"demo-plugin\",\"version\":\"1.0.0\","
                + "\"permissions\":" + permissions + "}").getBytes(StandardCharsets.UTF_8));
    }

    private void trustRoot() {
        verifier.addTrustAnchor(TrustAnchor.builder()
                .id("test-root")
                .name("Test Root")
                .certificate(root)
                .trustLevel(TrustLevel.ENTERPRISE)
                .build());
    }

    @Nested
    @DisplayName("基本验证")
    class BasicVerificationTests {

        @Test
        @DisplayName("清单缺少签名块时返回唯一的 FATAL 错误")
        void missingSignatureShouldBeFatal() {
            VerificationResult result = verifier.verify(pluginDir);

            assertFalse(result.isValid());
            assertEquals(TrustLevel.UNTRUSTED, result.getTrustLevel());
            assertEquals(1, result.getErrors().size());
            VerificationError error = result.getErrors().get(0);
            assertEquals(VerificationErrorCode.SIGNATURE_INVALID, error.getCode());
            assertTrue(error.isFatal());
            assertEquals(VerificationStep.CHECK_SIGNATURE, error.getStep());
        }

        @Test
        @DisplayName("签名后立即验证：有效且信任级别等于信任锚配置")
        void signThenVerifyShouldRoundTrip() {
            trustRoot();
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.isValid(), () -> "errors: " + result.getErrors());
            assertTrue(result.getErrors().isEmpty());
            assertEquals(TrustLevel.ENTERPRISE, result.getTrustLevel());
            assertTrue(result.getChain().complete());
            assertEquals(2, result.getChain().length());
            assertEquals("test-root", result.getChain().anchorId());
            assertEquals(VerificationStep.DONE, result.getCompletedStep());
            assertEquals("demo-plugin", result.getManifest().getId());
        }

        @Test
        @DisplayName("签名后修改插件内容导致摘要不匹配")
        void tamperedContentShouldFailHash() throws Exception {
            trustRoot();
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());
            Files.write(pluginDir.resolve("index.js"), "require('child_process');\n".getBytes(StandardCharsets.UTF_8));

            VerificationResult result = verifier.verify(pluginDir);

            assertFalse(result.isValid());
            assertTrue(result.hasError(VerificationErrorCode.HASH_MISMATCH));
            assertEquals(TrustLevel.UNTRUSTED, result.getTrustLevel());
        }

        @Test
        @DisplayName("篡改签名值被识别为无效签名")
        void alteredSignatureValueShouldBeRejected() throws Exception {
            trustRoot();
            PluginSignature signature = verifier.sign(pluginDir, List.of(leaf), leafKeys.getPrivate());
            PluginSignature forged = signature.toBuilder().contentHash("00" + signature.getContentHash().substring(2)).build();
            new ManifestLoader().writeSignature(pluginDir.resolve("plugin.json"), forged);

            VerificationResult result = verifier.verify(pluginDir);

            assertFalse(result.isValid());
            assertTrue(result.hasError(VerificationErrorCode.SIGNATURE_INVALID));
        }

        @Test
        @DisplayName("清单不存在时返回 MANIFEST_INVALID")
        void missingManifestShouldBeFatal() throws Exception {
            Files.delete(pluginDir.resolve("plugin.json"));

            VerificationResult result = verifier.verify(pluginDir);

            assertFalse(result.isValid());
            assertTrue(result.hasError(VerificationErrorCode.MANIFEST_INVALID));
        }
    }

    @Nested
    @DisplayName("证书链与信任")
    class ChainTests {

        @Test
        @DisplayName("没有信任锚时链不完整，降级为 UNTRUSTED 但不判定无效")
        void missingAnchorShouldDegradeTrust() {
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.isValid());
            assertEquals(TrustLevel.UNTRUSTED, result.getTrustLevel());
            assertTrue(result.hasError(VerificationErrorCode.CHAIN_INCOMPLETE));
            assertTrue(result.hasError(VerificationErrorCode.TRUST_ANCHOR_NOT_FOUND));
            assertTrue(result.hasWarning(VerificationWarningCode.UNKNOWN_ISSUER));
        }

        @Test
        @DisplayName("通过中间证书构建到信任锚的完整链")
        void intermediateChainShouldComplete() throws Exception {
            trustRoot();
            KeyPair intermediateKeys = SignatureAlgorithm.ECDSA.generateKeyPair();
            PluginCertificate intermediate = issuer.issue(CertificateRequest.builder()
                    .subject("CN=Plugin CA")
                    .publicKey(intermediateKeys.getPublic())
                    .ca(true)
                    .build(), root, rootKeys.getPrivate());
            PluginCertificate chainedLeaf = issuer.issue(CertificateRequest.builder()
                    .subject("CN=demo-plugin")
                    .publicKey(leafKeys.getPublic())
                    .permission("storage.read")
                    .build(), intermediate, intermediateKeys.getPrivate());
            verifier.signAndEmbed(pluginDir, List.of(chainedLeaf, intermediate), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.getErrors().isEmpty(), () -> "errors: " + result.getErrors());
            assertEquals(3, result.getChain().length());
            assertEquals(TrustLevel.ENTERPRISE, result.getTrustLevel());
        }

        @Test
        @DisplayName("链中证书不是下一级的签发者时链断裂")
        void brokenLinkShouldBeReported() throws Exception {
            trustRoot();
            KeyPair strangerKeys = SignatureAlgorithm.ECDSA.generateKeyPair();
            PluginCertificate stranger = issuer.selfSigned(CertificateRequest.builder()
                    .subject("CN=Stranger CA")
                    .publicKey(strangerKeys.getPublic())
                    .ca(true)
                    .build(), strangerKeys);
            verifier.signAndEmbed(pluginDir, List.of(leaf, stranger), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertFalse(result.getChain().complete());
            assertTrue(result.hasError(VerificationErrorCode.CHAIN_INCOMPLETE));
            assertEquals(TrustLevel.UNTRUSTED, result.getTrustLevel());
        }

        @Test
        @DisplayName("非自签名证书不能登记为信任锚")
        void anchorMustBeSelfSigned() {
            TrustAnchor anchor = TrustAnchor.builder()
                    .id("leaf")
                    .certificate(leaf)
                    .trustLevel(TrustLevel.HIGH)
                    .build();

            assertThrows(TrustAnchorException.class, () -> verifier.addTrustAnchor(anchor));
            assertTrue(verifier.listTrustAnchors().isEmpty());
        }

        @Test
        @DisplayName("声明超出证书授权的权限产生 PERMISSION_MISMATCH")
        void excessivePermissionsShouldBeReported() throws Exception {
            trustRoot();
            writeManifest("[\"storage.read\", \"network.https\"]");
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.isValid());
            assertTrue(result.hasError(VerificationErrorCode.PERMISSION_MISMATCH));
            assertTrue(result.getErrors().stream().noneMatch(VerificationError::isFatal));
        }
    }

    @Nested
    @DisplayName("有效期与吊销")
    class ValidityTests {

        @Test
        @DisplayName("吊销的证书产生 FATAL 错误并标记证书")
        void revokedCertificateShouldBeFatal() {
            trustRoot();
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());
            verifier.getRevocationRegistry().revoke(root.getSubject(), leaf.getSerialNumber(), RevocationReason.KEY_COMPROMISE);

            VerificationResult result = verifier.verify(pluginDir);

            assertFalse(result.isValid());
            assertTrue(result.hasError(VerificationErrorCode.CERTIFICATE_REVOKED));
            assertEquals(VerificationStep.CHECK_REVOCATION, result.getCompletedStep());
            assertTrue(result.certificate().orElseThrow().isRevoked());
            assertEquals("KEY_COMPROMISE", result.certificate().orElseThrow().getRevocationReason().orElseThrow());
        }

        @Test
        @DisplayName("过期证书是非致命错误")
        void expiredCertificateShouldBeError() {
            trustRoot();
            leaf = issueLeaf(Instant.now().minus(Duration.ofDays(10)), Duration.ofDays(1));
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.isValid());
            assertTrue(result.hasError(VerificationErrorCode.CERTIFICATE_EXPIRED));
        }

        @Test
        @DisplayName("30 天内到期的证书产生警告")
        void expiringCertificateShouldWarn() {
            trustRoot();
            leaf = issueLeaf(Instant.now(), Duration.ofDays(10));
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.getErrors().isEmpty());
            assertTrue(result.hasWarning(VerificationWarningCode.CERTIFICATE_EXPIRING_SOON));
        }
    }

    @Nested
    @DisplayName("缓存")
    class CacheTests {

        @Test
        @DisplayName("TTL 内返回缓存结果，过期后重新验证")
        void resultShouldBeCachedWithinTtl() {
            trustRoot();
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());

            VerificationResult first = verifier.verify(pluginDir);
            assertSame(first, verifier.verify(pluginDir));

            nanos.addAndGet(TimeUnit.MINUTES.toNanos(6));
            assertNotSame(first, verifier.verify(pluginDir));
        }

        @Test
        @DisplayName("移除信任锚使缓存失效")
        void removingAnchorShouldInvalidateCache() {
            trustRoot();
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());
            assertEquals(TrustLevel.ENTERPRISE, verifier.verify(pluginDir).getTrustLevel());

            assertTrue(verifier.removeTrustAnchor("test-root"));

            assertEquals(TrustLevel.UNTRUSTED, verifier.verify(pluginDir).getTrustLevel());
        }

        @Test
        @DisplayName("CRL 更新不影响 TTL 内的缓存结果")
        void revocationShouldNotBypassCache() {
            trustRoot();
            verifier.signAndEmbed(pluginDir, List.of(leaf), leafKeys.getPrivate());
            assertTrue(verifier.verify(pluginDir).isValid());

            verifier.getRevocationRegistry().revoke(root.getSubject(), leaf.getSerialNumber(), RevocationReason.SUPERSEDED);

            assertTrue(verifier.verify(pluginDir).isValid());
            verifier.invalidateCache();
            assertFalse(verifier.verify(pluginDir).isValid());
        }
    }

    @Nested
    @DisplayName("签名")
    class SigningTests {

        @Test
        @DisplayName("口令加密的 PEM 私钥可用于签名")
        void encryptedPemKeyShouldSign() {
            trustRoot();
            char[] passphrase = "correct horse".toCharArray();
            String pem = CertificateCodec.encodePrivateKey(leafKeys.getPrivate(), passphrase);

            PluginSignature signature = verifier.sign(pluginDir, List.of(leaf), pem, passphrase);

            assertEquals(SignatureAlgorithm.ECDSA, signature.getAlgorithm());
            assertTrue(signature.attribute(SignedAttribute.CONTENT_TYPE).orElseThrow().critical());
            assertEquals(signature.getContentHash(),
                    signature.attribute(SignedAttribute.MESSAGE_DIGEST).orElseThrow().value());
            assertThrows(SigningException.class, () -> verifier.sign(pluginDir, List.of(leaf), pem, null));
        }

        @Test
        @DisplayName("私钥与签名证书不匹配时拒绝签名")
        void mismatchedKeyShouldBeRejected() throws Exception {
            KeyPair rsa = SignatureAlgorithm.RSA_PSS.generateKeyPair();

            assertThrows(SigningException.class, () -> verifier.sign(pluginDir, List.of(leaf), rsa.getPrivate()));
        }

        @Test
        @DisplayName("Ed25519 自签名证书登记为锚后签名有效")
        void ed25519ShouldRoundTrip() throws Exception {
            KeyPair keys = SignatureAlgorithm.EDDSA.generateKeyPair();
            PluginCertificate self = issuer.selfSigned(CertificateRequest.builder()
                    .subject("CN=system-plugin")
                    .publicKey(keys.getPublic())
                    .permission("*")
                    .build(), keys);
            verifier.addTrustAnchor(TrustAnchor.builder().id("system").certificate(self)
                    .trustLevel(TrustLevel.SYSTEM).build());
            verifier.signAndEmbed(pluginDir, List.of(self), keys.getPrivate());

            VerificationResult result = verifier.verify(pluginDir);

            assertTrue(result.isValid());
            assertEquals(TrustLevel.SYSTEM, result.getTrustLevel());
            assertTrue(result.hasWarning(VerificationWarningCode.SELF_SIGNED_CERTIFICATE));
            assertTrue(result.hasWarning(VerificationWarningCode.EXCESSIVE_PERMISSIONS));
        }
    }
}
