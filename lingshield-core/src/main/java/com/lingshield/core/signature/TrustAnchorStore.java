package com.lingshield.core.signature;

import com.lingshield.core.exception.TrustAnchorException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 信任锚存储，读多写少，写入后立即对后续读取可见
 */
@Slf4j
public class TrustAnchorStore {

    private final Map<String, TrustAnchor> anchors = new ConcurrentHashMap<>();

    public void add(TrustAnchor anchor) {
        PluginCertificate certificate = anchor.getCertificate();
        if (!certificate.isSelfSigned()) {
            throw new TrustAnchorException("Trust anchor certificate must be self-signed: " + certificate.getSubject());
        }
        anchors.put(anchor.getId(), anchor);
        log.info("[{}] Trust anchor added: subject='{}', trustLevel={}",
                anchor.getId(), certificate.getSubject(), anchor.getTrustLevel());
    }

    public boolean remove(String anchorId) {
        TrustAnchor removed = anchors.remove(anchorId);
        if (removed != null) {
            log.info("[{}] Trust anchor removed", anchorId);
        }
        return removed != null;
    }

    public List<TrustAnchor> list() {
        return new ArrayList<>(anchors.values());
    }

    /**
     * 按证书指纹查找已启用的锚
     */
    public Optional<TrustAnchor> findByCertificate(PluginCertificate certificate) {
        return anchors.values().stream()
                .filter(TrustAnchor::isEnabled)
                .filter(a -> a.getCertificate().getFingerprint().equals(certificate.getFingerprint()))
                .findFirst();
    }

    /**
     * 查找签发了给定证书的已启用锚
     */
    public Optional<TrustAnchor> findIssuerOf(PluginCertificate certificate) {
        return anchors.values().stream()
                .filter(TrustAnchor::isEnabled)
                .filter(a -> certificate.isIssuedBy(a.getCertificate()))
                .findFirst();
    }
}
