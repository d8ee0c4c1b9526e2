package com.lingshield.core.signature;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按签发者缓存的 CRL
 * <p>
 * 更新不会使验证缓存失效，已缓存结果最多在 TTL 内保持旧的吊销视图。
 */
@Slf4j
public class RevocationRegistry {

    private final Map<String, CertificateRevocationList> lists = new ConcurrentHashMap<>();
    private final Clock clock;

    public RevocationRegistry() {
        this(Clock.systemUTC());
    }

    public RevocationRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * 发布完整 CRL；旧于当前版本的列表被忽略
     */
    public boolean publish(CertificateRevocationList crl) {
        CertificateRevocationList merged = lists.merge(crl.getIssuer(), crl,
                (current, fresh) -> fresh.getThisUpdate().isBefore(current.getThisUpdate()) ? current : fresh);
        boolean accepted = merged == crl;
        if (accepted) {
            log.info("[{}] CRL published with {} entries", crl.getIssuer(), crl.getRevokedCertificates().size());
        } else {
            log.warn("[{}] Ignoring stale CRL issued at {}", crl.getIssuer(), crl.getThisUpdate());
        }
        return accepted;
    }

    /**
     * 追加单条吊销记录
     */
    public void revoke(String issuer, String serialNumber, RevocationReason reason) {
        Instant now = clock.instant();
        RevokedCertificate entry = new RevokedCertificate(serialNumber, now, reason);
        lists.compute(issuer, (key, current) -> {
            CertificateRevocationList base = current != null ? current
                    : CertificateRevocationList.builder().issuer(issuer).thisUpdate(now).build();
            if (base.find(serialNumber).isPresent()) {
                return base;
            }
            return base.toBuilder().thisUpdate(now).revoked(entry).build();
        });
        log.info("[{}] Certificate {} revoked: {}", issuer, serialNumber, reason);
    }

    public Optional<RevokedCertificate> lookup(String issuer, String serialNumber) {
        CertificateRevocationList crl = lists.get(issuer);
        return crl == null ? Optional.empty() : crl.find(serialNumber);
    }

    public List<CertificateRevocationList> list() {
        return new ArrayList<>(lists.values());
    }
}
