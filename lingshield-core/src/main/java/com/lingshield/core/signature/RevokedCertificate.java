package com.lingshield.core.signature;

import java.time.Instant;

public record RevokedCertificate(String serialNumber, Instant revocationDate, RevocationReason reason) {
}
