package com.lingshield.core.audit.compliance;

public enum ComplianceFramework {
    ISO27001,
    SOC2,
    GDPR,
    HIPAA,
    PCI_DSS,
    NIST,
    CIS
}
