package com.lingshield.core.signature;

import com.lingshield.api.security.Severity;
import lombok.Value;

@Value
public class VerificationWarning {
    VerificationWarningCode code;
    String message;
    Severity severity;
}
