package com.proofly.backend.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Signature verification sub-state of a report. APPROVED and REJECTED are terminal.
 */
public enum SignatureStatus {
    NOT_SUBMITTED("This document has not been submitted for signature verification."),
    PENDING("This document is currently under review by administrators."),
    APPROVED("This document has been verified and approved by administrators."),
    REJECTED("This document signature was not approved.");

    private final String publicMessage;

    SignatureStatus(String publicMessage) {
        this.publicMessage = publicMessage;
    }

    public String getPublicMessage() {
        return publicMessage;
    }

    public Set<SignatureStatus> allowedNext() {
        return switch (this) {
            case NOT_SUBMITTED -> EnumSet.of(PENDING);
            case PENDING -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED, REJECTED -> EnumSet.noneOf(SignatureStatus.class);
        };
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }
}
