package com.evidencelocker.core.domain;

/**
 * Evidence lifecycle states. Transitions between them are free-form.
 */
public enum EvidenceStatus {
    PENDING,
    VERIFIED,
    ARCHIVED,
    DISPOSED
}
