package com.evidencelocker.core.domain;

public enum ResourceType {
    CASE,
    EVIDENCE,
    COMMENT,
    CUSTODY_ENTRY,
    AUDIT_ENTRY,
    TAG,
    PRINCIPAL
}
