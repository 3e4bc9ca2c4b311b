package com.evidencelocker.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every state-changing operation that produces an audit entry. The label is the stable
 * external name written to API responses.
 */
public enum AuditAction {
    CREATE_CASE("CreateCase"),
    UPDATE_CASE("UpdateCase"),
    ADD_EVIDENCE("AddEvidence"),
    UPDATE_EVIDENCE_STATUS("UpdateEvidenceStatus"),
    DOWNLOAD_EVIDENCE("DownloadEvidence"),
    APPEND_CUSTODY("AppendCustody"),
    ADD_COMMENT("AddComment"),
    UPDATE_COMMENT("UpdateComment"),
    DELETE_COMMENT("DeleteComment"),
    CREATE_TAG("CreateTag"),
    UPDATE_TAG("UpdateTag"),
    DELETE_TAG("DeleteTag"),
    TAG_EVIDENCE("TagEvidence"),
    UNTAG_EVIDENCE("UntagEvidence"),
    CREATE_PRINCIPAL("CreatePrincipal"),
    UPDATE_PRINCIPAL("UpdatePrincipal"),
    CHANGE_ROLE("ChangeRole");

    private final String label;

    AuditAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static AuditAction fromLabel(String value) {
        for (AuditAction action : values()) {
            if (action.label.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }
}
