package com.evidencelocker.core.domain;

import com.evidencelocker.core.domain.policy.CaseRelations;

import java.time.OffsetDateTime;
import java.util.UUID;

public class CaseRecord {

    private final UUID id;
    private final String caseNumber;
    private final String title;
    private final String description;
    private final UUID creatorId;
    private final UUID leadInvestigatorId;
    private final UUID assignedToId;
    private final String findings;
    private final OffsetDateTime dueDate;
    private final CaseStatus status;
    private final CasePriority priority;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime updatedAt;
    private final long version;


    public CaseRecord(UUID id, String caseNumber, String title, String description, UUID creatorId,
                      UUID leadInvestigatorId, UUID assignedToId, String findings, OffsetDateTime dueDate,
                      CaseStatus status, CasePriority priority, OffsetDateTime createdAt,
                      OffsetDateTime updatedAt, long version) {
        this.id = id;
        this.caseNumber = caseNumber;
        this.title = title;
        this.description = description;
        this.creatorId = creatorId;
        this.leadInvestigatorId = leadInvestigatorId;
        this.assignedToId = assignedToId;
        this.findings = findings;
        this.dueDate = dueDate;
        this.status = status;
        this.priority = priority;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    /** Relation fields the access policy needs, taken from this one read of the row. */
    public CaseRelations relations() {
        return new CaseRelations(id, creatorId, leadInvestigatorId, assignedToId);
    }


    public UUID getId() {
        return id;
    }

    public String getCaseNumber() {
        return caseNumber;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public UUID getCreatorId() {
        return creatorId;
    }

    public UUID getLeadInvestigatorId() {
        return leadInvestigatorId;
    }

    public UUID getAssignedToId() {
        return assignedToId;
    }

    public String getFindings() {
        return findings;
    }

    public OffsetDateTime getDueDate() {
        return dueDate;
    }

    public CaseStatus getStatus() {
        return status;
    }

    public CasePriority getPriority() {
        return priority;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
