package com.evidencelocker.core.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Row of the append-only custody ledger. Columns are not updatable.
 */
@Entity
@Table(name = "chain_of_custody")
public class CustodyEntryEntity {
    @Id
    private UUID id;

    @Column(name = "evidence_id", nullable = false, updatable = false)
    private UUID evidenceId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private long sequenceNo;

    @Column(nullable = false, updatable = false, length = 20)
    private String action;

    @Column(name = "from_principal_id", updatable = false)
    private UUID fromPrincipalId;

    @Column(name = "to_principal_id", updatable = false)
    private UUID toPrincipalId;

    @Column(nullable = false, updatable = false, length = 500)
    private String location;

    @Column(updatable = false, length = 2000)
    private String notes;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "previous_hash", updatable = false, length = 64)
    private String previousHash;

    @Column(name = "entry_hash", nullable = false, updatable = false, length = 64)
    private String entryHash;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getEvidenceId() { return evidenceId; }
    public void setEvidenceId(UUID evidenceId) { this.evidenceId = evidenceId; }

    public long getSequenceNo() { return sequenceNo; }
    public void setSequenceNo(long sequenceNo) { this.sequenceNo = sequenceNo; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public UUID getFromPrincipalId() { return fromPrincipalId; }
    public void setFromPrincipalId(UUID fromPrincipalId) { this.fromPrincipalId = fromPrincipalId; }

    public UUID getToPrincipalId() { return toPrincipalId; }
    public void setToPrincipalId(UUID toPrincipalId) { this.toPrincipalId = toPrincipalId; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public OffsetDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(OffsetDateTime occurredAt) { this.occurredAt = occurredAt; }

    public String getPreviousHash() { return previousHash; }
    public void setPreviousHash(String previousHash) { this.previousHash = previousHash; }

    public String getEntryHash() { return entryHash; }
    public void setEntryHash(String entryHash) { this.entryHash = entryHash; }
}
