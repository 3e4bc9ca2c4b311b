package com.evidencelocker.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public class Evidence {

    private final UUID id;
    private final UUID caseId;
    private final String title;
    private final String description;
    private final String fileName;
    private final String fileRef;
    private final Long fileSize;
    private final String fileType;
    private final String hashValue;
    private final EvidenceStatus status;
    private final OffsetDateTime collectedAt;
    private final String collectedBy;
    private final String locationFound;
    private final UUID uploaderId;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime updatedAt;
    private final long version;

    public Evidence(UUID id, UUID caseId, String title, String description, String fileName, String fileRef,
                    Long fileSize, String fileType, String hashValue, EvidenceStatus status,
                    OffsetDateTime collectedAt, String collectedBy, String locationFound, UUID uploaderId,
                    OffsetDateTime createdAt, OffsetDateTime updatedAt, long version) {
        this.id = id;
        this.caseId = caseId;
        this.title = title;
        this.description = description;
        this.fileName = fileName;
        this.fileRef = fileRef;
        this.fileSize = fileSize;
        this.fileType = fileType;
        this.hashValue = hashValue;
        this.status = status;
        this.collectedAt = collectedAt;
        this.collectedBy = collectedBy;
        this.locationFound = locationFound;
        this.uploaderId = uploaderId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    public UUID getId() { return id; }
    public UUID getCaseId() { return caseId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getFileName() { return fileName; }
    public String getFileRef() { return fileRef; }
    public Long getFileSize() { return fileSize; }
    public String getFileType() { return fileType; }
    public String getHashValue() { return hashValue; }
    public EvidenceStatus getStatus() { return status; }
    public OffsetDateTime getCollectedAt() { return collectedAt; }
    public String getCollectedBy() { return collectedBy; }
    public String getLocationFound() { return locationFound; }
    public UUID getUploaderId() { return uploaderId; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }
}
