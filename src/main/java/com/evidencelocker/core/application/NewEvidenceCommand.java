package com.evidencelocker.core.application;

import java.time.OffsetDateTime;

public class NewEvidenceCommand {
    public final String title;
    public final String description;
    public final String fileName;
    public final String fileRef;
    public final Long fileSize;
    public final String fileType;
    public final String hashValue;
    public final OffsetDateTime collectedAt;
    public final String collectedBy;
    public final String locationFound;
    public final String intakeLocation;

    public NewEvidenceCommand(String title, String description, String fileName, String fileRef, Long fileSize,
                              String fileType, String hashValue, OffsetDateTime collectedAt, String collectedBy,
                              String locationFound, String intakeLocation) {
        this.title = title;
        this.description = description;
        this.fileName = fileName;
        this.fileRef = fileRef;
        this.fileSize = fileSize;
        this.fileType = fileType;
        this.hashValue = hashValue;
        this.collectedAt = collectedAt;
        this.collectedBy = collectedBy;
        this.locationFound = locationFound;
        this.intakeLocation = intakeLocation;
    }
}
