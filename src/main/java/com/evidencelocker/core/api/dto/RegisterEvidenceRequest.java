package com.evidencelocker.core.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

public class RegisterEvidenceRequest {
  @NotBlank @Size(max = 255) public String title;
  @Size(max = 4000) public String description;
  @NotBlank @Size(max = 255) public String fileName;
  @Size(max = 1024) public String fileRef;
  @PositiveOrZero public Long fileSize;
  @Size(max = 100) public String fileType;
  @Size(max = 128) public String hashValue;
  public OffsetDateTime collectedAt;
  @Size(max = 200) public String collectedBy;
  @Size(max = 500) public String locationFound;
  @Size(max = 500) public String intakeLocation;
}
