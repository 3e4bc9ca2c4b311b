package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.UUID;

public class CreateCaseRequest {
  @NotBlank @Size(max = 50) public String caseNumber;
  @NotBlank @Size(max = 255) public String title;
  @Size(max = 4000) public String description;
  public CaseStatus status;
  public CasePriority priority;
  public UUID leadInvestigatorId;
  public UUID assignedToId;
  public OffsetDateTime dueDate;
}
