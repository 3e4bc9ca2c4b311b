package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.CasePriority;
import com.evidencelocker.core.domain.CaseStatus;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.UUID;

/** Absent fields are left unchanged. {@code expectedVersion} enables the stale-write check. */
public class UpdateCaseRequest {
  @Size(max = 255) public String title;
  @Size(max = 4000) public String description;
  @Size(max = 4000) public String findings;
  public OffsetDateTime dueDate;
  public CaseStatus status;
  public CasePriority priority;
  public UUID leadInvestigatorId;
  public boolean clearLeadInvestigator;
  public UUID assignedToId;
  public boolean clearAssignee;
  public Long expectedVersion;
}
