package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.EvidenceStatus;
import jakarta.validation.constraints.NotNull;

public class UpdateEvidenceStatusRequest {
  @NotNull public EvidenceStatus status;
  public Long expectedVersion;
}
