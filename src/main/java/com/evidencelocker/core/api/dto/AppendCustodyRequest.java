package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.CustodyAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public class AppendCustodyRequest {
  @NotNull public CustodyAction action;
  public UUID fromPrincipalId;
  public UUID toPrincipalId;
  @NotBlank @Size(max = 500) public String location;
  @Size(max = 2000) public String notes;
}
