package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.Role;
import jakarta.validation.constraints.NotNull;

public class ChangeRoleRequest {
  @NotNull public Role role;
}
