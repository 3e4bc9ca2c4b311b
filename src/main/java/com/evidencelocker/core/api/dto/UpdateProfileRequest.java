package com.evidencelocker.core.api.dto;

import jakarta.validation.constraints.Size;

public class UpdateProfileRequest {
  @Size(max = 200) public String fullName;
  @Size(max = 50) public String badgeNumber;
  @Size(max = 100) public String department;
}
