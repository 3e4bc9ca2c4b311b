package com.evidencelocker.core.api.dto;

import com.evidencelocker.core.domain.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public class CreatePrincipalRequest {
  @NotBlank @Size(max = 100) public String username;
  @NotBlank @Size(max = 200) public String fullName;
  @NotBlank @Email public String email;
  @NotBlank @Size(min = 8, max = 128) public String password;
  @NotNull public Role role;
  @Size(max = 50) public String badgeNumber;
  @Size(max = 100) public String department;
}
