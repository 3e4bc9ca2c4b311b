package com.evidencelocker.core.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public class TagRequest {
  @NotBlank @Size(max = 100) public String name;
  @Pattern(regexp = "^#[0-9a-fA-F]{6}$") public String color;
}
