package com.evidencelocker.core.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class DownloadRequest {
  @NotBlank @Size(max = 500) public String location;
}
