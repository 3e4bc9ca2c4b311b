package com.evidencelocker.core.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class CommentRequest {
  @NotBlank @Size(max = 4000) public String content;
}
