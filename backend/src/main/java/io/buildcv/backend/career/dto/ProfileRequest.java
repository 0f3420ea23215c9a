package io.buildcv.backend.career.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProfileRequest(
    @NotBlank(message = "fullName is required") @Size(max = 255) String fullName) {}
