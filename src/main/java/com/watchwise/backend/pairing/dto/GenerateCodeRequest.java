package com.watchwise.backend.pairing.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GenerateCodeRequest(
        @NotBlank @Size(max = 120) String childName,
        @NotBlank @Size(max = 120) String deviceName
) {}
