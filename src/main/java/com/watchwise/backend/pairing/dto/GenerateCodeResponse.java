package com.watchwise.backend.pairing.dto;

import java.time.Instant;

public record GenerateCodeResponse(String code, Instant expiresAt) {}
