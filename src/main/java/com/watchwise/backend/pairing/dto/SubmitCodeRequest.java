package com.watchwise.backend.pairing.dto;

/** Format is checked by the pairing engine so the caller gets INVALID_FORMAT, not a generic 400. */
public record SubmitCodeRequest(String code) {}
