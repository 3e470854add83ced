package com.watchwise.backend.pairing.dto;

public record PairResponse(
        Long relationshipId,
        Long childUserId,
        String childName,
        String deviceName
) {}
