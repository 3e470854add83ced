package com.watchwise.backend.relationship.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public final class RelationshipDtos {
    private RelationshipDtos() {}

    public enum DeviceStatus { ONLINE, OFFLINE }

    public record ChildDeviceDto(
            Long relationshipId,
            Long childUserId,
            String childName,
            String deviceName,
            Instant pairedAt,
            Instant lastSyncAt,
            Instant lastHeartbeatAt,
            int missedHeartbeats,
            boolean normalClosure,
            boolean online,
            DeviceStatus status,
            JsonNode deviceInfo
    ) {}

    public record LinkedParentDto(
            Long relationshipId,
            Long parentUserId,
            Instant pairedAt
    ) {}

    public record PairingStatusDto(
            boolean paired,
            List<LinkedParentDto> parents
    ) {}
}
