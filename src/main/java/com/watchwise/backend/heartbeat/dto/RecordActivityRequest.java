package com.watchwise.backend.heartbeat.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * @param occurredAt when the device observed the activity; later than the server clock is clamped
 */
public record RecordActivityRequest(
        String activityType,
        JsonNode deviceInfo,
        Instant occurredAt
) {}
