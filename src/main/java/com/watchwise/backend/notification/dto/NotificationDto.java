package com.watchwise.backend.notification.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record NotificationDto(
        Long id,
        Long recipientId,
        String type,
        String title,
        String message,
        JsonNode data,
        Instant timestamp,
        boolean read
) {}
