package com.example.deadline.api.response;

import com.example.deadline.model.NotificationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    NotificationType type,
    String title,
    String message,
    Instant scheduledFor,
    Instant createdAt,
    Instant sentAt,
    boolean read,
    JsonNode metadata) {}
