/*
 * Where: Deadline API request
 * What: Body of an externally created notification
 * Why: Administrators and other subsystems post ad-hoc notifications through this endpoint
 */
package com.example.deadline.api.request;

import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateNotificationRequest(
    @NotBlank String userId,
    @NotNull NotificationType type,
    @NotBlank String title,
    @NotBlank String message,
    Instant scheduledFor,
    Map<String, Object> metadata) {

  public NotificationCommand toCommand() {
    return new NotificationCommand(userId, type, title, message, scheduledFor, metadata);
  }
}
