package com.example.deadline.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(
    String userId, List<NotificationSummary> notifications, int total, int limit, int offset) {

  public NotificationInboxResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
