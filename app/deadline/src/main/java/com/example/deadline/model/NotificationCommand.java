/*
 * Where: Deadline domain model
 * What: Input for creating a notification
 * Why: Separates caller-supplied content from store-assigned id and timestamps
 */
package com.example.deadline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationCommand(
    String userId,
    NotificationType type,
    String title,
    String message,
    Instant scheduledFor,
    Map<String, Object> metadata) {

  public NotificationCommand {
    // insertion order is kept so stored metadata reads in the order it was built
    metadata =
        metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static NotificationCommand of(
      String userId, NotificationType type, String title, String message, Map<String, Object> metadata) {
    return new NotificationCommand(userId, type, title, message, null, metadata);
  }
}
