/*
 * Where: Deadline domain model
 * What: Snapshot of a notifications row
 * Why: Shared by the dedup checks, the dispatcher and the inbox API
 */
package com.example.deadline.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    NotificationType type,
    String title,
    String message,
    Instant scheduledFor,
    String metadataJson,
    Instant createdAt,
    Instant sentAt,
    boolean read) {

  public boolean isSent() {
    return sentAt != null;
  }
}
