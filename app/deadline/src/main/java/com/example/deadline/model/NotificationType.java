/*
 * Where: Deadline domain model
 * What: Kinds of notification the engine issues
 * Why: Stored as text in notifications.type and used as part of every dedup key
 */
package com.example.deadline.model;

public enum NotificationType {
  UPLOAD_DEADLINE_REMINDER,
  EVALUATION_DEADLINE_REMINDER,
  UPLOAD_WINDOW_OPENING,
  UPLOAD_WINDOW_CLOSING,
  EVALUATION_WINDOW_OPENING,
  EVALUATION_WINDOW_CLOSING,
  EVALUATION_OVERDUE,
  SYSTEM_ALERT
}
