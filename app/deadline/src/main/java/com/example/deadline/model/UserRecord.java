/*
 * Where: Deadline domain model
 * What: Read-only snapshot of a user row with notification preferences
 * Why: Recipient selection and channel routing both need role and preferences
 */
package com.example.deadline.model;

public record UserRecord(
    String userId,
    String name,
    String email,
    UserRole role,
    boolean active,
    boolean emailEnabled,
    boolean pushEnabled,
    int deadlineReminderDays) {}
