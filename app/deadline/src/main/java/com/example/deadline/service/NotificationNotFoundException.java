package com.example.deadline.service;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
