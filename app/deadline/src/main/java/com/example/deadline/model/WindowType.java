/*
 * Where: Deadline domain model
 * What: The two activity windows of an academic year
 * Why: Transition detection and reminders are identical apart from roles and types
 */
package com.example.deadline.model;

import java.util.Set;

public enum WindowType {
  UPLOAD(
      "upload",
      "Upload",
      Set.of(UserRole.SUBMITTER),
      NotificationType.UPLOAD_WINDOW_OPENING,
      NotificationType.UPLOAD_WINDOW_CLOSING,
      "/upload"),
  EVALUATION(
      "evaluation",
      "Evaluation",
      UserRole.REVIEWERS,
      NotificationType.EVALUATION_WINDOW_OPENING,
      NotificationType.EVALUATION_WINDOW_CLOSING,
      "/evaluate");

  private final String value;
  private final String label;
  private final Set<UserRole> affectedRoles;
  private final NotificationType openingType;
  private final NotificationType closingType;
  private final String actionPath;

  WindowType(
      String value,
      String label,
      Set<UserRole> affectedRoles,
      NotificationType openingType,
      NotificationType closingType,
      String actionPath) {
    this.value = value;
    this.label = label;
    this.affectedRoles = affectedRoles;
    this.openingType = openingType;
    this.closingType = closingType;
    this.actionPath = actionPath;
  }

  public String value() {
    return value;
  }

  public String label() {
    return label;
  }

  public Set<UserRole> affectedRoles() {
    return affectedRoles;
  }

  public NotificationType openingType() {
    return openingType;
  }

  public NotificationType closingType() {
    return closingType;
  }

  public String actionPath() {
    return actionPath;
  }
}
