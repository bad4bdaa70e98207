/*
 * Where: Deadline domain model
 * What: Roles the engine distinguishes when choosing recipients
 * Why: Reminder, escalation and alert recipients are all selected by role
 */
package com.example.deadline.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum UserRole {
  SUBMITTER,
  INTERNAL_REVIEWER,
  EXTERNAL_REVIEWER,
  EXECUTIVE,
  ADMINISTRATOR;

  public static final Set<UserRole> REVIEWERS =
      Collections.unmodifiableSet(EnumSet.of(INTERNAL_REVIEWER, EXTERNAL_REVIEWER));

  public static final Set<UserRole> SUPERVISORS =
      Collections.unmodifiableSet(EnumSet.of(ADMINISTRATOR, EXECUTIVE));

  public boolean isReviewer() {
    return REVIEWERS.contains(this);
  }
}
