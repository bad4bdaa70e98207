/*
 * Where: Deadline domain model
 * What: The overdue escalation ladder
 * Why: Levels are derived from elapsed days on every run and never stored on entities
 */
package com.example.deadline.model;

import java.util.Optional;

public enum EscalationLevel {
  LEVEL_1(1, 1, "Initial reminder", "Please complete these evaluations at your earliest convenience."),
  LEVEL_2(2, 3, "Second reminder", "Immediate action is required to complete these evaluations."),
  LEVEL_3(3, 7, "Escalation to supervisor", "This matter has been escalated to your supervisor for review."),
  LEVEL_4(
      4,
      14,
      "Final warning",
      "This is your final warning. Administrative action may be taken if not resolved immediately."),
  LEVEL_5(
      5,
      30,
      "Administrative action",
      "Administrative action is being initiated due to continued non-compliance.");

  private final int level;
  private final int thresholdDays;
  private final String description;
  private final String consequence;

  EscalationLevel(int level, int thresholdDays, String description, String consequence) {
    this.level = level;
    this.thresholdDays = thresholdDays;
    this.description = description;
    this.consequence = consequence;
  }

  /** Highest level whose threshold has been reached, or empty before the first threshold. */
  public static Optional<EscalationLevel> forElapsedDays(long elapsedDays) {
    EscalationLevel reached = null;
    for (EscalationLevel candidate : values()) {
      if (elapsedDays >= candidate.thresholdDays) {
        reached = candidate;
      }
    }
    return Optional.ofNullable(reached);
  }

  public int level() {
    return level;
  }

  public int thresholdDays() {
    return thresholdDays;
  }

  public String description() {
    return description;
  }

  public String consequence() {
    return consequence;
  }

  public boolean isUrgent() {
    return level >= LEVEL_3.level;
  }
}
