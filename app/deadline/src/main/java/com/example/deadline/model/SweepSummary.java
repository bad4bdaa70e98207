/*
 * Where: Deadline domain model
 * What: Counters describing one monitor run
 * Why: Logged after every sweep and returned to the manual control surface
 */
package com.example.deadline.model;

public record SweepSummary(
    int yearsProcessed, int yearsFailed, int notificationsCreated, int notificationsDispatched) {

  public SweepSummary plus(SweepSummary other) {
    return new SweepSummary(
        yearsProcessed + other.yearsProcessed,
        yearsFailed + other.yearsFailed,
        notificationsCreated + other.notificationsCreated,
        notificationsDispatched + other.notificationsDispatched);
  }

  public String describe() {
    return "years="
        + yearsProcessed
        + " failedYears="
        + yearsFailed
        + " created="
        + notificationsCreated
        + " dispatched="
        + notificationsDispatched;
  }
}
