/*
 * Where: Deadline configuration binding
 * What: Intervals of the default recurring jobs and the scheduler pool size
 * Why: Sweep cadence is operational tuning, not code
 */
package com.example.deadline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "deadline.scheduler")
@Validated
public record SchedulerProperties(
    boolean enabled,
    @NotNull Duration deadlineCheckInterval,
    @NotNull Duration notificationProcessingInterval,
    @NotNull Duration dailyCleanupInterval,
    @NotNull Duration weeklyReminderInterval,
    @Positive int poolSize) {

  @AssertTrue(message = "deadline.scheduler intervals must be positive")
  public boolean isIntervalsPositive() {
    return isPositive(deadlineCheckInterval)
        && isPositive(notificationProcessingInterval)
        && isPositive(dailyCleanupInterval)
        && isPositive(weeklyReminderInterval);
  }

  private boolean isPositive(Duration duration) {
    // null is reported by @NotNull
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
