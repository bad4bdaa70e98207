/*
 * Where: Deadline configuration binding
 * What: Dedup windows for reminders and escalation plus the link base for actions
 * Why: The windows decide how often a persisting condition may be re-notified
 */
package com.example.deadline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "deadline.monitor")
@Validated
public record DeadlineMonitorProperties(
    @NotNull Duration reminderDedupWindow,
    @NotNull Duration escalationCooldown,
    String actionBaseUrl) {

  public DeadlineMonitorProperties {
    actionBaseUrl = actionBaseUrl == null ? "" : stripTrailingSlash(actionBaseUrl.trim());
  }

  @AssertTrue(message = "deadline.monitor dedup windows must be positive")
  public boolean isWindowsPositive() {
    return isPositive(reminderDedupWindow) && isPositive(escalationCooldown);
  }

  public String actionUrl(String path) {
    return actionBaseUrl + path;
  }

  /** Longest window during which notification history is consulted for dedup. */
  public Duration longestDedupWindow() {
    if (reminderDedupWindow == null || escalationCooldown == null) {
      return reminderDedupWindow == null ? escalationCooldown : reminderDedupWindow;
    }
    return reminderDedupWindow.compareTo(escalationCooldown) >= 0
        ? reminderDedupWindow
        : escalationCooldown;
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  private boolean isPositive(Duration duration) {
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
