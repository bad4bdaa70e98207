/*
 * Where: Deadline service layer
 * What: Pure deadline arithmetic for an academic year at a given instant
 * Why: Reminders, transitions and escalation must agree on the same day counts
 */
package com.example.deadline.service;

import com.example.deadline.model.AcademicYear;
import com.example.deadline.model.DeadlineWindow;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

@Component
public class WindowEvaluator {

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

  /**
   * Day counts are whole days truncated toward zero, so 23 hours before the end date is still
   * day 0 and the first overdue day starts 24 hours after it.
   */
  public DeadlineWindow evaluate(AcademicYear year, Instant now) {
    final long daysUntilClose = Duration.between(now, year.endDate()).toDays();
    final boolean closed = now.isAfter(year.endDate());
    final long daysSinceClose = closed ? Duration.between(year.endDate(), now).toDays() : 0;
    final boolean shouldBeOpen = !now.isBefore(year.startDate()) && !closed;
    return new DeadlineWindow(daysUntilClose, daysSinceClose, closed, shouldBeOpen);
  }

  public static String formatDate(Instant instant) {
    return DATE_FORMAT.format(instant);
  }
}
