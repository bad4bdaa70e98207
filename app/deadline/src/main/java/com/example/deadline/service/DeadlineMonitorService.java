/*
 * Where: Deadline service layer
 * What: Sweeps every active academic year: reminders, window transitions, escalation, flush
 * Why: Single entry point for the recurring jobs and the manual control surface
 */
package com.example.deadline.service;

import com.example.deadline.model.AcademicYear;
import com.example.deadline.model.DeadlineWindow;
import com.example.deadline.model.SweepSummary;
import com.example.deadline.repository.AcademicYearRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeadlineMonitorService {

  private static final Logger logger = LoggerFactory.getLogger(DeadlineMonitorService.class);

  private final AcademicYearRepository academicYearRepository;
  private final WindowEvaluator windowEvaluator;
  private final DeadlineReminderService reminderService;
  private final WindowTransitionService transitionService;
  private final EscalationService escalationService;
  private final NotificationDispatcher dispatcher;
  private final DeadlineMetrics metrics;
  private final Clock clock;

  /** Reminders, transitions and escalation for every active year, then a pending flush. */
  public SweepSummary runAllChecks() {
    final SweepSummary sweep = sweepYears(true);
    final SweepSummary summary = sweep.plus(processPendingNotifications());
    logger.info("deadline checks completed {}", summary.describe());
    return summary;
  }

  /** Reminders and escalation without transition detection. */
  public SweepSummary runReminderChecks() {
    final SweepSummary summary = sweepYears(false);
    logger.info("reminder checks completed {}", summary.describe());
    return summary;
  }

  public SweepSummary processPendingNotifications() {
    final int dispatched = dispatcher.dispatchPending();
    return new SweepSummary(0, 0, 0, dispatched);
  }

  private SweepSummary sweepYears(boolean checkTransitions) {
    final List<AcademicYear> years = academicYearRepository.findActive();
    int processed = 0;
    int failed = 0;
    int created = 0;
    for (AcademicYear year : years) {
      try {
        created += processYear(year, checkTransitions);
        processed++;
      } catch (RuntimeException ex) {
        failed++;
        metrics.recordSweepFailure("academic_year");
        logger.error("deadline sweep failed academicYearId={}", year.academicYearId(), ex);
      }
    }
    return new SweepSummary(processed, failed, created, 0);
  }

  private int processYear(AcademicYear year, boolean checkTransitions) {
    final Instant now = Instant.now(clock);
    final DeadlineWindow window = windowEvaluator.evaluate(year, now);
    int created = 0;
    if (year.uploadWindowOpen()) {
      created += reminderService.remindUploads(year, window);
    }
    if (year.evaluationWindowOpen()) {
      created += reminderService.remindEvaluations(year, window);
    }
    AcademicYear current = year;
    if (checkTransitions) {
      final TransitionOutcome outcome = transitionService.checkTransitions(year, window);
      created += outcome.notificationsCreated();
      current = outcome.year();
    }
    if (!current.evaluationWindowOpen() && window.closed()) {
      created += escalationService.escalateYear(current, window);
    }
    return created;
  }
}
