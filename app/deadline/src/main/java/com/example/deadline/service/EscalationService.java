/*
 * Where: Deadline service layer
 * What: Escalates overdue evaluations per reviewer along the five-level ladder
 * Why: The level is recomputed every run; notification history is the only escalation state
 */
package com.example.deadline.service;

import com.example.deadline.config.DeadlineMonitorProperties;
import com.example.deadline.model.AcademicYear;
import com.example.deadline.model.DeadlineWindow;
import com.example.deadline.model.EscalationLevel;
import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import com.example.deadline.model.OverdueEvidence;
import com.example.deadline.model.UserRecord;
import com.example.deadline.model.UserRole;
import com.example.deadline.repository.EvidenceRepository;
import com.example.deadline.repository.UserRepository;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EscalationService {

  private static final Logger logger = LoggerFactory.getLogger(EscalationService.class);

  private static final String ADMIN_USERS_PATH = "/admin/users";
  private static final String EVALUATE_PATH = "/evaluate";

  private final EvidenceRepository evidenceRepository;
  private final UserRepository userRepository;
  private final NotificationService notificationService;
  private final DeadlineMonitorProperties monitorProperties;
  private final DeadlineMetrics metrics;

  /** Escalates every reviewer with unevaluated evidence in a year whose window has closed. */
  public int escalateYear(AcademicYear year, DeadlineWindow window) {
    if (!window.closed()) {
      return 0;
    }
    final Optional<EscalationLevel> level = EscalationLevel.forElapsedDays(window.daysSinceClose());
    if (level.isEmpty()) {
      return 0;
    }
    final Map<String, List<OverdueEvidence>> byReviewer =
        groupByOwner(evidenceRepository.findUnevaluatedByYear(year.academicYearId()));
    int created = 0;
    for (Map.Entry<String, List<OverdueEvidence>> entry : byReviewer.entrySet()) {
      try {
        created +=
            escalateReviewer(
                entry.getKey(), entry.getValue(), year, level.get(), window.daysSinceClose());
      } catch (RuntimeException ex) {
        metrics.recordSweepFailure("reviewer");
        logger.error(
            "escalation failed reviewerId={} academicYearId={}",
            entry.getKey(),
            year.academicYearId(),
            ex);
      }
    }
    return created;
  }

  @VisibleForTesting
  int escalateReviewer(
      String reviewerId,
      List<OverdueEvidence> overdue,
      AcademicYear year,
      EscalationLevel level,
      long daysSinceClose) {
    final Optional<UserRecord> reviewer = userRepository.findById(reviewerId);
    if (reviewer.isEmpty() || !reviewer.get().active()) {
      logger.warn(
          "escalation skipped for missing or inactive reviewer reviewerId={} academicYearId={}",
          reviewerId,
          year.academicYearId());
      return 0;
    }
    return notificationService.withDedupLock(
        reviewerId,
        NotificationType.EVALUATION_OVERDUE,
        year.academicYearId(),
        () -> {
          final Optional<Integer> previous = latestIssuedLevel(reviewerId, year.academicYearId());
          if (previous.isPresent() && previous.get() == level.level()) {
            logger.debug(
                "escalation already issued reviewerId={} academicYearId={} level={}",
                reviewerId,
                year.academicYearId(),
                level.level());
            return 0;
          }
          final int created = issue(reviewer.get(), overdue, year, level, daysSinceClose);
          metrics.recordEscalation(level);
          logger.info(
              "escalation issued reviewerId={} academicYearId={} level={} overdue={} notifications={}",
              reviewerId,
              year.academicYearId(),
              level.level(),
              overdue.size(),
              created);
          return created;
        });
  }

  private Optional<Integer> latestIssuedLevel(String reviewerId, String academicYearId) {
    final Optional<NotificationRecord> latest =
        notificationService.findLatestEscalation(
            reviewerId, academicYearId, monitorProperties.escalationCooldown());
    if (latest.isEmpty()) {
      return Optional.empty();
    }
    final Object level =
        notificationService.readMetadata(latest.get()).get(NotificationService.ESCALATION_LEVEL);
    if (level instanceof Number number) {
      return Optional.of(number.intValue());
    }
    return Optional.empty();
  }

  private int issue(
      UserRecord reviewer,
      List<OverdueEvidence> overdue,
      AcademicYear year,
      EscalationLevel level,
      long daysSinceClose) {
    notificationService.createNotification(
        escalationNotice(reviewer, overdue.size(), year, level, daysSinceClose));
    int created = 1;
    switch (level) {
      case LEVEL_3 -> created += notifySupervisors(reviewer, overdue.size(), year, daysSinceClose);
      case LEVEL_4 -> {
        notificationService.createNotification(detailedReport(reviewer, overdue, year, daysSinceClose));
        created++;
      }
      case LEVEL_5 -> created += administrativeAlert(reviewer, overdue.size(), year, daysSinceClose);
      default -> {
        // levels 1 and 2 only notify the reviewer
      }
    }
    return created;
  }

  @VisibleForTesting
  NotificationCommand escalationNotice(
      UserRecord reviewer, int overdueCount, AcademicYear year, EscalationLevel level, long daysSinceClose) {
    final String title =
        (level.isUrgent() ? "[URGENT] " : "") + "Overdue Evaluations - Level " + level.level();
    final String message =
        "You have "
            + overdueCount
            + " overdue evaluation(s) for "
            + year.name()
            + ". These evaluations are "
            + daysSinceClose
            + " day(s) overdue ("
            + level.description()
            + "). "
            + level.consequence();
    final Map<String, Object> metadata = yearMetadata(year, overdueCount, daysSinceClose);
    metadata.put(NotificationService.ESCALATION_LEVEL, level.level());
    metadata.put("escalationDescription", level.description());
    metadata.put(NotificationService.ACTION_URL, monitorProperties.actionUrl(EVALUATE_PATH));
    return NotificationCommand.of(
        reviewer.userId(), NotificationType.EVALUATION_OVERDUE, title, message, metadata);
  }

  private int notifySupervisors(
      UserRecord reviewer, int overdueCount, AcademicYear year, long daysSinceClose) {
    final List<UserRecord> supervisors = userRepository.findActiveByRoles(UserRole.SUPERVISORS);
    for (UserRecord supervisor : supervisors) {
      final Map<String, Object> metadata = reviewerMetadata(reviewer, year, overdueCount, daysSinceClose);
      metadata.put("escalationType", "supervisor_notification");
      notificationService.createNotification(
          NotificationCommand.of(
              supervisor.userId(),
              NotificationType.SYSTEM_ALERT,
              "Escalation Alert: Overdue Evaluations",
              reviewer.name()
                  + " ("
                  + reviewer.email()
                  + ") has "
                  + overdueCount
                  + " overdue evaluation(s) for "
                  + year.name()
                  + ". These evaluations are "
                  + daysSinceClose
                  + " day(s) overdue and require supervisor intervention.",
              metadata));
    }
    return supervisors.size();
  }

  @VisibleForTesting
  NotificationCommand detailedReport(
      UserRecord reviewer, List<OverdueEvidence> overdue, AcademicYear year, long daysSinceClose) {
    final List<Map<String, Object>> breakdown = new ArrayList<>();
    for (OverdueEvidence evidence : overdue) {
      final Map<String, Object> item = new LinkedHashMap<>();
      item.put("evidenceId", evidence.evidenceId());
      item.put("fileName", evidence.fileName());
      item.put("uploader", evidence.uploaderName());
      item.put("subIndicator", evidence.subIndicatorName());
      item.put("indicator", evidence.indicatorName());
      item.put("standard", evidence.standardName());
      item.put("educationLevel", evidence.educationLevelName());
      item.put("uploadedAt", evidence.uploadedAt() == null ? null : evidence.uploadedAt().toString());
      breakdown.add(item);
    }
    final Map<String, Object> metadata = yearMetadata(year, overdue.size(), daysSinceClose);
    metadata.put(NotificationService.ESCALATION_LEVEL, EscalationLevel.LEVEL_4.level());
    metadata.put("escalationType", "detailed_report");
    metadata.put("detailedBreakdown", breakdown);
    metadata.put(NotificationService.ACTION_URL, monitorProperties.actionUrl(EVALUATE_PATH));
    return NotificationCommand.of(
        reviewer.userId(),
        NotificationType.EVALUATION_OVERDUE,
        "[FINAL WARNING] Detailed Overdue Report - " + year.name(),
        "This is your final warning regarding "
            + overdue.size()
            + " overdue evaluation(s). Please review the detailed breakdown and complete all"
            + " evaluations immediately to avoid administrative action.",
        metadata);
  }

  private int administrativeAlert(
      UserRecord reviewer, int overdueCount, AcademicYear year, long daysSinceClose) {
    final List<UserRecord> administrators =
        userRepository.findActiveByRoles(Set.of(UserRole.ADMINISTRATOR));
    for (UserRecord administrator : administrators) {
      final Map<String, Object> metadata = reviewerMetadata(reviewer, year, overdueCount, daysSinceClose);
      metadata.put("escalationType", "administrative_action");
      metadata.put("severity", "critical");
      notificationService.createNotification(
          NotificationCommand.of(
              administrator.userId(),
              NotificationType.SYSTEM_ALERT,
              "[ADMINISTRATIVE ACTION REQUIRED] Chronic Evaluation Delays",
              "URGENT: "
                  + reviewer.name()
                  + " ("
                  + reviewer.email()
                  + ") has persistently failed to complete "
                  + overdueCount
                  + " evaluation(s) for "
                  + year.name()
                  + ". These evaluations are "
                  + daysSinceClose
                  + " day(s) overdue. Immediate administrative intervention is required.",
              metadata));
    }
    final Map<String, Object> notice = yearMetadata(year, overdueCount, daysSinceClose);
    notice.put("escalationType", "administrative_notice");
    notice.put("severity", "critical");
    notificationService.createNotification(
        NotificationCommand.of(
            reviewer.userId(),
            NotificationType.SYSTEM_ALERT,
            "[ADMINISTRATIVE ACTION] Evaluation Compliance Issue",
            "Due to persistent failure to complete evaluations, administrative action has been"
                + " initiated regarding your "
                + overdueCount
                + " overdue evaluation(s) for "
                + year.name()
                + ". Please contact the administrator immediately.",
            notice));
    return administrators.size() + 1;
  }

  private Map<String, Object> yearMetadata(AcademicYear year, int overdueCount, long daysSinceClose) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(NotificationService.ACADEMIC_YEAR_ID, year.academicYearId());
    metadata.put("overdueCount", overdueCount);
    metadata.put("daysSinceClosure", daysSinceClose);
    return metadata;
  }

  private Map<String, Object> reviewerMetadata(
      UserRecord reviewer, AcademicYear year, int overdueCount, long daysSinceClose) {
    final Map<String, Object> metadata = yearMetadata(year, overdueCount, daysSinceClose);
    metadata.put("evaluatorId", reviewer.userId());
    metadata.put("evaluatorName", reviewer.name());
    metadata.put("evaluatorEmail", reviewer.email());
    metadata.put(NotificationService.ACTION_URL, monitorProperties.actionUrl(ADMIN_USERS_PATH));
    return metadata;
  }

  /** Owner-less evidence has nobody to escalate to and is left out. */
  @VisibleForTesting
  static Map<String, List<OverdueEvidence>> groupByOwner(List<OverdueEvidence> overdue) {
    final Map<String, List<OverdueEvidence>> byOwner = new LinkedHashMap<>();
    for (OverdueEvidence evidence : overdue) {
      if (evidence.ownerId() == null) {
        continue;
      }
      byOwner.computeIfAbsent(evidence.ownerId(), ignored -> new ArrayList<>()).add(evidence);
    }
    return byOwner;
  }
}
