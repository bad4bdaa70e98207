/*
 * Where: Deadline service layer
 * What: Upload and evaluation deadline reminders for an academic year
 * Why: Users choose their own lead time; each gets at most one reminder per dedup window
 */
package com.example.deadline.service;

import com.example.deadline.config.DeadlineMonitorProperties;
import com.example.deadline.model.AcademicYear;
import com.example.deadline.model.DeadlineWindow;
import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationType;
import com.example.deadline.model.UserRecord;
import com.example.deadline.model.UserRole;
import com.example.deadline.model.WindowType;
import com.example.deadline.repository.UserRepository;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeadlineReminderService {

  private static final Logger logger = LoggerFactory.getLogger(DeadlineReminderService.class);

  private final UserRepository userRepository;
  private final NotificationService notificationService;
  private final PendingEvaluationCounter pendingEvaluationCounter;
  private final DeadlineMonitorProperties monitorProperties;

  public int remindUploads(AcademicYear year, DeadlineWindow window) {
    if (window.closed()) {
      return 0;
    }
    int created = 0;
    for (UserRecord submitter :
        userRepository.findReminderCandidates(Set.of(UserRole.SUBMITTER), window.daysUntilClose())) {
      final Map<String, Object> metadata = baseMetadata(year, window, WindowType.UPLOAD);
      final NotificationCommand command =
          NotificationCommand.of(
              submitter.userId(),
              NotificationType.UPLOAD_DEADLINE_REMINDER,
              "Upload Deadline Reminder - " + year.name(),
              "The upload window for "
                  + year.name()
                  + " will close in "
                  + window.daysUntilClose()
                  + " day(s) on "
                  + WindowEvaluator.formatDate(year.endDate())
                  + ". Please ensure all your evidence has been uploaded.",
              metadata);
      if (notificationService
          .createIfAbsent(command, monitorProperties.reminderDedupWindow())
          .isPresent()) {
        created++;
      }
    }
    if (created > 0) {
      logger.info(
          "upload reminders created academicYearId={} daysUntilClose={} count={}",
          year.academicYearId(),
          window.daysUntilClose(),
          created);
    }
    return created;
  }

  /** Reviewers with nothing pending get no reminder. */
  public int remindEvaluations(AcademicYear year, DeadlineWindow window) {
    if (window.closed()) {
      return 0;
    }
    int created = 0;
    for (UserRecord reviewer :
        userRepository.findReminderCandidates(UserRole.REVIEWERS, window.daysUntilClose())) {
      final int pendingCount = pendingEvaluationCounter.count(reviewer, year.academicYearId());
      if (pendingCount <= 0) {
        continue;
      }
      final Map<String, Object> metadata = baseMetadata(year, window, WindowType.EVALUATION);
      metadata.put("pendingCount", pendingCount);
      final NotificationCommand command =
          NotificationCommand.of(
              reviewer.userId(),
              NotificationType.EVALUATION_DEADLINE_REMINDER,
              "Evaluation Deadline Reminder - " + year.name(),
              "You have "
                  + pendingCount
                  + " pending evaluation(s) for "
                  + year.name()
                  + ". The evaluation window will close in "
                  + window.daysUntilClose()
                  + " day(s) on "
                  + WindowEvaluator.formatDate(year.endDate())
                  + ".",
              metadata);
      if (notificationService
          .createIfAbsent(command, monitorProperties.reminderDedupWindow())
          .isPresent()) {
        created++;
      }
    }
    if (created > 0) {
      logger.info(
          "evaluation reminders created academicYearId={} daysUntilClose={} count={}",
          year.academicYearId(),
          window.daysUntilClose(),
          created);
    }
    return created;
  }

  private Map<String, Object> baseMetadata(
      AcademicYear year, DeadlineWindow window, WindowType windowType) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(NotificationService.ACADEMIC_YEAR_ID, year.academicYearId());
    metadata.put("daysUntilDeadline", window.daysUntilClose());
    metadata.put("deadlineDate", year.endDate().toString());
    metadata.put(NotificationService.ACTION_URL, monitorProperties.actionUrl(windowType.actionPath()));
    return metadata;
  }
}
