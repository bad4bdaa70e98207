/*
 * Where: Deadline service layer
 * What: Flips window flags that disagree with the calendar and announces the change
 * Why: The conditional update makes exactly one concurrent sweep the announcer
 */
package com.example.deadline.service;

import com.example.deadline.config.DeadlineMonitorProperties;
import com.example.deadline.model.AcademicYear;
import com.example.deadline.model.DeadlineWindow;
import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.UserRecord;
import com.example.deadline.model.WindowType;
import com.example.deadline.repository.AcademicYearRepository;
import com.example.deadline.repository.UserRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class WindowTransitionService {

  private static final Logger logger = LoggerFactory.getLogger(WindowTransitionService.class);

  private final AcademicYearRepository academicYearRepository;
  private final UserRepository userRepository;
  private final NotificationService notificationService;
  private final DeadlineMonitorProperties monitorProperties;
  private final PlatformTransactionManager transactionManager;

  public TransitionOutcome checkTransitions(AcademicYear year, DeadlineWindow window) {
    AcademicYear current = year;
    int created = 0;
    for (WindowType windowType : WindowType.values()) {
      final int issued = checkTransition(current, windowType, window);
      if (issued > 0) {
        created += issued;
      }
      // whoever won the flip, the flag now matches the calendar
      current = current.withWindowOpen(windowType, window.shouldBeOpen());
    }
    return new TransitionOutcome(current, created);
  }

  /**
   * @return notifications issued, or -1 when the flag already matched or another sweep won the
   *     flip
   */
  int checkTransition(AcademicYear year, WindowType windowType, DeadlineWindow window) {
    final boolean persisted = year.isWindowOpen(windowType);
    final boolean shouldBeOpen = window.shouldBeOpen();
    if (persisted == shouldBeOpen) {
      return -1;
    }
    // flag flip and announcements commit together; a failed insert leaves the flip for the next run
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Integer issued =
        transactionTemplate.execute(
            status -> {
              final int updated =
                  academicYearRepository.updateWindowOpen(
                      year.academicYearId(), windowType, persisted, shouldBeOpen);
              if (updated == 0) {
                return -1;
              }
              return announce(year, windowType, shouldBeOpen);
            });
    final int result = issued == null ? -1 : issued;
    if (result < 0) {
      logger.debug(
          "window transition already applied academicYearId={} window={}",
          year.academicYearId(),
          windowType.value());
    } else {
      logger.info(
          "window {} academicYearId={} window={} notified={}",
          shouldBeOpen ? "opened" : "closed",
          year.academicYearId(),
          windowType.value(),
          result);
    }
    return result;
  }

  private int announce(AcademicYear year, WindowType windowType, boolean opened) {
    final List<UserRecord> recipients = userRepository.findActiveByRoles(windowType.affectedRoles());
    final String endDate = WindowEvaluator.formatDate(year.endDate());
    for (UserRecord recipient : recipients) {
      final Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put(NotificationService.ACADEMIC_YEAR_ID, year.academicYearId());
      metadata.put("windowType", windowType.value());
      final NotificationCommand command;
      if (opened) {
        metadata.put(
            NotificationService.ACTION_URL, monitorProperties.actionUrl(windowType.actionPath()));
        command =
            NotificationCommand.of(
                recipient.userId(),
                windowType.openingType(),
                windowType.label() + " Window Opened - " + year.name(),
                "The "
                    + windowType.value()
                    + " window for "
                    + year.name()
                    + " is now open until "
                    + endDate
                    + ".",
                metadata);
      } else {
        command =
            NotificationCommand.of(
                recipient.userId(),
                windowType.closingType(),
                windowType.label() + " Window Closed - " + year.name(),
                "The "
                    + windowType.value()
                    + " window for "
                    + year.name()
                    + " has been closed as of "
                    + endDate
                    + ".",
                metadata);
      }
      notificationService.createNotification(command);
    }
    return recipients.size();
  }
}
