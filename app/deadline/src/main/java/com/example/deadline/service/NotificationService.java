/*
 * Where: Deadline service layer
 * What: Creates, deduplicates, lists and marks notifications
 * Why: Every engine path writes through here so the at-most-once rule lives in one place
 */
package com.example.deadline.service;

import com.example.deadline.config.DeliveryProperties;
import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import com.example.deadline.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  public static final String ACADEMIC_YEAR_ID = "academicYearId";
  public static final String ESCALATION_LEVEL = "escalationLevel";
  public static final String ACTION_URL = "actionUrl";

  private final NotificationRepository notificationRepository;
  private final DedupLockKeyGenerator lockKeyGenerator;
  private final DeliveryProperties deliveryProperties;
  private final DeadlineMetrics metrics;
  private final ObjectMapper objectMapper;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  /** Inserts a notification. Nothing is sent here. */
  public NotificationRecord createNotification(NotificationCommand command) {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            command.userId(),
            command.type(),
            command.title(),
            command.message(),
            command.scheduledFor(),
            writeMetadata(command.metadata()),
            Instant.now(clock),
            null,
            false);
    notificationRepository.insert(record);
    metrics.recordCreated(record.type());
    logger.info(
        "notification created id={} userId={} type={}",
        record.notificationId(),
        record.userId(),
        record.type());
    return record;
  }

  /**
   * Creates the notification unless one with the same user, type and academic year was created
   * within {@code window}.
   */
  public Optional<NotificationRecord> createIfAbsent(NotificationCommand command, Duration window) {
    final String academicYearId = requireAcademicYearId(command);
    return withDedupLock(
        command.userId(),
        command.type(),
        academicYearId,
        () -> {
          final Instant since = Instant.now(clock).minus(window);
          if (notificationRepository.existsSince(
              command.userId(), command.type(), academicYearId, since)) {
            logger.debug(
                "notification skipped as duplicate userId={} type={} academicYearId={}",
                command.userId(),
                command.type(),
                academicYearId);
            return Optional.empty();
          }
          return Optional.of(createNotification(command));
        });
  }

  /**
   * Runs {@code action} in a transaction that holds the advisory lock of the dedup key, so the
   * history check and the inserts it decides on cannot interleave with another writer of the key.
   */
  public <T> T withDedupLock(
      String userId, NotificationType type, String academicYearId, Supplier<T> action) {
    final long lockKey = lockKeyGenerator.generate(userId, type, academicYearId);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    return transactionTemplate.execute(
        status -> {
          notificationRepository.lockByKey(lockKey);
          return action.get();
        });
  }

  public Optional<NotificationRecord> findLatestEscalation(
      String userId, String academicYearId, Duration window) {
    final Instant since = Instant.now(clock).minus(window);
    return notificationRepository.findLatestEscalationSince(
        userId, NotificationType.EVALUATION_OVERDUE, academicYearId, since);
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    return notificationRepository.findById(notificationId);
  }

  /** Unsent notifications that are due now, oldest first. */
  public List<NotificationRecord> getPending() {
    return getPending(deliveryProperties.batchSize());
  }

  public List<NotificationRecord> getPending(int limit) {
    return notificationRepository.findPending(Instant.now(clock), limit);
  }

  public int countPending() {
    return notificationRepository.countPending(Instant.now(clock));
  }

  public boolean markSent(UUID notificationId) {
    return notificationRepository.markSent(notificationId, Instant.now(clock)) > 0;
  }

  public void markRead(UUID notificationId, String userId) {
    final int updated = notificationRepository.markRead(notificationId, userId);
    if (updated == 0) {
      // also reached when the notification belongs to someone else
      throw new NotificationNotFoundException(notificationId);
    }
  }

  public NotificationPage getUserNotifications(
      String userId, int limit, int offset, boolean unreadOnly) {
    if (limit <= 0 || offset < 0) {
      throw new IllegalArgumentException("limit must be positive and offset non-negative");
    }
    final List<NotificationRecord> items =
        notificationRepository.findByUserId(userId, limit, offset, unreadOnly);
    final int total = notificationRepository.countByUserId(userId, unreadOnly);
    return new NotificationPage(items, total, limit, offset);
  }

  /** Parsed metadata, or an empty map when the stored JSON cannot be read. */
  public Map<String, Object> readMetadata(NotificationRecord record) {
    final String json = record.metadataJson();
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      final Map<String, Object> metadata = objectMapper.readValue(json, METADATA_TYPE);
      return metadata == null ? Map.of() : metadata;
    } catch (JsonProcessingException ex) {
      logger.warn("notification metadata unreadable id={}", record.notificationId(), ex);
      return Map.of();
    }
  }

  private String writeMetadata(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification metadata is not serializable", ex);
    }
  }

  private String requireAcademicYearId(NotificationCommand command) {
    final Object academicYearId = command.metadata().get(ACADEMIC_YEAR_ID);
    if (academicYearId == null) {
      throw new IllegalArgumentException("dedup requires metadata." + ACADEMIC_YEAR_ID);
    }
    return academicYearId.toString();
  }
}
