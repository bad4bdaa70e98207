/*
 * Where: Deadline data access
 * What: Insert, lookup and conditional updates of the notifications table
 * Why: Dedup, dispatch, inbox and retention all go through conditional SQL here
 */
package com.example.deadline.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, user_id, type, title, message, scheduled_for,
      metadata::text AS metadata_text, created_at, sent_at, is_read
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Serialises concurrent writers of one dedup key until the surrounding transaction ends. */
  @Transactional(propagation = Propagation.MANDATORY)
  public void lockByKey(long lockKey) {
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          type,
          title,
          message,
          scheduled_for,
          metadata,
          created_at,
          sent_at,
          is_read
        ) VALUES (
          :notificationId,
          :userId,
          :type,
          :title,
          :message,
          :scheduledFor,
          :metadata::jsonb,
          :createdAt,
          :sentAt,
          :read
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("type", record.type().name())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("scheduledFor", toTimestamp(record.scheduledFor()))
            .addValue("metadata", record.metadataJson() == null ? "{}" : record.metadataJson())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("read", record.read());
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = "SELECT " + COLUMNS + " FROM notifications WHERE notification_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean existsSince(
      String userId, NotificationType type, String academicYearId, Instant since) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notifications
          WHERE user_id = :userId
            AND type = :type
            AND metadata ->> 'academicYearId' = :academicYearId
            AND created_at >= :since
        )
        """;
    final MapSqlParameterSource params =
        dedupParams(userId, type, academicYearId).addValue("since", toTimestamp(since));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** Most recent notification of the key created at or after {@code since} that records a level. */
  public Optional<NotificationRecord> findLatestEscalationSince(
      String userId, NotificationType type, String academicYearId, Instant since) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE user_id = :userId
              AND type = :type
              AND metadata ->> 'academicYearId' = :academicYearId
              AND metadata ->> 'escalationLevel' IS NOT NULL
              AND created_at >= :since
            ORDER BY created_at DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        dedupParams(userId, type, academicYearId).addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findPending(Instant now, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE sent_at IS NULL
              AND (scheduled_for IS NULL OR scheduled_for <= :now)
            ORDER BY created_at, notification_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countPending(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE sent_at IS NULL
          AND (scheduled_for IS NULL OR scheduled_for <= :now)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public List<NotificationRecord> findByUserId(
      String userId, int limit, int offset, boolean unreadOnly) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE user_id = :userId
              AND (:unreadOnly = FALSE OR is_read = FALSE)
            ORDER BY created_at DESC, notification_id
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("unreadOnly", unreadOnly)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByUserId(String userId, boolean unreadOnly) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE user_id = :userId
          AND (:unreadOnly = FALSE OR is_read = FALSE)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("unreadOnly", unreadOnly);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** Sets sent_at once; a second call for the same row updates nothing. */
  public int markSent(UUID notificationId, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET sent_at = :sentAt
        WHERE notification_id = :id
          AND sent_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", notificationId)
            .addValue("sentAt", toTimestamp(sentAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markRead(UUID notificationId, String userId) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE
        WHERE notification_id = :id
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", notificationId).addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteReadOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE is_read = TRUE
          AND created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource dedupParams(
      String userId, NotificationType type, String academicYearId) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("type", type.name())
        .addValue("academicYearId", academicYearId);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getObject("notification_id", UUID.class),
        rs.getString("user_id"),
        NotificationType.valueOf(rs.getString("type")),
        rs.getString("title"),
        rs.getString("message"),
        toInstant(rs.getTimestamp("scheduled_for")),
        rs.getString("metadata_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getBoolean("is_read"));
  }
}
