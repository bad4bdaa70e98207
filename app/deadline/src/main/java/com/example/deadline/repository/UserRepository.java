/*
 * Where: Deadline data access
 * What: Reads users with their role and notification preferences
 * Why: Recipient selection for reminders, alerts and dispatch
 */
package com.example.deadline.repository;

import com.example.deadline.model.UserRecord;
import com.example.deadline.model.UserRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private static final String COLUMNS =
      "id, name, email, role, is_active, email_notifications, push_notifications, deadline_reminder_days";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(String userId) {
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UserRecord> findActiveByRoles(Collection<UserRole> roles) {
    if (roles.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM users WHERE is_active = TRUE AND role IN (:roles) ORDER BY id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("roles", roleNames(roles));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Active users of the given roles whose reminder lead time covers {@code daysUntilClose}. */
  public List<UserRecord> findReminderCandidates(Collection<UserRole> roles, long daysUntilClose) {
    if (roles.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM users
            WHERE is_active = TRUE
              AND role IN (:roles)
              AND deadline_reminder_days >= :daysUntilClose
            ORDER BY id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("roles", roleNames(roles))
            .addValue("daysUntilClose", daysUntilClose);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private List<String> roleNames(Collection<UserRole> roles) {
    return roles.stream().map(UserRole::name).toList();
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("email"),
        UserRole.valueOf(rs.getString("role")),
        rs.getBoolean("is_active"),
        rs.getBoolean("email_notifications"),
        rs.getBoolean("push_notifications"),
        rs.getInt("deadline_reminder_days"));
  }
}
