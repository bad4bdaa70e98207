/*
 * Where: Deadline data access
 * What: Reads academic_years and flips window flags conditionally
 * Why: Window transitions are the only academic-year writes the engine performs
 */
package com.example.deadline.repository;

import com.example.deadline.model.AcademicYear;
import com.example.deadline.model.WindowType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AcademicYearRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<AcademicYear> findActive() {
    final String sql =
        """
        SELECT id, name, start_date, end_date, is_active, upload_window_open, evaluation_window_open
        FROM academic_years
        WHERE is_active = TRUE
        ORDER BY start_date
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /**
   * Sets the window flag only if it still holds {@code expected}.
   *
   * @return 1 when this caller performed the transition, 0 when someone else already did
   */
  public int updateWindowOpen(
      String academicYearId, WindowType windowType, boolean expected, boolean open) {
    // column names come from the enum, never from input
    final String column =
        windowType == WindowType.UPLOAD ? "upload_window_open" : "evaluation_window_open";
    final String sql =
        "UPDATE academic_years SET "
            + column
            + " = :open WHERE id = :academicYearId AND "
            + column
            + " = :expected";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("open", open)
            .addValue("academicYearId", academicYearId)
            .addValue("expected", expected);
    return jdbcTemplate.update(sql, params);
  }

  private AcademicYear mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AcademicYear(
        rs.getString("id"),
        rs.getString("name"),
        rs.getTimestamp("start_date").toInstant(),
        rs.getTimestamp("end_date").toInstant(),
        rs.getBoolean("is_active"),
        rs.getBoolean("upload_window_open"),
        rs.getBoolean("evaluation_window_open"));
  }
}
