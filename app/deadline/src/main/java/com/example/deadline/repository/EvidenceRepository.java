/*
 * Where: Deadline data access
 * What: Pending-evaluation counts and the unevaluated evidence listing
 * Why: Reminders gate on pending counts; escalation groups unevaluated items by owner
 */
package com.example.deadline.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;

import com.example.deadline.model.OverdueEvidence;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EvidenceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Unevaluated, non-deleted evidence of a year under sub-indicators owned by the reviewer. */
  public int countUnevaluatedOwnedBy(String ownerId, String academicYearId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM evidence e
        JOIN sub_indicators si ON si.id = e.sub_indicator_id
        WHERE e.academic_year_id = :academicYearId
          AND e.deleted_at IS NULL
          AND si.owner_id = :ownerId
          AND NOT EXISTS (SELECT 1 FROM evaluations ev WHERE ev.evidence_id = e.id)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("academicYearId", academicYearId)
            .addValue("ownerId", ownerId);
    return count(sql, params);
  }

  /** Non-deleted evidence of a year that has no evaluation authored by this reviewer. */
  public int countMissingEvaluationBy(String evaluatorId, String academicYearId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM evidence e
        WHERE e.academic_year_id = :academicYearId
          AND e.deleted_at IS NULL
          AND NOT EXISTS (
            SELECT 1 FROM evaluations ev
            WHERE ev.evidence_id = e.id
              AND ev.evaluator_id = :evaluatorId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("academicYearId", academicYearId)
            .addValue("evaluatorId", evaluatorId);
    return count(sql, params);
  }

  public List<OverdueEvidence> findUnevaluatedByYear(String academicYearId) {
    final String sql =
        """
        SELECT e.id, e.original_name, e.uploaded_at,
               u.name AS uploader_name,
               si.owner_id, si.name AS sub_indicator_name,
               i.name AS indicator_name,
               s.name AS standard_name,
               el.name AS education_level_name
        FROM evidence e
        JOIN users u ON u.id = e.uploader_id
        JOIN sub_indicators si ON si.id = e.sub_indicator_id
        JOIN indicators i ON i.id = si.indicator_id
        JOIN standards s ON s.id = i.standard_id
        JOIN education_levels el ON el.id = s.education_level_id
        WHERE e.academic_year_id = :academicYearId
          AND e.deleted_at IS NULL
          AND NOT EXISTS (SELECT 1 FROM evaluations ev WHERE ev.evidence_id = e.id)
        ORDER BY e.uploaded_at, e.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("academicYearId", academicYearId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private int count(String sql, MapSqlParameterSource params) {
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private OverdueEvidence mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OverdueEvidence(
        rs.getString("id"),
        rs.getString("original_name"),
        rs.getString("uploader_name"),
        rs.getString("owner_id"),
        rs.getString("sub_indicator_name"),
        rs.getString("indicator_name"),
        rs.getString("standard_name"),
        rs.getString("education_level_name"),
        toInstant(rs.getTimestamp("uploaded_at")));
  }
}
