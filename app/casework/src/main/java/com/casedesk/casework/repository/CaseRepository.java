/*
 * どこで: Casework データアクセス
 * 何を: cases テーブルの作成/参照/楽観ロック付き状態更新を行う
 * なぜ: 状態遷移を version 条件付きの 1 文で確定させ、同時更新の取りこぼしを防ぐため
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.getInstantOrNull;
import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import com.casedesk.casework.model.CaseRecord;
import com.casedesk.casework.model.CaseStatus;
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
public class CaseRepository {

  private static final String SELECT_COLUMNS =
      """
      case_id, tenant_id, case_number, title, description, status, pending_until,
      created_by, created_at, last_transition_by, last_transition_at, version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void insert(CaseRecord record) {
    final String sql =
        """
        INSERT INTO cases (
          case_id,
          tenant_id,
          case_number,
          title,
          description,
          status,
          pending_until,
          created_by,
          created_at,
          last_transition_by,
          last_transition_at,
          version
        ) VALUES (
          :caseId,
          :tenantId,
          :caseNumber,
          :title,
          :description,
          :status,
          :pendingUntil,
          :createdBy,
          :createdAt,
          :lastTransitionBy,
          :lastTransitionAt,
          :version
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("caseId", record.caseId())
            .addValue("tenantId", record.tenantId())
            .addValue("caseNumber", record.caseNumber())
            .addValue("title", record.title())
            .addValue("description", record.description())
            .addValue("status", record.status().name())
            .addValue("pendingUntil", toTimestamp(record.pendingUntil()))
            .addValue("createdBy", record.createdBy())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("lastTransitionBy", record.lastTransitionBy())
            .addValue("lastTransitionAt", toTimestamp(record.lastTransitionAt()))
            .addValue("version", record.version());
    jdbcTemplate.update(sql, params);
  }

  public Optional<CaseRecord> findById(String tenantId, UUID caseId) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM cases
            WHERE tenant_id = :tenantId
              AND case_id = :caseId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("caseId", caseId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 読み取り時の状態と version が一致する場合だけ遷移を書き込む。
   *
   * @return 更新後の行。競合で 0 行のときは空
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<CaseRecord> updateStatus(
      CaseRecord current,
      CaseStatus targetStatus,
      Instant pendingUntil,
      String actorId,
      Instant transitionedAt) {
    final String sql =
        """
        UPDATE cases
        SET status = :targetStatus,
            pending_until = :pendingUntil,
            last_transition_by = :actorId,
            last_transition_at = :transitionedAt,
            version = version + 1
        WHERE tenant_id = :tenantId
          AND case_id = :caseId
          AND status = :currentStatus
          AND version = :expectedVersion
        RETURNING
        """
            + SELECT_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", current.tenantId())
            .addValue("caseId", current.caseId())
            .addValue("currentStatus", current.status().name())
            .addValue("expectedVersion", current.version())
            .addValue("targetStatus", targetStatus.name())
            .addValue("pendingUntil", toTimestamp(pendingUntil))
            .addValue("actorId", actorId)
            .addValue("transitionedAt", toTimestamp(transitionedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // 再開期限を過ぎた PENDED をテナント横断で古い順に取得する
  public List<CaseRecord> findDuePended(Instant now, int limit) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM cases
            WHERE status = 'PENDED'
              AND pending_until <= :now
            ORDER BY pending_until, case_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private CaseRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CaseRecord(
        rs.getObject("case_id", UUID.class),
        rs.getString("tenant_id"),
        rs.getString("case_number"),
        rs.getString("title"),
        rs.getString("description"),
        CaseStatus.valueOf(rs.getString("status")),
        getInstantOrNull(rs, "pending_until"),
        rs.getString("created_by"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getString("last_transition_by"),
        rs.getTimestamp("last_transition_at").toInstant(),
        rs.getLong("version"));
  }
}
