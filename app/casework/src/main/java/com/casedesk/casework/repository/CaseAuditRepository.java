/*
 * どこで: Casework データアクセス
 * 何を: case_audit への追記と履歴参照
 * なぜ: 状態遷移と同じトランザクションで監査を残し、遷移と監査の不一致を防ぐため
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import com.casedesk.casework.model.CaseAuditRecord;
import com.casedesk.casework.model.CaseStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class CaseAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void insert(CaseAuditRecord record) {
    final String sql =
        """
        INSERT INTO case_audit (
          audit_id,
          tenant_id,
          case_id,
          from_status,
          to_status,
          actor_id,
          occurred_at,
          annotation,
          detail
        ) VALUES (
          :auditId,
          :tenantId,
          :caseId,
          :fromStatus,
          :toStatus,
          :actorId,
          :occurredAt,
          :annotation,
          CAST(:detail AS jsonb)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("tenantId", record.tenantId())
            .addValue("caseId", record.caseId())
            .addValue("fromStatus", record.fromStatus() == null ? null : record.fromStatus().name())
            .addValue("toStatus", record.toStatus().name())
            .addValue("actorId", record.actorId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("annotation", record.annotation())
            .addValue("detail", record.detailJson());
    jdbcTemplate.update(sql, params);
  }

  public List<CaseAuditRecord> findByCase(String tenantId, UUID caseId) {
    final String sql =
        """
        SELECT audit_id, tenant_id, case_id, from_status, to_status, actor_id,
               occurred_at, annotation, detail::text AS detail
        FROM case_audit
        WHERE tenant_id = :tenantId
          AND case_id = :caseId
        ORDER BY occurred_at, audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("caseId", caseId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private CaseAuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String fromStatus = rs.getString("from_status");
    return new CaseAuditRecord(
        rs.getObject("audit_id", UUID.class),
        rs.getString("tenant_id"),
        rs.getObject("case_id", UUID.class),
        fromStatus == null ? null : CaseStatus.valueOf(fromStatus),
        CaseStatus.valueOf(rs.getString("to_status")),
        rs.getString("actor_id"),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getString("annotation"),
        rs.getString("detail"));
  }
}
