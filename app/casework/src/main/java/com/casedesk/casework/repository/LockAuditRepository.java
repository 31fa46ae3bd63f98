/*
 * どこで: Casework データアクセス
 * 何を: lock_audit への追記と参照
 * なぜ: ロックの取得・解放・自動解放を後から追跡できるようにするため
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import com.casedesk.casework.model.EntityRef;
import com.casedesk.casework.model.LockAction;
import com.casedesk.casework.model.LockAuditRecord;
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
public class LockAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void insert(LockAuditRecord record) {
    final String sql =
        """
        INSERT INTO lock_audit (
          audit_id,
          tenant_id,
          entity_type,
          entity_id,
          action,
          actor_id,
          previous_holder_id,
          occurred_at,
          detail
        ) VALUES (
          :auditId,
          :tenantId,
          :entityType,
          :entityId,
          :action,
          :actorId,
          :previousHolderId,
          :occurredAt,
          :detail
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("tenantId", record.entity().tenantId())
            .addValue("entityType", record.entity().entityType())
            .addValue("entityId", record.entity().entityId())
            .addValue("action", record.action().name())
            .addValue("actorId", record.actorId())
            .addValue("previousHolderId", record.previousHolderId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("detail", record.detail());
    jdbcTemplate.update(sql, params);
  }

  public List<LockAuditRecord> findByEntity(EntityRef entity) {
    final String sql =
        """
        SELECT audit_id, action, actor_id, previous_holder_id, occurred_at, detail
        FROM lock_audit
        WHERE tenant_id = :tenantId
          AND entity_type = :entityType
          AND entity_id = :entityId
        ORDER BY occurred_at, audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", entity.tenantId())
            .addValue("entityType", entity.entityType())
            .addValue("entityId", entity.entityId());
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new LockAuditRecord(
                rs.getObject("audit_id", UUID.class),
                entity,
                LockAction.valueOf(rs.getString("action")),
                rs.getString("actor_id"),
                rs.getString("previous_holder_id"),
                rs.getTimestamp("occurred_at").toInstant(),
                rs.getString("detail")));
  }
}
