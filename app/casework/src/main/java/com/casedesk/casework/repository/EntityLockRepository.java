/*
 * どこで: Casework データアクセス
 * 何を: entity_locks の参照/付与/活動更新/削除と、対象単位の advisory lock 取得
 * なぜ: ロック判定と書き込みを同一エンティティについて直列化するため
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import com.casedesk.casework.model.EntityLock;
import com.casedesk.casework.model.EntityRef;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class EntityLockRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** トランザクション終了まで保持される advisory lock を取る。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public void lockEntity(long lockKey) {
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<EntityLock> find(EntityRef entity) {
    final String sql =
        """
        SELECT holder_id, acquired_at, last_activity_at
        FROM entity_locks
        WHERE tenant_id = :tenantId
          AND entity_type = :entityType
          AND entity_id = :entityId
        """;
    return jdbcTemplate
        .query(
            sql,
            entityParams(entity),
            (rs, rowNum) ->
                new EntityLock(
                    entity,
                    rs.getString("holder_id"),
                    rs.getTimestamp("acquired_at").toInstant(),
                    rs.getTimestamp("last_activity_at").toInstant()))
        .stream()
        .findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void upsert(EntityLock lock) {
    final String sql =
        """
        INSERT INTO entity_locks (
          tenant_id,
          entity_type,
          entity_id,
          holder_id,
          acquired_at,
          last_activity_at
        ) VALUES (
          :tenantId,
          :entityType,
          :entityId,
          :holderId,
          :acquiredAt,
          :lastActivityAt
        )
        ON CONFLICT (tenant_id, entity_type, entity_id) DO UPDATE
          SET holder_id = EXCLUDED.holder_id,
              acquired_at = EXCLUDED.acquired_at,
              last_activity_at = EXCLUDED.last_activity_at
        """;
    final MapSqlParameterSource params =
        entityParams(lock.entity())
            .addValue("holderId", lock.holderId())
            .addValue("acquiredAt", toTimestamp(lock.acquiredAt()))
            .addValue("lastActivityAt", toTimestamp(lock.lastActivityAt()));
    jdbcTemplate.update(sql, params);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int touch(EntityRef entity, String holderId, Instant now) {
    final String sql =
        """
        UPDATE entity_locks
        SET last_activity_at = :now
        WHERE tenant_id = :tenantId
          AND entity_type = :entityType
          AND entity_id = :entityId
          AND holder_id = :holderId
        """;
    final MapSqlParameterSource params =
        entityParams(entity).addValue("holderId", holderId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int delete(EntityRef entity) {
    final String sql =
        """
        DELETE FROM entity_locks
        WHERE tenant_id = :tenantId
          AND entity_type = :entityType
          AND entity_id = :entityId
        """;
    return jdbcTemplate.update(sql, entityParams(entity));
  }

  private MapSqlParameterSource entityParams(EntityRef entity) {
    return new MapSqlParameterSource()
        .addValue("tenantId", entity.tenantId())
        .addValue("entityType", entity.entityType())
        .addValue("entityId", entity.entityId());
  }
}
