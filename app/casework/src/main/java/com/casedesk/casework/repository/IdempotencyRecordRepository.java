/*
 * どこで: Casework データアクセス
 * 何を: idempotency_records の予約/確定/失敗/参照を担う
 * なぜ: API 再送時に同一レスポンスを返し、同一キーの並行実行を 1 件に絞るため
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import com.casedesk.casework.model.IdempotencyRecord;
import com.casedesk.casework.model.IdempotencyStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
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
public class IdempotencyRecordRepository {

  private static final String SELECT_COLUMNS =
      """
      tenant_id, actor_id, idem_key, fingerprint, status, token, response_code,
      response_body, created_at, lease_until, expires_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * PENDING 予約を 1 文で行う。未登録・期限切れ・同一 fingerprint の FAILED/リース切れ PENDING
   * のときだけ書き込み、候補の token が返れば予約成功。
   *
   * <p>呼び出し元の業務トランザクションとは独立にコミットし、並行リクエストから PENDING が見えるようにする。
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public boolean reserve(IdempotencyRecord candidate, Instant now) {
    final String sql =
        """
        INSERT INTO idempotency_records (
          tenant_id,
          actor_id,
          idem_key,
          fingerprint,
          status,
          token,
          response_code,
          response_body,
          created_at,
          lease_until,
          expires_at
        ) VALUES (
          :tenantId,
          :actorId,
          :idempotencyKey,
          :fingerprint,
          'PENDING',
          :token,
          NULL,
          NULL,
          :createdAt,
          :leaseUntil,
          :expiresAt
        )
        ON CONFLICT (tenant_id, actor_id, idem_key) DO UPDATE
          SET
            fingerprint   = EXCLUDED.fingerprint,
            status        = 'PENDING',
            token         = EXCLUDED.token,
            response_code = NULL,
            response_body = NULL,
            created_at    = EXCLUDED.created_at,
            lease_until   = EXCLUDED.lease_until,
            expires_at    = EXCLUDED.expires_at
        WHERE idempotency_records.expires_at <= :now
           OR (
             idempotency_records.fingerprint = EXCLUDED.fingerprint
             AND (
               idempotency_records.status = 'FAILED'
               OR (idempotency_records.status = 'PENDING' AND idempotency_records.lease_until <= :now)
             )
           )
        RETURNING token
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", candidate.tenantId())
            .addValue("actorId", candidate.actorId())
            .addValue("idempotencyKey", candidate.idempotencyKey())
            .addValue("fingerprint", candidate.fingerprint())
            .addValue("token", candidate.token())
            .addValue("createdAt", toTimestamp(candidate.createdAt()))
            .addValue("leaseUntil", toTimestamp(candidate.leaseUntil()))
            .addValue("expiresAt", toTimestamp(candidate.expiresAt()))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getObject("token", UUID.class))
        .stream()
        .anyMatch(candidate.token()::equals);
  }

  public Optional<IdempotencyRecord> findByKey(
      String tenantId, String actorId, String idempotencyKey) {
    // 期限判定は呼び出し側の Clock で行うため、ここでは絞り込まない
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + """
            FROM idempotency_records
            WHERE tenant_id = :tenantId
              AND actor_id = :actorId
              AND idem_key = :idempotencyKey
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("actorId", actorId)
            .addValue("idempotencyKey", idempotencyKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  // 業務の書き込みと同じトランザクションで COMMITTED にし、両者をまとめて確定/ロールバックさせる
  @Transactional(propagation = Propagation.MANDATORY)
  public int markCommitted(UUID token, int responseCode, String responseBodyJson) {
    // token と PENDING の両方を条件にし、奪われた予約を上書きしない
    final String sql =
        """
        UPDATE idempotency_records
        SET status = 'COMMITTED',
            response_code = :responseCode,
            response_body = :responseBody
        WHERE token = :token
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("token", token)
            .addValue("responseCode", responseCode)
            .addValue("responseBody", responseBodyJson);
    return jdbcTemplate.update(sql, params);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public int markFailed(UUID token) {
    final String sql =
        """
        UPDATE idempotency_records
        SET status = 'FAILED',
            response_code = NULL,
            response_body = NULL
        WHERE token = :token
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("token", token);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    // 保持期間は expires_at に反映済みのため、期限切れのみ削除する。
    final String sql =
        """
        DELETE FROM idempotency_records
        WHERE expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    // wasNull は直前に読んだ列にしか効かないため先に確定させる
    final int rawResponseCode = rs.getInt("response_code");
    final Integer responseCode = rs.wasNull() ? null : rawResponseCode;
    return new IdempotencyRecord(
        rs.getString("tenant_id"),
        rs.getString("actor_id"),
        rs.getString("idem_key"),
        rs.getString("fingerprint"),
        IdempotencyStatus.valueOf(rs.getString("status")),
        rs.getObject("token", UUID.class),
        responseCode,
        rs.getString("response_body"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("lease_until").toInstant(),
        rs.getTimestamp("expires_at").toInstant());
  }
}
