/*
 * どこで: Casework データアクセス
 * 何を: circuit_breakers の状態を条件付き単一文で遷移させる
 * なぜ: 複数インスタンスで状態を共有しつつ、HALF_OPEN のプローブを 1 件に限定するため
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.getInstantOrNull;
import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import com.casedesk.casework.model.CircuitBreakerRecord;
import com.casedesk.casework.model.CircuitState;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 業務トランザクションのロールバックに巻き込まれないよう、書き込みはすべて REQUIRES_NEW で確定する。
 */
@Repository
@RequiredArgsConstructor
public class CircuitBreakerRepository {

  private static final String SELECT_COLUMNS =
      "name, state, failure_count, opened_at, probe_started_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<CircuitBreakerRecord> find(String name) {
    final String sql =
        "SELECT " + SELECT_COLUMNS + " FROM circuit_breakers WHERE name = :name";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<CircuitBreakerRecord> findAll() {
    final String sql = "SELECT " + SELECT_COLUMNS + " FROM circuit_breakers ORDER BY name";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /**
   * cooldown を過ぎた OPEN、またはプローブが cooldown 以上戻らない HALF_OPEN を HALF_OPEN に進める。
   *
   * @return この呼び出しがプローブ権を得た場合 true
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public boolean tryStartProbe(String name, Instant now, Instant cooledDownBefore) {
    final String sql =
        """
        UPDATE circuit_breakers
        SET state = 'HALF_OPEN',
            probe_started_at = :now,
            updated_at = :now
        WHERE name = :name
          AND (
            (state = 'OPEN' AND opened_at <= :cooledDownBefore)
            OR (state = 'HALF_OPEN' AND probe_started_at <= :cooledDownBefore)
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("now", toTimestamp(now))
            .addValue("cooledDownBefore", toTimestamp(cooledDownBefore));
    return jdbcTemplate.update(sql, params) == 1;
  }

  /**
   * CLOSED に戻して失敗数を 0 にする。
   *
   * @return 更新前の状態。行が無ければ空
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<CircuitState> close(String name, Instant now) {
    final String sql =
        """
        UPDATE circuit_breakers AS cb
        SET state = 'CLOSED',
            failure_count = 0,
            opened_at = NULL,
            probe_started_at = NULL,
            updated_at = :now
        FROM (
          SELECT name, state
          FROM circuit_breakers
          WHERE name = :name
          FOR UPDATE
        ) AS previous
        WHERE cb.name = previous.name
        RETURNING previous.state AS previous_state
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("name", name).addValue("now", toTimestamp(now));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> CircuitState.valueOf(rs.getString("previous_state")))
        .stream()
        .findFirst();
  }

  /**
   * 失敗を 1 件数え、閾値到達または HALF_OPEN 中の失敗で OPEN にする。
   *
   * @return 更新後の状態
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public CircuitBreakerRecord recordFailure(String name, int failureThreshold, Instant now) {
    // DO UPDATE 内の circuit_breakers.* は更新前の値を指す
    final String sql =
        """
        INSERT INTO circuit_breakers (
          name,
          state,
          failure_count,
          opened_at,
          probe_started_at,
          updated_at
        ) VALUES (
          :name,
          CASE WHEN 1 >= :threshold THEN 'OPEN' ELSE 'CLOSED' END,
          1,
          CASE WHEN 1 >= :threshold THEN CAST(:now AS timestamptz) ELSE NULL END,
          NULL,
          :now
        )
        ON CONFLICT (name) DO UPDATE
          SET failure_count = circuit_breakers.failure_count + 1,
              state = CASE
                WHEN circuit_breakers.state = 'HALF_OPEN' THEN 'OPEN'
                WHEN circuit_breakers.failure_count + 1 >= :threshold THEN 'OPEN'
                ELSE circuit_breakers.state
              END,
              opened_at = CASE
                WHEN circuit_breakers.state = 'HALF_OPEN' THEN EXCLUDED.updated_at
                WHEN circuit_breakers.state = 'CLOSED'
                  AND circuit_breakers.failure_count + 1 >= :threshold THEN EXCLUDED.updated_at
                ELSE circuit_breakers.opened_at
              END,
              probe_started_at = NULL,
              updated_at = EXCLUDED.updated_at
        RETURNING
        """
            + SELECT_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("threshold", failureThreshold)
            .addValue("now", toTimestamp(now));
    final CircuitBreakerRecord record = jdbcTemplate.queryForObject(sql, params, this::mapRow);
    if (record == null) {
      throw new IllegalStateException("circuit breaker upsert returned no row for " + name);
    }
    return record;
  }

  private CircuitBreakerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CircuitBreakerRecord(
        rs.getString("name"),
        CircuitState.valueOf(rs.getString("state")),
        rs.getInt("failure_count"),
        getInstantOrNull(rs, "opened_at"),
        getInstantOrNull(rs, "probe_started_at"),
        rs.getTimestamp("updated_at").toInstant());
  }
}
