/*
 * どこで: Casework データアクセス
 * 何を: sequence_counters のスコープ別カウンタを原子的に進める
 * なぜ: 読んでから書く方式だと並行採番で重複するため、単一 upsert で加算と取得を行う
 */
package com.casedesk.casework.repository;

import static com.casedesk.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class SequenceCounterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public long incrementAndGet(String scopeKey, Instant now) {
    final String sql =
        """
        INSERT INTO sequence_counters (scope_key, value, updated_at)
        VALUES (:scopeKey, 1, :now)
        ON CONFLICT (scope_key) DO UPDATE
          SET value = sequence_counters.value + 1,
              updated_at = EXCLUDED.updated_at
        RETURNING value
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scopeKey", scopeKey).addValue("now", toTimestamp(now));
    final Long value = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (value == null) {
      throw new IllegalStateException("sequence upsert returned no value for " + scopeKey);
    }
    return value;
  }

  public OptionalLong findValue(String scopeKey) {
    final String sql =
        """
        SELECT value
        FROM sequence_counters
        WHERE scope_key = :scopeKey
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("scopeKey", scopeKey);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getLong("value")).stream()
        .mapToLong(Long::longValue)
        .findFirst();
  }
}
