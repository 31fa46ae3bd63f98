/*
 * どこで: SequenceCounterService の統合テスト
 * 何を: 同時採番の一意性、スコープ分離、トランザクション必須を検証する
 * なぜ: 業務番号の重複を防ぐため
 */
package com.casedesk.casework.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.casedesk.casework.AbstractPostgresContainerTest;
import com.casedesk.casework.api.NoActiveTransactionException;
import com.casedesk.casework.model.SequenceScope;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SequenceCounterServiceTest extends AbstractPostgresContainerTest {

  private static final SequenceScope SCOPE =
      new SequenceScope("tenant-1", "case", LocalDate.of(2026, 10, 19));
  private static final int CONCURRENT_THREADS = 8;
  private static final int PER_THREAD = 10;
  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  @Autowired private SequenceCounterService service;

  @Autowired private TransactionGuard transactionGuard;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
  }

  @Test
  void concurrentNextReturnsDistinctContiguousValues() throws Exception {
    final ExecutorService pool = Executors.newFixedThreadPool(CONCURRENT_THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    final Set<Long> values = ConcurrentHashMap.newKeySet();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    try {
      for (int i = 0; i < CONCURRENT_THREADS; i++) {
        pool.submit(
            () -> {
              try {
                start.await();
                for (int n = 0; n < PER_THREAD; n++) {
                  values.add(
                      transactionGuard.execute(
                          TransactionContext.create(), context -> service.next(context, SCOPE)));
                }
              } catch (Exception ex) {
                errors.add(ex);
              }
            });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
    }

    final int total = CONCURRENT_THREADS * PER_THREAD;
    assertThat(errors).isEmpty();
    assertThat(values).hasSize(total);
    assertThat(values)
        .containsExactlyInAnyOrderElementsOf(LongStream.rangeClosed(1, total).boxed().toList());
    assertThat(service.current(SCOPE)).hasValue(total);
  }

  @Test
  void scopesAreIndependentPerTenantAndDay() {
    final SequenceScope otherTenant = new SequenceScope("tenant-2", "case", SCOPE.date());
    final SequenceScope nextDay = new SequenceScope("tenant-1", "case", SCOPE.date().plusDays(1));

    assertThat(next(SCOPE)).isEqualTo(1L);
    assertThat(next(SCOPE)).isEqualTo(2L);
    assertThat(next(otherTenant)).isEqualTo(1L);
    assertThat(next(nextDay)).isEqualTo(1L);
  }

  @Test
  void rollbackAlsoRollsBackIncrement() {
    next(SCOPE);

    assertThatThrownBy(
            () ->
                transactionGuard.execute(
                    TransactionContext.create(),
                    context -> {
                      service.next(context, SCOPE);
                      throw new IllegalStateException("abort");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(service.current(SCOPE)).hasValue(1L);
    assertThat(next(SCOPE)).isEqualTo(2L);
  }

  @Test
  void nextRequiresActiveUnitOfWork() {
    assertThatThrownBy(() -> service.next(TransactionContext.create(), SCOPE))
        .isInstanceOf(NoActiveTransactionException.class);
    assertThat(service.current(SCOPE)).isEmpty();
  }

  private long next(SequenceScope scope) {
    return transactionGuard.execute(
        TransactionContext.create(), context -> service.next(context, scope));
  }
}
