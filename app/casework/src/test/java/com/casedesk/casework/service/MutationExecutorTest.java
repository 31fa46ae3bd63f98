/*
 * どこで: MutationExecutor の統合テスト
 * 何を: ケース作成を題材に、再送・競合・失敗後の再実行・同時送信を検証する
 * なぜ: 同じ Idempotency-Key の送信が何回来てもケースが 1 件だけ作られることを保証するため
 */
package com.casedesk.casework.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;

import com.casedesk.casework.AbstractPostgresContainerTest;
import com.casedesk.casework.api.CaseResponse;
import com.casedesk.casework.api.CreateCaseRequest;
import com.casedesk.casework.api.IdempotencyConflictException;
import com.casedesk.casework.api.IdempotencyInProgressException;
import com.casedesk.casework.model.IdempotencyRecord;
import com.casedesk.casework.model.IdempotencyStatus;
import com.casedesk.casework.repository.IdempotencyRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

@SpringBootTest
@ActiveProfiles("test")
class MutationExecutorTest extends AbstractPostgresContainerTest {

  private static final String TENANT = "tenant-1";
  private static final String ACTOR = "user-1";
  private static final int CONCURRENT_THREADS = 4;
  // 同時実行テストがハングしないよう、待機時間を短めに固定する。
  private static final Duration LATCH_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(15);

  @Autowired private MutationExecutor executor;

  @Autowired private CaseService caseService;

  @MockitoSpyBean private IdempotencyRecordRepository idempotencyRecordRepository;

  @Autowired private ObjectMapper objectMapper;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
  }

  @Test
  void sameKeyTwiceCreatesSingleCaseAndReplaysIdenticalBody() throws Exception {
    final CreateCaseRequest request = new CreateCaseRequest("Printer on fire", "3rd floor");

    final MutationResult<CaseResponse> first = create("idem-create", request);
    final MutationResult<CaseResponse> second = create("idem-create", request);

    assertThat(first.replayed()).isFalse();
    assertThat(first.statusCode()).isEqualTo(HttpStatus.CREATED.value());
    assertThat(second.replayed()).isTrue();
    assertThat(second.statusCode()).isEqualTo(HttpStatus.CREATED.value());
    assertThat(second.body()).isEqualTo(first.body());
    assertThat(objectMapper.writeValueAsString(second.body()))
        .isEqualTo(
            idempotencyRecordRepository
                .findByKey(TENANT, ACTOR, "idem-create")
                .orElseThrow()
                .responseBodyJson());
    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(1);
    assertThat(countRows(jdbcTemplate, "sequence_counters")).isEqualTo(1);
  }

  @Test
  void sameKeyWithDifferentBodyConflicts() {
    create("idem-create", new CreateCaseRequest("first", null));

    assertThatThrownBy(() -> create("idem-create", new CreateCaseRequest("second", null)))
        .isInstanceOf(IdempotencyConflictException.class);
    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(1);
  }

  @Test
  void requestsWithoutKeyAreExecutedEachTime() {
    final CreateCaseRequest request = new CreateCaseRequest("no key", null);

    final MutationResult<CaseResponse> first = create(null, request);
    final MutationResult<CaseResponse> second = create(null, request);

    assertThat(first.body().caseNumber()).isNotEqualTo(second.body().caseNumber());
    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(2);
    assertThat(countRows(jdbcTemplate, "idempotency_records")).isZero();
  }

  @Test
  void failedExecutionIsNotCachedAndRetryRunsHandlerAgain() {
    final CreateCaseRequest request = new CreateCaseRequest("flaky", null);
    final AtomicInteger attempts = new AtomicInteger();
    final MutationRequest mutation = mutation("idem-flaky", request);

    assertThatThrownBy(
            () ->
                executor.execute(
                    mutation,
                    CaseResponse.class,
                    context -> {
                      attempts.incrementAndGet();
                      caseService.create(
                          context, new CreateCaseCommand(TENANT, ACTOR, request.title(), null));
                      throw new IllegalStateException("downstream failed after insert");
                    }))
        .isInstanceOf(IllegalStateException.class);

    // 挿入もろともロールバックされ、予約は FAILED になる
    assertThat(countRows(jdbcTemplate, "cases")).isZero();
    assertThat(
            idempotencyRecordRepository.findByKey(TENANT, ACTOR, "idem-flaky").orElseThrow().status())
        .isEqualTo(IdempotencyStatus.FAILED);

    final MutationResult<CaseResponse> retry =
        executor.execute(
            mutation,
            CaseResponse.class,
            context -> {
              attempts.incrementAndGet();
              return CaseResponse.from(
                  caseService.create(
                      context, new CreateCaseCommand(TENANT, ACTOR, request.title(), null)));
            });

    assertThat(retry.replayed()).isFalse();
    assertThat(attempts.get()).isEqualTo(2);
    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(1);
    // ロールバックで採番も戻るため 1 番から振られる
    assertThat(retry.body().caseNumber()).endsWith("-00001");
  }

  @Test
  void failedResponseStorageRollsBackSideEffectsSoRetryRunsOnce() {
    final CreateCaseRequest request = new CreateCaseRequest("store fails", null);
    final AtomicInteger attempts = new AtomicInteger();
    doThrow(new DataAccessResourceFailureException("connection lost"))
        .doCallRealMethod()
        .when(idempotencyRecordRepository)
        .markCommitted(any(), anyInt(), any());

    assertThatThrownBy(() -> countedCreate("idem-store", request, attempts))
        .isInstanceOf(DataAccessResourceFailureException.class);

    // 応答の保存に失敗したら作成もロールバックされ、予約は再実行可能な FAILED になる
    assertThat(countRows(jdbcTemplate, "cases")).isZero();
    assertThat(
            idempotencyRecordRepository.findByKey(TENANT, ACTOR, "idem-store").orElseThrow().status())
        .isEqualTo(IdempotencyStatus.FAILED);

    final MutationResult<CaseResponse> retry = countedCreate("idem-store", request, attempts);
    final MutationResult<CaseResponse> replay = countedCreate("idem-store", request, attempts);

    assertThat(retry.replayed()).isFalse();
    assertThat(replay.replayed()).isTrue();
    assertThat(replay.body()).isEqualTo(retry.body());
    assertThat(attempts.get()).isEqualTo(2);
    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(1);
  }

  @Test
  void committedCaseAndStoredResponseBecomeVisibleTogether() {
    final MutationResult<CaseResponse> created =
        create("idem-atomic", new CreateCaseRequest("atomic", null));

    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(1);
    final IdempotencyRecord record =
        idempotencyRecordRepository.findByKey(TENANT, ACTOR, "idem-atomic").orElseThrow();
    assertThat(record.status()).isEqualTo(IdempotencyStatus.COMMITTED);
    assertThat(record.responseBodyJson()).contains(created.body().caseNumber());
  }

  @Test
  void handlerFailureSurvivesFailureToMarkReservation() {
    final CreateCaseRequest request = new CreateCaseRequest("double fault", null);
    final DataAccessResourceFailureException markFailure =
        new DataAccessResourceFailureException("connection lost while marking");
    doThrow(markFailure).when(idempotencyRecordRepository).markFailed(any());

    final Throwable thrown =
        catchThrowable(
            () ->
                executor.execute(
                    mutation("idem-double-fault", request),
                    CaseResponse.class,
                    context -> {
                      throw new IllegalStateException("handler failed");
                    }));

    assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessage("handler failed");
    assertThat(thrown.getSuppressed()).containsExactly(markFailure);

    // FAILED にできなかった予約はリース切れまで PENDING のまま残る
    assertThat(
            idempotencyRecordRepository
                .findByKey(TENANT, ACTOR, "idem-double-fault")
                .orElseThrow()
                .status())
        .isEqualTo(IdempotencyStatus.PENDING);
  }

  @Test
  void concurrentSameKeyCreatesSingleCase() throws Exception {
    final CreateCaseRequest request = new CreateCaseRequest("double click", null);
    final ExecutorService pool = Executors.newFixedThreadPool(CONCURRENT_THREADS);
    final CountDownLatch ready = new CountDownLatch(CONCURRENT_THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    final List<MutationResult<CaseResponse>> results = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    try {
      for (int i = 0; i < CONCURRENT_THREADS; i++) {
        pool.submit(
            () -> {
              ready.countDown();
              try {
                start.await(LATCH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                results.add(create("idem-concurrent", request));
              } catch (IdempotencyInProgressException ex) {
                errors.add(ex);
              } catch (Exception ex) {
                errors.add(ex);
              }
            });
      }
      assertThat(ready.await(LATCH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
      start.countDown();
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(COMPLETION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
          .isTrue();
    }

    // 待機上限内に先行リクエストが確定するため、全員が同じケースを受け取る
    assertThat(errors).isEmpty();
    assertThat(results).hasSize(CONCURRENT_THREADS);
    assertThat(results).filteredOn(result -> !result.replayed()).hasSize(1);
    assertThat(results.stream().map(result -> result.body().caseId()).distinct()).hasSize(1);
    assertThat(countRows(jdbcTemplate, "cases")).isEqualTo(1);
  }

  private MutationResult<CaseResponse> countedCreate(
      String idempotencyKey, CreateCaseRequest request, AtomicInteger attempts) {
    return executor.execute(
        mutation(idempotencyKey, request),
        CaseResponse.class,
        context -> {
          attempts.incrementAndGet();
          return CaseResponse.from(
              caseService.create(
                  context, new CreateCaseCommand(TENANT, ACTOR, request.title(), null)));
        });
  }

  private MutationResult<CaseResponse> create(String idempotencyKey, CreateCaseRequest request) {
    return executor.execute(
        mutation(idempotencyKey, request),
        CaseResponse.class,
        context ->
            CaseResponse.from(
                caseService.create(
                    context,
                    new CreateCaseCommand(TENANT, ACTOR, request.title(), request.description()))));
  }

  private MutationRequest mutation(String idempotencyKey, CreateCaseRequest request) {
    return MutationRequest.transactional(
        TENANT,
        ACTOR,
        idempotencyKey,
        "CREATE_CASE",
        "/v1/cases",
        request,
        HttpStatus.CREATED.value());
  }
}
