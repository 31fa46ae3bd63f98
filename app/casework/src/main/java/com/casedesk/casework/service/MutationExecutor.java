/*
 * どこで: Casework サービス層
 * 何を: 変更系操作を Idempotency 予約 → トランザクション実行 → 結果確定の順で実行する
 * なぜ: 再送安全性とトランザクション境界をすべての変更系で同じ手順に揃えるため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.model.CachedResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MutationExecutor {

  private static final Logger logger = LoggerFactory.getLogger(MutationExecutor.class);

  private final IdempotencyCoordinator idempotencyCoordinator;
  private final RequestFingerprinter requestFingerprinter;
  private final TransactionGuard transactionGuard;
  private final ObjectMapper objectMapper;
  private final CaseworkMetrics metrics;

  public <T> MutationResult<T> execute(
      MutationRequest request, Class<T> responseType, Function<TransactionContext, T> handler) {
    final String fingerprint =
        requestFingerprinter.fingerprint(
            request.operation(), request.resourcePath(), request.body());
    final IdempotencyReservation reservation =
        idempotencyCoordinator.reserve(
            request.tenantId(), request.actorId(), request.idempotencyKey(), fingerprint);
    if (reservation.isReplay()) {
      metrics.recordCommand(request.operation(), "replayed");
      final CachedResponse cached = reservation.cachedResponse();
      return new MutationResult<>(
          readCached(cached, responseType), cached.statusCode(), true);
    }

    final TransactionContext context =
        request.skipTransaction() ? TransactionContext.skipped() : TransactionContext.create();
    final T response;
    try {
      response =
          transactionGuard.execute(
              context,
              ctx -> {
                final T result = handler.apply(ctx);
                if (!ctx.isSkipped()) {
                  // 応答の保存は業務の書き込みと同じ作業単位で確定させる
                  idempotencyCoordinator.commit(
                      ctx,
                      reservation,
                      new CachedResponse(request.successStatus(), write(result)));
                }
                return result;
              });
    } catch (RuntimeException ex) {
      markFailed(reservation, ex);
      metrics.recordCommand(request.operation(), "failed");
      logger.info(
          "mutation failed operation={} resource={} error={}",
          request.operation(),
          request.resourcePath(),
          ex.getClass().getSimpleName());
      throw ex;
    }
    if (context.isSkipped()) {
      // skip 実行はコミットされないため保存せず、再送時も再実行される
      idempotencyCoordinator.fail(reservation);
    }
    metrics.recordCommand(request.operation(), context.isCommitted() ? "committed" : "executed");
    return new MutationResult<>(response, request.successStatus(), false);
  }

  private void markFailed(IdempotencyReservation reservation, RuntimeException cause) {
    try {
      idempotencyCoordinator.fail(reservation);
    } catch (RuntimeException failure) {
      // 呼び出し元には元の例外を返す。予約はリース切れ後に取り直される
      cause.addSuppressed(failure);
      logger.warn("failed to mark idempotency reservation as failed", failure);
    }
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize response for idempotency", ex);
    }
  }

  private <T> T readCached(CachedResponse cached, Class<T> responseType) {
    try {
      return objectMapper.readValue(cached.bodyJson(), responseType);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to deserialize cached response", ex);
    }
  }
}
