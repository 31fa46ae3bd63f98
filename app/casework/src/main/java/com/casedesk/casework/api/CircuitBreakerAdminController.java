/*
 * どこで: Casework 管理 API
 * 何を: サーキットブレーカーの状態参照と強制リセットを提供する
 * なぜ: 依存先の復旧後に cooldown を待たず運用者が遮断を解除できるようにするため
 */
package com.casedesk.casework.api;

import com.casedesk.casework.service.CircuitBreakerService;
import com.casedesk.casework.service.MutationExecutor;
import com.casedesk.casework.service.MutationRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/circuit-breakers")
@RequiredArgsConstructor
@Validated
public class CircuitBreakerAdminController {

  private static final String HEADER_TENANT_ID = "X-Tenant-Id";
  private static final String HEADER_USER_ID = "X-User-Id";
  private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  private final CircuitBreakerService circuitBreakerService;
  private final MutationExecutor mutationExecutor;

  @GetMapping
  public CircuitBreakersResponse list() {
    return new CircuitBreakersResponse(
        circuitBreakerService.snapshot().stream().map(CircuitBreakerView::from).toList());
  }

  @PostMapping("/{name}/reset")
  public ResponseEntity<CircuitBreakerResetResponse> reset(
      @RequestHeader(HEADER_TENANT_ID)
          @NotBlank(message = "X-Tenant-Id is required")
          @Size(max = 64, message = "X-Tenant-Id must be at most 64 characters")
          String tenantId,
      @RequestHeader(HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          @Size(max = 128, message = "X-User-Id must be at most 128 characters")
          String actorId,
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false)
          @Size(max = 255, message = "Idempotency-Key must be at most 255 characters")
          String idempotencyKey,
      @PathVariable("name") @NotBlank(message = "name is required") String name) {
    // ブレーカーの書き込みは独立トランザクションで確定するため、作業単位を開かない
    final MutationRequest mutation =
        new MutationRequest(
            tenantId,
            actorId,
            idempotencyKey,
            "RESET_CIRCUIT_BREAKER",
            "/v1/admin/circuit-breakers/" + name + "/reset",
            null,
            HttpStatus.OK.value(),
            true);
    return MutationResponses.toResponseEntity(
        mutationExecutor.execute(
            mutation,
            CircuitBreakerResetResponse.class,
            context -> {
              circuitBreakerService.reset(name);
              return new CircuitBreakerResetResponse(name, "CLOSED");
            }));
  }
}
