/*
 * どこで: Casework API
 * 何を: ケースの作成/参照/状態遷移/履歴のエンドポイントを提供する
 * なぜ: アプリの公開インターフェースを明確にするため
 */
package com.casedesk.casework.api;

import com.casedesk.casework.service.CaseLifecycleService;
import com.casedesk.casework.service.CaseService;
import com.casedesk.casework.service.CaseTransitionCommand;
import com.casedesk.casework.service.CreateCaseCommand;
import com.casedesk.casework.service.MutationExecutor;
import com.casedesk.casework.service.MutationRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/cases")
@RequiredArgsConstructor
@Validated
public class CaseController {

  private static final String HEADER_TENANT_ID = "X-Tenant-Id";
  private static final String HEADER_USER_ID = "X-User-Id";
  private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  private static final String OPERATION_CREATE = "CREATE_CASE";
  private static final String OPERATION_TRANSITION = "TRANSITION_CASE";

  private final MutationExecutor mutationExecutor;
  private final CaseService caseService;
  private final CaseLifecycleService lifecycleService;

  @PostMapping
  public ResponseEntity<CaseResponse> create(
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
      @Valid @RequestBody CreateCaseRequest request) {
    final MutationRequest mutation =
        MutationRequest.transactional(
            tenantId,
            actorId,
            idempotencyKey,
            OPERATION_CREATE,
            "/v1/cases",
            request,
            HttpStatus.CREATED.value());
    return MutationResponses.toResponseEntity(
        mutationExecutor.execute(
            mutation,
            CaseResponse.class,
            context ->
                CaseResponse.from(
                    caseService.create(
                        context,
                        new CreateCaseCommand(
                            tenantId, actorId, request.title(), request.description())))));
  }

  @GetMapping("/{case_id}")
  public CaseResponse get(
      @RequestHeader(HEADER_TENANT_ID)
          @NotBlank(message = "X-Tenant-Id is required")
          @Size(max = 64, message = "X-Tenant-Id must be at most 64 characters")
          String tenantId,
      @PathVariable("case_id") UUID caseId) {
    return CaseResponse.from(caseService.get(tenantId, caseId));
  }

  @PostMapping("/{case_id}/transitions")
  public ResponseEntity<CaseResponse> transition(
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
      @PathVariable("case_id") UUID caseId,
      @Valid @RequestBody CaseTransitionRequest request) {
    final MutationRequest mutation =
        MutationRequest.transactional(
            tenantId,
            actorId,
            idempotencyKey,
            OPERATION_TRANSITION,
            "/v1/cases/" + caseId + "/transitions",
            request,
            HttpStatus.OK.value());
    final CaseTransitionCommand command =
        new CaseTransitionCommand(
            tenantId,
            caseId,
            request.targetStatus(),
            request.comment(),
            request.resumeAt(),
            actorId,
            request.expectedVersion());
    return MutationResponses.toResponseEntity(
        mutationExecutor.execute(
            mutation,
            CaseResponse.class,
            context -> CaseResponse.from(lifecycleService.applyTransition(context, command))));
  }

  @GetMapping("/{case_id}/audit")
  public CaseAuditResponse audit(
      @RequestHeader(HEADER_TENANT_ID)
          @NotBlank(message = "X-Tenant-Id is required")
          @Size(max = 64, message = "X-Tenant-Id must be at most 64 characters")
          String tenantId,
      @PathVariable("case_id") UUID caseId) {
    return new CaseAuditResponse(
        caseId,
        caseService.history(tenantId, caseId).stream().map(CaseAuditEntry::from).toList());
  }
}
