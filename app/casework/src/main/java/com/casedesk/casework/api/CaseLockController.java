/*
 * どこで: Casework API
 * 何を: ケースロックの取得/ハートビート/解放/参照のエンドポイントを提供する
 * なぜ: 編集中の担当者を他の利用者に示し、同時編集を避けるため
 */
package com.casedesk.casework.api;

import com.casedesk.casework.model.EntityRef;
import com.casedesk.casework.service.CaseService;
import com.casedesk.casework.service.EntityLockService;
import com.casedesk.casework.service.MutationExecutor;
import com.casedesk.casework.service.MutationRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/cases/{case_id}/lock")
@RequiredArgsConstructor
@Validated
public class CaseLockController {

  private static final String HEADER_TENANT_ID = "X-Tenant-Id";
  private static final String HEADER_USER_ID = "X-User-Id";
  private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  private final MutationExecutor mutationExecutor;
  private final EntityLockService lockService;
  private final CaseService caseService;

  @PostMapping
  public ResponseEntity<LockResponse> acquire(
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
      @PathVariable("case_id") UUID caseId) {
    final EntityRef entity = existingCase(tenantId, caseId);
    final MutationRequest mutation =
        MutationRequest.transactional(
            tenantId,
            actorId,
            idempotencyKey,
            "ACQUIRE_CASE_LOCK",
            "/v1/cases/" + caseId + "/lock",
            null,
            HttpStatus.OK.value());
    return MutationResponses.toResponseEntity(
        mutationExecutor.execute(
            mutation,
            LockResponse.class,
            context -> LockResponse.held(lockService.acquire(context, entity, actorId))));
  }

  @PostMapping("/heartbeat")
  public ResponseEntity<LockResponse> heartbeat(
      @RequestHeader(HEADER_TENANT_ID)
          @NotBlank(message = "X-Tenant-Id is required")
          @Size(max = 64, message = "X-Tenant-Id must be at most 64 characters")
          String tenantId,
      @RequestHeader(HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          @Size(max = 128, message = "X-User-Id must be at most 128 characters")
          String actorId,
      @PathVariable("case_id") UUID caseId) {
    final EntityRef entity = existingCase(tenantId, caseId);
    // ハートビートは再送されても結果が変わらないため Idempotency-Key を使わない
    final MutationRequest mutation =
        MutationRequest.transactional(
            tenantId,
            actorId,
            null,
            "HEARTBEAT_CASE_LOCK",
            "/v1/cases/" + caseId + "/lock/heartbeat",
            null,
            HttpStatus.OK.value());
    return MutationResponses.toResponseEntity(
        mutationExecutor.execute(
            mutation,
            LockResponse.class,
            context -> LockResponse.held(lockService.heartbeat(context, entity, actorId))));
  }

  @DeleteMapping
  public ResponseEntity<LockReleaseResponse> release(
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
      @PathVariable("case_id") UUID caseId) {
    final EntityRef entity = existingCase(tenantId, caseId);
    final MutationRequest mutation =
        MutationRequest.transactional(
            tenantId,
            actorId,
            idempotencyKey,
            "RELEASE_CASE_LOCK",
            "/v1/cases/" + caseId + "/lock",
            null,
            HttpStatus.OK.value());
    return MutationResponses.toResponseEntity(
        mutationExecutor.execute(
            mutation,
            LockReleaseResponse.class,
            context ->
                new LockReleaseResponse(
                    entity.entityType(),
                    entity.entityId(),
                    lockService.release(context, entity, actorId))));
  }

  @GetMapping
  public LockResponse current(
      @RequestHeader(HEADER_TENANT_ID)
          @NotBlank(message = "X-Tenant-Id is required")
          @Size(max = 64, message = "X-Tenant-Id must be at most 64 characters")
          String tenantId,
      @PathVariable("case_id") UUID caseId) {
    final EntityRef entity = existingCase(tenantId, caseId);
    return lockService.findLive(entity).map(LockResponse::held).orElse(LockResponse.unlocked(entity));
  }

  @GetMapping("/audit")
  public LockAuditResponse audit(
      @RequestHeader(HEADER_TENANT_ID)
          @NotBlank(message = "X-Tenant-Id is required")
          @Size(max = 64, message = "X-Tenant-Id must be at most 64 characters")
          String tenantId,
      @PathVariable("case_id") UUID caseId) {
    final EntityRef entity = existingCase(tenantId, caseId);
    return new LockAuditResponse(
        entity.entityType(),
        entity.entityId(),
        lockService.history(entity).stream().map(LockAuditEntry::from).toList());
  }

  private EntityRef existingCase(String tenantId, UUID caseId) {
    // 他テナントや存在しないケースへのロックは 404 にする
    caseService.get(tenantId, caseId);
    return EntityRef.ofCase(tenantId, caseId.toString());
  }
}
