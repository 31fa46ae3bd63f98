package com.casedesk.casework.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.casedesk.casework.model.CaseAuditRecord;
import com.casedesk.casework.model.CaseRecord;
import com.casedesk.casework.model.CaseStatus;
import com.casedesk.casework.service.CaseLifecycleService;
import com.casedesk.casework.service.CaseService;
import com.casedesk.casework.service.CaseTransitionCommand;
import com.casedesk.casework.service.CircuitBreakerService;
import com.casedesk.casework.service.MutationExecutor;
import com.casedesk.casework.service.MutationRequest;
import com.casedesk.casework.service.MutationResult;
import com.casedesk.casework.service.TransactionContext;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CaseController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class CaseControllerTest {

  private static final UUID CASE_ID = UUID.fromString("7f1c1a52-5a55-4b0c-9b57-2d5b0a4c9e11");
  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MutationExecutor mutationExecutor;

  @MockitoBean private CaseService caseService;

  @MockitoBean private CaseLifecycleService lifecycleService;

  @MockitoBean private CircuitBreakerService circuitBreakerService;

  @Test
  void createReturns201WithCaseNumber() throws Exception {
    runMutationsDirectly(false);
    when(caseService.create(any(), any())).thenReturn(caseRecord(CaseStatus.UNASSIGNED, 0L));

    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Printer jam","description":"3F printer"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().doesNotExist("Idempotent-Replay"))
        .andExpect(jsonPath("$.case_id").value(CASE_ID.toString()))
        .andExpect(jsonPath("$.case_number").value("CASE-20260301-00001"))
        .andExpect(jsonPath("$.status").value("UNASSIGNED"));

    final ArgumentCaptor<MutationRequest> captor = ArgumentCaptor.forClass(MutationRequest.class);
    verify(mutationExecutor).execute(captor.capture(), eq(CaseResponse.class), any());
    assertThat(captor.getValue().operation()).isEqualTo("CREATE_CASE");
    assertThat(captor.getValue().idempotencyKey()).isEqualTo("idem-1");
    assertThat(captor.getValue().tenantId()).isEqualTo("tenant-1");
  }

  @Test
  void replayedCreateIsMarkedWithHeader() throws Exception {
    runMutationsDirectly(true);
    when(caseService.create(any(), any())).thenReturn(caseRecord(CaseStatus.UNASSIGNED, 0L));

    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Printer jam"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Idempotent-Replay", "true"));
  }

  @Test
  void createReturns400WhenTitleIsBlank() throws Exception {
    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"  "}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verify(mutationExecutor, never()).execute(any(), any(), any());
  }

  @Test
  void createReturns400WhenTenantHeaderIsMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Printer jam"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("X-Tenant-Id is required"));
  }

  @Test
  void createReturns400WhenIdempotencyKeyIsTooLong() throws Exception {
    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .header("Idempotency-Key", "k".repeat(256))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Printer jam"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("Idempotency-Key must be at most 255 characters"));

    verify(mutationExecutor, never()).execute(any(), any(), any());
  }

  @Test
  void createAcceptsIdempotencyKeyAtMaximumLength() throws Exception {
    runMutationsDirectly(false);
    when(caseService.create(any(), any())).thenReturn(caseRecord(CaseStatus.UNASSIGNED, 0L));

    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "t".repeat(64))
                .header("X-User-Id", "u".repeat(128))
                .header("Idempotency-Key", "k".repeat(255))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Printer jam"}
                    """))
        .andExpect(status().isCreated());
  }

  @Test
  void oversizedTenantAndUserHeadersReturn400() throws Exception {
    mockMvc
        .perform(get("/v1/cases/" + CASE_ID).header("X-Tenant-Id", "t".repeat(65)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-Tenant-Id must be at most 64 characters"));
    mockMvc
        .perform(
            post("/v1/cases/" + CASE_ID + "/transitions")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "u".repeat(129))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_status":"OPEN"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-User-Id must be at most 128 characters"));

    verify(caseService, never()).get(any(), any());
    verify(mutationExecutor, never()).execute(any(), any(), any());
  }

  @Test
  void writesReturn503WhileDependencyIsUnavailableButReadsStillWork() throws Exception {
    when(circuitBreakerService.blockingDependencies()).thenReturn(List.of("document-storage"));
    when(caseService.get("tenant-1", CASE_ID)).thenReturn(caseRecord(CaseStatus.OPEN, 1L));

    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Printer jam"}
                    """))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("DEPENDENCY_UNAVAILABLE"))
        .andExpect(jsonPath("$.details.dependency").value("document-storage"));
    mockMvc
        .perform(get("/v1/cases/" + CASE_ID).header("X-Tenant-Id", "tenant-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("OPEN"));

    verify(mutationExecutor, never()).execute(any(), any(), any());
  }

  @Test
  void idempotencyKeyConflictReturns409() throws Exception {
    when(mutationExecutor.execute(any(), any(), any()))
        .thenThrow(new IdempotencyConflictException("Idempotency-Key conflict"));

    mockMvc
        .perform(
            post("/v1/cases")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"Another title"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("IDEMPOTENCY_KEY_CONFLICT"));
  }

  @Test
  void transitionPassesCommentAndExpectedVersion() throws Exception {
    runMutationsDirectly(false);
    when(lifecycleService.applyTransition(any(), any()))
        .thenReturn(caseRecord(CaseStatus.RESOLVED, 2L));

    mockMvc
        .perform(
            post("/v1/cases/" + CASE_ID + "/transitions")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_status":"RESOLVED","comment":"fixed","expected_version":1}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("RESOLVED"))
        .andExpect(jsonPath("$.version").value(2));

    final ArgumentCaptor<CaseTransitionCommand> captor =
        ArgumentCaptor.forClass(CaseTransitionCommand.class);
    verify(lifecycleService).applyTransition(any(), captor.capture());
    assertThat(captor.getValue().targetStatus()).isEqualTo(CaseStatus.RESOLVED);
    assertThat(captor.getValue().annotation()).isEqualTo("fixed");
    assertThat(captor.getValue().expectedVersion()).isEqualTo(1L);
    assertThat(captor.getValue().actorId()).isEqualTo("user-1");
  }

  @Test
  void transitionReturns409WithStatusesWhenNotAllowed() throws Exception {
    runMutationsDirectly(false);
    when(lifecycleService.applyTransition(any(), any()))
        .thenThrow(new InvalidTransitionException("RESOLVED", "RESOLVED"));

    mockMvc
        .perform(
            post("/v1/cases/" + CASE_ID + "/transitions")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_status":"RESOLVED","comment":"again"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
        .andExpect(jsonPath("$.details.current_status").value("RESOLVED"))
        .andExpect(jsonPath("$.details.target_status").value("RESOLVED"));
  }

  @Test
  void transitionReturns400WhenCommentIsMissing() throws Exception {
    runMutationsDirectly(false);
    when(lifecycleService.applyTransition(any(), any()))
        .thenThrow(new MissingAnnotationException("comment is required to move a case to FILED"));

    mockMvc
        .perform(
            post("/v1/cases/" + CASE_ID + "/transitions")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_status":"FILED"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MISSING_ANNOTATION"));
  }

  @Test
  void transitionReturns409WhenLockedByAnotherUser() throws Exception {
    runMutationsDirectly(false);
    when(lifecycleService.applyTransition(any(), any()))
        .thenThrow(new LockConflictException("user-2", NOW, NOW));

    mockMvc
        .perform(
            post("/v1/cases/" + CASE_ID + "/transitions")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_status":"OPEN"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("LOCK_CONFLICT"))
        .andExpect(jsonPath("$.details.holder").value("user-2"));
  }

  @Test
  void transitionReturns400ForUnknownTargetStatus() throws Exception {
    mockMvc
        .perform(
            post("/v1/cases/" + CASE_ID + "/transitions")
                .header("X-Tenant-Id", "tenant-1")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_status":"ARCHIVED"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }

  @Test
  void getReturns404ForUnknownCase() throws Exception {
    when(caseService.get("tenant-1", CASE_ID))
        .thenThrow(new CaseNotFoundException("case not found: " + CASE_ID));

    mockMvc
        .perform(get("/v1/cases/" + CASE_ID).header("X-Tenant-Id", "tenant-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CASE_NOT_FOUND"));
  }

  @Test
  void getReturns400ForMalformedCaseId() throws Exception {
    mockMvc
        .perform(get("/v1/cases/not-a-uuid").header("X-Tenant-Id", "tenant-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("case_id is invalid"));
  }

  @Test
  void auditListsTransitionsInOrder() throws Exception {
    when(caseService.history("tenant-1", CASE_ID))
        .thenReturn(
            List.of(
                new CaseAuditRecord(
                    UUID.randomUUID(),
                    "tenant-1",
                    CASE_ID,
                    null,
                    CaseStatus.UNASSIGNED,
                    "user-1",
                    NOW,
                    null,
                    null),
                new CaseAuditRecord(
                    UUID.randomUUID(),
                    "tenant-1",
                    CASE_ID,
                    CaseStatus.UNASSIGNED,
                    CaseStatus.RESOLVED,
                    "user-1",
                    NOW.plusSeconds(60),
                    "fixed",
                    "{}")));

    mockMvc
        .perform(get("/v1/cases/" + CASE_ID + "/audit").header("X-Tenant-Id", "tenant-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.case_id").value(CASE_ID.toString()))
        .andExpect(jsonPath("$.entries.length()").value(2))
        .andExpect(jsonPath("$.entries[1].from_status").value("UNASSIGNED"))
        .andExpect(jsonPath("$.entries[1].annotation").value("fixed"));
  }

  // 変更処理をトランザクション無しでそのまま実行し、コントローラの組み立てだけを検証する
  @SuppressWarnings("unchecked")
  private void runMutationsDirectly(boolean replayed) {
    when(mutationExecutor.execute(any(MutationRequest.class), any(), any()))
        .thenAnswer(
            invocation -> {
              final MutationRequest request = invocation.getArgument(0);
              final Function<TransactionContext, Object> work = invocation.getArgument(2);
              return new MutationResult<>(
                  work.apply(TransactionContext.skipped()), request.successStatus(), replayed);
            });
  }

  private CaseRecord caseRecord(CaseStatus status, long version) {
    return new CaseRecord(
        CASE_ID,
        "tenant-1",
        "CASE-20260301-00001",
        "Printer jam",
        "3F printer",
        status,
        null,
        "user-1",
        NOW,
        "user-1",
        NOW,
        version);
  }
}
