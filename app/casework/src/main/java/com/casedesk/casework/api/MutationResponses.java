package com.casedesk.casework.api;

import com.casedesk.casework.service.MutationResult;
import org.springframework.http.ResponseEntity;

final class MutationResponses {

  static final String HEADER_IDEMPOTENT_REPLAY = "Idempotent-Replay";

  private MutationResponses() {}

  static <T> ResponseEntity<T> toResponseEntity(MutationResult<T> result) {
    final ResponseEntity.BodyBuilder builder = ResponseEntity.status(result.statusCode());
    if (result.replayed()) {
      builder.header(HEADER_IDEMPOTENT_REPLAY, "true");
    }
    return builder.body(result.body());
  }
}
