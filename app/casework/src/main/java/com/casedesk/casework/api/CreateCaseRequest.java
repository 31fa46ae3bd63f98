/*
 * どこで: Casework API
 * 何を: ケース作成リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.casedesk.casework.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateCaseRequest(
    @NotBlank(message = "title is required")
        @Size(max = 200, message = "title must be at most 200 characters")
        String title,
    String description) {}
