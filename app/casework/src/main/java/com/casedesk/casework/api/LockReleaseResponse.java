package com.casedesk.casework.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// released=false はロックが存在しなかったことを表す
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LockReleaseResponse(String entityType, String entityId, boolean released) {}
