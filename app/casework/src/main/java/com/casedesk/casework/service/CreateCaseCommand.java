package com.casedesk.casework.service;

public record CreateCaseCommand(
    String tenantId, String actorId, String title, String description) {}
