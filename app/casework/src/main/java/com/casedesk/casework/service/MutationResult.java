package com.casedesk.casework.service;

public record MutationResult<T>(T body, int statusCode, boolean replayed) {}
