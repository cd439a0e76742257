package com.mixtape.playlist.infrastructure.api.dto;

/**
 * One failed validation rule, reported in the details of a VALIDATION_ERROR.
 */
public record FieldIssue(
        String field,
        String message
) {}
