package com.mixtape.playlist.infrastructure.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response DTO for error responses: {@code { "error": { "code", "message", "details"? } }}.
 */
public record ErrorResponse(
        ErrorBody error
) {

    public ErrorResponse(String code, String message) {
        this(new ErrorBody(code, message, null));
    }

    public ErrorResponse(String code, String message, Object details) {
        this(new ErrorBody(code, message, details));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(
            String code,
            String message,
            Object details
    ) {}
}
