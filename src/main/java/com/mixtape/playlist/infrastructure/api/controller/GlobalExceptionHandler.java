package com.mixtape.playlist.infrastructure.api.controller;

import com.mixtape.playlist.core.exception.DuplicateTrackException;
import com.mixtape.playlist.core.exception.InvalidCallerIdentityException;
import com.mixtape.playlist.core.exception.InvalidPaginationException;
import com.mixtape.playlist.core.exception.InvalidPositionException;
import com.mixtape.playlist.core.exception.PlaylistCapacityExceededException;
import com.mixtape.playlist.core.exception.PlaylistLimitExceededException;
import com.mixtape.playlist.core.exception.PlaylistNameConflictException;
import com.mixtape.playlist.core.exception.ReorderRejectedException;
import com.mixtape.playlist.core.exception.ResourceNotFoundException;
import com.mixtape.playlist.core.position.ReorderValidation;
import com.mixtape.playlist.infrastructure.api.dto.ErrorResponse;
import com.mixtape.playlist.infrastructure.api.dto.FieldIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST API.
 * Maps domain and framework exceptions to the shared {@code { error: { code, message, details? } }} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidPaginationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPagination(InvalidPaginationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(VALIDATION_ERROR, ex.getMessage(), Map.of("parameter", ex.getParameter())));
    }

    @ExceptionHandler(InvalidPositionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPosition(InvalidPositionException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(VALIDATION_ERROR, ex.getMessage(), Map.of("position", ex.getPosition())));
    }

    @ExceptionHandler(PlaylistCapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceeded(PlaylistCapacityExceededException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentCount", ex.getCurrentCount());
        details.put("maxCount", ex.getMaxCount());
        details.put("requestedToAdd", ex.getRequestedToAdd());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("PLAYLIST_MAX_ITEMS_EXCEEDED", ex.getMessage(), details));
    }

    @ExceptionHandler(DuplicateTrackException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateTrack(DuplicateTrackException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("DUPLICATE_TRACK", ex.getMessage(), Map.of("trackUri", ex.getTrackUri())));
    }

    @ExceptionHandler(ReorderRejectedException.class)
    public ResponseEntity<ErrorResponse> handleReorderRejected(ReorderRejectedException ex) {
        ReorderValidation validation = ex.getValidation();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", validation.reason().name());

        return switch (validation.reason()) {
            case COUNT_MISMATCH -> {
                details.put("currentCount", validation.currentCount());
                details.put("orderedCount", validation.submittedCount());
                yield ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                        .body(new ErrorResponse("MISSING_OR_EXTRA_ITEMS", ex.getMessage(), details));
            }
            case MISSING_OR_EXTRA_ITEMS -> {
                details.put("missing", validation.missing());
                details.put("extra", validation.extra());
                yield ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                        .body(new ErrorResponse("MISSING_OR_EXTRA_ITEMS", ex.getMessage(), details));
            }
            case DUPLICATE_POSITION -> {
                details.put("positions", validation.conflictingPositions());
                yield ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(new ErrorResponse(VALIDATION_ERROR, ex.getMessage(), details));
            }
            case POSITION_RESERVED -> {
                details.put("positions", validation.conflictingPositions());
                yield ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(new ErrorResponse("POSITION_RESERVED", ex.getMessage(), details));
            }
        };
    }

    @ExceptionHandler(PlaylistNameConflictException.class)
    public ResponseEntity<ErrorResponse> handleNameConflict(PlaylistNameConflictException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("CONFLICT", ex.getMessage()));
    }

    @ExceptionHandler(PlaylistLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handlePlaylistLimit(PlaylistLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("LIMIT_EXCEEDED", ex.getMessage(), Map.of("maxCount", ex.getLimit())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<FieldIssue> issues = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldIssue(error.getField(), error.getDefaultMessage()))
                .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(VALIDATION_ERROR, "Invalid body", issues));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(VALIDATION_ERROR, "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", ex.getName());
        details.put("value", String.valueOf(ex.getValue()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(VALIDATION_ERROR, "Invalid value for " + ex.getName(), details));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingIdentity(MissingRequestHeaderException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse("UNAUTHORIZED", "Unauthorized"));
    }

    @ExceptionHandler(InvalidCallerIdentityException.class)
    public ResponseEntity<ErrorResponse> handleInvalidIdentity(InvalidCallerIdentityException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse("UNAUTHORIZED", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse frameworkError
                && frameworkError.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = frameworkError.getStatusCode();
            String code = status.value() == HttpStatus.NOT_FOUND.value() ? "NOT_FOUND" : VALIDATION_ERROR;
            return ResponseEntity.status(status).body(new ErrorResponse(code, ex.getMessage()));
        }

        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_SERVER_ERROR", "Something went wrong"));
    }
}
