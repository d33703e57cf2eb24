package com.frontline.controller;

import com.frontline.service.ErrorKind;
import com.frontline.service.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Translates {@link OperationResult}s into HTTP responses.
 */
final class OperationResponses {

    private OperationResponses() {
    }

    static <T> ResponseEntity<Object> ok(OperationResult<T> result, Function<T, ?> mapper) {
        return respond(result, HttpStatus.OK, mapper);
    }

    static <T> ResponseEntity<Object> created(OperationResult<T> result, Function<T, ?> mapper) {
        return respond(result, HttpStatus.CREATED, mapper);
    }

    static <T> ResponseEntity<Object> respond(OperationResult<T> result, HttpStatus successStatus,
                                              Function<T, ?> mapper) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(mapper.apply(result.getValue()));
        }
        return ResponseEntity.status(statusOf(result.getErrorKind())).body(errorBody(result));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case COOLDOWN -> HttpStatus.TOO_MANY_REQUESTS;
            case INVALID_STATE, INVALID_TARGET, INSUFFICIENT_RESOURCES -> HttpStatus.BAD_REQUEST;
        };
    }

    static Map<String, Object> errorBody(OperationResult<?> result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", labelOf(result.getErrorKind()));
        body.put("message", result.getMessage());
        if (result.getRemainingMs() != null) {
            body.put("timeLeftMs", result.getRemainingMs());
        }
        if (result.getRequiredAmount() != null) {
            body.put("required", result.getRequiredAmount());
            body.put("available", result.getAvailableAmount());
        }
        return body;
    }

    private static String labelOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> "Not Found";
            case FORBIDDEN -> "Access Denied";
            case CONFLICT -> "Conflict";
            case COOLDOWN -> "Rate Limited";
            case INSUFFICIENT_RESOURCES -> "Insufficient Resources";
            case INVALID_STATE, INVALID_TARGET -> "Bad Request";
        };
    }

    static ResponseEntity<Object> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Not Found", "message", message));
    }
}
