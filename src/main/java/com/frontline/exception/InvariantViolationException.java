package com.frontline.exception;

import lombok.Getter;

/**
 * Raised when authoritative state is found corrupted (negative balance, push whose war
 * no longer exists). The affected entity is taken out of service rather than mutated further.
 */
@Getter
public class InvariantViolationException extends RuntimeException {

    private final String entityId;

    public InvariantViolationException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }
}
