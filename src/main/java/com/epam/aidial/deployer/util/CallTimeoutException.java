package com.epam.aidial.deployer.util;

import lombok.Getter;

/**
 * Raised when a call to an external collaborator does not finish within its ceiling.
 * Kept apart from functional failures so callers can tell a slow peer from a failing one.
 */
@Getter
public class CallTimeoutException extends RuntimeException {

    private final String operation;
    private final long timeout;

    public CallTimeoutException(String operation, long timeout) {
        super("%s timed out after %d ms".formatted(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }
}
