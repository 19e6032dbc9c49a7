package com.selfheal.remediator.engine;

/**
 * Thrown when a remediation request body cannot be turned into a {@code RemediationRequest}.
 */
public class InvalidRequestException extends Exception {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
