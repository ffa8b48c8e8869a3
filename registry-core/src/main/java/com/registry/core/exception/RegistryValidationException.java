package com.registry.core.exception;

/**
 * Thrown when a caller supplies a malformed identifier, reference or
 * incomplete registration input. Never retried by the engine.
 */
public class RegistryValidationException extends RegistryException {

    public static final String ERROR_CODE = "VALIDATION_FAILED";

    public RegistryValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public RegistryValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
        with(CTX_FIELD, field);
    }
}
