package com.registry.core.exception;

/**
 * Thrown when a write-once entity (a version, or a storage path written
 * with write-if-absent semantics) already exists.
 */
public class AlreadyExistsException extends RegistryException {

    public static final String ERROR_CODE = "ALREADY_EXISTS";

    public AlreadyExistsException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s already exists: %s",
            entityType, entityId
        ));
    }
}
