package com.registry.core.exception;

/**
 * Thrown when a task, model, version, alias or storage path is not found.
 */
public class NotFoundException extends RegistryException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
