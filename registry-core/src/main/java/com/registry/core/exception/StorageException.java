package com.registry.core.exception;

/**
 * Thrown when the storage backend fails. May be transient; backends can
 * retry internally, the engine surfaces it unchanged.
 */
public class StorageException extends RegistryException {

    public static final String ERROR_CODE = "STORAGE_ERROR";

    public StorageException(String operation, String path, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Storage operation '%s' failed on %s: %s",
            operation, path, cause.getMessage()
        ), cause);
        with(CTX_PATH, path);
    }

    public StorageException(String message) {
        super(ERROR_CODE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
