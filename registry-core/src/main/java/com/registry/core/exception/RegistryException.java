package com.registry.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all registry errors.
 *
 * Every error carries a stable error code and a structured context
 * (task, model, version, alias, field, path) so callers can map failures
 * to distinct outcomes without parsing messages.
 */
public class RegistryException extends RuntimeException {

    public static final String CTX_TASK = "task";
    public static final String CTX_MODEL = "model";
    public static final String CTX_VERSION = "version";
    public static final String CTX_ALIAS = "alias";
    public static final String CTX_FIELD = "field";
    public static final String CTX_PATH = "path";

    private final String errorCode;
    private final Map<String, String> context = new LinkedHashMap<>();

    public RegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RegistryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Structured context of the failure, in insertion order.
     */
    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Attach a context entry. Null values are ignored.
     */
    public RegistryException with(String key, String value) {
        if (value != null) {
            context.put(key, value);
        }
        return this;
    }

    /**
     * Attach task/model/version coordinates.
     */
    public RegistryException withCoordinates(String task, String model, String version) {
        return with(CTX_TASK, task).with(CTX_MODEL, model).with(CTX_VERSION, version);
    }
}
