package com.registry.core.model;

import com.registry.core.exception.RegistryValidationException;

import java.util.regex.Pattern;

/**
 * Validation rules for path-safe identifiers.
 */
public final class Identifiers {

    public static final int MAX_LENGTH = 128;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final Pattern FILE_SEGMENT = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9._-]*");

    private Identifiers() {
    }

    /**
     * Check a task, model, version or alias identifier.
     *
     * @param field Name of the field, reported on failure
     * @param value The identifier
     * @return The identifier, unchanged
     * @throws RegistryValidationException if the identifier is not path-safe
     */
    public static String requireValid(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new RegistryValidationException(field, "cannot be empty");
        }
        if (value.length() > MAX_LENGTH) {
            throw new RegistryValidationException(field, "longer than " + MAX_LENGTH + " characters");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new RegistryValidationException(field,
                "'" + value + "' must match " + IDENTIFIER.pattern());
        }
        return value;
    }

    /**
     * Check a relative artifact file name such as {@code model.bin} or {@code tokenizer/vocab.txt}.
     */
    public static String requireValidFileName(String value) {
        if (value == null || value.isBlank()) {
            throw new RegistryValidationException("fileName", "cannot be empty");
        }
        for (String segment : value.split("/", -1)) {
            if (segment.length() > MAX_LENGTH || !FILE_SEGMENT.matcher(segment).matches()) {
                throw new RegistryValidationException("fileName",
                    "'" + value + "' is not a safe relative path");
            }
        }
        return value;
    }

    public static boolean isValid(String value) {
        return value != null && value.length() <= MAX_LENGTH && IDENTIFIER.matcher(value).matches();
    }
}
