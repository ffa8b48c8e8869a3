package com.registry.core.model;

import com.registry.core.exception.RegistryValidationException;

/**
 * Symbolic reference to a version: {@code model} or {@code model@qualifier},
 * where the qualifier is an alias name or an explicit version identifier.
 * A bare model name refers to the {@code latest} alias.
 */
public record ModelRef(String model, String qualifier, boolean implicitQualifier) {

    public static final String SEPARATOR = "@";
    public static final String DEFAULT_QUALIFIER = "latest";

    /**
     * Parse a reference string.
     *
     * @throws RegistryValidationException if either part is missing or not path-safe
     */
    public static ModelRef parse(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new RegistryValidationException("ref", "cannot be empty");
        }
        String trimmed = ref.strip();
        int at = trimmed.indexOf(SEPARATOR);
        if (at < 0) {
            return new ModelRef(Identifiers.requireValid("model", trimmed), DEFAULT_QUALIFIER, true);
        }
        String model = trimmed.substring(0, at).strip();
        String qualifier = trimmed.substring(at + 1).strip();
        if (model.isEmpty() || qualifier.isEmpty()) {
            throw new RegistryValidationException("ref",
                "'" + ref + "' must be <model> or <model>@<alias-or-version>");
        }
        return new ModelRef(
            Identifiers.requireValid("model", model),
            Identifiers.requireValid("qualifier", qualifier),
            false
        );
    }

    @Override
    public String toString() {
        return model + SEPARATOR + qualifier;
    }
}
