package com.registry.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Content of {@code aliases/<alias>.json}: the version an alias points at,
 * plus who moved it last and when.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AliasPointer(
    String version,
    String alias,
    Instant updatedAt,
    String updatedBy
) {
    public static final String FILE_SUFFIX = ".json";

    public static String fileName(String alias) {
        return alias + FILE_SUFFIX;
    }
}
