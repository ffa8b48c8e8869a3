package com.registry.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Provenance of a version, stored as {@code metadata.json}.
 *
 * Well-known fields are typed; anything framework specific goes into
 * {@code hyperparameters} or the open {@code extensions} map.
 * Identity fields (task, model, version, createdAt) are owned by the
 * registry and overwritten at registration.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VersionMetadata(
    // Identity
    String task,
    String model,
    String version,

    // Provenance
    Instant createdAt,
    String createdBy,
    String codeRef,
    String datasetRef,
    String framework,
    String description,

    // Open schema
    Map<String, JsonNode> hyperparameters,
    Map<String, JsonNode> extensions
) {
    public static final String FILE_NAME = "metadata.json";

    public VersionMetadata {
        hyperparameters = hyperparameters == null
            ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(hyperparameters));
        extensions = extensions == null
            ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(extensions));
    }

    /**
     * Metadata with no provenance fields set.
     */
    public static VersionMetadata empty() {
        return builder().build();
    }

    /**
     * Stamp registry-owned identity fields. The creator defaults to the
     * registering actor when the caller did not name one.
     */
    public VersionMetadata withRegistration(VersionId id, Instant registeredAt, String actor) {
        return toBuilder()
            .task(id.task())
            .model(id.model())
            .version(id.version())
            .createdAt(registeredAt)
            .createdBy(createdBy != null && !createdBy.isBlank() ? createdBy : actor)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .task(task)
            .model(model)
            .version(version)
            .createdAt(createdAt)
            .createdBy(createdBy)
            .codeRef(codeRef)
            .datasetRef(datasetRef)
            .framework(framework)
            .description(description)
            .hyperparameters(hyperparameters)
            .extensions(extensions);
    }

    public static class Builder {
        private String task;
        private String model;
        private String version;
        private Instant createdAt;
        private String createdBy;
        private String codeRef;
        private String datasetRef;
        private String framework;
        private String description;
        private Map<String, JsonNode> hyperparameters = Map.of();
        private Map<String, JsonNode> extensions = Map.of();

        public Builder task(String task) {
            this.task = task;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder codeRef(String codeRef) {
            this.codeRef = codeRef;
            return this;
        }

        public Builder datasetRef(String datasetRef) {
            this.datasetRef = datasetRef;
            return this;
        }

        public Builder framework(String framework) {
            this.framework = framework;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder hyperparameters(Map<String, JsonNode> hyperparameters) {
            this.hyperparameters = hyperparameters;
            return this;
        }

        public Builder extensions(Map<String, JsonNode> extensions) {
            this.extensions = extensions;
            return this;
        }

        public VersionMetadata build() {
            return new VersionMetadata(
                task, model, version,
                createdAt, createdBy, codeRef, datasetRef, framework, description,
                hyperparameters, extensions
            );
        }
    }
}
