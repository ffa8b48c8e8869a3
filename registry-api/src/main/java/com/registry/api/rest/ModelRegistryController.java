package com.registry.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.registry.core.exception.RegistryValidationException;
import com.registry.core.model.AliasPointer;
import com.registry.core.model.ArtifactSet;
import com.registry.core.model.AuditEntry;
import com.registry.core.model.ManifestMismatch;
import com.registry.core.model.VersionMetadata;
import com.registry.engine.service.RegistryService;
import com.registry.engine.service.RegistryService.ManifestStatus;
import com.registry.engine.service.RegistryService.PromoteRequest;
import com.registry.engine.service.RegistryService.PromotionResult;
import com.registry.engine.service.RegistryService.RegisterRequest;
import com.registry.engine.service.RegistryService.RegistrationResult;
import com.registry.engine.service.RegistryService.ResolvedVersion;
import com.registry.engine.service.RegistryService.VerificationResult;
import com.registry.engine.service.RegistryService.VersionDetails;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * REST API for model versions, aliases and their audit trail.
 */
@RestController
@RequestMapping("/api/v1/tasks/{task}")
public class ModelRegistryController {

    private final RegistryService registryService;

    public ModelRegistryController(RegistryService registryService) {
        this.registryService = registryService;
    }

    /**
     * Register a new immutable version. Artifacts come either from a directory
     * readable by the server or inline as base64.
     */
    @PostMapping("/models/{model}/versions/{version}")
    public ResponseEntity<RegistrationResponse> register(
            @PathVariable String task,
            @PathVariable String model,
            @PathVariable String version,
            @RequestBody RegisterVersionRequest request) {

        RegistrationResult result = registryService.register(new RegisterRequest(
            task,
            model,
            version,
            toArtifacts(request),
            request.metadata(),
            request.metrics(),
            request.featureSchema(),
            request.actor(),
            request.setAlias(),
            request.reason()
        ));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(RegistrationResponse.from(result));
    }

    /**
     * Resolve {@code model}, {@code model@alias} or {@code model@version}.
     */
    @GetMapping("/resolve")
    public ResponseEntity<ResolveResponse> resolve(
            @PathVariable String task,
            @RequestParam String ref,
            @RequestParam(defaultValue = "false") boolean verify) {

        ResolvedVersion resolved = registryService.resolve(task, ref, verify);
        return ResponseEntity.ok(ResolveResponse.from(resolved));
    }

    @GetMapping("/show")
    public ResponseEntity<ShowResponse> show(
            @PathVariable String task,
            @RequestParam String ref,
            @RequestParam(defaultValue = "false") boolean verify) {

        VersionDetails details = registryService.show(task, ref, verify);
        return ResponseEntity.ok(ShowResponse.from(details));
    }

    /**
     * Recompute digests of a stored version. A mismatch is a result, not an error.
     */
    @GetMapping("/verify")
    public ResponseEntity<VerificationResponse> verify(
            @PathVariable String task,
            @RequestParam String ref) {

        VerificationResult result = registryService.verify(task, ref);
        return ResponseEntity.ok(VerificationResponse.from(result));
    }

    /**
     * Point an alias at an existing version.
     */
    @PostMapping("/models/{model}/aliases/{alias}")
    public ResponseEntity<PromotionResponse> promote(
            @PathVariable String task,
            @PathVariable String model,
            @PathVariable String alias,
            @RequestBody PromoteRequestDto request) {

        PromotionResult result = registryService.promote(new PromoteRequest(
            task,
            model,
            alias,
            request.version(),
            request.actor(),
            request.reason()
        ));
        return ResponseEntity.ok(PromotionResponse.from(result));
    }

    @GetMapping("/models")
    public ResponseEntity<List<String>> listModels(@PathVariable String task) {
        return ResponseEntity.ok(registryService.listModels(task));
    }

    @GetMapping("/models/{model}/versions")
    public ResponseEntity<List<String>> listVersions(
            @PathVariable String task,
            @PathVariable String model) {
        return ResponseEntity.ok(registryService.listVersions(task, model));
    }

    @GetMapping("/models/{model}/aliases")
    public ResponseEntity<List<AliasPointer>> listAliases(
            @PathVariable String task,
            @PathVariable String model) {
        return ResponseEntity.ok(registryService.listAliases(task, model));
    }

    @GetMapping("/models/{model}/audit")
    public ResponseEntity<List<AuditEntry>> auditTrail(
            @PathVariable String task,
            @PathVariable String model) {
        return ResponseEntity.ok(registryService.auditTrail(task, model));
    }

    private static ArtifactSet toArtifacts(RegisterVersionRequest request) {
        boolean hasDir = request.artifactDir() != null && !request.artifactDir().isBlank();
        boolean hasInline = request.artifacts() != null && !request.artifacts().isEmpty();
        if (hasDir == hasInline) {
            throw new RegistryValidationException("artifacts",
                "exactly one of artifactDir or artifacts must be given");
        }
        if (hasDir) {
            return ArtifactSet.fromDirectory(Path.of(request.artifactDir()));
        }

        Map<String, byte[]> decoded = new TreeMap<>();
        Base64.Decoder decoder = Base64.getDecoder();
        for (Map.Entry<String, String> entry : request.artifacts().entrySet()) {
            try {
                decoded.put(entry.getKey(), decoder.decode(entry.getValue() == null ? "" : entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new RegistryValidationException("artifacts", "not valid base64: " + entry.getKey());
            }
        }
        return ArtifactSet.of(decoded);
    }

    // ========== DTOs ==========

    /**
     * @param artifacts File name to base64 content
     */
    public record RegisterVersionRequest(
        String artifactDir,
        Map<String, String> artifacts,
        VersionMetadata metadata,
        JsonNode metrics,
        JsonNode featureSchema,
        String actor,
        String setAlias,
        String reason
    ) {}

    public record PromoteRequestDto(
        String version,
        String actor,
        String reason
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RegistrationResponse(
        String task,
        String model,
        String version,
        String path,
        Map<String, String> manifest,
        PromotionResponse alias
    ) {
        public static RegistrationResponse from(RegistrationResult result) {
            return new RegistrationResponse(
                result.versionId().task(),
                result.versionId().model(),
                result.versionId().version(),
                result.path(),
                result.manifest().entries(),
                result.aliasSet() == null ? null : PromotionResponse.from(result.aliasSet())
            );
        }
    }

    public record ResolveResponse(
        String task,
        String model,
        String version,
        String path,
        String alias,
        ManifestStatus manifestStatus
    ) {
        public static ResolveResponse from(ResolvedVersion resolved) {
            return new ResolveResponse(
                resolved.versionId().task(),
                resolved.versionId().model(),
                resolved.versionId().version(),
                resolved.path(),
                resolved.alias(),
                resolved.manifestStatus()
            );
        }
    }

    public record ShowResponse(
        ResolveResponse resolved,
        VersionMetadata metadata,
        Map<String, String> manifest,
        List<String> files
    ) {
        public static ShowResponse from(VersionDetails details) {
            return new ShowResponse(
                ResolveResponse.from(details.resolved()),
                details.metadata(),
                details.manifest().entries(),
                details.files()
            );
        }
    }

    public record PromotionResponse(
        String alias,
        String previous,
        @JsonProperty("new") String current
    ) {
        public static PromotionResponse from(PromotionResult result) {
            return new PromotionResponse(result.alias(), result.previous(), result.current());
        }
    }

    public record VerificationResponse(
        String task,
        String model,
        String version,
        String path,
        boolean ok,
        List<ManifestMismatch> mismatches
    ) {
        public static VerificationResponse from(VerificationResult result) {
            return new VerificationResponse(
                result.versionId().task(),
                result.versionId().model(),
                result.versionId().version(),
                result.path(),
                result.ok(),
                result.mismatches()
            );
        }
    }
}
