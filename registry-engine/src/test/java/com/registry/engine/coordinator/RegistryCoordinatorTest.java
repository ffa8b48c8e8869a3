package com.registry.engine.coordinator;

import com.registry.core.exception.AlreadyExistsException;
import com.registry.core.exception.IntegrityException;
import com.registry.core.exception.NotFoundException;
import com.registry.core.exception.RegistryValidationException;
import com.registry.core.exception.StorageException;
import com.registry.core.model.AliasPointer;
import com.registry.core.model.ArtifactSet;
import com.registry.core.model.AuditEntry;
import com.registry.core.model.Manifest;
import com.registry.core.model.ManifestMismatch;
import com.registry.engine.config.RegistrySettings;
import com.registry.engine.integrity.ManifestCalculator;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.service.RegistryService;
import com.registry.engine.service.RegistryService.ManifestStatus;
import com.registry.engine.service.RegistryService.PromoteRequest;
import com.registry.engine.service.RegistryService.PromotionResult;
import com.registry.engine.service.RegistryService.RegisterRequest;
import com.registry.engine.service.RegistryService.RegistrationResult;
import com.registry.engine.service.RegistryService.RegistryStatus;
import com.registry.engine.service.RegistryService.ResolvedVersion;
import com.registry.engine.service.RegistryService.VerificationResult;
import com.registry.engine.service.RegistryService.VersionDetails;
import com.registry.engine.storage.InMemoryObjectStorageBackend;
import com.registry.engine.storage.LocalFilesystemStorageBackend;
import com.registry.engine.test.FailureInjector;
import com.registry.engine.test.FaultInjectingStorageBackend;
import com.registry.engine.test.FaultInjectingStorageBackend.Operation;
import com.registry.engine.test.TimeController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class RegistryCoordinatorTest {

    @TempDir
    Path root;

    private final TimeController clock = TimeController.frozen();

    private RegistryMetrics metrics;
    private RegistryCoordinator registry;

    @BeforeEach
    void setUp() {
        metrics = RegistryMetrics.standalone();
        // Lenient resolution so tests can observe tampered versions through verify()
        registry = RegistryCoordinator.create(
            new LocalFilesystemStorageBackend(root),
            RegistrySettings.defaults().withStrictVerify(false),
            clock,
            metrics
        );
    }

    // ========== Round trip ==========

    @Test
    @DisplayName("Registered artifacts resolve to byte-identical files covered by the manifest")
    void roundTrip() throws Exception {
        Map<String, byte[]> files = Map.of(
            "model.bin", bytes("weights"),
            "config/params.json", bytes("{\"lr\":0.01}")
        );

        RegistrationResult registered = registry.register(request("v1", ArtifactSet.of(files)));
        ResolvedVersion resolved = registry.resolve("ct", "pbmc@v1", false);

        assertThat(resolved.versionId().version()).isEqualTo("v1");
        assertThat(resolved.alias()).isNull();
        assertThat(resolved.path()).isEqualTo(registered.path());
        Path dir = Path.of(resolved.path());
        assertThat(Files.readAllBytes(dir.resolve("model.bin"))).isEqualTo(files.get("model.bin"));
        assertThat(Files.readAllBytes(dir.resolve("config/params.json"))).isEqualTo(files.get("config/params.json"));

        Manifest expected = new ManifestCalculator().computeManifest(ArtifactSet.of(files).asMap());
        assertThat(registered.manifest().entries()).containsAllEntriesOf(expected.entries());
    }

    @Test
    @DisplayName("Registering twice is AlreadyExists and leaves the stored version unchanged")
    void immutability() throws Exception {
        registry.register(request("v1", artifacts("model.bin", "A")));
        Path modelFile = Path.of(registry.resolve("ct", "pbmc@v1", false).path()).resolve("model.bin");

        assertThatThrownBy(() -> registry.register(request("v1", artifacts("model.bin", "A"))))
            .isInstanceOf(AlreadyExistsException.class);
        assertThatThrownBy(() -> registry.register(request("v1", artifacts("model.bin", "B"))))
            .isInstanceOf(AlreadyExistsException.class);

        assertThat(Files.readString(modelFile)).isEqualTo("A");
        assertThat(registry.verify("ct", "pbmc@v1").ok()).isTrue();
    }

    @Test
    @DisplayName("show returns metadata, manifest and file listing")
    void show() {
        registry.register(request("v1", artifacts("model.bin", "A")));

        VersionDetails details = registry.show("ct", "pbmc@v1", true);

        assertThat(details.resolved().manifestStatus()).isEqualTo(ManifestStatus.VERIFIED);
        assertThat(details.metadata().createdBy()).isEqualTo("alice");
        assertThat(details.metadata().createdAt()).isEqualTo(clock.instant());
        assertThat(details.manifest().entries()).containsKeys("model.bin", "metadata.json");
        assertThat(details.files()).containsExactly("manifest.sha256", "metadata.json", "model.bin");
    }

    // ========== Integrity ==========

    @Test
    @DisplayName("Out-of-band edits are reported by verify, naming the file")
    void integrityDetection() throws Exception {
        registry.register(request("v1", artifacts("model.bin", "A")));
        Path dir = Path.of(registry.resolve("ct", "pbmc@v1", false).path());
        Files.writeString(dir.resolve("model.bin"), "tampered");

        VerificationResult result = registry.verify("ct", "pbmc@v1");

        assertThat(result.ok()).isFalse();
        assertThat(result.mismatches())
            .extracting(ManifestMismatch::fileName)
            .containsExactly("model.bin");
        assertThat(counter(RegistryMetrics.INTEGRITY_FAILURES).count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Verified resolution refuses a corrupted version")
    void verifiedResolveRejectsCorruption() throws Exception {
        registry.register(request("v1", artifacts("model.bin", "A")));
        Path dir = Path.of(registry.resolve("ct", "pbmc@v1", false).path());
        Files.writeString(dir.resolve("model.bin"), "tampered");

        assertThat(registry.resolve("ct", "pbmc@v1", false).manifestStatus()).isEqualTo(ManifestStatus.NOT_CHECKED);
        assertThatThrownBy(() -> registry.resolve("ct", "pbmc@v1", true))
            .isInstanceOf(IntegrityException.class)
            .satisfies(e -> assertThat(((IntegrityException) e).getMismatches())
                .extracting(ManifestMismatch::fileName)
                .containsExactly("model.bin"));
    }

    @Test
    @DisplayName("Strict mode verifies on every resolution")
    void strictVerify() throws Exception {
        RegistryCoordinator strict = RegistryCoordinator.create(
            new LocalFilesystemStorageBackend(root), RegistrySettings.defaults(), clock, metrics);
        strict.register(request("v1", artifacts("model.bin", "A")));

        assertThat(strict.resolve("ct", "pbmc@v1", false).manifestStatus()).isEqualTo(ManifestStatus.VERIFIED);

        Path dir = Path.of(strict.resolve("ct", "pbmc@v1", false).path());
        Files.writeString(dir.resolve("model.bin"), "B");
        assertThatThrownBy(() -> strict.resolve("ct", "pbmc@v1", false))
            .isInstanceOf(IntegrityException.class);
    }

    // ========== Promotion ==========

    @Test
    @DisplayName("Promotion makes the alias resolvable and appends exactly one audit entry")
    void promotion() {
        registry.register(request("v1", artifacts("model.bin", "A")));

        PromotionResult result = registry.promote(new PromoteRequest("ct", "pbmc", "production", "v1", "bob", "ok"));
        ResolvedVersion resolved = registry.resolve("ct", "pbmc@production", false);

        assertThat(result.previous()).isNull();
        assertThat(result.current()).isEqualTo("v1");
        assertThat(resolved.versionId().version()).isEqualTo("v1");
        assertThat(resolved.alias()).isEqualTo("production");
        assertThat(registry.auditTrail("ct", "pbmc"))
            .extracting(AuditEntry::to, AuditEntry::actor, AuditEntry::reason)
            .containsExactly(tuple("v1", "bob", "ok"));
    }

    @Test
    @DisplayName("Promoting to a missing version changes neither the alias nor the audit log")
    void promotionPrecondition() {
        registry.register(request("v1", artifacts("model.bin", "A")));
        registry.promote(new PromoteRequest("ct", "pbmc", "production", "v1", "bob", "ok"));

        assertThatThrownBy(() -> registry.promote(
                new PromoteRequest("ct", "pbmc", "production", "v-missing", "bob", "oops")))
            .isInstanceOf(NotFoundException.class);

        assertThat(registry.resolve("ct", "pbmc@production", false).versionId().version()).isEqualTo("v1");
        assertThat(registry.auditTrail("ct", "pbmc")).hasSize(1);
        assertThat(counter(RegistryMetrics.PROMOTIONS, "outcome", "not_found").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A version can go straight to production without staging")
    void noPromotionLattice() {
        registry.register(request("v1", artifacts("model.bin", "A")));
        registry.register(request("v2", artifacts("model.bin", "B")));

        registry.promote(new PromoteRequest("ct", "pbmc", "production", "v2", "bob", null));
        registry.promote(new PromoteRequest("ct", "pbmc", "staging", "v1", "bob", null));

        assertThat(registry.listAliases("ct", "pbmc"))
            .extracting(AliasPointer::alias, AliasPointer::version)
            .containsExactly(tuple("production", "v2"), tuple("staging", "v1"));
    }

    @Test
    @DisplayName("An alias can be set at registration with the default reason")
    void setAliasAtRegistration() {
        RegisterRequest withAlias = new RegisterRequest("ct", "pbmc", "v1", artifacts("model.bin", "A"),
            null, null, null, "alice", "staging", null);

        RegistrationResult result = registry.register(withAlias);

        assertThat(result.aliasSet()).isNotNull();
        assertThat(result.aliasSet().current()).isEqualTo("v1");
        assertThat(registry.resolve("ct", "pbmc@staging", false).versionId().version()).isEqualTo("v1");
        assertThat(registry.auditTrail("ct", "pbmc"))
            .extracting(AuditEntry::reason)
            .containsExactly(RegistryCoordinator.DEFAULT_REGISTRATION_REASON);
    }

    @Test
    @DisplayName("An invalid alias at registration is rejected before the version is committed")
    void invalidAliasAtRegistration() {
        RegisterRequest withAlias = new RegisterRequest("ct", "pbmc", "v1", artifacts("model.bin", "A"),
            null, null, null, "alice", "bad alias!", null);

        assertThatThrownBy(() -> registry.register(withAlias))
            .isInstanceOf(RegistryValidationException.class);
        assertThatThrownBy(() -> registry.resolve("ct", "pbmc@v1", false))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A version whose alias could not be set stays committed and the failure says so")
    void aliasFailureAfterCommit() {
        FaultInjectingStorageBackend storage = new FaultInjectingStorageBackend(new InMemoryObjectStorageBackend("alias-down"))
            .failOn(Operation.WRITE_ATOMIC, FailureInjector.alwaysFail());
        RegistryCoordinator flaky = RegistryCoordinator.create(storage, RegistrySettings.defaults(), clock, metrics);
        RegisterRequest withAlias = new RegisterRequest("ct", "pbmc", "v1", artifacts("model.bin", "A"),
            null, null, null, "alice", "production", null);

        assertThatThrownBy(() -> flaky.register(withAlias))
            .isInstanceOf(StorageException.class)
            .satisfies(e -> assertThat(((StorageException) e).getContext())
                .containsEntry(RegistryService.CTX_VERSION_COMMITTED, "true")
                .containsEntry("version", "v1")
                .containsEntry("alias", "production"));

        storage.heal();
        assertThat(flaky.resolve("ct", "pbmc@v1", true).versionId().version()).isEqualTo("v1");
        assertThat(flaky.listAliases("ct", "pbmc")).isEmpty();
        assertThatThrownBy(() -> flaky.register(withAlias)).isInstanceOf(AlreadyExistsException.class);
    }

    // ========== Example scenario ==========

    @Test
    @DisplayName("A bare model reference needs an explicit latest alias")
    void exampleScenario() {
        RegistrationResult registered = registry.register(request("v1", artifacts("model.bin", "A")));

        assertThatThrownBy(() -> registry.resolve("ct", "pbmc", false))
            .isInstanceOf(NotFoundException.class);

        registry.promote(new PromoteRequest("ct", "pbmc", "latest", "v1", "alice", "first model"));

        assertThat(registry.resolve("ct", "pbmc@latest", false).path()).isEqualTo(registered.path());
        assertThat(registry.resolve("ct", "pbmc", false).path()).isEqualTo(registered.path());
    }

    // ========== Listings ==========

    @Test
    @DisplayName("Listings are sorted and unknown models are NotFound")
    void listings() {
        registry.register(request("v2", artifacts("model.bin", "B")));
        registry.register(request("v1", artifacts("model.bin", "A")));
        registry.register(new RegisterRequest("ct", "lung", "v1", artifacts("model.bin", "L"),
            null, null, null, "alice", null, null));

        assertThat(registry.listModels("ct")).containsExactly("lung", "pbmc");
        assertThat(registry.listModels("unknown-task")).isEmpty();
        assertThat(registry.listVersions("ct", "pbmc")).containsExactly("v1", "v2");
        assertThat(registry.listAliases("ct", "pbmc")).isEmpty();
        assertThat(registry.auditTrail("ct", "pbmc")).isEmpty();

        assertThatThrownBy(() -> registry.listVersions("ct", "ghost")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.auditTrail("ct", "ghost")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.listModels("../etc")).isInstanceOf(RegistryValidationException.class);
    }

    // ========== Status and metrics ==========

    @Test
    @DisplayName("Status reports the backend and whether it answers")
    void status() {
        RegistryStatus up = registry.status();
        assertThat(up.available()).isTrue();
        assertThat(up.backend()).isEqualTo("local");
        assertThat(up.root()).isEqualTo(root.toAbsolutePath().normalize().toString());

        FaultInjectingStorageBackend broken = new FaultInjectingStorageBackend(new InMemoryObjectStorageBackend("down"))
            .failOn(Operation.LIST, FailureInjector.alwaysFail());
        RegistryStatus down = RegistryCoordinator.create(broken, RegistrySettings.defaults(), clock, metrics).status();
        assertThat(down.available()).isFalse();
        assertThat(down.detail()).contains("Injected");
    }

    @Test
    @DisplayName("Outcomes are counted per operation")
    void metricsRecorded() {
        registry.register(request("v1", artifacts("model.bin", "A")));
        assertThatThrownBy(() -> registry.register(request("v1", artifacts("model.bin", "A"))))
            .isInstanceOf(AlreadyExistsException.class);
        registry.resolve("ct", "pbmc@v1", false);
        assertThatThrownBy(() -> registry.resolve("ct", "pbmc@v9", false))
            .isInstanceOf(NotFoundException.class);

        assertThat(counter(RegistryMetrics.REGISTRATIONS, "outcome", "success").count()).isEqualTo(1.0);
        assertThat(counter(RegistryMetrics.REGISTRATIONS, "outcome", "already_exists").count()).isEqualTo(1.0);
        assertThat(counter(RegistryMetrics.RESOLUTIONS, "outcome", "success").count()).isEqualTo(1.0);
        assertThat(counter(RegistryMetrics.RESOLUTIONS, "outcome", "not_found").count()).isEqualTo(1.0);
        assertThat(metrics.registry().find(RegistryMetrics.OPERATION_DURATION)
            .tag("operation", "register").timers())
            .extracting(Timer::count)
            .containsOnly(1L)
            .hasSize(2);
    }

    // ========== Concurrency ==========

    @Test
    @DisplayName("Concurrent registrations of different versions both succeed")
    void concurrentDistinctVersions() throws Exception {
        List<Future<RegistrationResult>> results = race(List.of(
            request("v1", artifacts("model.bin", "A")),
            request("v2", artifacts("model.bin", "B"))
        ));
        for (Future<RegistrationResult> f : results) {
            f.get(30, TimeUnit.SECONDS);
        }

        assertThat(registry.resolve("ct", "pbmc@v1", true).manifestStatus()).isEqualTo(ManifestStatus.VERIFIED);
        assertThat(registry.resolve("ct", "pbmc@v2", true).manifestStatus()).isEqualTo(ManifestStatus.VERIFIED);
    }

    @Test
    @DisplayName("Concurrent registrations of the same version: one wins, the rest are AlreadyExists")
    void concurrentSameVersion() throws Exception {
        List<RegisterRequest> requests = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            requests.add(request("v1", artifacts("model.bin", "content-" + i)));
        }

        int successes = 0;
        int conflicts = 0;
        for (Future<RegistrationResult> f : race(requests)) {
            try {
                f.get(30, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(AlreadyExistsException.class);
                conflicts++;
            }
        }

        assertThat(successes).isEqualTo(1);
        assertThat(conflicts).isEqualTo(3);
        assertThat(registry.verify("ct", "pbmc@v1").ok()).isTrue();
        assertThat(registry.listVersions("ct", "pbmc")).containsExactly("v1");
    }

    private List<Future<RegistrationResult>> race(List<RegisterRequest> requests) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(requests.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RegistrationResult>> futures = new ArrayList<>();
        try {
            for (RegisterRequest r : requests) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.register(r);
                }));
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        return futures;
    }

    private Counter counter(String name, String... tags) {
        Counter counter = metrics.registry().find(name).tags(tags).counter();
        assertThat(counter).as("counter %s %s", name, List.of(tags)).isNotNull();
        return counter;
    }

    private static RegisterRequest request(String version, ArtifactSet artifacts) {
        return new RegisterRequest("ct", "pbmc", version, artifacts, null, null, null, "alice", null, null);
    }

    private static ArtifactSet artifacts(String name, String content) {
        return ArtifactSet.of(Map.of(name, bytes(content)));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
