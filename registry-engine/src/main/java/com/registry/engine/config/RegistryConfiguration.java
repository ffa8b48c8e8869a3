package com.registry.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.core.json.RegistryJson;
import com.registry.core.storage.StorageBackend;
import com.registry.engine.audit.AuditLog;
import com.registry.engine.coordinator.RegistryCoordinator;
import com.registry.engine.integrity.ManifestCalculator;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.promotion.PromotionEngine;
import com.registry.engine.resolve.AliasResolver;
import com.registry.engine.service.RegistryService;
import com.registry.engine.storage.InMemoryObjectStorageBackend;
import com.registry.engine.storage.LocalFilesystemStorageBackend;
import com.registry.engine.storage.SharedFilesystemStorageBackend;
import com.registry.engine.store.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the registry engine over the configured storage backend.
 *
 * The storage root is bound into the backend here and nowhere else; there
 * is no process-wide default root.
 */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfiguration.class);

    // Storage documents only; the HTTP layer keeps its own mapper
    private final ObjectMapper storageMapper = RegistryJson.newObjectMapper();

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public StorageBackend storageBackend(RegistryProperties properties) {
        log.info("Configuring {} storage backend", properties.backend());
        return switch (properties.backend()) {
            case LOCAL -> new LocalFilesystemStorageBackend(requireRoot(properties));
            case SHARED -> new SharedFilesystemStorageBackend(
                requireRoot(properties), properties.ioRetry().toPolicy());
            case MEMORY -> new InMemoryObjectStorageBackend(
                properties.root() == null || properties.root().isBlank() ? "registry" : properties.root());
        };
    }

    @Bean
    public RegistrySettings registrySettings(RegistryProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public ManifestCalculator manifestCalculator() {
        return new ManifestCalculator();
    }

    @Bean
    public VersionStore versionStore(
            StorageBackend storageBackend,
            ManifestCalculator manifestCalculator,
            Clock registryClock,
            RegistrySettings registrySettings) {
        return new VersionStore(
            storageBackend, manifestCalculator, storageMapper, registryClock, registrySettings.requiredFiles());
    }

    @Bean
    public AliasResolver aliasResolver(StorageBackend storageBackend) {
        return new AliasResolver(storageBackend, storageMapper);
    }

    @Bean
    public AuditLog auditLog(StorageBackend storageBackend, RegistrySettings registrySettings) {
        return new AuditLog(storageBackend, storageMapper, registrySettings.lockTimeout());
    }

    @Bean
    public PromotionEngine promotionEngine(
            StorageBackend storageBackend,
            VersionStore versionStore,
            AliasResolver aliasResolver,
            AuditLog auditLog,
            Clock registryClock,
            RegistrySettings registrySettings) {
        return new PromotionEngine(
            storageBackend, versionStore, aliasResolver, auditLog, storageMapper, registryClock,
            registrySettings.lockTimeout(), registrySettings.auditRetryPolicy());
    }

    @Bean
    public RegistryService registryService(
            StorageBackend storageBackend,
            VersionStore versionStore,
            AliasResolver aliasResolver,
            PromotionEngine promotionEngine,
            AuditLog auditLog,
            RegistrySettings registrySettings,
            RegistryMetrics registryMetrics) {
        return new RegistryCoordinator(
            storageBackend, versionStore, aliasResolver, promotionEngine, auditLog,
            registrySettings, registryMetrics);
    }

    private static Path requireRoot(RegistryProperties properties) {
        if (properties.root() == null || properties.root().isBlank()) {
            throw new IllegalStateException(
                "registry.root must be set for the " + properties.backend() + " backend");
        }
        return Path.of(properties.root());
    }
}
