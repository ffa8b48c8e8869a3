package com.registry.engine.health;

import com.registry.engine.service.RegistryService;
import com.registry.engine.service.RegistryService.RegistryStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicator for the registry.
 * Reports DOWN when the storage backend cannot list the registry root.
 */
@Component
public class RegistryHealthIndicator implements HealthIndicator {

    private final RegistryService registryService;

    public RegistryHealthIndicator(RegistryService registryService) {
        this.registryService = registryService;
    }

    @Override
    public Health health() {
        RegistryStatus status = registryService.status();
        Health.Builder builder = status.available() ? Health.up() : Health.down();
        return builder
            .withDetail("backend", status.backend())
            .withDetail("root", status.root())
            .withDetail("detail", status.detail())
            .build();
    }
}
