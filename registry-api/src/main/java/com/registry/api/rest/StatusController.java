package com.registry.api.rest;

import com.registry.engine.service.RegistryService;
import com.registry.engine.service.RegistryService.RegistryStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status probe: which backend and root this instance serves, and whether it answers.
 */
@RestController
@RequestMapping("/api/v1/status")
public class StatusController {

    private final RegistryService registryService;

    public StatusController(RegistryService registryService) {
        this.registryService = registryService;
    }

    @GetMapping
    public ResponseEntity<RegistryStatus> status() {
        RegistryStatus status = registryService.status();
        HttpStatus httpStatus = status.available() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(status);
    }
}
