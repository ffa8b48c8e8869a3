package com.registry.api;

import com.registry.core.storage.StorageBackend;
import com.registry.engine.service.RegistryService;
import com.registry.engine.storage.InMemoryObjectStorageBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "registry.backend=memory",
    "registry.root=it"
})
@AutoConfigureMockMvc
class RegistryApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StorageBackend storageBackend;

    @Autowired
    private RegistryService registryService;

    @Test
    @DisplayName("The application wires the configured backend behind the REST API")
    void contextWiresBackend() throws Exception {
        assertThat(storageBackend).isInstanceOf(InMemoryObjectStorageBackend.class);
        assertThat(registryService.status().available()).isTrue();

        mockMvc.perform(post("/api/v1/tasks/ct/models/pbmc/versions/v1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"artifacts\":{\"model.bin\":\"QQ==\"},\"actor\":\"alice\",\"setAlias\":\"latest\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.path").value("memory://it/tasks/ct/models/pbmc/versions/v1"));

        mockMvc.perform(get("/api/v1/tasks/ct/models/pbmc/audit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].ts").isString())
            .andExpect(jsonPath("$[0].reason").value("set at registration"));
    }

    @Test
    @DisplayName("The caller's trace ID is echoed and reported with errors")
    void traceIdPropagated() throws Exception {
        mockMvc.perform(get("/api/v1/tasks/ct/resolve").param("ref", "ghost@v1")
                .header("X-Trace-Id", "abc-123"))
            .andExpect(status().isNotFound())
            .andExpect(header().string("X-Trace-Id", "abc-123"))
            .andExpect(jsonPath("$.traceId").value("abc-123"));

        mockMvc.perform(get("/api/v1/status").header("X-Trace-Id", "not a valid id!"))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Trace-Id", matchesPattern("[0-9a-f]{8}")));
    }

    @Test
    @DisplayName("Actuator health includes the registry check")
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.registry.details.backend").value("memory"));
    }
}
