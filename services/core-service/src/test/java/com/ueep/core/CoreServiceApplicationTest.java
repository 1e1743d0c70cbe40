package com.ueep.core;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ueep.core.resilience.CircuitBreakerRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:postgresql://127.0.0.1:1/ueep_core",
    "spring.datasource.hikari.connection-timeout=250",
    "spring.datasource.hikari.minimum-idle=0",
    "spring.sql.init.mode=never",
    "spring.data.redis.host=127.0.0.1",
    "spring.data.redis.port=1",
    "spring.data.redis.timeout=250ms",
    "spring.data.redis.connect-timeout=250ms"
})
@AutoConfigureMockMvc
@AutoConfigureObservability
class CoreServiceApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CircuitBreakerRegistry registry;

    @Autowired
    private Environment environment;

    @Autowired
    private ResourceLoader resourceLoader;

    @Test
    void registersStoreAndCacheThenSeals() {
        assertEquals(List.of("store", "cache"), registry.names());
        assertTrue(registry.isSealed());
    }

    @Test
    void healthIsUnavailableWhenDependenciesAreDown() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("unhealthy"))
            .andExpect(jsonPath("$.checks.service").value("healthy"))
            .andExpect(jsonPath("$.checks.store").value("unhealthy"))
            .andExpect(jsonPath("$.checks.cache").value("unhealthy"));
    }

    @Test
    void dataIsUnavailableWhenStoreIsDown() throws Exception {
        mockMvc.perform(get("/api/data").header("X-Correlation-ID", "boot-1"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("X-Correlation-ID", "boot-1"))
            .andExpect(jsonPath("$.error.code").value("dependency_unavailable"))
            .andExpect(jsonPath("$.correlation_id").value("boot-1"));
    }

    @Test
    void readyStaysUpWhenDependenciesAreDown() throws Exception {
        mockMvc.perform(get("/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    void prometheusScrapeIsServedAtMetrics() throws Exception {
        mockMvc.perform(get("/metrics"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("ueep_circuit_breaker_state")));
    }

    @Test
    void schemaScriptIsWiredForSqlInit() throws IOException {
        String location = environment.getProperty("spring.sql.init.schema-locations");
        assertEquals("classpath:db/init-db.sql", location);

        Resource script = resourceLoader.getResource(location);
        assertTrue(script.exists());
        String sql = script.getContentAsString(StandardCharsets.UTF_8);
        assertTrue(sql.contains("CREATE TABLE IF NOT EXISTS system_info"));
    }
}
