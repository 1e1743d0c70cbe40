package com.ueep.core.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ueep.core.health.DependencyHealth;
import com.ueep.core.health.DependencyStatus;
import com.ueep.core.health.HealthAggregator;
import com.ueep.core.health.HealthVerdict;
import com.ueep.core.resilience.CircuitState;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HealthController.class)
@Import(ControllerTestConfig.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthAggregator healthAggregator;

    @Test
    void healthyWhenEveryDependencyIsHealthy() throws Exception {
        when(healthAggregator.checkHealth()).thenReturn(HealthVerdict.of(
            List.of(
                new DependencyHealth("store", DependencyStatus.HEALTHY, CircuitState.CLOSED, "ok"),
                new DependencyHealth("cache", DependencyStatus.HEALTHY, CircuitState.CLOSED, "ok")
            ),
            ControllerTestConfig.NOW
        ));

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.node").value("node-1"))
            .andExpect(jsonPath("$.timestamp").value("2026-01-01T00:00:00Z"))
            .andExpect(jsonPath("$.checks.service").value("healthy"))
            .andExpect(jsonPath("$.checks.store").value("healthy"))
            .andExpect(jsonPath("$.checks.cache").value("healthy"))
            .andExpect(jsonPath("$.circuits.store").value("closed"));
    }

    @Test
    void unavailableWhenAnyDependencyIsUnhealthy() throws Exception {
        when(healthAggregator.checkHealth()).thenReturn(HealthVerdict.of(
            List.of(
                new DependencyHealth("store", DependencyStatus.HEALTHY, CircuitState.CLOSED, "ok"),
                new DependencyHealth("cache", DependencyStatus.UNHEALTHY, CircuitState.OPEN, "circuit_open")
            ),
            ControllerTestConfig.NOW
        ));

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("unhealthy"))
            .andExpect(jsonPath("$.checks.store").value("healthy"))
            .andExpect(jsonPath("$.checks.cache").value("unhealthy"))
            .andExpect(jsonPath("$.circuits.cache").value("open"));
    }

    @Test
    void readyDoesNotProbeDependencies() throws Exception {
        mockMvc.perform(get("/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"))
            .andExpect(jsonPath("$.timestamp").value("2026-01-01T00:00:00Z"))
            .andExpect(jsonPath("$.checks").doesNotExist());
    }

    @Test
    void echoesCorrelationIdHeader() throws Exception {
        mockMvc.perform(get("/ready").header("X-Correlation-ID", "cid-123"))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Correlation-ID", "cid-123"));
    }

    @Test
    void generatesCorrelationIdWhenAbsent() throws Exception {
        mockMvc.perform(get("/ready"))
            .andExpect(header().exists("X-Correlation-ID"));
    }
}
