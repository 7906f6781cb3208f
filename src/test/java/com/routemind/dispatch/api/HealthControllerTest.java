package com.routemind.dispatch.api;

import com.routemind.core.health.HealthCheckService;
import com.routemind.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /api/v1/health returns UP when every component is up")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("router", HealthStatus.Status.UP, "5 backends registered", Map.of()),
                new HealthStatus("backends", HealthStatus.Status.UP, "5 of 5 backends online",
                        Map.of("coding", "ONLINE"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.router.status").value("UP"))
                .andExpect(jsonPath("$.components.router.details").doesNotExist())
                .andExpect(jsonPath("$.components.backends.details.coding").value("ONLINE"));
    }

    @Test
    @DisplayName("GET /api/v1/health reports DEGRADED with 200 when a component is degraded")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("router", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("backends", HealthStatus.Status.DEGRADED, "3 of 5 backends online", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.backends.detail", containsString("3 of 5")));
    }

    @Test
    @DisplayName("GET /api/v1/health returns 503 when any component is down")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("router", HealthStatus.Status.DOWN, "no backends registered", Map.of()),
                new HealthStatus("backends", HealthStatus.Status.DEGRADED, "0 of 0", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components", aMapWithSize(2)));
    }
}
