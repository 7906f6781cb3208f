package com.routemind.dispatch.api;

import com.routemind.core.Fixtures;
import com.routemind.core.model.HealthState;
import com.routemind.core.registry.BackendRegistry;
import com.routemind.core.routing.BackendAnalytics;
import com.routemind.core.routing.BackendRouter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BackendController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class BackendControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BackendRouter router;

    @Test
    @DisplayName("GET /api/v1/backends lists backends in registration order")
    void listsBackends() throws Exception {
        when(router.registry()).thenReturn(new BackendRegistry(Fixtures.seedBackends()));
        when(router.isRoutable(any())).thenReturn(true);

        mockMvc.perform(get("/api/v1/backends"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)))
                .andExpect(jsonPath("$[*].name", contains("reasoning", "general", "coding", "creative", "advanced")))
                .andExpect(jsonPath("$[2].maxComplexity").value("complex"))
                .andExpect(jsonPath("$[2].fallbackChain", contains("reasoning", "general")))
                .andExpect(jsonPath("$[2].status").value("UNKNOWN"))
                .andExpect(jsonPath("$[2].routable").value(true));
    }

    @Test
    @DisplayName("GET /api/v1/backends returns an empty list for an empty registry")
    void emptyRegistry() throws Exception {
        when(router.registry()).thenReturn(new BackendRegistry());

        mockMvc.perform(get("/api/v1/backends"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", empty()));
    }

    @Test
    @DisplayName("GET /api/v1/backends/analytics returns per-backend counts")
    void analytics() throws Exception {
        when(router.analytics()).thenReturn(new BackendAnalytics(2, List.of(
                new BackendAnalytics.BackendStats("coding", 4, 3, 0.75, 1.9, HealthState.ONLINE, 0),
                new BackendAnalytics.BackendStats("general", 0, 0, 1.0, 1.2, HealthState.OFFLINE, 3))));

        mockMvc.perform(get("/api/v1/backends/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registrySize").value(2))
                .andExpect(jsonPath("$.backends[0].routedRequests").value(4))
                .andExpect(jsonPath("$.backends[0].successRate").value(0.75))
                .andExpect(jsonPath("$.backends[1].health").value("OFFLINE"))
                .andExpect(jsonPath("$.backends[1].consecutiveFailures").value(3));
    }
}
