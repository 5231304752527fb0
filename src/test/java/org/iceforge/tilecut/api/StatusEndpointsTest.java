package org.iceforge.tilecut.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tilecut.cache.ArtifactCacheFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StatusEndpointsTest {

    @TempDir
    Path tmp;

    @Test
    void health_reflectsActuatorStatus() throws Exception {
        HealthEndpoint endpoint = mock(HealthEndpoint.class);
        when(endpoint.health()).thenReturn(Health.down().build());
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(endpoint)).build();

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.service").value("tilecut"))
                .andExpect(jsonPath("$.version").exists());
    }

    @Test
    void cacheStats_describesPermanentTier() throws Exception {
        ArtifactCacheFactory factory = new ArtifactCacheFactory(tmp.resolve("cache"), new ObjectMapper());
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new CacheStatsController(factory)).build();

        mockMvc.perform(get("/api/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("permanent"))
                .andExpect(jsonPath("$.objectCount").value(0))
                .andExpect(jsonPath("$.error").value(false));
    }
}
