package org.iceforge.tilecut.api;

import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Health summary for external callers, backed by Actuator so a DOWN archive shows up here.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    static final String SERVICE = "tilecut";

    private final HealthEndpoint healthEndpoint;

    public HealthController(HealthEndpoint healthEndpoint) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        HealthComponent hc = healthEndpoint.health();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", hc.getStatus().getCode());
        out.put("service", SERVICE);
        String version = HealthController.class.getPackage().getImplementationVersion();
        out.put("version", version != null ? version : "dev");
        return out;
    }
}
