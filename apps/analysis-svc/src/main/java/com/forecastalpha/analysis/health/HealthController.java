package com.forecastalpha.analysis.health;

import com.forecastalpha.analysis.config.AnalysisProperties;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint; reports the configured environment.
 */
@RestController
public class HealthController {

    private final AnalysisProperties properties;

    public HealthController(AnalysisProperties properties) {
        this.properties = properties;
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", "ok", "environment", properties.environment());
    }
}
