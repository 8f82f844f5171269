package io.monitorselector.api.handlers;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prometheus scrape endpoint.
 * GET /metrics
 */
@Slf4j
@RestController
public class MetricsHandler {

    private final PrometheusMeterRegistry registry;

    public MetricsHandler(PrometheusMeterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> scrape() {
        log.debug("Serving metrics scrape");
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_PLAIN)
            .body(registry.scrape());
    }
}
