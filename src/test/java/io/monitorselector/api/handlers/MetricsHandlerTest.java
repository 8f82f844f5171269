package io.monitorselector.api.handlers;

import io.micrometer.core.instrument.Counter;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsHandlerTest {

    @Test
    void testScrapeReturnsPrometheusText() {
        // Given
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Counter.builder("selector_status_changes").tag("server_id", "42").register(registry).increment(3);
        MetricsHandler handler = new MetricsHandler(registry);

        // When
        ResponseEntity<String> response = handler.scrape();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.TEXT_PLAIN);
        assertThat(response.getBody()).contains("selector_status_changes_total{server_id=\"42\"}");
    }
}
