package io.monitorselector.api.handlers;

import io.monitorselector.MonitorSelector;
import io.monitorselector.SelectorCommandLine;
import io.monitorselector.api.models.responses.ErrorResponse;
import io.monitorselector.api.models.responses.HealthResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Reports the state of the review driver.
 * GET /health
 *
 * In server mode the status is "down" once the worker has stopped; one-shot commands always
 * report "up" while the process lives.
 */
@Slf4j
@RestController
public class HealthHandler {

    static final String STATUS_UP = "up";
    static final String STATUS_DOWN = "down";

    private final MonitorSelector selector;
    private final SelectorCommandLine commandLine;

    public HealthHandler(MonitorSelector selector, SelectorCommandLine commandLine) {
        this.selector = selector;
        this.commandLine = commandLine;
    }

    @GetMapping("/health")
    public ResponseEntity<Object> health() {
        try {
            boolean running = selector.isRunning();
            boolean healthy = running || !commandLine.isServerMode();
            Instant lastPass = selector.getLastPassAt();
            HealthResponse response = HealthResponse.builder()
                .status(healthy ? STATUS_UP : STATUS_DOWN)
                .mode(commandLine.getCommand())
                .running(running)
                .lastPass(lastPass == null ? null : lastPass.toString())
                .serversProcessed(selector.getServersProcessed())
                .serversFailed(selector.getServersFailed())
                .build();
            return healthy ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
        } catch (Exception e) {
            log.error("Error reporting selector health: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
