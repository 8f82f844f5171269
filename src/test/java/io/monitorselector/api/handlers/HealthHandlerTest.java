package io.monitorselector.api.handlers;

import io.monitorselector.MonitorSelector;
import io.monitorselector.SelectorCommandLine;
import io.monitorselector.api.models.responses.ErrorResponse;
import io.monitorselector.api.models.responses.HealthResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class HealthHandlerTest {

    @Mock
    private MonitorSelector selector;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testHealth_RunningServer() throws Exception {
        // Given
        HealthHandler handler = new HealthHandler(selector, SelectorCommandLine.parse(new String[]{"server"}));
        when(selector.isRunning()).thenReturn(true);
        when(selector.getLastPassAt()).thenReturn(Instant.parse("2024-05-01T12:00:00Z"));
        when(selector.getServersProcessed()).thenReturn(12L);
        when(selector.getServersFailed()).thenReturn(1L);

        // When
        ResponseEntity<Object> response = handler.health();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        HealthResponse body = (HealthResponse) response.getBody();
        assertThat(body.getStatus()).isEqualTo("up");
        assertThat(body.getMode()).isEqualTo("server");
        assertThat(body.isRunning()).isTrue();
        assertThat(body.getLastPass()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(body.getServersProcessed()).isEqualTo(12L);
        assertThat(body.getServersFailed()).isEqualTo(1L);
    }

    @Test
    void testHealth_StoppedServerIsDown() throws Exception {
        // Given
        HealthHandler handler = new HealthHandler(selector, SelectorCommandLine.parse(new String[]{"server"}));
        when(selector.isRunning()).thenReturn(false);

        // When
        ResponseEntity<Object> response = handler.health();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        HealthResponse body = (HealthResponse) response.getBody();
        assertThat(body.getStatus()).isEqualTo("down");
        assertThat(body.getLastPass()).isNull();
    }

    @Test
    void testHealth_OneShotCommandIsUp() throws Exception {
        // Given
        HealthHandler handler = new HealthHandler(selector, SelectorCommandLine.parse(new String[]{"once"}));
        when(selector.isRunning()).thenReturn(false);

        // When
        ResponseEntity<Object> response = handler.health();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((HealthResponse) response.getBody()).getMode()).isEqualTo("once");
    }

    @Test
    void testHealth_Exception() throws Exception {
        // Given
        HealthHandler handler = new HealthHandler(selector, SelectorCommandLine.parse(new String[]{"server"}));
        when(selector.isRunning()).thenThrow(new IllegalStateException("boom"));

        // When
        ResponseEntity<Object> response = handler.health();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("internal_server_error");
        assertThat(error.getReason()).isEqualTo("boom");
    }
}
