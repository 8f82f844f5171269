package io.monitorselector;

import io.monitorselector.config.SelectorConfig;
import io.monitorselector.models.ProcessResult;
import io.monitorselector.processing.ServerProcessor;
import io.monitorselector.store.JdbcMonitorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Runs the driver against H2 with real transactions so failed reviews are visible in the queue.
 */
class MonitorSelectorReschedulingTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbc;
    private ServerProcessor processor;
    private SelectorConfig config;
    private MonitorSelector selector;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .setName("selector-" + UUID.randomUUID() + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE")
                .addScript("schema.sql")
                .build();
        jdbc = new JdbcTemplate(database);
        JdbcMonitorStore store = new JdbcMonitorStore(jdbc);
        config = new SelectorConfig();

        processor = mock(ServerProcessor.class);
        when(processor.process(anyLong(), eq(false))).thenAnswer(invocation -> {
            long serverId = invocation.getArgument(0);
            store.getServer(serverId);
            return new ProcessResult(serverId, false, 0, List.of(), 0, 0);
        });

        selector = new MonitorSelector(store, processor,
                new TransactionTemplate(new DataSourceTransactionManager(database)), config,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void testFailingServersDoNotStarveTheQueue() {
        // Ten orphaned review rows fill a whole batch ahead of the one real server.
        for (long id = 1; id <= 10; id++) {
            review(id, NOW.minus(Duration.ofMinutes(60)));
        }
        review(11, NOW.minus(Duration.ofMinutes(1)));
        jdbc.update("INSERT INTO servers (id, ip, ip_version, account_id) VALUES (11, '192.0.2.11', 'v4', NULL)");

        assertThat(selector.runPass()).isZero();
        assertThat(selector.getServersFailed()).isEqualTo(10);

        assertThat(selector.runPass()).isEqualTo(1);
        verify(processor).process(11L, false);
        verify(processor, times(1)).process(1L, false);
    }

    @Test
    void testFailedServerIsRescheduledWithUnchangedInterval() {
        review(1, NOW.minus(Duration.ofMinutes(5)));

        selector.runPass();

        Timestamp next = jdbc.queryForObject(
                "SELECT next_review FROM servers_monitor_review WHERE server_id = 1", Timestamp.class);
        assertThat(next.toInstant()).isEqualTo(NOW.plus(config.getUnchangedReviewInterval()));
    }

    private void review(long serverId, Instant nextReview) {
        jdbc.update("INSERT INTO servers_monitor_review (server_id, next_review) VALUES (?, ?)",
                serverId, Timestamp.from(nextReview));
    }
}
