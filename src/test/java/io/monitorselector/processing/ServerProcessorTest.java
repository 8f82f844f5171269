package io.monitorselector.processing;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.monitorselector.config.SelectorConfig;
import io.monitorselector.constraints.AccountLimitPolicy;
import io.monitorselector.constraints.ConstraintEngine;
import io.monitorselector.enums.PauseReason;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.metrics.MetricsProvider;
import io.monitorselector.metrics.SelectorMetrics;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ProcessResult;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.GrandfatheringPolicy;
import io.monitorselector.selection.SelectionRuleEngine;
import io.monitorselector.selection.StateClassifier;
import io.monitorselector.store.MonitorStore;
import io.monitorselector.store.ServerNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static io.monitorselector.TestMonitors.*;
import static io.monitorselector.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ServerProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private MonitorStore store;

    private SimpleMeterRegistry registry;
    private SelectorConfig config;
    private ServerProcessor processor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        config = new SelectorConfig();
        ConstraintEngine constraintEngine = new ConstraintEngine(CLOCK);
        processor = new ServerProcessor(
                store,
                constraintEngine,
                new AccountLimitPolicy(new ObjectMapper(), CLOCK),
                new GrandfatheringPolicy(),
                new StateClassifier(),
                new SelectionRuleEngine(constraintEngine, config.getSelectionSettings()),
                new ViolationTracker(store, CLOCK, config.getRecheckPausedInterval()),
                new SelectorMetrics(new MetricsProvider(registry, "selector-test")),
                config,
                CLOCK);
    }

    @Test
    void testServerNoLongerDueIsSkipped() {
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(false);

        ProcessResult result = processor.process(SERVER_ID, false);

        assertThat(result.isSkipped()).isTrue();
        verify(store, never()).getServer(anyLong());
        verify(store, never()).updateServersMonitorReview(anyLong(), any(), any(), anyBoolean());
    }

    @Test
    void testForcedRunIgnoresSchedule() {
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(false);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(stableCommittee());

        ProcessResult result = processor.process(SERVER_ID, true);

        assertThat(result.isSkipped()).isFalse();
        assertThat(result.getEvaluatedMonitors()).isEqualTo(12);
    }

    @Test
    void testUnchangedServerIsRescheduledWithUnchangedInterval() {
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(SERVER_ID, NOW.minus(config.getTelemetryWindow()))).thenReturn(stableCommittee());

        ProcessResult result = processor.process(SERVER_ID, false);

        assertThat(result.getPlannedChanges()).isEmpty();
        assertThat(result.isChanged()).isFalse();
        verify(store, never()).updateServerScoreStatus(anyLong(), anyLong(), any());
        verify(store).updateServersMonitorReview(SERVER_ID, NOW, NOW.plus(config.getUnchangedReviewInterval()), false);
        assertThat(registry.find(MONITOR_POOL_SIZE_METRIC_NAME).tag(STATUS_TAG, "active").gauge().value()).isEqualTo(7.0);
        assertThat(registry.find(MONITOR_POOL_SIZE_METRIC_NAME).tag(STATUS_TAG, "testing").gauge().value()).isEqualTo(5.0);
    }

    @Test
    void testAccountExcessHolderIsRecordedAndDemoted() {
        long account = 4242L;
        List<MonitorCandidate> rows = List.of(
                monitor(1, ServerScoreStatus.ACTIVE).accountId(account).priority(10).build(),
                monitor(2, ServerScoreStatus.ACTIVE).accountId(account).priority(20).build(),
                monitor(3, ServerScoreStatus.ACTIVE).accountId(account).priority(30).build());
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(rows);

        ProcessResult result = processor.process(SERVER_ID, false);

        assertThat(result.getPlannedChanges()).hasSize(1);
        assertThat(result.getAppliedChanges()).isEqualTo(1);
        verify(store).updateServerScoreStatus(SERVER_ID, 3L, ServerScoreStatus.TESTING);
        verify(store).updateServerScoreConstraintViolation(SERVER_ID, 3L, ViolationType.LIMIT, NOW);
        verify(store).updateServersMonitorReview(SERVER_ID, NOW, NOW.plus(config.getChangedReviewInterval()), true);

        Counter changes = registry.find(STATUS_CHANGES_METRIC_NAME)
                .tag(FROM_STATUS_TAG, "active").tag(TO_STATUS_TAG, "testing").counter();
        assertThat(changes).isNotNull();
        assertThat(changes.count()).isEqualTo(1.0);
        Counter violations = registry.find(CONSTRAINT_VIOLATIONS_METRIC_NAME)
                .tag(CONSTRAINT_TYPE_TAG, "limit").tag(IS_GRANDFATHERED_TAG, "true").counter();
        assertThat(violations).isNotNull();
        assertThat(violations.count()).isEqualTo(1.0);
    }

    @Test
    void testUnchangeableViolationPausesAssignment() {
        List<MonitorCandidate> rows = new ArrayList<>(stableCommittee());
        rows.add(monitor(50, ServerScoreStatus.CANDIDATE).ip("198.51.100.77").build());
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(rows);

        ProcessResult result = processor.process(SERVER_ID, false);

        assertThat(result.getPlannedChanges()).extracting(StatusChange::getMonitorId).containsExactly(50L);
        assertThat(result.getPlannedChanges().get(0).getToStatus()).isEqualTo(ServerScoreStatus.PAUSED);
        verify(store).updateServerScoreConstraintViolation(SERVER_ID, 50L, ViolationType.NETWORK_SAME_SUBNET, NOW);
        verify(store).updateServerScoreStatus(SERVER_ID, 50L, ServerScoreStatus.PAUSED);
        verify(store).updateServerScorePauseReason(SERVER_ID, 50L, PauseReason.CONSTRAINT_VIOLATION);
        verify(store).updateServerScoreLastConstraintCheck(SERVER_ID, 50L, NOW);
        verify(store).updateServersMonitorReview(SERVER_ID, NOW, NOW.plus(config.getChangedReviewInterval()), true);
    }

    @Test
    void testPauseAfterRemovalReportsNewStatusAndCountsOnce() {
        List<MonitorCandidate> rows = new ArrayList<>(stableCommittee());
        rows.add(7, monitor(8, ServerScoreStatus.ACTIVE).ip("198.51.100.77").build());
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(rows);

        ProcessResult result = processor.process(SERVER_ID, false);

        verify(store).updateServerScoreStatus(SERVER_ID, 8L, ServerScoreStatus.TESTING);
        verify(store).updateServerScoreStatus(SERVER_ID, 8L, ServerScoreStatus.PAUSED);
        StatusChange pause = result.getPlannedChanges().get(result.getPlannedChanges().size() - 1);
        assertThat(pause.getMonitorId()).isEqualTo(8L);
        assertThat(pause.getFromStatus()).isEqualTo(ServerScoreStatus.TESTING);
        assertThat(pause.getToStatus()).isEqualTo(ServerScoreStatus.PAUSED);
        long changedMonitors = result.getPlannedChanges().stream().map(StatusChange::getMonitorId).distinct().count();
        assertThat(result.getAppliedChanges()).isEqualTo((int) changedMonitors);
    }

    @Test
    void testSecondPassOnPausedSnapshotWritesNothing() {
        List<MonitorCandidate> rows = new ArrayList<>(stableCommittee());
        rows.add(monitor(50, ServerScoreStatus.PAUSED).ip("198.51.100.77")
                .violationType(ViolationType.NETWORK_SAME_SUBNET).violationSince(NOW)
                .lastConstraintCheck(NOW).pauseReason(PauseReason.CONSTRAINT_VIOLATION).build());
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(rows);

        ProcessResult result = processor.process(SERVER_ID, false);

        assertThat(result.getPlannedChanges()).isEmpty();
        assertThat(result.getAppliedChanges()).isZero();
        verify(store, never()).updateServerScoreStatus(anyLong(), anyLong(), any());
        verify(store, never()).updateServerScoreConstraintViolation(anyLong(), anyLong(), any(), any());
        verify(store, never()).clearServerScoreConstraintViolation(anyLong(), anyLong());
        verify(store, never()).updateServerScorePauseReason(anyLong(), anyLong(), any());
        verify(store, never()).updateServerScoreLastConstraintCheck(anyLong(), anyLong(), any());
        verify(store).updateServersMonitorReview(SERVER_ID, NOW, NOW.plus(config.getUnchangedReviewInterval()), false);
    }

    @Test
    void testFailedWriteIsCountedAndPassContinues() {
        List<MonitorCandidate> rows = new ArrayList<>();
        for (long id = 1; id <= 9; id++) {
            rows.add(monitor(id, ServerScoreStatus.ACTIVE).build());
        }
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(rows);
        doThrow(new DataIntegrityViolationException("row gone"))
                .when(store).updateServerScoreStatus(SERVER_ID, 8L, ServerScoreStatus.TESTING);

        ProcessResult result = processor.process(SERVER_ID, false);

        assertThat(result.getPlannedChanges()).hasSize(2);
        assertThat(result.getAppliedChanges()).isEqualTo(1);
        assertThat(result.getFailedChanges()).isEqualTo(1);
        verify(store).updateServerScoreStatus(SERVER_ID, 9L, ServerScoreStatus.TESTING);
        assertThat(registry.find(CHANGES_FAILED_METRIC_NAME).counter().count()).isEqualTo(1.0);
    }

    @Test
    void testInterruptCancelsBeforeWriting() {
        List<MonitorCandidate> rows = new ArrayList<>();
        for (long id = 1; id <= 9; id++) {
            rows.add(monitor(id, ServerScoreStatus.ACTIVE).build());
        }
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenReturn(server());
        when(store.getMonitorPriority(eq(SERVER_ID), any())).thenReturn(rows);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> processor.process(SERVER_ID, false))
                    .isInstanceOf(SelectionCancelledException.class);
        } finally {
            Thread.interrupted();
        }
        verify(store, never()).updateServerScoreStatus(anyLong(), anyLong(), any());
        verify(store, never()).updateServersMonitorReview(anyLong(), any(), any(), anyBoolean());
    }

    @Test
    void testMissingServerPropagates() {
        when(store.lockServerForReview(SERVER_ID, NOW)).thenReturn(true);
        when(store.getServer(SERVER_ID)).thenThrow(new ServerNotFoundException(SERVER_ID));

        assertThatThrownBy(() -> processor.process(SERVER_ID, false))
                .isInstanceOf(ServerNotFoundException.class);
    }

    private static List<MonitorCandidate> stableCommittee() {
        List<MonitorCandidate> rows = new ArrayList<>();
        for (long id = 1; id <= 7; id++) {
            rows.add(monitor(id, ServerScoreStatus.ACTIVE).build());
        }
        for (long id = 11; id <= 15; id++) {
            rows.add(monitor(id, ServerScoreStatus.TESTING).build());
        }
        return rows;
    }
}
