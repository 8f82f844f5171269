package io.monitorselector;

import io.monitorselector.config.SelectorConfig;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.ProcessResult;
import io.monitorselector.models.StatusChange;
import io.monitorselector.processing.SelectionCancelledException;
import io.monitorselector.processing.ServerProcessor;
import io.monitorselector.store.MonitorStore;
import io.monitorselector.store.ServerNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MonitorSelectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private MonitorStore store;

    @Mock
    private ServerProcessor processor;

    @Mock
    private SelectorConfig config;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AutoCloseable mocks;
    private MonitorSelector selector;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(config.getInitialBackoff()).thenReturn(Duration.ofMillis(20));
        when(config.getMaxBackoff()).thenReturn(Duration.ofMillis(100));
        when(config.getReviewBatchSize()).thenReturn(10);
        when(config.getUnchangedReviewInterval()).thenReturn(Duration.ofMinutes(20));
        when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus());

        selector = new MonitorSelector(store, processor, new TransactionTemplate(transactionManager), config,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        selector.stop();
        mocks.close();
    }

    @Test
    void testRunPassProcessesEveryDueServer() {
        when(store.getServersDueForReview(NOW, 10)).thenReturn(List.of(1L, 2L, 3L, 4L));
        when(processor.process(1L, false)).thenReturn(result(1L));
        when(processor.process(2L, false)).thenThrow(new ServerNotFoundException(2L));
        when(processor.process(3L, false)).thenReturn(ProcessResult.skipped(3L));
        when(processor.process(4L, false)).thenThrow(new CannotAcquireLockException("deadlock"));

        int processed = selector.runPass();

        assertThat(processed).isEqualTo(1);
        assertThat(selector.getServersProcessed()).isEqualTo(1);
        assertThat(selector.getServersFailed()).isEqualTo(2);
        assertThat(selector.getLastPassAt()).isEqualTo(NOW);
        // Two reviews commit, two roll back and each failure commits its own reschedule.
        verify(transactionManager, times(4)).commit(any());
        verify(transactionManager, times(2)).rollback(any());
        Instant nextReview = NOW.plus(Duration.ofMinutes(20));
        verify(store).updateServersMonitorReview(2L, NOW, nextReview, false);
        verify(store).updateServersMonitorReview(4L, NOW, nextReview, false);
        verify(store, never()).updateServersMonitorReview(eq(1L), any(), any(), anyBoolean());
    }

    @Test
    void testRescheduleFailureDoesNotStopThePass() {
        when(store.getServersDueForReview(NOW, 10)).thenReturn(List.of(1L, 2L));
        when(processor.process(1L, false)).thenThrow(new CannotAcquireLockException("deadlock"));
        doThrow(new CannotAcquireLockException("still locked"))
                .when(store).updateServersMonitorReview(eq(1L), any(), any(), anyBoolean());
        when(processor.process(2L, false)).thenReturn(result(2L));

        assertThat(selector.runPass()).isEqualTo(1);
        assertThat(selector.getServersFailed()).isEqualTo(1);
    }

    @Test
    void testRunPassStopsOnCancellation() {
        when(store.getServersDueForReview(NOW, 10)).thenReturn(List.of(1L, 2L));
        when(processor.process(1L, false)).thenThrow(new SelectionCancelledException(1L));

        assertThatThrownBy(() -> selector.runPass()).isInstanceOf(SelectionCancelledException.class);
        verify(processor, never()).process(2L, false);
        verify(transactionManager).rollback(any());
    }

    @Test
    void testRunPassWithNothingDue() {
        when(store.getServersDueForReview(NOW, 10)).thenReturn(List.of());

        assertThat(selector.runPass()).isZero();
        verifyNoInteractions(processor);
    }

    @Test
    void testProcessServerForcesReview() {
        when(processor.process(7L, true)).thenReturn(result(7L));

        ProcessResult result = selector.processServer(7L);

        assertThat(result.getServerId()).isEqualTo(7L);
        assertThat(selector.getServersProcessed()).isEqualTo(1);
        verify(transactionManager).commit(any());
    }

    @Test
    void testSimulateRollsBack() {
        when(processor.process(7L, true)).thenReturn(result(7L));

        ProcessResult result = selector.simulate(7L);

        assertThat(result.getPlannedChanges()).hasSize(1);
        ArgumentCaptor<TransactionStatus> status = ArgumentCaptor.forClass(TransactionStatus.class);
        verify(transactionManager).commit(status.capture());
        assertThat(status.getValue().isRollbackOnly()).isTrue();
    }

    @Test
    void testStartAndStop() {
        when(store.getServersDueForReview(any(), anyInt())).thenReturn(List.of());

        selector.start();
        assertThat(selector.isRunning()).isTrue();
        verify(store, timeout(2000).atLeast(2)).getServersDueForReview(any(), anyInt());

        selector.stop();
        assertThat(selector.isRunning()).isFalse();
    }

    private static ProcessResult result(long serverId) {
        StatusChange change = new StatusChange(5L, ServerScoreStatus.TESTING, ServerScoreStatus.ACTIVE, "promotion to active");
        return new ProcessResult(serverId, false, 12, List.of(change), 1, 0);
    }
}
