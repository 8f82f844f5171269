package io.monitorselector;

import io.monitorselector.config.SelectorConfig;
import io.monitorselector.models.ProcessResult;
import io.monitorselector.processing.SelectionCancelledException;
import io.monitorselector.processing.ServerProcessor;
import io.monitorselector.store.MonitorStore;
import io.monitorselector.store.ServerNotFoundException;
import io.monitorselector.util.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives server reviews.
 * Each pass asks the store for the servers that are due and processes every one of them in its
 * own transaction. In continuous mode a worker thread repeats passes and backs off while idle.
 */
@Slf4j
public class MonitorSelector {

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final MonitorStore store;
    private final ServerProcessor processor;
    private final TransactionTemplate transactionTemplate;
    private final SelectorConfig config;
    private final Clock clock;
    private final ExponentialBackoff backoff;

    private final AtomicLong serversProcessed = new AtomicLong();
    private final AtomicLong serversFailed = new AtomicLong();
    private volatile Instant lastPassAt;
    private volatile boolean isRunning = false;
    private Thread worker;

    public MonitorSelector(MonitorStore store,
                           ServerProcessor processor,
                           TransactionTemplate transactionTemplate,
                           SelectorConfig config,
                           Clock clock) {
        this.store = store;
        this.processor = processor;
        this.transactionTemplate = transactionTemplate;
        this.config = config;
        this.clock = clock;
        this.backoff = new ExponentialBackoff(config.getInitialBackoff(), config.getMaxBackoff());
    }

    /**
     * Start the continuous review loop on a worker thread.
     */
    public synchronized void start() {
        if (isRunning) {
            log.warn("Monitor selector already running");
            return;
        }
        log.info("Starting monitor selector, batch size {}", config.getReviewBatchSize());
        isRunning = true;
        worker = new Thread(this::runContinuous, "monitor-selector");
        worker.start();
    }

    /**
     * Stop the review loop. A server that is being processed is rolled back.
     */
    public void stop() {
        Thread current;
        synchronized (this) {
            if (!isRunning) {
                return;
            }
            log.info("Stopping monitor selector");
            isRunning = false;
            current = worker;
            worker = null;
        }
        if (current == null) {
            return;
        }
        current.interrupt();
        try {
            current.join(TimeUnit.SECONDS.toMillis(STOP_TIMEOUT_SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the selector worker to finish");
        }
    }

    public boolean isRunning() {
        return isRunning;
    }

    public long getServersProcessed() {
        return serversProcessed.get();
    }

    public long getServersFailed() {
        return serversFailed.get();
    }

    public Instant getLastPassAt() {
        return lastPassAt;
    }

    void runContinuous() {
        try {
            while (isRunning && !Thread.currentThread().isInterrupted()) {
                int processed = runPass();
                if (processed > 0) {
                    backoff.reset();
                    continue;
                }
                Duration delay = backoff.nextDelay();
                log.debug("No servers due for review, sleeping {} ms", delay.toMillis());
                Thread.sleep(delay.toMillis());
            }
        } catch (InterruptedException | SelectionCancelledException e) {
            Thread.currentThread().interrupt();
            log.info("Monitor selector loop cancelled");
        } finally {
            isRunning = false;
        }
    }

    /**
     * Run one pass over the servers that are due now.
     *
     * @return number of servers that were processed (not skipped)
     * @throws SelectionCancelledException when the calling thread is interrupted
     */
    public int runPass() {
        Instant now = clock.instant();
        List<Long> due = store.getServersDueForReview(now, config.getReviewBatchSize());
        lastPassAt = now;
        if (due.isEmpty()) {
            return 0;
        }
        log.debug("Found {} servers due for review", due.size());

        int processed = 0;
        for (Long serverId : due) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SelectionCancelledException(serverId);
            }
            try {
                ProcessResult result = transactionTemplate.execute(status -> processor.process(serverId, false));
                if (result != null && !result.isSkipped()) {
                    processed++;
                    serversProcessed.incrementAndGet();
                }
            } catch (SelectionCancelledException e) {
                throw e;
            } catch (ServerNotFoundException e) {
                serversFailed.incrementAndGet();
                log.warn("Server {} disappeared before it could be reviewed: {}", serverId, e.getMessage());
                rescheduleAfterFailure(serverId, now);
            } catch (RuntimeException e) {
                serversFailed.incrementAndGet();
                log.error("Failed to process server {}: {}", serverId, e.getMessage(), e);
                rescheduleAfterFailure(serverId, now);
            }
        }
        return processed;
    }

    /**
     * Push a failed server's next review out so it cannot hold the head of the due queue.
     * Runs in its own transaction because the failed one has been rolled back.
     */
    private void rescheduleAfterFailure(long serverId, Instant now) {
        Instant nextReview = now.plus(config.getUnchangedReviewInterval());
        try {
            transactionTemplate.executeWithoutResult(status ->
                    store.updateServersMonitorReview(serverId, now, nextReview, false));
            log.info("Rescheduled failed server {} for {}", serverId, nextReview);
        } catch (RuntimeException e) {
            log.error("Failed to reschedule server {} after a failed review: {}", serverId, e.getMessage(), e);
        }
    }

    /**
     * Process a single server now, whether or not it is due, and commit the result.
     */
    public ProcessResult processServer(long serverId) {
        log.info("Processing server {} on request", serverId);
        ProcessResult result = transactionTemplate.execute(status -> processor.process(serverId, true));
        if (result != null && !result.isSkipped()) {
            serversProcessed.incrementAndGet();
        }
        return result;
    }

    /**
     * Process a single server and roll every write back.
     */
    public ProcessResult simulate(long serverId) {
        log.info("Simulating selection for server {}", serverId);
        return transactionTemplate.execute(status -> {
            status.setRollbackOnly();
            return processor.process(serverId, true);
        });
    }
}
