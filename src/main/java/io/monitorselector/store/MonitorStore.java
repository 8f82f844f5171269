package io.monitorselector.store;

import io.monitorselector.enums.PauseReason;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ServerInfo;

import java.time.Instant;
import java.util.List;

/**
 * Store operations used by the selector. All calls take part in the caller's transaction;
 * failures surface as Spring {@code DataAccessException}s.
 */
public interface MonitorStore {

    /**
     * Servers whose next review is due, oldest deadline first.
     */
    List<Long> getServersDueForReview(Instant now, int limit);

    /**
     * Lock the server's review row for the rest of the transaction.
     *
     * @return whether the server is still due at {@code now}
     */
    boolean lockServerForReview(long serverId, Instant now);

    /**
     * @throws ServerNotFoundException when the server does not exist
     */
    ServerInfo getServer(long serverId);

    /**
     * Every candidate, testing, active or paused assignment of the server with monitor,
     * account and telemetry data since {@code telemetrySince}, best first.
     */
    List<MonitorCandidate> getMonitorPriority(long serverId, Instant telemetrySince);

    void updateServerScoreStatus(long serverId, long monitorId, ServerScoreStatus status);

    void updateServerScoreConstraintViolation(long serverId, long monitorId, ViolationType type, Instant since);

    void clearServerScoreConstraintViolation(long serverId, long monitorId);

    void updateServerScoreLastConstraintCheck(long serverId, long monitorId, Instant checkedAt);

    void updateServerScorePauseReason(long serverId, long monitorId, PauseReason reason);

    /**
     * Record a review and schedule the next one; {@code changed} also stamps the last change.
     */
    void updateServersMonitorReview(long serverId, Instant reviewedAt, Instant nextReview, boolean changed);
}
