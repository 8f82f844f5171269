package io.monitorselector.store;

import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.PauseReason;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ServerInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * {@link MonitorStore} over the pool's MySQL schema.
 *
 * Timestamps are always supplied by the caller so the selector's clock is the only time source.
 */
@Slf4j
@Repository
public class JdbcMonitorStore implements MonitorStore {

    static final String SERVERS_DUE_SQL =
            "SELECT server_id FROM servers_monitor_review"
            + " WHERE next_review IS NULL OR next_review <= ?"
            + " ORDER BY next_review, server_id LIMIT ?";

    static final String LOCK_REVIEW_SQL =
            "SELECT next_review FROM servers_monitor_review WHERE server_id = ? FOR UPDATE";

    static final String SERVER_SQL =
            "SELECT id, ip, ip_version, account_id FROM servers WHERE id = ?";

    static final String MONITOR_PRIORITY_SQL =
            "SELECT m.id, m.id_token, m.tls_name, m.ip AS monitor_ip, m.account_id, m.status AS monitor_status,"
            + " a.flags AS account_flags,"
            + " ss.status, ss.constraint_violation_type, ss.constraint_violation_since,"
            + " ss.last_constraint_check, ss.pause_reason,"
            + " ls.avg_rtt, ls.sample_count, ls.healthy, ls.monitor_priority"
            + " FROM server_scores ss"
            + " INNER JOIN monitors m ON m.id = ss.monitor_id"
            + " LEFT JOIN accounts a ON a.id = m.account_id"
            + " LEFT JOIN ("
            + "   SELECT monitor_id,"
            + "     AVG(rtt) / 1000 AS avg_rtt,"
            + "     COUNT(*) AS sample_count,"
            + "     CASE WHEN AVG(step) >= 0 THEN 1 ELSE 0 END AS healthy,"
            + "     ROUND((AVG(rtt) / 1000) * (1 + (2 * (1 - AVG(step))))) AS monitor_priority"
            + "   FROM log_scores"
            + "   WHERE server_id = ? AND ts > ?"
            + "   GROUP BY monitor_id"
            + " ) ls ON ls.monitor_id = ss.monitor_id"
            + " WHERE ss.server_id = ? AND ss.status IN ('candidate', 'testing', 'active', 'paused')"
            + " ORDER BY COALESCE(ls.healthy, 0) DESC, COALESCE(ls.monitor_priority, 999999), m.id";

    static final String UPDATE_STATUS_SQL =
            "UPDATE server_scores SET status = ? WHERE server_id = ? AND monitor_id = ?";

    static final String UPDATE_VIOLATION_SQL =
            "UPDATE server_scores SET constraint_violation_type = ?, constraint_violation_since = ?"
            + " WHERE server_id = ? AND monitor_id = ?";

    static final String CLEAR_VIOLATION_SQL =
            "UPDATE server_scores SET constraint_violation_type = NULL, constraint_violation_since = NULL"
            + " WHERE server_id = ? AND monitor_id = ?";

    static final String UPDATE_LAST_CHECK_SQL =
            "UPDATE server_scores SET last_constraint_check = ? WHERE server_id = ? AND monitor_id = ?";

    static final String UPDATE_PAUSE_REASON_SQL =
            "UPDATE server_scores SET pause_reason = ? WHERE server_id = ? AND monitor_id = ?";

    static final String UPDATE_REVIEW_SQL =
            "UPDATE servers_monitor_review SET last_review = ?, next_review = ? WHERE server_id = ?";

    static final String UPDATE_REVIEW_CHANGED_SQL =
            "UPDATE servers_monitor_review SET last_review = ?, next_review = ?, last_change = ? WHERE server_id = ?";

    static final String INSERT_REVIEW_SQL =
            "INSERT INTO servers_monitor_review (server_id, last_review, next_review, last_change) VALUES (?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcMonitorStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Long> getServersDueForReview(Instant now, int limit) {
        return jdbcTemplate.queryForList(SERVERS_DUE_SQL, Long.class, Timestamp.from(now), limit);
    }

    @Override
    public boolean lockServerForReview(long serverId, Instant now) {
        List<Timestamp> rows = jdbcTemplate.query(LOCK_REVIEW_SQL, (rs, i) -> rs.getTimestamp(1), serverId);
        if (rows.isEmpty() || rows.get(0) == null) {
            return true;
        }
        return !rows.get(0).toInstant().isAfter(now);
    }

    @Override
    public ServerInfo getServer(long serverId) {
        List<ServerInfo> servers = jdbcTemplate.query(SERVER_SQL, (rs, i) -> ServerInfo.builder()
                .id(rs.getLong("id"))
                .ip(rs.getString("ip"))
                .ipVersion(rs.getString("ip_version"))
                .accountId(nullableLong(rs, "account_id"))
                .build(), serverId);
        if (servers.isEmpty()) {
            throw new ServerNotFoundException(serverId);
        }
        return servers.get(0);
    }

    @Override
    public List<MonitorCandidate> getMonitorPriority(long serverId, Instant telemetrySince) {
        return jdbcTemplate.query(MONITOR_PRIORITY_SQL, MONITOR_ROW_MAPPER,
                serverId, Timestamp.from(telemetrySince), serverId);
    }

    @Override
    public void updateServerScoreStatus(long serverId, long monitorId, ServerScoreStatus status) {
        int rows = jdbcTemplate.update(UPDATE_STATUS_SQL, status.getValue(), serverId, monitorId);
        if (rows != 1) {
            throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(UPDATE_STATUS_SQL, 1, rows);
        }
    }

    @Override
    public void updateServerScoreConstraintViolation(long serverId, long monitorId, ViolationType type, Instant since) {
        jdbcTemplate.update(UPDATE_VIOLATION_SQL, type.getValue(), Timestamp.from(since), serverId, monitorId);
    }

    @Override
    public void clearServerScoreConstraintViolation(long serverId, long monitorId) {
        jdbcTemplate.update(CLEAR_VIOLATION_SQL, serverId, monitorId);
    }

    @Override
    public void updateServerScoreLastConstraintCheck(long serverId, long monitorId, Instant checkedAt) {
        jdbcTemplate.update(UPDATE_LAST_CHECK_SQL, Timestamp.from(checkedAt), serverId, monitorId);
    }

    @Override
    public void updateServerScorePauseReason(long serverId, long monitorId, PauseReason reason) {
        jdbcTemplate.update(UPDATE_PAUSE_REASON_SQL, reason == null ? null : reason.getValue(), serverId, monitorId);
    }

    @Override
    public void updateServersMonitorReview(long serverId, Instant reviewedAt, Instant nextReview, boolean changed) {
        Timestamp reviewed = Timestamp.from(reviewedAt);
        Timestamp next = Timestamp.from(nextReview);
        int rows = changed
                ? jdbcTemplate.update(UPDATE_REVIEW_CHANGED_SQL, reviewed, next, reviewed, serverId)
                : jdbcTemplate.update(UPDATE_REVIEW_SQL, reviewed, next, serverId);
        if (rows == 0) {
            log.debug("No review row for server {}, creating one", serverId);
            jdbcTemplate.update(INSERT_REVIEW_SQL, serverId, reviewed, next, changed ? reviewed : null);
        }
    }

    static final RowMapper<MonitorCandidate> MONITOR_ROW_MAPPER = (rs, rowNum) -> {
        long sampleCount = rs.getLong("sample_count");
        double priority = rs.getDouble("monitor_priority");
        boolean hasPriority = !rs.wasNull();
        double rtt = rs.getDouble("avg_rtt");

        return MonitorCandidate.builder()
                .id(rs.getLong("id"))
                .idToken(rs.getString("id_token"))
                .tlsName(rs.getString("tls_name"))
                .ip(rs.getString("monitor_ip"))
                .accountId(nullableLong(rs, "account_id"))
                .accountFlags(rs.getString("account_flags"))
                .globalStatus(MonitorStatus.fromString(rs.getString("monitor_status")))
                .serverStatus(ServerScoreStatus.fromString(rs.getString("status")))
                .hasMetrics(sampleCount > 0)
                .healthy(rs.getInt("healthy") > 0)
                .rtt(rtt)
                .priority(hasPriority ? priority : -1)
                .count(sampleCount)
                .violationType(violationType(rs.getString("constraint_violation_type")))
                .violationSince(instant(rs.getTimestamp("constraint_violation_since")))
                .lastConstraintCheck(instant(rs.getTimestamp("last_constraint_check")))
                .pauseReason(PauseReason.fromString(rs.getString("pause_reason")))
                .build();
    };

    private static ViolationType violationType(String value) {
        ViolationType type = ViolationType.fromString(value);
        return type == null ? ViolationType.NONE : type;
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
