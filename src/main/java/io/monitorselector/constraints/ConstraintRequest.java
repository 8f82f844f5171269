package io.monitorselector.constraints;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ServerInfo;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * A prospective assignment to validate: the monitor, the server, the target status and the
 * assignment state it is checked against.
 */
@Getter
@Builder
public class ConstraintRequest {

    private final MonitorCandidate monitor;

    private final ServerInfo server;

    // every assignment row of the server, with the statuses planned so far in the pass
    private final List<MonitorCandidate> assignedMonitors;

    private final ServerScoreStatus targetStatus;

    // keyed by account id; may be a working copy owned by the current pass
    private final Map<Long, AccountLimit> accountLimits;
}
