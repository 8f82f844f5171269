package io.monitorselector.selection;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;

/**
 * Decides whether a violation on an existing assignment is tolerated (the monitor drains out
 * gradually) or must be enforced in this pass.
 */
public class GrandfatheringPolicy {

    public boolean isGrandfathered(MonitorCandidate monitor, ConstraintViolation violation) {
        if (violation == null || violation.isNone()) {
            return false;
        }
        ServerScoreStatus status = monitor.getServerStatus();
        if (status != ServerScoreStatus.ACTIVE && status != ServerScoreStatus.TESTING) {
            return false;
        }

        switch (violation.getType()) {
            case LIMIT:
            case NETWORK_DIVERSITY:
                return true;
            case NETWORK_SAME_SUBNET:
            case ACCOUNT:
            default:
                return false;
        }
    }
}
