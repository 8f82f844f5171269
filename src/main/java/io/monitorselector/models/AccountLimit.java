package io.monitorselector.models;

import io.monitorselector.enums.ServerScoreStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Per-account cap and current usage on one server.
 *
 * Caps by target status: active below maxPerServer, testing below maxPerServer + 1,
 * and active + testing below maxPerServer + 1. Candidates are not counted.
 */
@Data
@AllArgsConstructor
public class AccountLimit {

    private long accountId;

    private int maxPerServer;

    private int activeCount;

    private int testingCount;

    public AccountLimit copy() {
        return new AccountLimit(accountId, maxPerServer, activeCount, testingCount);
    }

    public int getMaxActive() {
        return maxPerServer;
    }

    public int getMaxTesting() {
        return maxPerServer + 1;
    }

    public int getMaxTotal() {
        return maxPerServer + 1;
    }

    /**
     * Move one slot from {@code from} to {@code to}. Counts never drop below zero.
     */
    public void applyTransition(ServerScoreStatus from, ServerScoreStatus to) {
        if (from == ServerScoreStatus.ACTIVE && activeCount > 0) {
            activeCount--;
        } else if (from == ServerScoreStatus.TESTING && testingCount > 0) {
            testingCount--;
        }

        if (to == ServerScoreStatus.ACTIVE) {
            activeCount++;
        } else if (to == ServerScoreStatus.TESTING) {
            testingCount++;
        }
    }
}
