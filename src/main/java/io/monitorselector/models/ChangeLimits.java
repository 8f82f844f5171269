package io.monitorselector.models;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Per-pass change budgets. Each category is budgeted separately so removals never
 * compete with promotions.
 */
@Data
@AllArgsConstructor
public class ChangeLimits {

    public static final int BASE_LIMIT = 2;
    public static final int BLOCKED_LIMIT = 3;
    public static final int BOOTSTRAP_LIMIT = 4;

    private int activeRemovals;

    private int testingRemovals;

    private int promotions;

    public static ChangeLimits forPass(int activeCount, int blockedCount) {
        int base = BASE_LIMIT;
        if (blockedCount > 1) {
            base = BLOCKED_LIMIT;
        }
        if (activeCount == 0) {
            base = BOOTSTRAP_LIMIT;
        }
        return new ChangeLimits(base, base, base);
    }
}
