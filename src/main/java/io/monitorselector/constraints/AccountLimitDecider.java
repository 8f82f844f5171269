package io.monitorselector.constraints;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;
import lombok.extern.slf4j.Slf4j;

import static io.monitorselector.config.Constants.DEFAULT_ACCOUNT_LIMIT_PER_SERVER;

/**
 * Per-account cardinality caps for the target status.
 *
 * With L = the account's per-server limit and a / t the account's active / testing counts
 * excluding the monitor itself:
 * <ul>
 *   <li>active: a &lt; L and a + t &lt; L + 1</li>
 *   <li>testing: t &lt; L + 1 and a + t &lt; L + 1</li>
 *   <li>anything else: no cap</li>
 * </ul>
 */
@Slf4j
public class AccountLimitDecider implements ConstraintDecider {

    private boolean enabled = true;

    @Override
    public ConstraintViolation check(ConstraintRequest request) {
        MonitorCandidate monitor = request.getMonitor();
        ServerScoreStatus target = request.getTargetStatus();
        if (monitor.getAccountId() == null || (target != ServerScoreStatus.ACTIVE && target != ServerScoreStatus.TESTING)) {
            return ConstraintViolation.none();
        }

        AccountLimit limit = request.getAccountLimits() == null ? null : request.getAccountLimits().get(monitor.getAccountId());
        if (limit == null) {
            log.debug("AccountLimit: no usage loaded for account {}, assuming empty with default limit",
                    monitor.getAccountId());
            limit = new AccountLimit(monitor.getAccountId(), DEFAULT_ACCOUNT_LIMIT_PER_SERVER, 0, 0);
        }

        int activeCount = limit.getActiveCount();
        int testingCount = limit.getTestingCount();
        // don't count self
        if (monitor.getServerStatus() == ServerScoreStatus.ACTIVE) {
            activeCount--;
        } else if (monitor.getServerStatus() == ServerScoreStatus.TESTING) {
            testingCount--;
        }
        activeCount = Math.max(0, activeCount);
        testingCount = Math.max(0, testingCount);
        int total = activeCount + testingCount;

        if (target == ServerScoreStatus.ACTIVE && activeCount >= limit.getMaxActive()) {
            return violation(limit, "active", activeCount, limit.getMaxActive());
        }
        if (target == ServerScoreStatus.TESTING && testingCount >= limit.getMaxTesting()) {
            return violation(limit, "testing", testingCount, limit.getMaxTesting());
        }
        if (total >= limit.getMaxTotal()) {
            return violation(limit, "total", total, limit.getMaxTotal());
        }
        return ConstraintViolation.none();
    }

    private static ConstraintViolation violation(AccountLimit limit, String category, int count, int max) {
        return ConstraintViolation.of(ViolationType.LIMIT,
                String.format("account %d at %s limit (%d/%d)", limit.getAccountId(), category, count, max));
    }

    @Override
    public String getName() {
        return "AccountLimitDecider";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
