package io.monitorselector.constraints;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ServerInfo;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AccountLimitDeciderTest {

    private static final long ACCOUNT = 7L;

    private final AccountLimitDecider decider = new AccountLimitDecider();

    @Test
    void testActivePromotionBlockedAtActiveCap() {
        // limit 2, two active already
        ConstraintViolation violation = decider.check(
                request(ServerScoreStatus.TESTING, ServerScoreStatus.ACTIVE, new AccountLimit(ACCOUNT, 2, 2, 1)));

        assertThat(violation.getType()).isEqualTo(ViolationType.LIMIT);
        assertThat(violation.getDetails()).contains("active limit (2/2)");
    }

    @Test
    void testActivePromotionExcludesSelfFromCount() {
        // the monitor is one of the two active, so moving it to active again stays within the cap
        ConstraintViolation violation = decider.check(
                request(ServerScoreStatus.ACTIVE, ServerScoreStatus.ACTIVE, new AccountLimit(ACCOUNT, 2, 2, 0)));

        assertThat(violation.isNone()).isTrue();
    }

    @Test
    void testTestingPromotionAllowedUpToLimitPlusOneTotal() {
        // one active + one testing = 2 < 3
        assertThat(decider.check(
                request(ServerScoreStatus.CANDIDATE, ServerScoreStatus.TESTING, new AccountLimit(ACCOUNT, 2, 1, 1))).isNone())
                .isTrue();
        // one active + two testing = 3, total cap reached
        ConstraintViolation violation = decider.check(
                request(ServerScoreStatus.CANDIDATE, ServerScoreStatus.TESTING, new AccountLimit(ACCOUNT, 2, 1, 2)));
        assertThat(violation.getType()).isEqualTo(ViolationType.LIMIT);
        assertThat(violation.getDetails()).contains("total");
    }

    @Test
    void testTestingCapIsLimitPlusOne() {
        ConstraintViolation violation = decider.check(
                request(ServerScoreStatus.CANDIDATE, ServerScoreStatus.TESTING, new AccountLimit(ACCOUNT, 1, 0, 2)));

        assertThat(violation.getType()).isEqualTo(ViolationType.LIMIT);
        assertThat(violation.getDetails()).contains("testing limit (2/2)");
    }

    @Test
    void testMissingUsageFallsBackToDefaultLimit() {
        ConstraintViolation violation = decider.check(ConstraintRequest.builder()
                .monitor(MonitorCandidate.builder().id(1).accountId(ACCOUNT).serverStatus(ServerScoreStatus.CANDIDATE).build())
                .server(ServerInfo.builder().id(10).build())
                .targetStatus(ServerScoreStatus.ACTIVE)
                .accountLimits(Map.of())
                .build());

        assertThat(violation.isNone()).isTrue();
    }

    @Test
    void testNoCapForOtherTargetsOrAccountlessMonitors() {
        AccountLimit full = new AccountLimit(ACCOUNT, 1, 5, 5);
        assertThat(decider.check(request(ServerScoreStatus.ACTIVE, ServerScoreStatus.CANDIDATE, full)).isNone()).isTrue();

        ConstraintViolation accountless = decider.check(ConstraintRequest.builder()
                .monitor(MonitorCandidate.builder().id(1).serverStatus(ServerScoreStatus.CANDIDATE).build())
                .server(ServerInfo.builder().id(10).build())
                .targetStatus(ServerScoreStatus.ACTIVE)
                .accountLimits(Map.of(ACCOUNT, full))
                .build());
        assertThat(accountless.isNone()).isTrue();
    }

    private static ConstraintRequest request(ServerScoreStatus current, ServerScoreStatus target, AccountLimit limit) {
        return ConstraintRequest.builder()
                .monitor(MonitorCandidate.builder().id(1).accountId(ACCOUNT).serverStatus(current).build())
                .server(ServerInfo.builder().id(10).build())
                .targetStatus(target)
                .accountLimits(Map.of(ACCOUNT, limit))
                .build();
    }
}
