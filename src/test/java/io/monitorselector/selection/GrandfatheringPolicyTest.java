package io.monitorselector.selection;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.ConstraintViolation;
import org.junit.jupiter.api.Test;

import static io.monitorselector.TestMonitors.monitor;
import static org.assertj.core.api.Assertions.assertThat;

class GrandfatheringPolicyTest {

    private final GrandfatheringPolicy policy = new GrandfatheringPolicy();

    @Test
    void testLimitAndDiversityAreTolerated() {
        assertThat(policy.isGrandfathered(monitor(1, ServerScoreStatus.ACTIVE).build(),
                ConstraintViolation.of(ViolationType.LIMIT, "over"))).isTrue();
        assertThat(policy.isGrandfathered(monitor(2, ServerScoreStatus.TESTING).build(),
                ConstraintViolation.of(ViolationType.NETWORK_DIVERSITY, "same /20"))).isTrue();
    }

    @Test
    void testSubnetAndAccountAreNeverTolerated() {
        assertThat(policy.isGrandfathered(monitor(1, ServerScoreStatus.ACTIVE).build(),
                ConstraintViolation.of(ViolationType.NETWORK_SAME_SUBNET, "same /24"))).isFalse();
        assertThat(policy.isGrandfathered(monitor(2, ServerScoreStatus.ACTIVE).build(),
                ConstraintViolation.of(ViolationType.ACCOUNT, "same account"))).isFalse();
    }

    @Test
    void testOnlyAssignmentsHoldingASlotQualify() {
        ConstraintViolation limit = ConstraintViolation.of(ViolationType.LIMIT, "over");
        assertThat(policy.isGrandfathered(monitor(1, ServerScoreStatus.CANDIDATE).build(), limit)).isFalse();
        assertThat(policy.isGrandfathered(monitor(2, ServerScoreStatus.NEW).build(), limit)).isFalse();
        assertThat(policy.isGrandfathered(monitor(3, ServerScoreStatus.ACTIVE).build(), ConstraintViolation.none())).isFalse();
    }
}
