package io.monitorselector.constraints;

import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.util.NetworkUtils;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.util.Optional;

import static io.monitorselector.config.Constants.DIVERSITY_PREFIX_V4;
import static io.monitorselector.config.Constants.DIVERSITY_PREFIX_V6;

/**
 * Keeps a server's committee spread across networks: a monitor conflicts with an existing
 * active or testing assignment in the same IPv4 /20 or IPv6 /44.
 *
 * Pair rules (target status vs. existing status):
 * - active vs. active or testing: conflict
 * - testing vs. active or testing: conflict
 * - anything else: pass
 */
@Slf4j
public class NetworkDiversityDecider implements ConstraintDecider {

    private boolean enabled = true;

    @Override
    public ConstraintViolation check(ConstraintRequest request) {
        ServerScoreStatus target = request.getTargetStatus();
        if (target != ServerScoreStatus.ACTIVE && target != ServerScoreStatus.TESTING) {
            return ConstraintViolation.none();
        }

        MonitorCandidate monitor = request.getMonitor();
        Optional<InetAddress> parsed = NetworkUtils.parse(monitor.getIp());
        if (parsed.isEmpty() || request.getAssignedMonitors() == null) {
            return ConstraintViolation.none();
        }
        InetAddress candidate = parsed.get();
        int prefixLength = NetworkUtils.isIpv4(candidate) ? DIVERSITY_PREFIX_V4 : DIVERSITY_PREFIX_V6;

        for (MonitorCandidate existing : request.getAssignedMonitors()) {
            if (existing.getId() == monitor.getId()) {
                continue;
            }
            ServerScoreStatus existingStatus = existing.getServerStatus();
            if (existingStatus == null || !existingStatus.isCounted()) {
                continue;
            }
            Optional<InetAddress> existingAddress = NetworkUtils.parse(existing.getIp());
            if (existingAddress.isEmpty() || !NetworkUtils.sameFamily(candidate, existingAddress.get())) {
                continue;
            }
            if (NetworkUtils.samePrefix(candidate, existingAddress.get(), prefixLength)) {
                log.trace("NetworkDiversity: monitor {} shares /{} with {} monitor {}",
                        monitor.getId(), prefixLength, existingStatus.getValue(), existing.getId());
                return ConstraintViolation.of(ViolationType.NETWORK_DIVERSITY,
                        String.format("monitor would conflict with existing %s monitor in same /%d network (%s)",
                                existingStatus.getValue(), prefixLength, NetworkUtils.toCidr(candidate, prefixLength)));
            }
        }
        return ConstraintViolation.none();
    }

    @Override
    public String getName() {
        return "NetworkDiversityDecider";
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
