package io.monitorselector.constraints;

import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.util.NetworkUtils;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.util.Optional;

import static io.monitorselector.config.Constants.SAME_SUBNET_PREFIX_V4;
import static io.monitorselector.config.Constants.SAME_SUBNET_PREFIX_V6;

/**
 * Rejects a monitor that shares an IPv4 /24 or IPv6 /48 with the server it would watch.
 *
 * Missing or unparsable addresses cannot be checked and pass. Mixed address families pass.
 */
@Slf4j
public class SameSubnetDecider implements ConstraintDecider {

    private boolean enabled = true;

    @Override
    public ConstraintViolation check(ConstraintRequest request) {
        String monitorIp = request.getMonitor().getIp();
        String serverIp = request.getServer().getIp();

        Optional<InetAddress> monitorAddress = NetworkUtils.parse(monitorIp);
        Optional<InetAddress> serverAddress = NetworkUtils.parse(serverIp);
        if (monitorAddress.isEmpty() || serverAddress.isEmpty()) {
            if (!isBlank(monitorIp) && !isBlank(serverIp)) {
                log.debug("SameSubnet: cannot parse monitor {} ip '{}' or server {} ip '{}', allowing",
                        request.getMonitor().getId(), monitorIp, request.getServer().getId(), serverIp);
            }
            return ConstraintViolation.none();
        }

        InetAddress monitor = monitorAddress.get();
        InetAddress server = serverAddress.get();
        if (!NetworkUtils.sameFamily(monitor, server)) {
            return ConstraintViolation.none();
        }

        int prefixLength = NetworkUtils.isIpv4(monitor) ? SAME_SUBNET_PREFIX_V4 : SAME_SUBNET_PREFIX_V6;
        if (NetworkUtils.samePrefix(monitor, server, prefixLength)) {
            return ConstraintViolation.of(ViolationType.NETWORK_SAME_SUBNET,
                    "monitor and server in same /" + prefixLength + " network");
        }
        return ConstraintViolation.none();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String getName() {
        return "SameSubnetDecider";
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
