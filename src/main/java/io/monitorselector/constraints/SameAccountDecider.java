package io.monitorselector.constraints;

import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.ConstraintViolation;

import java.util.Objects;

/**
 * Rejects a monitor owned by the same account as the server.
 */
public class SameAccountDecider implements ConstraintDecider {

    private boolean enabled = true;

    @Override
    public ConstraintViolation check(ConstraintRequest request) {
        Long monitorAccount = request.getMonitor().getAccountId();
        Long serverAccount = request.getServer().getAccountId();
        if (monitorAccount != null && serverAccount != null && Objects.equals(monitorAccount, serverAccount)) {
            return ConstraintViolation.of(ViolationType.ACCOUNT, "monitor from same account as server");
        }
        return ConstraintViolation.none();
    }

    @Override
    public String getName() {
        return "SameAccountDecider";
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
