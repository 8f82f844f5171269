package io.monitorselector.constraints;

import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chains the constraint deciders in a fixed order and returns the first violation.
 *
 * Order: same subnet, same account, account limit, network diversity. A returned violation
 * keeps the recorded {@code since} of the assignment when the type is unchanged, otherwise
 * it starts now.
 */
@Slf4j
public class ConstraintEngine {

    private final Map<Class<? extends ConstraintDecider>, ConstraintDecider> availableDeciders;

    private final List<ConstraintDecider> enabledDeciders;

    private final Clock clock;

    public ConstraintEngine(Clock clock) {
        this.clock = clock;
        this.availableDeciders = new LinkedHashMap<>();
        this.enabledDeciders = new ArrayList<>();

        registerDecider(SameSubnetDecider.class, new SameSubnetDecider());
        registerDecider(SameAccountDecider.class, new SameAccountDecider());
        registerDecider(AccountLimitDecider.class, new AccountLimitDecider());
        registerDecider(NetworkDiversityDecider.class, new NetworkDiversityDecider());
        enabledDeciders.addAll(availableDeciders.values());
    }

    /**
     * Full check for a prospective status, including per-account limits.
     */
    public ConstraintViolation check(ConstraintRequest request) {
        return evaluate(request, false);
    }

    /**
     * Check everything except per-account limits, which are enforced across the whole
     * server by {@link AccountLimitPolicy#findExcessHolders}.
     */
    public ConstraintViolation checkExcludingLimits(ConstraintRequest request) {
        return evaluate(request, true);
    }

    private ConstraintViolation evaluate(ConstraintRequest request, boolean skipLimits) {
        for (ConstraintDecider decider : enabledDeciders) {
            if (!decider.isEnabled()) continue;
            if (skipLimits && decider instanceof AccountLimitDecider) continue;

            ConstraintViolation violation = decider.check(request);
            if (violation.isPresent()) {
                log.trace("{} rejected monitor {} for {} on server {}: {}", decider.getName(),
                        request.getMonitor().getId(), request.getTargetStatus(), request.getServer().getId(),
                        violation.getDetails());
                return stampSince(request.getMonitor(), violation);
            }
        }
        return ConstraintViolation.none();
    }

    ConstraintViolation stampSince(MonitorCandidate monitor, ConstraintViolation violation) {
        if (monitor.getViolationType() == violation.getType() && monitor.getViolationSince() != null) {
            return violation.withSince(monitor.getViolationSince());
        }
        return violation.withSince(clock.instant());
    }

    /**
     * Enable a decider.
     */
    public void enableDecider(Class<? extends ConstraintDecider> deciderClass) {
        ConstraintDecider decider = availableDeciders.get(deciderClass);
        if (decider != null && !enabledDeciders.contains(decider)) {
            decider.setEnabled(true);
            // keep registration order so checks stay deterministic
            enabledDeciders.clear();
            availableDeciders.values().stream().filter(ConstraintDecider::isEnabled).forEach(enabledDeciders::add);
        }
    }

    /**
     * Disable a decider.
     */
    public void disableDecider(Class<? extends ConstraintDecider> deciderClass) {
        ConstraintDecider decider = availableDeciders.get(deciderClass);
        if (decider != null) {
            decider.setEnabled(false);
            enabledDeciders.remove(decider);
        }
    }

    /**
     * Register a decider.
     */
    public void registerDecider(Class<? extends ConstraintDecider> deciderClass, ConstraintDecider decider) {
        availableDeciders.put(deciderClass, decider);
    }
}
