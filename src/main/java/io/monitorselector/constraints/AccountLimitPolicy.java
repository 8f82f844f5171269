package io.monitorselector.constraints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.enums.ViolationType;
import io.monitorselector.models.AccountFlags;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ConstraintViolation;
import io.monitorselector.models.MonitorCandidate;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.monitorselector.config.Constants.DEFAULT_ACCOUNT_LIMIT_PER_SERVER;

/**
 * Builds per-account usage for a server and finds the assignments holding slots beyond the
 * account's caps.
 */
@Slf4j
public class AccountLimitPolicy {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AccountLimitPolicy(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Usage per account across the given assignment rows. Each account's per-server limit
     * comes from its flags; missing, malformed or non-positive values mean the default of 2.
     */
    public Map<Long, AccountLimit> buildLimits(List<MonitorCandidate> monitors) {
        Map<Long, AccountLimit> limits = new LinkedHashMap<>();
        for (MonitorCandidate monitor : monitors) {
            if (monitor.getAccountId() == null) {
                continue;
            }
            AccountLimit limit = limits.computeIfAbsent(monitor.getAccountId(),
                    accountId -> new AccountLimit(accountId, perServerLimit(accountId, monitor.getAccountFlags()), 0, 0));

            if (monitor.getServerStatus() == ServerScoreStatus.ACTIVE) {
                limit.setActiveCount(limit.getActiveCount() + 1);
            } else if (monitor.getServerStatus() == ServerScoreStatus.TESTING) {
                limit.setTestingCount(limit.getTestingCount() + 1);
            }
        }
        return limits;
    }

    /**
     * For every (account, active|testing) group above its cap, flag the worst performers
     * holding the excess slots with a {@code limit} violation. Active cap is L, testing cap L + 1.
     *
     * @param monitors assignment rows ordered best first
     * @param limits usage built by {@link #buildLimits}
     * @return violations keyed by monitor id
     */
    public Map<Long, ConstraintViolation> findExcessHolders(List<MonitorCandidate> monitors, Map<Long, AccountLimit> limits) {
        Map<Long, Map<ServerScoreStatus, List<MonitorCandidate>>> groups = new LinkedHashMap<>();
        for (MonitorCandidate monitor : monitors) {
            if (monitor.getAccountId() == null || monitor.getServerStatus() == null || !monitor.getServerStatus().isCounted()) {
                continue;
            }
            groups.computeIfAbsent(monitor.getAccountId(), id -> new LinkedHashMap<>())
                    .computeIfAbsent(monitor.getServerStatus(), status -> new ArrayList<>())
                    .add(monitor);
        }

        Map<Long, ConstraintViolation> violations = new HashMap<>();
        groups.forEach((accountId, byStatus) -> {
            AccountLimit limit = limits.get(accountId);
            int perServer = limit != null ? limit.getMaxPerServer() : DEFAULT_ACCOUNT_LIMIT_PER_SERVER;

            byStatus.forEach((status, holders) -> {
                int cap = status == ServerScoreStatus.ACTIVE ? perServer : perServer + 1;
                if (holders.size() <= cap) {
                    return;
                }
                List<MonitorCandidate> worstFirst = worstFirst(holders);
                int excess = holders.size() - cap;
                for (int i = 0; i < excess; i++) {
                    MonitorCandidate monitor = worstFirst.get(i);
                    ConstraintViolation violation = ConstraintViolation.of(ViolationType.LIMIT,
                            String.format("account %d exceeds %s limit (%d/%d)",
                                    accountId, status.getValue(), holders.size(), cap));
                    if (monitor.getViolationType() == ViolationType.LIMIT && monitor.getViolationSince() != null) {
                        violation = violation.withSince(monitor.getViolationSince());
                    } else {
                        violation = violation.withSince(clock.instant());
                    }
                    violations.put(monitor.getId(), violation);
                }
                log.debug("Account {} holds {} {} slots with cap {}, flagged {} worst performers",
                        accountId, holders.size(), status.getValue(), cap, excess);
            });
        });
        return violations;
    }

    /**
     * Highest priority value (worst) first. Rows without a valid priority count as worst;
     * ties keep the later position in the best-first input first.
     */
    private static List<MonitorCandidate> worstFirst(List<MonitorCandidate> holders) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < holders.size(); i++) {
            positions.add(i);
        }
        positions.sort(Comparator
                .comparingDouble((Integer i) -> effectivePriority(holders.get(i))).reversed()
                .thenComparing(Comparator.<Integer>reverseOrder()));
        List<MonitorCandidate> sorted = new ArrayList<>(holders.size());
        positions.forEach(i -> sorted.add(holders.get(i)));
        return sorted;
    }

    private static double effectivePriority(MonitorCandidate monitor) {
        return monitor.getPriority() < 0 ? Double.MAX_VALUE : monitor.getPriority();
    }

    int perServerLimit(long accountId, String flagsJson) {
        AccountFlags flags = parseFlags(accountId, flagsJson);
        return flags.getMonitorsPerServerLimit() > 0 ? flags.getMonitorsPerServerLimit() : DEFAULT_ACCOUNT_LIMIT_PER_SERVER;
    }

    /**
     * Parse accounts.flags. Malformed JSON is logged and treated as defaults
     * (limit 2, monitoring enabled).
     */
    public AccountFlags parseFlags(long accountId, String flagsJson) {
        if (flagsJson == null || flagsJson.trim().isEmpty()) {
            return new AccountFlags();
        }
        try {
            AccountFlags flags = objectMapper.readValue(flagsJson, AccountFlags.class);
            return flags != null ? flags : new AccountFlags();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse account flags for account {}: {}", accountId, e.getOriginalMessage());
            return new AccountFlags();
        }
    }
}
