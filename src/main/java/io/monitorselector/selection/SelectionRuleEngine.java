package io.monitorselector.selection;

import io.monitorselector.config.SelectionSettings;
import io.monitorselector.constraints.ConstraintEngine;
import io.monitorselector.enums.CandidateState;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.ChangeLimits;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.ServerInfo;
import io.monitorselector.models.StatusChange;
import io.monitorselector.selection.rules.ActiveExcessDemotionRule;
import io.monitorselector.selection.rules.BootstrapPromotionRule;
import io.monitorselector.selection.rules.CandidateToTestingPromotionRule;
import io.monitorselector.selection.rules.GradualRemovalRule;
import io.monitorselector.selection.rules.ImmediateBlockingRule;
import io.monitorselector.selection.rules.OutOfOrderRule;
import io.monitorselector.selection.rules.TestingPoolTrimRule;
import io.monitorselector.selection.rules.TestingToActivePromotionRule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the selection rules for one server in their fixed order.
 *
 * <ol>
 *   <li>immediate blocking</li>
 *   <li>gradual removal of monitors classified out</li>
 *   <li>active excess demotion</li>
 *   <li>testing to active promotion (and active-testing swaps)</li>
 *   <li>candidate to testing promotion (and performance replacement)</li>
 *   <li>dynamic testing pool trim</li>
 *   <li>bootstrap of an empty testing pool</li>
 *   <li>out-of-order detection (no changes)</li>
 * </ol>
 *
 * Paused assignments are never passed to the rules.
 */
@Slf4j
public class SelectionRuleEngine {

    @Getter
    private final SelectionSettings settings;

    private final List<SelectionRule> rules;

    public SelectionRuleEngine(ConstraintEngine constraintEngine, SelectionSettings settings) {
        this.settings = settings;

        PromotionGate promotionGate = new PromotionGate(constraintEngine);
        PerformanceReplacer replacer = new PerformanceReplacer(promotionGate);
        this.rules = List.of(
                new ImmediateBlockingRule(),
                new GradualRemovalRule(),
                new ActiveExcessDemotionRule(),
                new TestingToActivePromotionRule(promotionGate, replacer),
                new CandidateToTestingPromotionRule(promotionGate, replacer),
                new TestingPoolTrimRule(),
                new BootstrapPromotionRule(promotionGate),
                new OutOfOrderRule(new OutOfOrderDetector()));
    }

    /**
     * Plan the status changes for one server.
     *
     * @param evaluated classified monitors, best first
     * @param assignments every assignment row of the server, best first
     * @param accountLimits per-account usage; copied, never modified
     */
    public SelectionPlan plan(ServerInfo server, List<EvaluatedMonitor> evaluated,
                              List<MonitorCandidate> assignments, Map<Long, AccountLimit> accountLimits) {
        List<EvaluatedMonitor> active = new ArrayList<>();
        List<EvaluatedMonitor> testing = new ArrayList<>();
        List<EvaluatedMonitor> candidates = new ArrayList<>();
        for (EvaluatedMonitor em : evaluated) {
            switch (em.getMonitor().getServerStatus()) {
                case ACTIVE:
                    active.add(em);
                    break;
                case TESTING:
                    testing.add(em);
                    break;
                case CANDIDATE:
                    candidates.add(em);
                    break;
                default:
                    break;
            }
        }

        int total = active.size() + testing.size() + candidates.size();
        int blocked = count(active, CandidateState.BLOCK) + count(testing, CandidateState.BLOCK)
                + count(candidates, CandidateState.BLOCK);
        int healthyActive = countHealthy(active);
        int healthyTesting = countHealthy(testing);
        ChangeLimits limits = ChangeLimits.forPass(active.size(), blocked);
        int target = settings.getTargetActive();

        log.debug("Monitor counts on server {}: active={}, healthyActive={}, testing={}, healthyTesting={}, "
                        + "candidates={}, blocked={}, limits={}",
                server.getId(), active.size(), healthyActive, testing.size(), healthyTesting,
                candidates.size(), blocked, limits);

        boolean anyOut = count(active, CandidateState.OUT) + count(testing, CandidateState.OUT)
                + count(candidates, CandidateState.OUT) > 0;
        boolean healthyCandidates = candidates.stream()
                .anyMatch(em -> em.isState(CandidateState.IN) && em.getMonitor().isHealthy());
        if (target > total && healthyActive == 0 && healthyTesting == 0 && !anyOut && !healthyCandidates) {
            log.warn("Emergency on server {}: not enough healthy monitors available (target={}, total={}), no changes",
                    server.getId(), target, total);
            return new SelectionPlan(List.of(), active.size(), testing.size(), active.isEmpty(), true);
        }

        RuleContext context = new RuleContext(server, settings, limits, active, testing, candidates,
                assignments, accountLimits);
        applySafetyFloor(context, healthyActive);

        for (SelectionRule rule : rules) {
            List<StatusChange> changes = rule.apply(context);
            if (!changes.isEmpty()) {
                log.debug("Rule {} planned {} changes on server {} (active={}, testing={})",
                        rule.getName(), changes.size(), server.getId(), context.getActiveCount(), context.getTestingCount());
            }
        }

        validate(context);

        log.debug("Planned changes on server {}: total={}, finalActiveCount={}, finalTestingCount={}",
                server.getId(), context.getChanges().size(), context.getActiveCount(), context.getTestingCount());
        return new SelectionPlan(List.copyOf(context.getChanges()), context.getActiveCount(),
                context.getTestingCount(), context.isEmergencyOverride(), false);
    }

    void applySafetyFloor(RuleContext context, int healthyActive) {
        int activeCount = context.getActiveCount();
        int target = settings.getTargetActive();

        if (activeCount > 0 && activeCount <= target - 2 && healthyActive < target) {
            context.setProtectActivePerformance(true);
        }

        int budget = context.getLimits().getActiveRemovals();
        if (activeCount > 0 && budget >= activeCount) {
            log.warn("Limiting active removals on server {} to keep an active monitor: requested={}, allowed={}",
                    context.getServer().getId(), budget, activeCount - 1);
            budget = activeCount - 1;
        }
        context.setActiveRemovalBudget(budget);
    }

    private void validate(RuleContext context) {
        long serverId = context.getServer().getId();
        if (context.getActiveCount() > settings.getTargetActive()) {
            log.error("CRITICAL: active monitor count exceeds target after selection: server={}, finalActiveCount={}, target={}",
                    serverId, context.getActiveCount(), settings.getTargetActive());
        }
        int testingTarget = settings.dynamicTestingTarget(context.getActiveCount());
        if (context.getTestingCount() > testingTarget) {
            log.error("CRITICAL: testing monitor count exceeds target after selection: server={}, finalTestingCount={}, target={}",
                    serverId, context.getTestingCount(), testingTarget);
        }
    }

    private static int count(List<EvaluatedMonitor> monitors, CandidateState state) {
        int count = 0;
        for (EvaluatedMonitor em : monitors) {
            if (em.isState(state)) count++;
        }
        return count;
    }

    private static int countHealthy(List<EvaluatedMonitor> monitors) {
        int count = 0;
        for (EvaluatedMonitor em : monitors) {
            if (em.getMonitor().isHealthy()) count++;
        }
        return count;
    }
}
