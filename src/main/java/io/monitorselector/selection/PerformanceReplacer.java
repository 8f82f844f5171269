package io.monitorselector.selection;

import io.monitorselector.config.SelectionSettings;
import io.monitorselector.enums.CandidateState;
import io.monitorselector.enums.MonitorStatus;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.AccountLimit;
import io.monitorselector.models.EvaluatedMonitor;
import io.monitorselector.models.MonitorCandidate;
import io.monitorselector.models.StatusChange;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Swaps incumbents for significantly better performers, worst incumbent first.
 *
 * Each swap is simulated on a copy of the working account limits with the incumbent's slot
 * released; only if the replacer still passes its promotion check are the paired demote and
 * promote changes recorded.
 */
@Slf4j
public class PerformanceReplacer {

    private final PromotionGate promotionGate;

    public PerformanceReplacer(PromotionGate promotionGate) {
        this.promotionGate = promotionGate;
    }

    /**
     * @param replacers monitors that may move up, best first
     * @param targets incumbents that may move down, best first
     * @param budget promotions budget available to the swaps
     * @return the recorded changes, demote/promote pairs in order
     */
    public List<StatusChange> replace(RuleContext context, List<EvaluatedMonitor> replacers,
                                      List<EvaluatedMonitor> targets, int budget, ReplacementType type) {
        List<StatusChange> changes = new ArrayList<>();
        SelectionSettings settings = context.getSettings();

        List<EvaluatedMonitor> eligibleTargets = new ArrayList<>();
        for (EvaluatedMonitor em : targets) {
            if (!em.isState(CandidateState.OUT) && !em.hasViolation() && !context.isTouched(em.getId())) {
                eligibleTargets.add(em);
            }
        }
        if (eligibleTargets.isEmpty()) {
            log.debug("No eligible incumbents for {} replacement on server {}", type, context.getServer().getId());
            return changes;
        }

        List<EvaluatedMonitor> eligibleReplacers = new ArrayList<>();
        for (EvaluatedMonitor em : replacers) {
            MonitorStatus global = em.getMonitor().getGlobalStatus();
            if ((global == MonitorStatus.ACTIVE || global == MonitorStatus.TESTING)
                    && !em.isState(CandidateState.OUT)
                    && !em.isState(CandidateState.BLOCK)
                    && !context.isTouched(em.getId())) {
                eligibleReplacers.add(em);
            }
        }
        if (eligibleReplacers.isEmpty()) {
            log.debug("No eligible replacers for {} replacement on server {}", type, context.getServer().getId());
            return changes;
        }

        List<EvaluatedMonitor> worstFirst = new ArrayList<>(eligibleTargets);
        Collections.reverse(worstFirst);

        int replacements = 0;
        for (EvaluatedMonitor target : worstFirst) {
            if ((replacements + 1) * type.getBudgetPerSwap() > budget) {
                log.debug("Replacement budget exhausted after {} swaps", replacements);
                break;
            }

            for (int i = 0; i < eligibleReplacers.size(); i++) {
                EvaluatedMonitor replacer = eligibleReplacers.get(i);

                // replacers are best first: once one fails, the rest do too
                if (!outperforms(replacer.getMonitor(), target.getMonitor(), settings)) {
                    break;
                }
                if (replacer.getMonitor().getCount() < type.minCount(settings)) {
                    log.info("Replacer {} skipped: insufficient data points ({} < {})",
                            replacer.getId(), replacer.getMonitor().getCount(), type.minCount(settings));
                    continue;
                }

                if (trySwap(context, replacer, target, type, changes)) {
                    log.info("Planned performance-based swap on server {}: replacer={} (priority {}), target={} (priority {})",
                            context.getServer().getId(), replacer.getId(), replacer.getMonitor().getPriority(),
                            target.getId(), target.getMonitor().getPriority());
                    eligibleReplacers.remove(i);
                    replacements++;
                    break;
                }
                log.info("Performance-based swap blocked by constraints: replacer={}, target={}",
                        replacer.getId(), target.getId());
            }
        }
        return changes;
    }

    private boolean trySwap(RuleContext context, EvaluatedMonitor replacer, EvaluatedMonitor target,
                            ReplacementType type, List<StatusChange> changes) {
        MonitorCandidate replacerMonitor = replacer.getMonitor();
        MonitorCandidate targetMonitor = target.getMonitor();

        Map<Long, AccountLimit> simulated = context.copyWorkingLimits();
        RuleContext.applyToLimits(simulated, targetMonitor.getAccountId(), type.getTargetFrom(), type.getTargetTo());
        List<MonitorCandidate> assignments = context.assignmentsView(Map.of(target.getId(), type.getTargetTo()));

        boolean allowed = type.getReplacerTo() == ServerScoreStatus.ACTIVE
                ? promotionGate.canPromoteToActive(replacerMonitor, context, simulated, assignments)
                : promotionGate.canPromoteToTesting(replacerMonitor, context, simulated, assignments);
        if (!allowed) {
            return false;
        }

        StatusChange demote = new StatusChange(target.getId(), type.getTargetFrom(), type.getTargetTo(), type.getDemoteReason());
        String promoteReason = context.isEmergencyOverride()
                ? PromotionGate.emergencyReason(type.getPromoteReason(), type.getReplacerTo(), false)
                : type.getPromoteReason();
        StatusChange promote = new StatusChange(replacer.getId(), type.getReplacerFrom(), type.getReplacerTo(), promoteReason);

        context.record(demote, targetMonitor.getAccountId());
        context.record(promote, replacerMonitor.getAccountId());
        changes.add(demote);
        changes.add(promote);
        return true;
    }

    /**
     * Whether {@code better} significantly outperforms {@code worse}. Health decides first;
     * otherwise the priority (lower is better) must improve by at least the configured
     * percentage and the configured number of points.
     */
    public static boolean outperforms(MonitorCandidate better, MonitorCandidate worse, SelectionSettings settings) {
        if (better.isHealthy() && !worse.isHealthy()) {
            return true;
        }
        if (!better.isHealthy() && worse.isHealthy()) {
            return false;
        }
        if (worse.getPriority() <= 0 || better.getPriority() < 0) {
            return false;
        }

        double diff = better.getPriority() - worse.getPriority();
        double percent = diff / worse.getPriority() * 100;
        return percent <= -settings.getReplacementMinPercent() && diff <= -settings.getReplacementMinPoints();
    }
}
