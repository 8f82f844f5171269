package io.monitorselector.selection;

import io.monitorselector.config.SelectionSettings;
import io.monitorselector.enums.ServerScoreStatus;

/**
 * The two performance swaps: a candidate replacing a testing monitor, and a testing monitor
 * replacing an active one.
 */
public enum ReplacementType {
    CANDIDATE_TO_TESTING(ServerScoreStatus.CANDIDATE, ServerScoreStatus.TESTING,
            ServerScoreStatus.TESTING, ServerScoreStatus.CANDIDATE,
            "replacement promotion", "replaced by better candidate", 1),
    TESTING_TO_ACTIVE(ServerScoreStatus.TESTING, ServerScoreStatus.ACTIVE,
            ServerScoreStatus.ACTIVE, ServerScoreStatus.TESTING,
            "active-testing swap (promote)", "active-testing swap (demote)", 2);

    private final ServerScoreStatus replacerFrom;
    private final ServerScoreStatus replacerTo;
    private final ServerScoreStatus targetFrom;
    private final ServerScoreStatus targetTo;
    private final String promoteReason;
    private final String demoteReason;
    private final int budgetPerSwap;

    ReplacementType(ServerScoreStatus replacerFrom, ServerScoreStatus replacerTo,
                    ServerScoreStatus targetFrom, ServerScoreStatus targetTo,
                    String promoteReason, String demoteReason, int budgetPerSwap) {
        this.replacerFrom = replacerFrom;
        this.replacerTo = replacerTo;
        this.targetFrom = targetFrom;
        this.targetTo = targetTo;
        this.promoteReason = promoteReason;
        this.demoteReason = demoteReason;
        this.budgetPerSwap = budgetPerSwap;
    }

    public ServerScoreStatus getReplacerFrom() {
        return replacerFrom;
    }

    public ServerScoreStatus getReplacerTo() {
        return replacerTo;
    }

    public ServerScoreStatus getTargetFrom() {
        return targetFrom;
    }

    public ServerScoreStatus getTargetTo() {
        return targetTo;
    }

    public String getPromoteReason() {
        return promoteReason;
    }

    public String getDemoteReason() {
        return demoteReason;
    }

    public int getBudgetPerSwap() {
        return budgetPerSwap;
    }

    public int minCount(SelectionSettings settings) {
        return this == CANDIDATE_TO_TESTING ? settings.getMinCountForTesting() : settings.getMinCountForActive();
    }
}
