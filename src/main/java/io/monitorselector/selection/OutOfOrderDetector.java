package io.monitorselector.selection;

import io.monitorselector.enums.CandidateState;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.EvaluatedMonitor;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Finds a testing monitor that ranks ahead of an active one.
 *
 * Scans the priority-ordered active + testing list; the first eligible testing monitor is the
 * better one and the last eligible active monitor after it is the one to replace.
 */
public class OutOfOrderDetector {

    public Optional<OutOfOrderPair> detect(List<EvaluatedMonitor> ordered) {
        Long best = null;
        Long replace = null;

        for (EvaluatedMonitor em : ordered) {
            if (!em.isState(CandidateState.IN)) {
                continue;
            }
            ServerScoreStatus status = em.getMonitor().getServerStatus();
            if (status == ServerScoreStatus.TESTING && best == null) {
                best = em.getId();
            } else if (status == ServerScoreStatus.ACTIVE && best != null) {
                replace = em.getId();
            }
        }

        if (best == null || replace == null) {
            return Optional.empty();
        }
        return Optional.of(new OutOfOrderPair(best, replace));
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class OutOfOrderPair {
        private final long betterTestingId;
        private final long replaceActiveId;
    }
}
