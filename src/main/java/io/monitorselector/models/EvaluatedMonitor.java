package io.monitorselector.models;

import io.monitorselector.enums.CandidateState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A monitor together with its current constraint verdict and recommended state.
 */
@Getter
@ToString
@AllArgsConstructor
public class EvaluatedMonitor {

    private final MonitorCandidate monitor;

    private final ConstraintViolation violation;

    private final CandidateState recommendedState;

    public long getId() {
        return monitor.getId();
    }

    public boolean hasViolation() {
        return violation != null && violation.isPresent();
    }

    public boolean isState(CandidateState state) {
        return recommendedState == state;
    }
}
