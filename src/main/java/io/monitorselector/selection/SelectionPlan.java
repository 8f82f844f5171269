package io.monitorselector.selection;

import io.monitorselector.models.StatusChange;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Changes planned by one selection pass, in the order the rules emitted them, with the
 * working counts they lead to.
 */
@Getter
@ToString
@AllArgsConstructor
public class SelectionPlan {

    private final List<StatusChange> changes;

    private final int finalActiveCount;

    private final int finalTestingCount;

    private final boolean emergencyOverride;

    // nothing was planned because no healthy monitor could be worked with
    private final boolean frozen;

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
