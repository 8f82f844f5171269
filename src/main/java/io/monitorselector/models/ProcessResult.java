package io.monitorselector.models;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of processing one server.
 */
@Getter
@ToString
@AllArgsConstructor
public class ProcessResult {

    private final long serverId;

    private final boolean skipped;

    private final int evaluatedMonitors;

    private final List<StatusChange> plannedChanges;

    private final int appliedChanges;

    private final int failedChanges;

    public static ProcessResult skipped(long serverId) {
        return new ProcessResult(serverId, true, 0, List.of(), 0, 0);
    }

    public boolean isChanged() {
        return appliedChanges > 0;
    }
}
