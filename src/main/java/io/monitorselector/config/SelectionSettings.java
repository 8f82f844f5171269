package io.monitorselector.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import static io.monitorselector.config.Constants.*;

/**
 * Tunables consumed by the selection rules.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class SelectionSettings {

    @Builder.Default
    private final int targetActive = DEFAULT_TARGET_ACTIVE;

    @Builder.Default
    private final int baseTesting = DEFAULT_BASE_TESTING;

    @Builder.Default
    private final int minCountForTesting = DEFAULT_MIN_COUNT_FOR_TESTING;

    @Builder.Default
    private final int minCountForActive = DEFAULT_MIN_COUNT_FOR_ACTIVE;

    @Builder.Default
    private final double replacementMinPercent = DEFAULT_REPLACEMENT_MIN_PERCENT;

    @Builder.Default
    private final double replacementMinPoints = DEFAULT_REPLACEMENT_MIN_POINTS;

    @Builder.Default
    private final boolean activeSwapEnabled = DEFAULT_ACTIVE_SWAP_ENABLED;

    public static SelectionSettings defaults() {
        return SelectionSettings.builder().build();
    }

    /**
     * Testing pool size for a given active count: grows by one for every missing active
     * monitor so there are enough promotion candidates while the committee is short.
     */
    public int dynamicTestingTarget(int activeCount) {
        return baseTesting + Math.max(0, targetActive - activeCount);
    }
}
