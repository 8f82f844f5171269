package io.monitorselector.selection;

import io.monitorselector.config.SelectionSettings;
import io.monitorselector.enums.ServerScoreStatus;
import io.monitorselector.models.MonitorCandidate;
import org.junit.jupiter.api.Test;

import static io.monitorselector.TestMonitors.monitor;
import static org.assertj.core.api.Assertions.assertThat;

class PerformanceReplacerTest {

    private final SelectionSettings settings = SelectionSettings.defaults();

    @Test
    void testHealthDecidesBeforePriority() {
        MonitorCandidate healthy = monitor(1, ServerScoreStatus.CANDIDATE).priority(90).build();
        MonitorCandidate unhealthy = monitor(2, ServerScoreStatus.TESTING).priority(10).healthy(false).build();

        assertThat(PerformanceReplacer.outperforms(healthy, unhealthy, settings)).isTrue();
        assertThat(PerformanceReplacer.outperforms(unhealthy, healthy, settings)).isFalse();
    }

    @Test
    void testRequiresBothPercentAndPoints() {
        MonitorCandidate incumbent = monitor(1, ServerScoreStatus.TESTING).priority(200).build();

        // 4 points better: enough percent, not enough points
        assertThat(PerformanceReplacer.outperforms(
                monitor(2, ServerScoreStatus.CANDIDATE).priority(20).build(),
                monitor(3, ServerScoreStatus.TESTING).priority(24).build(), settings)).isFalse();
        // 6 points of 200 is 3%
        assertThat(PerformanceReplacer.outperforms(
                monitor(4, ServerScoreStatus.CANDIDATE).priority(194).build(), incumbent, settings)).isFalse();
        assertThat(PerformanceReplacer.outperforms(
                monitor(5, ServerScoreStatus.CANDIDATE).priority(150).build(), incumbent, settings)).isTrue();
    }

    @Test
    void testInvalidPrioritiesNeverOutperform() {
        MonitorCandidate unknown = monitor(1, ServerScoreStatus.CANDIDATE).priority(-1).build();
        MonitorCandidate incumbent = monitor(2, ServerScoreStatus.TESTING).priority(50).build();

        assertThat(PerformanceReplacer.outperforms(unknown, incumbent, settings)).isFalse();
        assertThat(PerformanceReplacer.outperforms(incumbent, monitor(3, ServerScoreStatus.TESTING).priority(0).build(),
                settings)).isFalse();
    }

    @Test
    void testThresholdsAreConfigurable() {
        SelectionSettings loose = SelectionSettings.builder().replacementMinPercent(1).replacementMinPoints(1).build();
        MonitorCandidate better = monitor(1, ServerScoreStatus.CANDIDATE).priority(97).build();
        MonitorCandidate worse = monitor(2, ServerScoreStatus.TESTING).priority(100).build();

        assertThat(PerformanceReplacer.outperforms(better, worse, settings)).isFalse();
        assertThat(PerformanceReplacer.outperforms(better, worse, loose)).isTrue();
    }
}
