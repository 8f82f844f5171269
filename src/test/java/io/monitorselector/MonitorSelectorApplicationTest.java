package io.monitorselector;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorSelectorApplicationTest {

    @Test
    void testDefaultPropertiesCarryMetricsPort() throws Exception {
        SelectorCommandLine cl = SelectorCommandLine.parse(new String[]{"server", "--metrics-port", "9100"});

        Map<String, Object> properties = MonitorSelectorApplication.defaultProperties(cl, false);

        assertThat(properties)
                .containsEntry(MonitorSelectorApplication.METRICS_PORT_PROPERTY, 9100)
                .doesNotContainKey(MonitorSelectorApplication.CONSOLE_PATTERN_PROPERTY);
    }

    @Test
    void testManagedServiceDropsTimestamps() throws Exception {
        SelectorCommandLine cl = SelectorCommandLine.parse(new String[]{"once"});

        Map<String, Object> properties = MonitorSelectorApplication.defaultProperties(cl, true);

        assertThat(properties.get(MonitorSelectorApplication.CONSOLE_PATTERN_PROPERTY))
                .isEqualTo(MonitorSelectorApplication.MANAGED_CONSOLE_PATTERN);
    }
}
