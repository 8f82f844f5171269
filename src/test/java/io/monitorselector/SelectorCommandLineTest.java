package io.monitorselector;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

class SelectorCommandLineTest {

    @Test
    void testServerWithDefaults() throws Exception {
        SelectorCommandLine cl = SelectorCommandLine.parse(new String[]{"server"});

        assertThat(cl.getCommand()).isEqualTo("server");
        assertThat(cl.isServerMode()).isTrue();
        assertThat(cl.getMetricsPort()).isEqualTo(9000);
        assertThat(cl.getServerId()).isNull();
        assertThat(cl.getSpringArgs()).isEmpty();
    }

    @Test
    void testOnceWithOptions() throws Exception {
        SelectorCommandLine cl = SelectorCommandLine.parse(
                new String[]{"once", "--metrics-port", "9100", "--server-id=42"});

        assertThat(cl.isServerMode()).isFalse();
        assertThat(cl.getMetricsPort()).isEqualTo(9100);
        assertThat(cl.getServerId()).isEqualTo(42L);
    }

    @Test
    void testForeignOptionsArePassedToSpring() throws Exception {
        SelectorCommandLine cl = SelectorCommandLine.parse(new String[]{
                "simulate", "--server-id", "7", "--spring.datasource.url=jdbc:mysql://db/ntppool", "--debug"});

        assertThat(cl.getServerId()).isEqualTo(7L);
        assertThat(cl.getSpringArgs()).containsExactly("--spring.datasource.url=jdbc:mysql://db/ntppool", "--debug");
    }

    @Test
    void testInvalidCommandLines() {
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{}))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{"serve"}))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unknown command");
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{"simulate"}))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("server-id");
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{"once", "--server-id", "0"}))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{"once", "--metrics-port", "70000"}))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{"once", "--metrics-port", "abc"}))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> SelectorCommandLine.parse(new String[]{"once", "extra"}))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unexpected arguments");
    }

    @Test
    void testHelp() {
        assertThat(SelectorCommandLine.isHelpRequested(new String[]{"server", "--help"})).isTrue();
        assertThat(SelectorCommandLine.isHelpRequested(new String[]{"-h"})).isTrue();
        assertThat(SelectorCommandLine.isHelpRequested(new String[]{"server"})).isFalse();

        StringWriter out = new StringWriter();
        SelectorCommandLine.printHelp(new PrintWriter(out));
        assertThat(out.toString())
                .contains("Usage: monitor-selector <once|server|simulate>")
                .contains("--metrics-port")
                .contains("--server-id");
    }
}
