package io.tributary.distributor.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();

        String json = layout.doLayout(event(context, "Beam P_L0_S0 carries -0.36"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00");
        assertThat(json).contains("\"message\":\"Beam P_L0_S0 carries -0.36\"");
        assertThat(json).contains("\"logger\":\"io.tributary.distributor.cli\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"error\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void escapesQuotesAndIncludesErrors() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = event(context, "load \"F\"\nfailed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalArgumentException("negative width")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"load \\\"F\\\"\\nfailed\"");
        assertThat(json).contains("\"error\":\"java.lang.IllegalArgumentException: negative width\"");
    }

    @Test
    void writesBeamContextAsTopLevelFields() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = event(context, "Beam P_L1_S0 carries -0.36");
        event.setMDCPropertyMap(Map.of("beam", "P_L1_S0", "total", "-0.36", "message", "ignored"));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"beam\":\"P_L1_S0\"");
        assertThat(json).contains("\"total\":\"-0.36\"");
        assertThat(json).contains("\"message\":\"Beam P_L1_S0 carries -0.36\"");
        assertThat(json).doesNotContain("ignored");
    }

    @Test
    void quotesControlCharacters() {
        assertThat(SimpleJsonLayout.quote("a\u0001b")).isEqualTo("\"a\\u0001b\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("io.tributary.distributor.cli");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
