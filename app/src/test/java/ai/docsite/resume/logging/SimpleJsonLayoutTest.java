package ai.docsite.resume.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.util.LogbackMDCAdapter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private LoggerContext context;
    private SimpleJsonLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.setMDCAdapter(new LogbackMDCAdapter());
        context.start();
        layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJson() {
        String json = layout.doLayout(event("hello world", null));

        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).contains("\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).doesNotContain("\"mdc\"", "\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesMdcAndException() throws Exception {
        LoggingEvent event = event("Roundtrip failed", new IllegalStateException("boom \"quoted\""));
        event.setMDCPropertyMap(Map.of("document", "resume.tex"));

        JsonNode node = new ObjectMapper().readTree(layout.doLayout(event));

        assertThat(node.path("mdc").path("document").asText()).isEqualTo("resume.tex");
        assertThat(node.path("exception").path("class").asText()).isEqualTo("java.lang.IllegalStateException");
        assertThat(node.path("exception").path("message").asText()).isEqualTo("boom \"quoted\"");
        assertThat(node.path("exception").path("stack_trace").asText()).contains("IllegalStateException");
    }

    private LoggingEvent event(String message, Throwable throwable) {
        LoggingEvent event = new LoggingEvent("test.Caller", context.getLogger("test.logger"), Level.INFO, message,
                throwable, null);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        return event;
    }
}
