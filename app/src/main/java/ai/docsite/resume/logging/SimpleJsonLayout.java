package ai.docsite.resume.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Writes each logging event as one JSON object per line. MDC entries, such as the document under conversion,
 * go under {@code mdc}; a throwable goes under {@code exception} with its stack trace.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        node.put("level", event.getLevel().toString());
        node.put("logger", event.getLoggerName());
        node.put("thread", event.getThreadName());
        node.put("message", event.getFormattedMessage());

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && !mdc.isEmpty()) {
            ObjectNode mdcNode = node.putObject("mdc");
            mdc.forEach(mdcNode::put);
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            ObjectNode exception = node.putObject("exception");
            exception.put("class", throwable.getClassName());
            exception.put("message", throwable.getMessage());
            exception.put("stack_trace", ThrowableProxyUtil.asString(throwable));
        }
        try {
            return mapper.writeValueAsString(node) + CoreConstants.LINE_SEPARATOR;
        } catch (JsonProcessingException ex) {
            addError("Failed to serialize logging event", ex);
            return "{\"level\":\"" + event.getLevel() + "\",\"message\":\"unserializable event\"}"
                    + CoreConstants.LINE_SEPARATOR;
        }
    }
}
