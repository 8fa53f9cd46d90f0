package io.github.hongjungwan.contextlog.core.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;
import org.slf4j.event.KeyValuePair;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appender filter stamping one log context onto every event it sees.
 *
 * <p>Values are attached as SLF4J key-value pairs, read back in patterns through
 * {@code %ctx{name}}. The filter never rejects an event.</p>
 */
public class ContextLogFilter extends Filter<ILoggingEvent> {

    private final LogContextProvider<?> provider;

    public ContextLogFilter(LogContextProvider<?> provider) {
        this.provider = provider;
        setName(provider.getName() + "_filter");
    }

    public LogContextProvider<?> getProvider() {
        return provider;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event instanceof LoggingEvent loggingEvent) {
            stamp(loggingEvent, provider.logFields());
        }
        return FilterReply.NEUTRAL;
    }

    /**
     * Put the fields on the event, replacing pairs already stamped under the same keys.
     */
    static void stamp(LoggingEvent event, Map<String, String> fields) {
        List<KeyValuePair> existing = event.getKeyValuePairs();
        List<KeyValuePair> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);

        updated.removeIf(pair -> fields.containsKey(pair.key));
        fields.forEach((key, value) -> updated.add(new KeyValuePair(key, value)));

        event.setKeyValuePairs(updated);
    }
}
