package io.github.hongjungwan.contextlog.core.logback;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.slf4j.event.KeyValuePair;

import java.util.List;
import java.util.Map;

/**
 * {@code %ctx{key}}: value stamped by a {@link ContextLogFilter}, then the MDC entry, then {@code -}.
 */
public class ContextValueConverter extends ClassicConverter {

    public static final String CONVERSION_WORD = "ctx";
    static final String MISSING = "-";

    private String key;

    @Override
    public void start() {
        key = getFirstOption();
        super.start();
    }

    @Override
    public String convert(ILoggingEvent event) {
        if (key == null || key.isEmpty()) {
            return MISSING;
        }

        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair pair : pairs) {
                if (key.equals(pair.key)) {
                    return String.valueOf(pair.value);
                }
            }
        }

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && mdc.get(key) != null) {
            return mdc.get(key);
        }
        return MISSING;
    }
}
