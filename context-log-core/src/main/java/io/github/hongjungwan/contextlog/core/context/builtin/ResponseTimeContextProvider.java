package io.github.hongjungwan.contextlog.core.context.builtin;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Elapsed request time. Binds a {@link Timing} started when the request enters; log events
 * carry the milliseconds elapsed at the moment they are emitted, under both
 * {@code response_time} and {@code response_time_ms}.
 *
 * <p>The same {@link Timing} is published as the {@code response_time} request attribute, so
 * downstream code can read the start instant or the elapsed time.</p>
 */
public class ResponseTimeContextProvider extends LogContextProvider<ResponseTimeContextProvider.Timing> {

    public static final String NAME = "response_time";
    public static final String MILLIS_FIELD = "response_time_ms";

    public ResponseTimeContextProvider() {
        super(NAME, null);
    }

    @Override
    public Timing extract(ContextRequest request) {
        return Timing.start();
    }

    @Override
    public String render(Timing timing) {
        if (timing == null) {
            return "-";
        }
        return String.valueOf(timing.elapsedMillis());
    }

    @Override
    public Map<String, String> logFields() {
        String elapsed = render(current());

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(getName(), elapsed);
        fields.put(MILLIS_FIELD, elapsed);
        return fields;
    }

    /**
     * Start of a request: wall-clock instant for display, monotonic nanos for measuring.
     */
    public record Timing(Instant startedAt, long startNanos) {

        public static Timing start() {
            return new Timing(Instant.now(), System.nanoTime());
        }

        public long elapsedMillis() {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }

        @Override
        public String toString() {
            return elapsedMillis() + "ms since " + startedAt;
        }
    }
}
