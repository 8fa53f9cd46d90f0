package io.github.hongjungwan.contextlog.core.context;

import io.github.hongjungwan.contextlog.api.context.ContextResponse;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Map-based response (for testing or non-servlet callers).
 */
public final class SimpleContextResponse implements ContextResponse {

    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    @Override
    public void setHeader(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }
}
