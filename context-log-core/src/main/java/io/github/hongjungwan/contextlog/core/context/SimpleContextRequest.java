package io.github.hongjungwan.contextlog.core.context;

import io.github.hongjungwan.contextlog.api.context.ContextRequest;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-based request (for testing or non-servlet callers).
 */
public final class SimpleContextRequest implements ContextRequest {

    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public SimpleContextRequest() {
    }

    public SimpleContextRequest(Map<String, String> headers) {
        this.headers.putAll(headers);
    }

    public SimpleContextRequest withHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public SimpleContextRequest withAttribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    @Override
    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public void setAttribute(String name, Object value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
    }

    public Map<String, Object> getAttributes() {
        return Map.copyOf(attributes);
    }
}
