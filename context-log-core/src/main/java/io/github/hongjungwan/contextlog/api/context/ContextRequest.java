package io.github.hongjungwan.contextlog.api.context;

import java.util.Optional;

/**
 * Inbound request as seen by log context providers.
 */
public interface ContextRequest {

    /**
     * Header value, looked up case-insensitively.
     */
    Optional<String> header(String name);

    Optional<Object> attribute(String name);

    void setAttribute(String name, Object value);
}
