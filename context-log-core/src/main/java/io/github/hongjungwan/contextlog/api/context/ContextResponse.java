package io.github.hongjungwan.contextlog.api.context;

import java.util.Optional;

/**
 * Outbound response whose headers log context providers may decorate.
 */
public interface ContextResponse {

    void setHeader(String name, String value);

    Optional<String> header(String name);
}
