package io.github.hongjungwan.contextlog.core.config;

import java.util.Map;

/**
 * Installs a logging configuration document into the running logging backend.
 */
public interface LogConfigApplier {

    /**
     * Replace the backend's appenders and logger settings with those of the document.
     */
    void apply(Map<String, Object> document);

    /**
     * Route records emitted through {@code java.util.logging} into the backend.
     */
    void captureWarnings();
}
