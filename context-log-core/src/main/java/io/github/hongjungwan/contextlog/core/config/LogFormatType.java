package io.github.hongjungwan.contextlog.core.config;

/**
 * Log line layouts generated by {@link LogConfigurator}.
 */
public enum LogFormatType {
    /** Application log lines */
    STANDARD,
    /** One line per completed request, tagged {@code [ACCESS]} */
    ACCESS
}
