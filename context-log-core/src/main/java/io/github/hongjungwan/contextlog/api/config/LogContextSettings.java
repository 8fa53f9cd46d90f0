package io.github.hongjungwan.contextlog.api.config;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Settings consumed by the log context registry and the configurator.
 */
@Getter
@Builder
public class LogContextSettings {

    public static final String DEFAULT_TRACE_ID_HEADER = "X-Trace-Id";

    /**
     * Level applied to the baseline handlers and loggers
     */
    @Builder.Default
    private final String logLevel = "INFO";

    /**
     * Builtin contexts to register, in order. Order drives log patterns and middleware nesting.
     */
    @Builder.Default
    private final List<String> logContexts = List.of("correlation_id", "request_id", "trace_id", "user_id");

    /**
     * YAML file merged over the generated baseline. Missing file is ignored.
     */
    @Builder.Default
    private final String logConfigPath = "logging.yml";

    /**
     * Header read and echoed by the trace_id context
     */
    @Builder.Default
    private final String traceIdHeader = DEFAULT_TRACE_ID_HEADER;

    /**
     * Logger of the embedded web server
     */
    @Builder.Default
    private final String serverLoggerName = "org.apache.catalina";

    /**
     * Logger receiving request handling errors
     */
    @Builder.Default
    private final String errorLoggerName = "org.springframework.web";

    /**
     * Logger receiving one line per completed request
     */
    @Builder.Default
    private final String accessLoggerName = "http.access";

    public static LogContextSettings defaultSettings() {
        return LogContextSettings.builder().build();
    }
}
