package io.github.hongjungwan.contextlog.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.hongjungwan.contextlog.api.config.LogContextSettings;
import io.github.hongjungwan.contextlog.api.exception.InvalidConfigFileException;
import io.github.hongjungwan.contextlog.core.context.LogContextRegistry;
import io.github.hongjungwan.contextlog.core.context.builtin.ResponseTimeContextProvider;
import io.github.hongjungwan.contextlog.core.logback.ContextFilterFactory;
import io.github.hongjungwan.contextlog.core.logback.LogbackConfigApplier;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static io.github.hongjungwan.contextlog.core.config.ConfigDocuments.*;

/**
 * Builds the logging configuration from the registered log contexts.
 *
 * <p>{@link #configure(Map, boolean)} merges three layers, each overriding the previous one:</p>
 * <ol>
 *   <li>baseline generated from the registry (one filter per context, standard and access
 *       formatters tagging every context, console handlers, server/error/access loggers)</li>
 *   <li>custom YAML file at {@link LogContextSettings#getLogConfigPath()}</li>
 *   <li>programmatic overrides passed by the caller</li>
 * </ol>
 * <p>then attaches the context filters to handlers (see {@link #autoApplyFilters(Map)}) and
 * optionally installs the result.</p>
 */
@Slf4j
public class LogConfigurator {

    public static final String CONSOLE_HANDLER = "console";
    public static final String ACCESS_CONSOLE_HANDLER = "access_console";
    public static final String STANDARD_FORMATTER = "standard";
    public static final String ACCESS_FORMATTER = "access";
    public static final String CONSOLE_APPENDER_CLASS = "ch.qos.logback.core.ConsoleAppender";

    static final String FORMAT_PREFIX = "[%d{yyyy-MM-dd HH:mm:ss,SSS}][%level]";
    static final String ACCESS_TAG = "[ACCESS]";
    static final String FORMAT_SUFFIX = "[%logger]: %msg%n";
    static final String RESPONSE_TIME_TAG =
            "[" + ResponseTimeContextProvider.MILLIS_FIELD + ": %ctx{" + ResponseTimeContextProvider.MILLIS_FIELD + "}]";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final LogContextSettings settings;
    private final LogContextRegistry registry;
    private final LogConfigApplier applier;

    public LogConfigurator(LogContextSettings settings, LogContextRegistry registry) {
        this(settings, registry, new LogbackConfigApplier());
    }

    public LogConfigurator(LogContextSettings settings, LogContextRegistry registry, LogConfigApplier applier) {
        this.settings = settings;
        this.registry = registry;
        this.applier = applier;
    }

    /**
     * Merge, attach filters and install the configuration.
     */
    public Map<String, Object> configure() {
        return configure(null, true);
    }

    /**
     * Merge baseline, custom file and {@code extra}, then attach filters.
     *
     * @param extra overrides applied last, may be null
     * @param apply install the result into Logback; when false nothing outside this call changes
     * @return the merged document
     */
    public Map<String, Object> configure(Map<String, Object> extra, boolean apply) {
        Map<String, Object> custom = loadCustomConfigFile(settings.getLogConfigPath());

        Map<String, Object> merged = ConfigMerger.merge(buildBaseConfig(), custom);
        merged = ConfigMerger.merge(merged, extra);
        merged = autoApplyFilters(merged);

        if (apply) {
            applier.apply(merged);
            applier.captureWarnings();
            log.info("Logging configured with contexts {}", registry.names());
        }

        return merged;
    }

    /**
     * Baseline document for the current registry contents.
     */
    public Map<String, Object> buildBaseConfig() {
        String level = settings.getLogLevel();

        Map<String, Object> filters = new LinkedHashMap<>();
        registry.getContexts().forEach((name, context) ->
                filters.put(name + "_filter", entry(FACTORY, new ContextFilterFactory(context))));

        Map<String, Object> formatters = new LinkedHashMap<>();
        formatters.put(STANDARD_FORMATTER, entry(FORMAT, buildFormat(LogFormatType.STANDARD)));
        formatters.put(ACCESS_FORMATTER, entry(FORMAT, buildFormat(LogFormatType.ACCESS)));

        Map<String, Object> handlers = new LinkedHashMap<>();
        handlers.put(CONSOLE_HANDLER, handler(STANDARD_FORMATTER, level));
        handlers.put(ACCESS_CONSOLE_HANDLER, handler(ACCESS_FORMATTER, level));

        Map<String, Object> loggers = new LinkedHashMap<>();
        loggers.put(settings.getServerLoggerName(), logger(level, CONSOLE_HANDLER));
        loggers.put(settings.getErrorLoggerName(), logger(level, CONSOLE_HANDLER));
        loggers.put(settings.getAccessLoggerName(), logger(level, ACCESS_CONSOLE_HANDLER));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put(LEVEL, level);
        root.put(HANDLERS, new ArrayList<>(List.of(CONSOLE_HANDLER)));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put(VERSION, 1);
        config.put(DISABLE_EXISTING_LOGGERS, false);
        config.put(FORMATTERS, formatters);
        config.put(FILTERS, filters);
        config.put(HANDLERS, handlers);
        config.put(LOGGERS, loggers);
        config.put(ROOT, root);
        return config;
    }

    /**
     * Logback pattern tagging every registered context, in registry order.
     */
    public String buildFormat(LogFormatType type) {
        StringBuilder format = new StringBuilder(FORMAT_PREFIX);
        if (type == LogFormatType.ACCESS) {
            format.append(ACCESS_TAG);
        }

        for (String name : registry.names()) {
            format.append('[').append(name).append(": %ctx{").append(name).append("}]");
        }

        if (type == LogFormatType.ACCESS && registry.contains(ResponseTimeContextProvider.NAME)) {
            format.append(RESPONSE_TIME_TAG);
        }

        return format.append(FORMAT_SUFFIX).toString();
    }

    /**
     * Read the custom YAML document.
     *
     * @return the mapping, or an empty map when the file is missing or empty
     * @throws InvalidConfigFileException the file holds something other than a mapping
     */
    public Map<String, Object> loadCustomConfigFile(String logPath) {
        if (logPath == null || logPath.isBlank()) {
            return new LinkedHashMap<>();
        }

        Path path = Path.of(logPath).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            log.debug("No custom logging config at {}", path);
            return new LinkedHashMap<>();
        }

        JsonNode node;
        try {
            node = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new InvalidConfigFileException(path, e);
        }

        if (node == null || node.isMissingNode() || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new InvalidConfigFileException(path);
        }

        log.debug("Loaded custom logging config from {}", path);
        return YAML_MAPPER.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    /**
     * Attach every declared filter to every handler unless the handler opts out.
     *
     * <p>Per handler: {@code auto_filters: false} leaves it as is; {@code exclude_filters} names
     * filters to skip; filters it already declares keep their order and the remaining ones are
     * appended sorted by name. A handler that declares none and gets none keeps no
     * {@code filters} key. Both opt-out keys are removed.</p>
     *
     * <p>Documents without {@code filters} or {@code handlers} are returned untouched.</p>
     */
    public Map<String, Object> autoApplyFilters(Map<String, Object> config) {
        Map<String, Object> filters = asMap(config.get(FILTERS));
        Map<String, Object> handlers = asMap(config.get(HANDLERS));
        if (filters == null || handlers == null) {
            return config;
        }

        Set<String> allFilterNames = filters.keySet();

        for (Object value : handlers.values()) {
            Map<String, Object> handler = asMap(value);
            if (handler == null) {
                continue;
            }

            boolean autoFilters = isTrue(handler.remove(AUTO_FILTERS), true);
            if (!autoFilters) {
                continue;
            }

            Set<String> excluded = new TreeSet<>(stringList(handler.remove(EXCLUDE_FILTERS)));

            List<String> existing = new ArrayList<>();
            if (handler.containsKey(FILTERS)) {
                if (handler.get(FILTERS) instanceof List<?>) {
                    existing = stringList(handler.get(FILTERS));
                } else {
                    handler.put(FILTERS, existing);
                }
            }

            Set<String> toAdd = new TreeSet<>(allFilterNames);
            toAdd.removeAll(excluded);
            toAdd.removeAll(existing);

            if (!toAdd.isEmpty() || !existing.isEmpty()) {
                List<String> combined = new ArrayList<>(existing);
                combined.addAll(toAdd);
                handler.put(FILTERS, combined);
            }
        }

        return config;
    }

    private static Map<String, Object> entry(String key, Object value) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(key, value);
        return entry;
    }

    private static Map<String, Object> handler(String formatter, String level) {
        Map<String, Object> handler = new LinkedHashMap<>();
        handler.put(CLASS, CONSOLE_APPENDER_CLASS);
        handler.put(FORMATTER, formatter);
        handler.put(LEVEL, level);
        return handler;
    }

    private static Map<String, Object> logger(String level, String handler) {
        Map<String, Object> logger = new LinkedHashMap<>();
        logger.put(LEVEL, level);
        logger.put(HANDLERS, new ArrayList<>(List.of(handler)));
        logger.put(PROPAGATE, false);
        return logger;
    }
}
