package io.github.hongjungwan.contextlog.core.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.filter.Filter;
import io.github.hongjungwan.contextlog.api.exception.LogConfigurationException;
import io.github.hongjungwan.contextlog.core.config.LogConfigApplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import static io.github.hongjungwan.contextlog.core.config.ConfigDocuments.*;

/**
 * Installs a logging document into Logback.
 *
 * <p>Handlers become appenders named after the handler (any {@link Appender} class with a
 * no-arg constructor; output stream appenders get a pattern encoder from the referenced
 * formatter, file appenders the {@code file} path). A handler level becomes a leading
 * {@link ThresholdFilter}; each referenced filter is created through its {@code factory}.
 * Configured loggers and root lose their previous appenders.</p>
 */
@Slf4j
public class LogbackConfigApplier implements LogConfigApplier {

    static final String DEFAULT_PATTERN = "%msg%n";

    private final LoggerContext context;

    public LogbackConfigApplier() {
        this(currentLoggerContext());
    }

    public LogbackConfigApplier(LoggerContext context) {
        this.context = context;
    }

    @Override
    public void apply(Map<String, Object> document) {
        registerConverter();

        Map<String, Object> formatters = section(document, FORMATTERS);
        Map<String, Object> filters = section(document, FILTERS);

        Map<String, Appender<ILoggingEvent>> appenders = new LinkedHashMap<>();
        section(document, HANDLERS).forEach((name, handler) ->
                appenders.put(name, buildAppender(name, requireMap(handler, "handler", name), formatters, filters)));

        Map<String, Object> loggers = section(document, LOGGERS);
        Map<String, Object> root = section(document, ROOT);

        if (isTrue(document.get(DISABLE_EXISTING_LOGGERS), false)) {
            disableExistingLoggers(loggers);
        }

        // detach everything first: an appender may be shared by several loggers
        loggers.keySet().forEach(name -> context.getLogger(name).detachAndStopAllAppenders());
        if (!root.isEmpty()) {
            rootLogger().detachAndStopAllAppenders();
        }

        loggers.forEach((name, definition) ->
                configureLogger(context.getLogger(name), requireMap(definition, "logger", name), appenders));
        if (!root.isEmpty()) {
            configureLogger(rootLogger(), root, appenders);
        }

        log.debug("Logback configured: handlers={}, loggers={}", appenders.keySet(), loggers.keySet());
    }

    @Override
    public void captureWarnings() {
        if (!SLF4JBridgeHandler.isInstalled()) {
            SLF4JBridgeHandler.removeHandlersForRootLogger();
            SLF4JBridgeHandler.install();
            log.debug("java.util.logging routed to SLF4J");
        }
    }

    @SuppressWarnings("unchecked")
    private void registerConverter() {
        Map<String, String> ruleRegistry = (Map<String, String>) context.getObject(CoreConstants.PATTERN_RULE_REGISTRY);
        if (ruleRegistry == null) {
            ruleRegistry = new HashMap<>();
            context.putObject(CoreConstants.PATTERN_RULE_REGISTRY, ruleRegistry);
        }
        ruleRegistry.put(ContextValueConverter.CONVERSION_WORD, ContextValueConverter.class.getName());
    }

    private Appender<ILoggingEvent> buildAppender(
            String name,
            Map<String, Object> handler,
            Map<String, Object> formatters,
            Map<String, Object> filters) {

        String className = String.valueOf(handler.getOrDefault(CLASS, "ch.qos.logback.core.ConsoleAppender"));
        Appender<ILoggingEvent> appender = instantiateAppender(name, className);
        appender.setContext(context);
        appender.setName(name);

        if (appender instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
            streamAppender.setEncoder(buildEncoder(handler, formatters));
        }
        if (appender instanceof FileAppender<ILoggingEvent> fileAppender && handler.get(FILE) != null) {
            fileAppender.setFile(String.valueOf(handler.get(FILE)));
        }

        Object level = handler.get(LEVEL);
        if (level != null) {
            ThresholdFilter threshold = new ThresholdFilter();
            threshold.setContext(context);
            threshold.setLevel(String.valueOf(level));
            threshold.start();
            appender.addFilter(threshold);
        }

        for (String filterName : stringList(handler.get(FILTERS))) {
            appender.addFilter(buildFilter(name, filterName, filters));
        }

        appender.start();
        return appender;
    }

    @SuppressWarnings("unchecked")
    private Appender<ILoggingEvent> instantiateAppender(String name, String className) {
        try {
            Class<?> type = Class.forName(className);
            if (!Appender.class.isAssignableFrom(type)) {
                throw new LogConfigurationException(
                        String.format("Handler '%s': %s is not a Logback appender", name, className));
            }
            return (Appender<ILoggingEvent>) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new LogConfigurationException(
                    String.format("Handler '%s': cannot instantiate %s", name, className), e);
        }
    }

    private PatternLayoutEncoder buildEncoder(Map<String, Object> handler, Map<String, Object> formatters) {
        String pattern = DEFAULT_PATTERN;

        Object formatterName = handler.get(FORMATTER);
        if (formatterName != null) {
            Map<String, Object> formatter = asMap(formatters.get(String.valueOf(formatterName)));
            if (formatter == null) {
                throw new LogConfigurationException(
                        String.format("Unknown formatter '%s'", formatterName));
            }
            pattern = String.valueOf(formatter.getOrDefault(FORMAT, DEFAULT_PATTERN));
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();
        return encoder;
    }

    @SuppressWarnings("unchecked")
    private Filter<ILoggingEvent> buildFilter(String handlerName, String filterName, Map<String, Object> filters) {
        Map<String, Object> definition = asMap(filters.get(filterName));
        if (definition == null) {
            throw new LogConfigurationException(
                    String.format("Handler '%s' references unknown filter '%s'", handlerName, filterName));
        }
        if (!(definition.get(FACTORY) instanceof Supplier<?> factory)) {
            throw new LogConfigurationException(
                    String.format("Filter '%s' has no factory", filterName));
        }

        Object created = factory.get();
        if (!(created instanceof Filter<?>)) {
            throw new LogConfigurationException(
                    String.format("Filter '%s' factory produced %s", filterName, created));
        }

        Filter<ILoggingEvent> filter = (Filter<ILoggingEvent>) created;
        filter.setContext(context);
        filter.start();
        return filter;
    }

    private void configureLogger(Logger logger, Map<String, Object> definition, Map<String, Appender<ILoggingEvent>> appenders) {
        Object level = definition.get(LEVEL);
        if (level != null) {
            logger.setLevel(Level.toLevel(String.valueOf(level), Level.INFO));
        }
        if (!Logger.ROOT_LOGGER_NAME.equals(logger.getName())) {
            logger.setAdditive(isTrue(definition.get(PROPAGATE), true));
        }

        for (String handlerName : stringList(definition.get(HANDLERS))) {
            Appender<ILoggingEvent> appender = appenders.get(handlerName);
            if (appender == null) {
                throw new LogConfigurationException(
                        String.format("Logger '%s' references unknown handler '%s'", logger.getName(), handlerName));
            }
            logger.addAppender(appender);
        }
    }

    private void disableExistingLoggers(Map<String, Object> configured) {
        for (Logger logger : context.getLoggerList()) {
            String name = logger.getName();
            if (Logger.ROOT_LOGGER_NAME.equals(name) || isConfigured(name, configured)) {
                continue;
            }
            logger.setLevel(Level.OFF);
        }
    }

    private static boolean isConfigured(String name, Map<String, Object> configured) {
        return configured.keySet().stream()
                .anyMatch(parent -> name.equals(parent) || name.startsWith(parent + "."));
    }

    private Logger rootLogger() {
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private static Map<String, Object> requireMap(Object value, String kind, String name) {
        Map<String, Object> map = asMap(value);
        if (map == null) {
            throw new LogConfigurationException(String.format("%s '%s' is not a mapping", kind, name));
        }
        return map;
    }

    private static LoggerContext currentLoggerContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext loggerContext) {
            return loggerContext;
        }
        throw new LogConfigurationException(
                "Logback is not the active SLF4J binding: " + factory.getClass().getName());
    }
}
