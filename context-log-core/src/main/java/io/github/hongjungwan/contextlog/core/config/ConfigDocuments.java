package io.github.hongjungwan.contextlog.core.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys and typed accessors for logging configuration documents.
 *
 * <pre>
 * version, disable_existing_loggers
 * formatters: {name: {format}}
 * filters:    {name: {factory}}
 * handlers:   {name: {class, formatter, level, filters?, auto_filters?, exclude_filters?, file?}}
 * loggers:    {name: {level, handlers, propagate}}
 * root:       {level, handlers}
 * </pre>
 */
public final class ConfigDocuments {

    public static final String VERSION = "version";
    public static final String DISABLE_EXISTING_LOGGERS = "disable_existing_loggers";
    public static final String FORMATTERS = "formatters";
    public static final String FILTERS = "filters";
    public static final String HANDLERS = "handlers";
    public static final String LOGGERS = "loggers";
    public static final String ROOT = "root";

    public static final String FORMAT = "format";
    public static final String FACTORY = "factory";
    public static final String CLASS = "class";
    public static final String FORMATTER = "formatter";
    public static final String LEVEL = "level";
    public static final String FILE = "file";
    public static final String PROPAGATE = "propagate";
    public static final String AUTO_FILTERS = "auto_filters";
    public static final String EXCLUDE_FILTERS = "exclude_filters";

    private ConfigDocuments() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /**
     * Nested section, or an empty map when absent or not a mapping.
     */
    public static Map<String, Object> section(Map<String, Object> document, String key) {
        Map<String, Object> section = asMap(document.get(key));
        return section != null ? section : Map.of();
    }

    public static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(item -> result.add(String.valueOf(item)));
        } else if (value instanceof String single && !single.isBlank()) {
            result.add(single);
        }
        return result;
    }

    /**
     * YAML-style truthiness: missing means the fallback.
     */
    public static boolean isTrue(Object value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }

    /**
     * Copy of every nested map and list; leaf values are shared.
     */
    public static Map<String, Object> deepCopy(Map<String, Object> document) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (document != null) {
            document.forEach((key, value) -> copy.put(key, copyValue(value)));
        }
        return copy;
    }

    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?>) {
            return deepCopy(asMap(value));
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
