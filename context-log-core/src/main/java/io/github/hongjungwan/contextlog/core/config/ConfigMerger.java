package io.github.hongjungwan.contextlog.core.config;

import java.util.Map;

/**
 * Right-biased deep merge of configuration documents.
 *
 * <p>For every key of the override: when both sides hold a mapping the two are merged
 * recursively, otherwise the override value replaces the base value wholly. Lists are
 * replaced, never concatenated. Neither input is modified.</p>
 */
public final class ConfigMerger {

    private ConfigMerger() {}

    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> result = ConfigDocuments.deepCopy(base);
        if (override == null || override.isEmpty()) {
            return result;
        }

        override.forEach((key, value) -> {
            Map<String, Object> baseSection = ConfigDocuments.asMap(result.get(key));
            Map<String, Object> overrideSection = ConfigDocuments.asMap(value);

            if (baseSection != null && overrideSection != null) {
                result.put(key, merge(baseSection, overrideSection));
            } else {
                result.put(key, ConfigDocuments.copyValue(value));
            }
        });

        return result;
    }
}
