package io.github.hongjungwan.contextlog.core.context;

import io.github.hongjungwan.contextlog.api.context.LogContextProvider;
import io.github.hongjungwan.contextlog.api.exception.BuiltinContextAmbiguousException;
import io.github.hongjungwan.contextlog.api.exception.BuiltinContextNotFoundException;
import io.github.hongjungwan.contextlog.core.context.builtin.CorrelationIdContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.RequestIdContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.ResponseTimeContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.TraceIdContextProvider;
import io.github.hongjungwan.contextlog.core.context.builtin.UserIdContextProvider;
import io.github.hongjungwan.contextlog.spi.LogContextProviderFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Name to constructor table of log contexts that can be registered by name alone.
 *
 * <p>The bundled contexts are listed explicitly; additional ones come from
 * {@link LogContextProviderFactory} service registrations. A name with no entry or with more
 * than one entry cannot be resolved.</p>
 */
@Slf4j
public final class BuiltinContextProviders {

    private final Map<String, List<Supplier<LogContextProvider<?>>>> table;

    private BuiltinContextProviders(Map<String, List<Supplier<LogContextProvider<?>>>> table) {
        this.table = table;
    }

    /**
     * Bundled contexts plus those registered through ServiceLoader.
     */
    public static BuiltinContextProviders standard() {
        Builder builder = bundled();

        ServiceLoader.load(LogContextProviderFactory.class)
                .forEach(factory -> {
                    log.debug("Discovered log context factory '{}' ({})",
                            factory.name(), factory.getClass().getName());
                    builder.add(factory.name(), factory::create);
                });

        return builder.build();
    }

    /**
     * Bundled contexts only.
     */
    public static Builder bundled() {
        return builder()
                .add(CorrelationIdContextProvider.NAME, CorrelationIdContextProvider::new)
                .add(RequestIdContextProvider.NAME, RequestIdContextProvider::new)
                .add(TraceIdContextProvider.NAME, TraceIdContextProvider::new)
                .add(UserIdContextProvider.NAME, UserIdContextProvider::new)
                .add(ResponseTimeContextProvider.NAME, ResponseTimeContextProvider::new);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Instantiate the context registered under the name.
     *
     * @throws BuiltinContextNotFoundException  no entry for the name
     * @throws BuiltinContextAmbiguousException more than one entry for the name
     */
    public LogContextProvider<?> create(String name) {
        List<Supplier<LogContextProvider<?>>> candidates = table.getOrDefault(name, List.of());

        if (candidates.isEmpty()) {
            throw new BuiltinContextNotFoundException(name);
        }
        if (candidates.size() > 1) {
            throw new BuiltinContextAmbiguousException(name, candidates.size());
        }

        return candidates.get(0).get();
    }

    public Set<String> names() {
        return table.keySet();
    }

    public static class Builder {
        private final Map<String, List<Supplier<LogContextProvider<?>>>> table = new LinkedHashMap<>();

        public Builder add(String name, Supplier<LogContextProvider<?>> constructor) {
            table.computeIfAbsent(name, k -> new ArrayList<>()).add(constructor);
            return this;
        }

        public BuiltinContextProviders build() {
            Map<String, List<Supplier<LogContextProvider<?>>>> copy = new LinkedHashMap<>();
            table.forEach((name, constructors) -> copy.put(name, List.copyOf(constructors)));
            return new BuiltinContextProviders(Collections.unmodifiableMap(copy));
        }
    }
}
