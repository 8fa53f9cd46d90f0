package io.github.hongjungwan.contextlog.core.context;

import io.github.hongjungwan.contextlog.api.context.ContextMiddleware;
import io.github.hongjungwan.contextlog.api.context.ContextSlot;
import io.github.hongjungwan.contextlog.api.context.LogContextProvider;
import io.github.hongjungwan.contextlog.core.logback.ContextLogFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Central registry of the active log contexts, in registration order.
 *
 * <p>The order is significant: it fixes the position of each context in the generated log
 * patterns and the nesting of the generated middlewares (first registered is outermost).
 * Contexts are not assumed to be independent, so callers that install middlewares one by one
 * must follow {@link #getAllMiddlewares()} iteration order.</p>
 *
 * <p>Populated during startup on a single thread and read-only afterwards.</p>
 */
@Slf4j
public class LogContextRegistry {

    private final Map<String, LogContextProvider<?>> contexts = new LinkedHashMap<>();
    private final BuiltinContextProviders builtins;

    public LogContextRegistry() {
        this(BuiltinContextProviders.standard());
    }

    public LogContextRegistry(BuiltinContextProviders builtins) {
        this.builtins = builtins;
    }

    /**
     * Register a context, replacing any context already registered under the name.
     */
    public void register(String name, LogContextProvider<?> context) {
        LogContextProvider<?> previous = contexts.put(name, context);
        if (previous != null) {
            log.debug("Log context '{}' replaced: {} -> {}", name, previous, context);
        } else {
            log.debug("Log context '{}' registered: {}", name, context);
        }
    }

    /**
     * Register a builtin context by name.
     *
     * @throws io.github.hongjungwan.contextlog.api.exception.BuiltinContextNotFoundException  unknown name
     * @throws io.github.hongjungwan.contextlog.api.exception.BuiltinContextAmbiguousException name claimed twice
     */
    public void registerBuiltin(String name) {
        register(name, builtins.create(name));
    }

    public Optional<LogContextProvider<?>> get(String name) {
        return Optional.ofNullable(contexts.get(name));
    }

    public boolean contains(String name) {
        return contexts.containsKey(name);
    }

    public Map<String, LogContextProvider<?>> getContexts() {
        return Collections.unmodifiableMap(contexts);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(contexts.keySet());
    }

    public boolean isEmpty() {
        return contexts.isEmpty();
    }

    /**
     * One fresh log filter per context.
     */
    public Map<String, ContextLogFilter> getAllFilters() {
        Map<String, ContextLogFilter> filters = new LinkedHashMap<>();
        contexts.forEach((name, context) -> filters.put(name, new ContextLogFilter(context)));
        return filters;
    }

    /**
     * One middleware per context, in installation order.
     */
    public Map<String, ContextMiddleware<?>> getAllMiddlewares() {
        Map<String, ContextMiddleware<?>> middlewares = new LinkedHashMap<>();
        contexts.forEach((name, context) -> middlewares.put(name, context.createMiddleware()));
        return middlewares;
    }

    public ContextMiddlewareChain createMiddlewareChain() {
        ContextMiddlewareChain.Builder builder = ContextMiddlewareChain.builder();
        getAllMiddlewares().forEach(builder::add);
        return builder.build();
    }

    /**
     * Wrap a Runnable so every context value bound on the calling thread is visible to it.
     */
    public Runnable wrap(Runnable runnable) {
        Runnable wrapped = runnable;
        for (ContextSlot<?> slot : slots()) {
            wrapped = slot.wrap(wrapped);
        }
        return wrapped;
    }

    /**
     * Wrap a Callable so every context value bound on the calling thread is visible to it.
     */
    public <V> Callable<V> wrap(Callable<V> callable) {
        Callable<V> wrapped = callable;
        for (ContextSlot<?> slot : slots()) {
            wrapped = slot.wrap(wrapped);
        }
        return wrapped;
    }

    private List<ContextSlot<?>> slots() {
        List<ContextSlot<?>> slots = new ArrayList<>();
        contexts.values().forEach(context -> slots.add(context.getSlot()));
        return slots;
    }
}
