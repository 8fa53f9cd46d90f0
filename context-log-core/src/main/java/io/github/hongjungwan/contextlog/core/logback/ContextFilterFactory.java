package io.github.hongjungwan.contextlog.core.logback;

import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

import java.util.function.Supplier;

/**
 * Filter factory placed under {@code filters.<name>.factory} of a logging document.
 * Bound to a single context; equal for the same context instance.
 */
public record ContextFilterFactory(LogContextProvider<?> provider) implements Supplier<ContextLogFilter> {

    @Override
    public ContextLogFilter get() {
        return new ContextLogFilter(provider);
    }
}
