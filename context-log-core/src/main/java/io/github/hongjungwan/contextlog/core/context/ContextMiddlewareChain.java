package io.github.hongjungwan.contextlog.core.context;

import io.github.hongjungwan.contextlog.api.context.ContextMiddleware;
import io.github.hongjungwan.contextlog.api.context.ContextRequest;
import io.github.hongjungwan.contextlog.api.context.ContextResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered composition of context middlewares.
 *
 * <p>Middlewares run in the order they were added: the first one is outermost on the way in
 * and innermost on the way out, so its value is bound before any later one extracts and is
 * reset last.</p>
 */
public final class ContextMiddlewareChain {

    private final List<NamedMiddleware> middlewares;

    private ContextMiddlewareChain(List<NamedMiddleware> middlewares) {
        this.middlewares = middlewares;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Run the request through every middleware, then the endpoint.
     */
    public <R extends ContextResponse, E extends Exception> R execute(
            ContextRequest request, ContextMiddleware.Downstream<R, E> endpoint) throws E {
        return proceed(0, request, endpoint);
    }

    private <R extends ContextResponse, E extends Exception> R proceed(
            int index, ContextRequest request, ContextMiddleware.Downstream<R, E> endpoint) throws E {
        if (index >= middlewares.size()) {
            return endpoint.proceed(request);
        }

        ContextMiddleware<?> current = middlewares.get(index).middleware();
        return current.<R, E>handle(request, next -> proceed(index + 1, next, endpoint));
    }

    public List<String> names() {
        return middlewares.stream().map(NamedMiddleware::name).toList();
    }

    public int size() {
        return middlewares.size();
    }

    private record NamedMiddleware(String name, ContextMiddleware<?> middleware) {
    }

    public static class Builder {
        private final List<NamedMiddleware> middlewares = new ArrayList<>();

        public Builder add(String name, ContextMiddleware<?> middleware) {
            middlewares.add(new NamedMiddleware(name, middleware));
            return this;
        }

        public ContextMiddlewareChain build() {
            return new ContextMiddlewareChain(Collections.unmodifiableList(new ArrayList<>(middlewares)));
        }
    }
}
