package io.github.hongjungwan.contextlog.api.context;

/**
 * Binds one provider's value around the handling of a request.
 *
 * <p>Per request: extract once, publish as request attribute and slot value, run downstream,
 * decorate the response when downstream returned one, and reset the slot on every exit path.
 * Exceptions from downstream pass through untouched.</p>
 *
 * @param <T> value type of the provider
 */
public final class ContextMiddleware<T> {

    private final LogContextProvider<T> provider;

    ContextMiddleware(LogContextProvider<T> provider) {
        this.provider = provider;
    }

    public LogContextProvider<T> getProvider() {
        return provider;
    }

    public <R extends ContextResponse, E extends Exception> R handle(
            ContextRequest request, Downstream<R, E> downstream) throws E {

        T value = provider.extract(request);

        request.setAttribute(provider.getName(), value);
        provider.bind(value);

        try {
            R response = downstream.proceed(request);
            if (response != null) {
                provider.decorateResponse(response, value);
            }
            return response;
        } finally {
            provider.reset();
        }
    }

    /**
     * Rest of the request pipeline.
     *
     * @param <R> response type
     * @param <E> checked exception the pipeline may raise
     */
    @FunctionalInterface
    public interface Downstream<R extends ContextResponse, E extends Exception> {
        R proceed(ContextRequest request) throws E;
    }
}
