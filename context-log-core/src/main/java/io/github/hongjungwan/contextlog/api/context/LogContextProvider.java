package io.github.hongjungwan.contextlog.api.context;

import java.util.Map;

/**
 * Named source of one piece of per-request metadata.
 *
 * <p>A provider knows how to pull its value out of an inbound request, where to keep it while
 * the request is handled ({@link ContextSlot}), how to echo it on the response and how to render
 * it on log events ({@link #logFields()}). {@link #createMiddleware()} binds the value around
 * request handling; log backends read the rendered fields of the current value.</p>
 *
 * <h2>Implementation Example:</h2>
 * <pre>{@code
 * public class TenantIdContextProvider extends LogContextProvider<String> {
 *     public TenantIdContextProvider() {
 *         super("tenant_id", "-");
 *     }
 *
 *     @Override
 *     public String extract(ContextRequest request) {
 *         return request.header("x-tenant-id").orElse(getDefaultValue());
 *     }
 * }
 * }</pre>
 *
 * @param <T> value type
 */
public abstract class LogContextProvider<T> {

    private final String name;
    private final ContextSlot<T> slot;

    protected LogContextProvider(String name, T defaultValue) {
        this.name = name;
        this.slot = new ContextSlot<>(name, defaultValue);
    }

    public String getName() {
        return name;
    }

    public T getDefaultValue() {
        return slot.getDefaultValue();
    }

    public ContextSlot<T> getSlot() {
        return slot;
    }

    /**
     * Pull the value out of the request. Must not throw: missing data resolves to a
     * synthesized or default value.
     */
    public abstract T extract(ContextRequest request);

    /**
     * Echo the value on the response. No-op unless overridden.
     */
    public void decorateResponse(ContextResponse response, T value) {
    }

    public void bind(T value) {
        slot.bind(value);
    }

    public T current() {
        return slot.current();
    }

    public void reset() {
        slot.reset();
    }

    /**
     * Text written to log output for a value.
     */
    public String render(T value) {
        return value == null ? "-" : String.valueOf(value);
    }

    /**
     * Fields stamped onto a log event, keyed by the names log patterns refer to.
     */
    public Map<String, String> logFields() {
        return Map.of(name, render(current()));
    }

    public ContextMiddleware<T> createMiddleware() {
        return new ContextMiddleware<>(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
