package io.github.hongjungwan.contextlog.api.context;

import java.util.concurrent.Callable;

/**
 * Per-thread cell holding the current value of one log context.
 *
 * <p>A value bound on one request thread is never visible to other threads. Work handed to
 * another thread sees the value only when wrapped with {@link #wrap(Runnable)} or
 * {@link #wrap(Callable)}, which bind the captured value for the duration of the task and
 * restore whatever the executing thread held before.</p>
 *
 * @param <T> value type
 */
public final class ContextSlot<T> {

    private final String name;
    private final T defaultValue;
    private final ThreadLocal<T> current;

    public ContextSlot(String name, T defaultValue) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.current = ThreadLocal.withInitial(() -> defaultValue);
    }

    public String getName() {
        return name;
    }

    public T getDefaultValue() {
        return defaultValue;
    }

    public void bind(T value) {
        current.set(value);
    }

    /**
     * Bound value, or the default when nothing is bound on this thread.
     */
    public T current() {
        return current.get();
    }

    public void reset() {
        current.remove();
    }

    /**
     * Wrap a Runnable so it runs with the value bound on the calling thread.
     */
    public Runnable wrap(Runnable runnable) {
        T captured = current();
        return () -> {
            T previous = current();
            bind(captured);
            try {
                runnable.run();
            } finally {
                bind(previous);
            }
        };
    }

    /**
     * Wrap a Callable so it runs with the value bound on the calling thread.
     */
    public <V> Callable<V> wrap(Callable<V> callable) {
        T captured = current();
        return () -> {
            T previous = current();
            bind(captured);
            try {
                return callable.call();
            } finally {
                bind(previous);
            }
        };
    }

    @Override
    public String toString() {
        return "ContextSlot[" + name + "=" + current() + "]";
    }
}
