package io.github.hongjungwan.contextlog.spi;

import io.github.hongjungwan.contextlog.api.context.LogContextProvider;

/**
 * SPI for contributing builtin log contexts resolvable by name.
 *
 * <p>Register via ServiceLoader in META-INF/services/. A factory claiming a name that another
 * factory or a bundled context already uses makes that name ambiguous.</p>
 *
 * <h2>Implementation Example:</h2>
 * <pre>{@code
 * public class TenantIdContextFactory implements LogContextProviderFactory {
 *     @Override
 *     public String name() {
 *         return "tenant_id";
 *     }
 *
 *     @Override
 *     public LogContextProvider<?> create() {
 *         return new TenantIdContextProvider();
 *     }
 * }
 * }</pre>
 */
public interface LogContextProviderFactory {

    /**
     * Name under which the context is registered.
     */
    String name();

    /**
     * Create a new provider with its default settings.
     */
    LogContextProvider<?> create();
}
