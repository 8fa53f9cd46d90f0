/**
 * Public API for request-scoped log contexts.
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.contextlog.api.context.LogContextProvider} - per-request value source</li>
 *   <li>{@link io.github.hongjungwan.contextlog.api.context.ContextMiddleware} - binds values around a request</li>
 *   <li>{@link io.github.hongjungwan.contextlog.api.config.LogContextSettings} - registry and configurator settings</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * LogContextRegistry registry = new LogContextRegistry();
 * settings.getLogContexts().forEach(registry::registerBuiltin);
 *
 * LogConfigurator configurator = new LogConfigurator(settings, registry);
 * configurator.configure(null, true);
 *
 * ContextMiddlewareChain chain = registry.createMiddlewareChain();
 * ContextResponse response = chain.execute(request, req -> handler.handle(req));
 * }</pre>
 */
package io.github.hongjungwan.contextlog.api;
