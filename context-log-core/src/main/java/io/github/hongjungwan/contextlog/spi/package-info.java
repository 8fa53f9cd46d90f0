/**
 * Service Provider Interface for extending the set of builtin log contexts.
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.contextlog.spi.LogContextProviderFactory} - named provider factory</li>
 * </ul>
 */
package io.github.hongjungwan.contextlog.spi;
