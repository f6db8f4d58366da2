/**
 * Protocol-centric core for the Watson client.
 *
 * <p>This module is deliberately dependency-free. It contains only:
 * <ul>
 *   <li>Protocol constants (paths, headers, configuration keys)</li>
 *   <li>Small validated models ({@link io.watson.core.StackName}, {@link io.watson.core.Scheme})</li>
 *   <li>The {@link io.watson.core.WatsonException} error taxonomy</li>
 * </ul>
 *
 * <p>HTTP and JSON bindings live in other modules.
 */
package io.watson.core;
