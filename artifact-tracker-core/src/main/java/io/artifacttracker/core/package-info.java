/**
 * Protocol-centric core for the artifact tracker client.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the default configuration table</li>
 *   <li>Lightweight URL and query-string building</li>
 *   <li>{@link io.artifacttracker.core.RequestContext}, the cancellation and deadline signal
 *       threaded through every operation</li>
 * </ul>
 *
 * <p>HTTP bindings and JSON codecs live in other modules.
 */
package io.artifacttracker.core;
