/**
 * Tracker client: request dispatch, retry with backoff, and error normalization.
 *
 * <p>Entry point is {@link io.artifacttracker.client.TrackerClient}. Typed per-artifact operations
 * live in {@code io.artifacttracker.client.resources}.
 */
package io.artifacttracker.client;
