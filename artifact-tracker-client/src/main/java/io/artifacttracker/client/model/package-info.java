/**
 * Artifact records and the result envelopes the tracker wraps them in.
 *
 * <p>Property names map to the service's UpperCamelCase JSON names ({@code objectID} is
 * {@code ObjectID}) through the codec's naming strategy.
 */
package io.artifacttracker.client.model;
