package org.podtrace.catalog;

/**
 * How a metric is keyed in the raw exports.
 */
public enum MetricKind {
    /**
     * Observed separately for every entity; rows carry an entity id.
     */
    PER_ENTITY,
    /**
     * Observed once per timestamp and broadcast to every entity.
     */
    SHARED
}
