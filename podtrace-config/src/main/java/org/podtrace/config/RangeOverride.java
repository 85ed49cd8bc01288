package org.podtrace.config;

/**
 * Replacement bounds for one metric of the fixed range table.
 *
 * @param metric Catalog metric name
 * @param min    Lower bound
 * @param max    Upper bound
 */
public record RangeOverride(String metric, double min, double max) {}
