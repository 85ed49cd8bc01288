package org.podtrace.series;

import org.podtrace.lang.Option;

import java.time.Instant;

/**
 * One raw sample of a metric.
 *
 * @param timestamp Sample time
 * @param value     Sample value, NaN when the export left the cell empty
 * @param entity    Entity id for per-entity metrics, empty for shared metrics
 */
public record Observation(Instant timestamp, double value, Option<String> entity) {}
