package org.podtrace.series;

import org.podtrace.catalog.MetricKind;

import java.util.List;

/**
 * Raw observations of one metric for one experiment group, in source order.
 * <p>
 * The series is named after its metric, which takes the place of the export's generic {@code value}
 * column when series are merged.
 *
 * @param metric       Catalog metric name
 * @param source       Id of the source the series was parsed from
 * @param kind         Whether observations carry an entity id
 * @param observations Samples in source order
 */
public record MetricSeries(String metric, String source, MetricKind kind, List<Observation> observations) {
    public MetricSeries {
        observations = List.copyOf(observations);
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public int size() {
        return observations.size();
    }
}
