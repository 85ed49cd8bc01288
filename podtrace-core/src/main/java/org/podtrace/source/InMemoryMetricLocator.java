package org.podtrace.source;

import org.podtrace.error.TraceError;
import org.podtrace.trace.ExperimentGroup;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;

import java.util.List;
import java.util.Map;

/**
 * {@link MetricLocator} over CSV texts held in memory.
 */
record InMemoryMetricLocator(ExperimentGroup group, Map<String, String> sources) implements MetricLocator {
    private static final String LOCATION = "in-memory";

    @Override
    public Result<MetricSource> locate(String metric) {
        return SourceMatching.resolve(group.id(), LOCATION, metric, sources.keySet())
                             .map(name -> MetricSource.text(name, sources.get(name)));
    }

    @Override
    public Result<MetricSource> source(String name) {
        return Option.option(sources.get(name))
                     .toResult(TraceError.sourceNotFound(group.id(), name, LOCATION))
                     .map(content -> MetricSource.text(name, content));
    }

    @Override
    public List<String> sourceNames() {
        return sources.keySet()
                      .stream()
                      .sorted()
                      .toList();
    }
}
