package org.podtrace.source;

import org.podtrace.trace.ExperimentGroup;
import org.podtrace.lang.Result;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Resolves the single source of a metric within one experiment group's source collection.
 * <p>
 * Resolution never falls back to the first of several candidates: zero matches fail with
 * {@link org.podtrace.error.TraceError.SourceNotFound}, several with
 * {@link org.podtrace.error.TraceError.AmbiguousSource}.
 */
public interface MetricLocator {
    /**
     * Group whose sources this locator serves.
     */
    ExperimentGroup group();

    Result<MetricSource> locate(String metric);

    /**
     * Names of all sources in the collection, sorted.
     */
    List<String> sourceNames();

    /**
     * Source with the given name, whether or not it matches a catalog metric.
     */
    Result<MetricSource> source(String name);

    /**
     * Catalog metrics whose token run occurs in the source name. Empty for non-CSV names.
     */
    static List<String> metricsOf(String sourceName, List<String> metrics) {
        return metrics.stream()
                      .filter(metric -> SourceMatching.matches(sourceName, metric))
                      .toList();
    }

    /**
     * Locator over the files of a group directory. The directory is listed once.
     */
    static Result<MetricLocator> directory(ExperimentGroup group, Path directory) {
        return DirectoryMetricLocator.directoryMetricLocator(group, directory);
    }

    /**
     * Locator over in-memory CSV texts keyed by source name.
     */
    static MetricLocator inMemory(ExperimentGroup group, Map<String, String> sources) {
        return new InMemoryMetricLocator(group, Map.copyOf(sources));
    }
}
