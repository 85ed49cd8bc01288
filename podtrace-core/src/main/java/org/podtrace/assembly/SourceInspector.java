package org.podtrace.assembly;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.series.MetricSeriesLoader;
import org.podtrace.source.ExperimentSources;
import org.podtrace.source.MetricLocator;
import org.podtrace.source.MetricSource;
import org.podtrace.lang.Cause;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes the raw sources of each group without merging them: which metrics each file resolves to,
 * its header, row count and whether it carries the entity column.
 */
public final class SourceInspector {
    private static final Logger log = LoggerFactory.getLogger(SourceInspector.class);

    private final MetricCatalog catalog;
    private final String entityColumn;

    private SourceInspector(MetricCatalog catalog, String entityColumn) {
        this.catalog = catalog;
        this.entityColumn = entityColumn;
    }

    public static SourceInspector sourceInspector(MetricCatalog catalog, String entityColumn) {
        return new SourceInspector(catalog, entityColumn);
    }

    public Result<List<SourceReport>> inspectAll(Path root) {
        return ExperimentSources.scan(root)
                                .map(directories -> directories.stream()
                                                               .map(this::inspectDirectory)
                                                               .toList());
    }

    public SourceReport inspectDirectory(Path directory) {
        var groupId = directory.getFileName()
                               .toString();
        return ExperimentSources.groupDirectory(directory)
                                .fold(cause -> {
                                          log.warn("Cannot inspect group {}: {}", groupId, cause.message());
                                          return new SourceReport(groupId, List.of(), Option.some(cause));
                                      },
                                      this::inspect);
    }

    /**
     * Inspect every source the locator serves, CSV or not.
     */
    public SourceReport inspect(MetricLocator locator) {
        var entries = locator.sourceNames()
                             .stream()
                             .map(name -> locator.source(name)
                                                 .fold(cause -> unreadable(name, cause),
                                                       source -> describe(name, source)))
                             .toList();
        log.debug("Inspected {} sources of group {}",
                  entries.size(),
                  locator.group()
                         .id());
        return new SourceReport(locator.group()
                                       .id(),
                                entries,
                                Option.none());
    }

    private SourceReport.SourceEntry describe(String name, MetricSource source) {
        var metrics = MetricLocator.metricsOf(name, catalog.order());
        if (metrics.isEmpty()) {
            return new SourceReport.SourceEntry(name, metrics, List.of(), 0, false, Option.none());
        }
        return MetricSeriesLoader.rows(source, String.join(",", metrics))
                                 .fold(cause -> unreadable(name, cause),
                                       rows -> entry(name, metrics, rows));
    }

    private SourceReport.SourceEntry entry(String name, List<String> metrics, List<String[]> rows) {
        if (rows.isEmpty()) {
            return new SourceReport.SourceEntry(name, metrics, List.of(), 0, false, Option.none());
        }
        var columns = Arrays.stream(rows.get(0))
                            .map(String::trim)
                            .toList();
        return new SourceReport.SourceEntry(name,
                                            metrics,
                                            columns,
                                            rows.size() - 1,
                                            columns.contains(entityColumn),
                                            Option.none());
    }

    private static SourceReport.SourceEntry unreadable(String name, Cause cause) {
        log.warn("Cannot read source {}: {}", name, cause.message());
        return new SourceReport.SourceEntry(name, List.of(), List.of(), 0, false, Option.some(cause));
    }
}
