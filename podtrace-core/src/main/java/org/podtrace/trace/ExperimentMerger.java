package org.podtrace.trace;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.error.TraceError;
import org.podtrace.series.MetricSeries;
import org.podtrace.series.MetricSeriesLoader;
import org.podtrace.source.MetricLocator;
import org.podtrace.lang.Result;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the per-entity and shared series of one experiment group into an {@link AlignedTable}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Outer join of all per-entity series on (timestamp, entity)</li>
 *   <li>Outer join of all shared series on timestamp</li>
 *   <li>Left join of the shared table onto the per-entity table on timestamp; shared-only timestamps are dropped</li>
 *   <li>Sort by (timestamp, entity)</li>
 * </ol>
 * Cells without an observation stay NaN; completeness is checked by {@link PodTraceExtractor}.
 * Any metric that cannot be located or parsed fails the whole group.
 */
public final class ExperimentMerger {
    private static final Logger log = LoggerFactory.getLogger(ExperimentMerger.class);

    private static final Comparator<EntityKey> KEY_ORDER = Comparator.comparing(EntityKey::timestamp)
                                                                     .thenComparing(EntityKey::entity);

    private final MetricCatalog catalog;
    private final MetricSeriesLoader loader;

    private ExperimentMerger(MetricSeriesLoader loader) {
        this.catalog = loader.catalog();
        this.loader = loader;
    }

    public static ExperimentMerger experimentMerger(MetricSeriesLoader loader) {
        return new ExperimentMerger(loader);
    }

    /**
     * Merge all catalog metrics of the group served by the locator.
     */
    public Result<AlignedTable> merge(MetricLocator locator) {
        var group = locator.group();
        return loadAll(locator, catalog.perEntity())
                      .flatMap(perEntity -> loadAll(locator, catalog.shared())
                                                   .flatMap(shared -> align(group, perEntity, shared)));
    }

    private Result<List<MetricSeries>> loadAll(MetricLocator locator, List<String> metrics) {
        Result<List<MetricSeries>> loaded = Result.success(List.of());
        for (var metric : metrics) {
            loaded = loaded.flatMap(list -> locator.locate(metric)
                                                   .flatMap(source -> loader.load(source, metric))
                                                   .map(series -> append(list, series)));
        }
        return loaded;
    }

    private static List<MetricSeries> append(List<MetricSeries> list, MetricSeries series) {
        var result = new ArrayList<MetricSeries>(list.size() + 1);
        result.addAll(list);
        result.add(series);
        return result;
    }

    /**
     * Join already loaded series of one group. Series must cover every catalog metric exactly once.
     */
    public Result<AlignedTable> align(ExperimentGroup group, List<MetricSeries> perEntity, List<MetricSeries> shared) {
        Result<TreeMap<EntityKey, double[]>> entityRows = Result.success(new TreeMap<>(KEY_ORDER));
        for (var series : perEntity) {
            entityRows = entityRows.flatMap(rows -> joinPerEntity(group, series, rows));
        }
        Result<Map<Instant, double[]>> sharedRows = Result.success(new HashMap<>());
        for (var series : shared) {
            sharedRows = sharedRows.flatMap(rows -> joinShared(group, series, rows));
        }
        var sharedTable = sharedRows;
        return entityRows.flatMap(rows -> sharedTable.map(broadcast -> broadcast(group, rows, broadcast)))
                         .onSuccess(table -> log.info("Merged group {}: {} rows, {} per-entity and {} shared series",
                                                      group.id(),
                                                      table.rows()
                                                           .size(),
                                                      perEntity.size(),
                                                      shared.size()));
    }

    private AlignedTable broadcast(ExperimentGroup group,
                                   TreeMap<EntityKey, double[]> entityRows,
                                   Map<Instant, double[]> sharedRows) {
        var sharedColumns = catalog.shared()
                                   .stream()
                                   .mapToInt(metric -> catalog.indexOf(metric)
                                                              .or(-1))
                                   .toArray();
        var rows = new ArrayList<AlignedRow>(entityRows.size());
        var unmatched = 0;
        for (var entry : entityRows.entrySet()) {
            var key = entry.getKey();
            var cells = entry.getValue();
            var shared = sharedRows.get(key.timestamp());
            if (shared == null) {
                unmatched++;
            } else {
                for (int column : sharedColumns) {
                    cells[column] = shared[column];
                }
            }
            rows.add(new AlignedRow(key.timestamp(), key.entity(), cells));
        }
        if (unmatched > 0) {
            log.debug("Group {}: {} entity rows have no shared observation at their timestamp", group.id(), unmatched);
        }
        return new AlignedTable(group, catalog.order(), rows);
    }

    private Result<TreeMap<EntityKey, double[]>> joinPerEntity(ExperimentGroup group,
                                                               MetricSeries series,
                                                               TreeMap<EntityKey, double[]> rows) {
        var column = columnOf(series);
        if (column < 0) {
            return unknownMetric(series);
        }
        var seen = new HashSet<EntityKey>();
        for (var observation : series.observations()) {
            var entity = observation.entity();
            if (entity.isEmpty()) {
                return TraceError.malformedSource(series.source(), series.metric(), "observation without entity id")
                                 .result();
            }
            var key = new EntityKey(observation.timestamp(), entity.or(""));
            if (!seen.add(key)) {
                return duplicate(series, key.timestamp() + " for entity " + key.entity());
            }
            rows.computeIfAbsent(key, k -> emptyRow())[column] = observation.value();
        }
        log.debug("Group {}: joined {} observations of {}", group.id(), series.size(), series.metric());
        return Result.success(rows);
    }

    private Result<Map<Instant, double[]>> joinShared(ExperimentGroup group,
                                                      MetricSeries series,
                                                      Map<Instant, double[]> rows) {
        var column = columnOf(series);
        if (column < 0) {
            return unknownMetric(series);
        }
        var seen = new HashSet<Instant>();
        for (var observation : series.observations()) {
            if (!seen.add(observation.timestamp())) {
                return duplicate(series, observation.timestamp()
                                                    .toString());
            }
            rows.computeIfAbsent(observation.timestamp(), k -> emptyRow())[column] = observation.value();
        }
        log.debug("Group {}: joined {} observations of {}", group.id(), series.size(), series.metric());
        return Result.success(rows);
    }

    private int columnOf(MetricSeries series) {
        return catalog.indexOf(series.metric())
                      .or(-1);
    }

    private static <T> Result<T> unknownMetric(MetricSeries series) {
        return TraceError.malformedSource(series.source(), series.metric(), "metric is not part of the catalog")
                         .result();
    }

    private static <T> Result<T> duplicate(MetricSeries series, String key) {
        return TraceError.malformedSource(series.source(), series.metric(), "duplicate observation at " + key)
                         .result();
    }

    private double[] emptyRow() {
        var row = new double[catalog.size()];
        Arrays.fill(row, Double.NaN);
        return row;
    }

    private record EntityKey(Instant timestamp, String entity) {}
}
