package org.podtrace.trace;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.error.TraceError;
import org.podtrace.lang.Cause;
import org.podtrace.lang.Result;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a merged group table into one {@link PodTrace} per entity.
 * <p>
 * Entities are emitted in order of first appearance in the table, rows of each entity in timestamp order,
 * columns in catalog order. An entity with any missing or non-finite value is rejected as a whole.
 */
public final class PodTraceExtractor {
    private static final Logger log = LoggerFactory.getLogger(PodTraceExtractor.class);

    private final MetricCatalog catalog;

    private PodTraceExtractor(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    public static PodTraceExtractor podTraceExtractor(MetricCatalog catalog) {
        return new PodTraceExtractor(catalog);
    }

    /**
     * Extract all entity traces of the table. Fails with {@link TraceError.NoEntities} when the table has no rows.
     */
    public Result<ExtractionResult> extract(AlignedTable table) {
        var group = table.group();
        if (table.isEmpty()) {
            return TraceError.noEntities(group.id()).result();
        }
        var byEntity = new LinkedHashMap<String, List<AlignedRow>>();
        for (var row : table.rows()) {
            byEntity.computeIfAbsent(row.entity(), entity -> new ArrayList<>())
                    .add(row);
        }
        if (byEntity.size() != group.cardinality()) {
            log.warn("Group {} declares {} replicas but has {} entities", group.id(), group.cardinality(), byEntity.size());
        }
        var columns = columnMapping(table);
        var traces = new ArrayList<PodTrace>(byEntity.size());
        var failures = new ArrayList<Cause>();
        for (var entry : byEntity.entrySet()) {
            extractEntity(group, entry.getKey(), entry.getValue(), columns)
                    .onSuccess(traces::add)
                    .onFailure(cause -> {
                        log.warn("Rejected entity {} of group {}: {}", entry.getKey(), group.id(), cause.message());
                        failures.add(cause);
                    });
        }
        log.info("Extracted {} of {} entity traces from group {}", traces.size(), byEntity.size(), group.id());
        return Result.success(new ExtractionResult(group, traces, failures));
    }

    private int[] columnMapping(AlignedTable table) {
        var order = catalog.order();
        var mapping = new int[order.size()];
        for (int j = 0; j < order.size(); j++) {
            mapping[j] = table.columnIndex(order.get(j));
        }
        return mapping;
    }

    private Result<PodTrace> extractEntity(ExperimentGroup group, String entity, List<AlignedRow> rows, int[] columns) {
        var order = catalog.order();
        for (int j = 0; j < columns.length; j++) {
            if (columns[j] < 0) {
                return TraceError.incompleteTrace(group.id(), entity, order.get(j), "column missing from merged table")
                                 .result();
            }
        }
        var sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(AlignedRow::timestamp));
        var values = new double[sorted.size()][order.size()];
        var missing = 0;
        String firstMetric = null;
        AlignedRow firstRow = null;
        for (int t = 0; t < sorted.size(); t++) {
            var row = sorted.get(t);
            for (int j = 0; j < columns.length; j++) {
                var value = row.valueAt(columns[j]);
                if (!Double.isFinite(value)) {
                    if (missing++ == 0) {
                        firstMetric = order.get(j);
                        firstRow = row;
                    }
                }
                values[t][j] = value;
            }
        }
        if (missing > 0) {
            return TraceError.incompleteTrace(group.id(),
                                              entity,
                                              firstMetric,
                                              missing + " missing or non-finite values, first at " + firstRow.timestamp())
                             .result();
        }
        return PodTrace.podTrace(values,
                                 TraceMetadata.traceMetadata(group, entity, sorted.size(), order.size()));
    }
}
