package org.podtrace.series;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.catalog.MetricKind;
import org.podtrace.error.TraceError;
import org.podtrace.source.MetricSource;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;

import java.io.Reader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import static org.podtrace.lang.Option.none;
import static org.podtrace.lang.Option.some;

/**
 * Parses one raw per-metric CSV export into a {@link MetricSeries}.
 * <p>
 * Required columns are {@code timestamp} and {@code value}, plus the entity column for per-entity metrics.
 * Any other columns (monitoring labels) are ignored. A file with a header and no rows yields an empty
 * series; gaps are left to the merger.
 */
public final class MetricSeriesLoader {
    public static final String TIMESTAMP_COLUMN = "timestamp";
    public static final String VALUE_COLUMN = "value";

    private static final CsvMapper CSV_MAPPER = csvMapper();

    private final MetricCatalog catalog;
    private final String entityColumn;

    private MetricSeriesLoader(MetricCatalog catalog, String entityColumn) {
        this.catalog = catalog;
        this.entityColumn = entityColumn;
    }

    public static MetricSeriesLoader metricSeriesLoader(MetricCatalog catalog, String entityColumn) {
        return new MetricSeriesLoader(catalog, entityColumn);
    }

    private static CsvMapper csvMapper() {
        var mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        return mapper;
    }

    public MetricCatalog catalog() {
        return catalog;
    }

    /**
     * Load the series of a catalog metric from its source.
     */
    public Result<MetricSeries> load(MetricSource source, String metric) {
        return catalog.kindOf(metric)
                      .toResult(TraceError.malformedSource(source.id(), metric, "metric is not part of the catalog"))
                      .flatMap(kind -> rows(source, metric).flatMap(rows -> toSeries(source.id(), metric, kind, rows)));
    }

    /**
     * Raw rows of a source, header row first. The metric name only labels errors.
     */
    public static Result<List<String[]>> rows(MetricSource source, String metric) {
        return source.open()
                     .flatMap(reader -> readRows(source.id(), metric, reader));
    }

    private static Result<List<String[]>> readRows(String sourceId, String metric, Reader reader) {
        return Result.lift(e -> TraceError.malformedSource(sourceId, metric, "unreadable CSV: " + e.getMessage()),
                           () -> {
                               try (reader;
                                    MappingIterator<String[]> iterator = CSV_MAPPER.readerFor(String[].class)
                                                                                   .readValues(reader)) {
                                   return iterator.readAll();
                               }
                           });
    }

    private Result<MetricSeries> toSeries(String sourceId, String metric, MetricKind kind, List<String[]> rows) {
        if (rows.isEmpty()) {
            return TraceError.malformedSource(sourceId, metric, "missing header row").result();
        }
        var header = rows.get(0);
        var timestampIndex = columnIndex(header, TIMESTAMP_COLUMN);
        var valueIndex = columnIndex(header, VALUE_COLUMN);
        var entityIndex = kind == MetricKind.PER_ENTITY
                          ? columnIndex(header, entityColumn)
                          : -1;
        var missing = new ArrayList<String>();
        if (timestampIndex < 0) {
            missing.add(TIMESTAMP_COLUMN);
        }
        if (valueIndex < 0) {
            missing.add(VALUE_COLUMN);
        }
        if (kind == MetricKind.PER_ENTITY && entityIndex < 0) {
            missing.add(entityColumn);
        }
        if (!missing.isEmpty()) {
            return TraceError.malformedSource(sourceId, metric, "missing required columns " + missing).result();
        }
        var required = Math.max(timestampIndex, Math.max(valueIndex, entityIndex));
        var observations = new ArrayList<Observation>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            var row = rows.get(i);
            var line = i + 1;
            if (row.length <= required) {
                return TraceError.malformedSource(sourceId,
                                                  metric,
                                                  "line " + line + " has " + row.length + " columns, expected at least "
                                                  + (required + 1))
                                 .result();
            }
            var timestamp = Timestamps.parse(row[timestampIndex]);
            if (timestamp.isEmpty()) {
                return TraceError.malformedSource(sourceId,
                                                  metric,
                                                  "line " + line + " has invalid timestamp '" + row[timestampIndex] + "'")
                                 .result();
            }
            var value = parseValue(row[valueIndex]);
            if (value.isEmpty()) {
                return TraceError.malformedSource(sourceId,
                                                  metric,
                                                  "line " + line + " has invalid value '" + row[valueIndex] + "'")
                                 .result();
            }
            Option<String> entity = none();
            if (entityIndex >= 0) {
                var entityId = row[entityIndex].trim();
                if (entityId.isEmpty()) {
                    return TraceError.malformedSource(sourceId, metric, "line " + line + " has blank " + entityColumn)
                                     .result();
                }
                entity = some(entityId);
            }
            observations.add(new Observation(timestamp.or(Instant.EPOCH), value.or(Double.NaN), entity));
        }
        return Result.success(new MetricSeries(metric, sourceId, kind, observations));
    }

    private static int columnIndex(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim()
                         .equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private static Option<Double> parseValue(String text) {
        var value = text.trim();
        if (value.isEmpty() || value.equalsIgnoreCase("nan")) {
            return some(Double.NaN);
        }
        if (value.equalsIgnoreCase("+inf") || value.equalsIgnoreCase("inf")) {
            return some(Double.POSITIVE_INFINITY);
        }
        if (value.equalsIgnoreCase("-inf")) {
            return some(Double.NEGATIVE_INFINITY);
        }
        try{
            return some(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return none();
        }
    }
}
