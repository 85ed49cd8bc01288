package org.podtrace.normalize;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.config.RangeOverride;
import org.podtrace.trace.PodTrace;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frozen per-metric bounds, one {@link NormalizationRange} per catalog metric in column order.
 * <p>
 * The {@code mins}, {@code maxs} and {@code scales} vectors are computed once at construction.
 */
public final class RangeTable {
    private static final Logger log = LoggerFactory.getLogger(RangeTable.class);

    private static final Map<String, double[]> STANDARD_BOUNDS = standardBounds();

    private final MetricCatalog catalog;
    private final List<NormalizationRange> ranges;
    private final double[] mins;
    private final double[] maxs;
    private final double[] scales;

    private RangeTable(MetricCatalog catalog, List<NormalizationRange> ranges) {
        this.catalog = catalog;
        this.ranges = List.copyOf(ranges);
        this.mins = new double[ranges.size()];
        this.maxs = new double[ranges.size()];
        this.scales = new double[ranges.size()];
        for (int j = 0; j < ranges.size(); j++) {
            mins[j] = ranges.get(j)
                            .min();
            maxs[j] = ranges.get(j)
                            .max();
            scales[j] = maxs[j] - mins[j];
        }
    }

    private static Map<String, double[]> standardBounds() {
        var bounds = new LinkedHashMap<String, double[]>();
        bounds.put(MetricCatalog.CPU_PSI, new double[]{0.0, 1.0});
        bounds.put(MetricCatalog.CPU_USAGE, new double[]{0.0, 8.0});
        bounds.put(MetricCatalog.GPU_MEMORY, new double[]{0.0, 20000.0});
        bounds.put(MetricCatalog.GPU_POWER, new double[]{0.0, 100.0});
        bounds.put(MetricCatalog.GPU_TEMPERATURE, new double[]{0.0, 100.0});
        bounds.put(MetricCatalog.GPU_UTILIZATION, new double[]{0.0, 100.0});
        bounds.put(MetricCatalog.INFERENCE_LATENCY_AVG, new double[]{0.0, 5.0});
        bounds.put(MetricCatalog.INFERENCE_LATENCY_P50, new double[]{0.0, 5.0});
        bounds.put(MetricCatalog.INFERENCE_LATENCY_P95, new double[]{0.0, 8.0});
        bounds.put(MetricCatalog.INFERENCE_LATENCY_P99, new double[]{0.0, 10.0});
        bounds.put(MetricCatalog.INFERENCE_THROUGHPUT, new double[]{0.0, 500.0});
        bounds.put(MetricCatalog.INFERENCE_TOTAL, new double[]{0.0, 100000.0});
        bounds.put(MetricCatalog.IO_PSI, new double[]{0.0, 1.0});
        bounds.put(MetricCatalog.MEMORY_PSI, new double[]{0.0, 1.0});
        bounds.put(MetricCatalog.MEMORY_USAGE, new double[]{0.0, 1e10});
        return Map.copyOf(bounds);
    }

    /**
     * Absolute bounds of the standard metrics. Fails with {@link NormalizerError.MissingRange} for a catalog
     * metric that has no standard bounds.
     */
    public static Result<RangeTable> fixed(MetricCatalog catalog) {
        var ranges = new LinkedHashMap<String, NormalizationRange>();
        for (var metric : catalog.order()) {
            var bounds = STANDARD_BOUNDS.get(metric);
            if (bounds == null) {
                return NormalizerError.missingRange(metric).result();
            }
            ranges.put(metric, new NormalizationRange(metric, bounds[0], bounds[1]));
        }
        return rangeTable(catalog, ranges);
    }

    /**
     * Table from explicit ranges keyed by metric. Every catalog metric needs a range and no other metric may have one.
     */
    public static Result<RangeTable> rangeTable(MetricCatalog catalog, Map<String, NormalizationRange> ranges) {
        for (var metric : ranges.keySet()) {
            if (!catalog.contains(metric)) {
                return NormalizerError.unknownMetric(metric).result();
            }
        }
        var ordered = new ArrayList<NormalizationRange>(catalog.size());
        for (var metric : catalog.order()) {
            var range = ranges.get(metric);
            if (range == null) {
                return NormalizerError.missingRange(metric).result();
            }
            if (!Double.isFinite(range.min()) || !Double.isFinite(range.max()) || range.max() <= range.min()) {
                return NormalizerError.invalidRange(metric, range.min(), range.max()).result();
            }
            ordered.add(range);
        }
        return Result.success(new RangeTable(catalog, ordered));
    }

    /**
     * Derive bounds from reference traces.
     * <p>
     * Per metric over all values of all traces: {@code min = max(0, observed min)} and
     * {@code max = percentile(observed, percentile) * margin}; a range narrower than {@code minWidth}
     * becomes {@code [min, min + 1]}.
     */
    public static Result<RangeTable> derived(MetricCatalog catalog,
                                             List<PodTrace> references,
                                             double percentile,
                                             double margin,
                                             double minWidth) {
        if (references.isEmpty()) {
            return NormalizerError.EmptyReferenceSet.INSTANCE.result();
        }
        for (var trace : references) {
            if (trace.metrics() != catalog.size()) {
                return NormalizerError.shapeMismatch(catalog.size(), trace.metrics(), "reference trace " + trace)
                                      .result();
            }
        }
        var ranges = new LinkedHashMap<String, NormalizationRange>();
        for (int j = 0; j < catalog.size(); j++) {
            var metric = catalog.order()
                                .get(j);
            var values = collect(references, j);
            if (values.length == 0) {
                return NormalizerError.EmptyReferenceSet.INSTANCE.result();
            }
            Arrays.sort(values);
            var min = Math.max(0.0, values[0]);
            var max = Percentiles.percentile(values, percentile) * margin;
            if (max - min < minWidth) {
                max = min + 1.0;
            }
            ranges.put(metric, new NormalizationRange(metric, min, max));
            log.debug("Derived range for {}: [{}, {}] from {} values", metric, min, max, values.length);
        }
        log.info("Derived normalization ranges from {} reference traces at p{} x {}",
                 references.size(),
                 percentile,
                 margin);
        return rangeTable(catalog, ranges);
    }

    private static double[] collect(List<PodTrace> references, int metric) {
        var total = references.stream()
                              .mapToInt(PodTrace::timesteps)
                              .sum();
        var values = new double[total];
        var offset = 0;
        for (var trace : references) {
            var column = trace.column(metric);
            System.arraycopy(column, 0, values, offset, column.length);
            offset += column.length;
        }
        return values;
    }

    /**
     * Same table with the bounds of the listed metrics replaced.
     */
    public Result<RangeTable> withOverrides(List<RangeOverride> overrides) {
        if (overrides.isEmpty()) {
            return Result.success(this);
        }
        var replaced = new LinkedHashMap<String, NormalizationRange>();
        ranges.forEach(range -> replaced.put(range.metric(), range));
        for (var override : overrides) {
            if (!catalog.contains(override.metric())) {
                return NormalizerError.unknownMetric(override.metric()).result();
            }
            replaced.put(override.metric(), new NormalizationRange(override.metric(), override.min(), override.max()));
            log.debug("Range of {} overridden with [{}, {}]", override.metric(), override.min(), override.max());
        }
        return rangeTable(catalog, replaced);
    }

    public MetricCatalog catalog() {
        return catalog;
    }

    /**
     * Ranges in catalog order.
     */
    public List<NormalizationRange> ranges() {
        return ranges;
    }

    public Option<NormalizationRange> range(String metric) {
        return catalog.indexOf(metric)
                      .map(ranges::get);
    }

    public NormalizationRange rangeAt(int column) {
        return ranges.get(column);
    }

    public int size() {
        return ranges.size();
    }

    public double[] mins() {
        return mins.clone();
    }

    public double[] maxs() {
        return maxs.clone();
    }

    public double[] scales() {
        return scales.clone();
    }

    double minAt(int column) {
        return mins[column];
    }

    double scaleAt(int column) {
        return scales[column];
    }

    /**
     * Table of bounds, one line per metric: name, min, max and width.
     */
    public String describe() {
        var builder = new StringBuilder();
        builder.append("Normalization ranges:\n");
        builder.append("=".repeat(72))
               .append('\n');
        builder.append(String.format("%-24s %14s %14s %14s%n", "Metric", "Min", "Max", "Width"));
        builder.append("-".repeat(72))
               .append('\n');
        for (var range : ranges) {
            builder.append(String.format("%-24s %14.4g %14.4g %14.4g%n",
                                         range.metric(),
                                         range.min(),
                                         range.max(),
                                         range.width()));
        }
        return builder.toString();
    }

    /**
     * Names of the metrics whose bounds differ between the two tables.
     */
    public List<String> differences(RangeTable other) {
        var differing = new ArrayList<String>();
        var otherByMetric = new HashMap<String, NormalizationRange>();
        other.ranges.forEach(range -> otherByMetric.put(range.metric(), range));
        for (var range : ranges) {
            if (!range.equals(otherByMetric.get(range.metric()))) {
                differing.add(range.metric());
            }
        }
        return differing;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RangeTable other && catalog.equals(other.catalog) && ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return catalog.hashCode() * 31 + ranges.hashCode();
    }

    @Override
    public String toString() {
        return "RangeTable" + ranges;
    }
}
