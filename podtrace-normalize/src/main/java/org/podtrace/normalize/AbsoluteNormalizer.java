package org.podtrace.normalize;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.config.NormalizationConfig;
import org.podtrace.config.NormalizationMode;
import org.podtrace.trace.PodTrace;
import org.podtrace.lang.Result;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-channel affine map between metric units and [0, 1].
 * <p>
 * {@code normalize(x) = clamp((x - min) / (max - min), 0, 1)} and {@code denormalize(y) = y * (max - min) + min}.
 * Values outside the bounds are clamped and therefore do not round-trip exactly. The only state is the
 * {@link RangeTable}; inputs are never modified.
 */
public final class AbsoluteNormalizer {
    private static final Logger log = LoggerFactory.getLogger(AbsoluteNormalizer.class);

    private final RangeTable ranges;

    private AbsoluteNormalizer(RangeTable ranges) {
        this.ranges = ranges;
    }

    public static AbsoluteNormalizer absoluteNormalizer(RangeTable ranges) {
        return new AbsoluteNormalizer(ranges);
    }

    /**
     * Normalizer over the standard absolute bounds.
     */
    public static Result<AbsoluteNormalizer> standard(MetricCatalog catalog) {
        return RangeTable.fixed(catalog)
                         .map(AbsoluteNormalizer::absoluteNormalizer);
    }

    /**
     * Normalizer as configured: fixed bounds with overrides, or bounds derived from the reference traces.
     * Overrides apply in both modes.
     */
    public static Result<AbsoluteNormalizer> absoluteNormalizer(MetricCatalog catalog,
                                                                NormalizationConfig config,
                                                                List<PodTrace> references) {
        var base = config.mode() == NormalizationMode.DERIVED
                   ? RangeTable.derived(catalog, references, config.percentile(), config.margin(), config.minWidth())
                   : RangeTable.fixed(catalog);
        return base.flatMap(table -> table.withOverrides(config.overrides()))
                   .map(AbsoluteNormalizer::absoluteNormalizer)
                   .onSuccess(normalizer -> log.info("Using {} normalization ranges", config.mode().value()));
    }

    public RangeTable rangeTable() {
        return ranges;
    }

    public Result<double[][]> normalize(double[][] values) {
        return checkShape(values).map(checked -> transform(checked, true));
    }

    public Result<double[][]> denormalize(double[][] values) {
        return checkShape(values).map(checked -> transform(checked, false));
    }

    public Result<PodTrace> normalize(PodTrace trace) {
        return normalize(trace.values()).map(trace::withValues);
    }

    public Result<PodTrace> denormalize(PodTrace trace) {
        return denormalize(trace.values()).map(trace::withValues);
    }

    /**
     * Normalize every trace independently. Fails on the first trace with a wrong shape.
     */
    public Result<List<PodTrace>> normalizeAll(List<PodTrace> traces) {
        return applyAll(traces, true);
    }

    public Result<List<PodTrace>> denormalizeAll(List<PodTrace> traces) {
        return applyAll(traces, false);
    }

    private Result<List<PodTrace>> applyAll(List<PodTrace> traces, boolean forward) {
        Result<List<PodTrace>> transformed = Result.success(new ArrayList<>(traces.size()));
        for (var trace : traces) {
            transformed = transformed.flatMap(list -> (forward
                                                       ? normalize(trace)
                                                       : denormalize(trace)).map(done -> {
                                                                                list.add(done);
                                                                                return list;
                                                                            }));
        }
        return transformed.onSuccess(list -> log.debug("{} {} traces",
                                                       forward ? "Normalized" : "Denormalized",
                                                       list.size()));
    }

    /**
     * Human readable table of the ranges in use.
     */
    public String describe() {
        return ranges.describe();
    }

    private Result<double[][]> checkShape(double[][] values) {
        for (int t = 0; t < values.length; t++) {
            if (values[t].length != ranges.size()) {
                return NormalizerError.shapeMismatch(ranges.size(), values[t].length, "row " + t).result();
            }
        }
        return Result.success(values);
    }

    private double[][] transform(double[][] values, boolean forward) {
        var result = new double[values.length][ranges.size()];
        for (int t = 0; t < values.length; t++) {
            for (int j = 0; j < ranges.size(); j++) {
                var min = ranges.minAt(j);
                var scale = ranges.scaleAt(j);
                result[t][j] = forward
                               ? Math.min(1.0, Math.max(0.0, (values[t][j] - min) / scale))
                               : values[t][j] * scale + min;
            }
        }
        return result;
    }
}
