package org.podtrace.config;

import java.util.List;

/**
 * Configuration for range normalization.
 *
 * <p>Example podtrace.toml:
 * <pre>
 * [normalization]
 * mode = "derived"
 * percentile = 99.5
 * margin = 1.2
 * min_width = 1e-6
 *
 * [normalization.ranges]
 * cpu_usage = [0.0, 16.0]
 * </pre>
 *
 * @param mode       Where ranges come from (default: fixed)
 * @param percentile Percentile used as the observed maximum in derived mode (default: 99.5)
 * @param margin     Safety factor applied to the derived maximum (default: 1.2)
 * @param minWidth   Ranges narrower than this are widened to one unit (default: 1e-6)
 * @param overrides  Replacement bounds applied on top of the fixed table
 */
public record NormalizationConfig(NormalizationMode mode,
                                  double percentile,
                                  double margin,
                                  double minWidth,
                                  List<RangeOverride> overrides) {
    public static final double DEFAULT_PERCENTILE = 99.5;
    public static final double DEFAULT_MARGIN = 1.2;
    public static final double DEFAULT_MIN_WIDTH = 1e-6;

    private static final NormalizationConfig DEFAULT = new NormalizationConfig(NormalizationMode.FIXED,
                                                                               DEFAULT_PERCENTILE,
                                                                               DEFAULT_MARGIN,
                                                                               DEFAULT_MIN_WIDTH,
                                                                               List.of());

    public NormalizationConfig {
        overrides = List.copyOf(overrides);
    }

    public static NormalizationConfig defaults() {
        return DEFAULT;
    }

    public NormalizationConfig withMode(NormalizationMode mode) {
        return new NormalizationConfig(mode, percentile, margin, minWidth, overrides);
    }

    public NormalizationConfig withPercentile(double percentile) {
        return new NormalizationConfig(mode, percentile, margin, minWidth, overrides);
    }

    public NormalizationConfig withMargin(double margin) {
        return new NormalizationConfig(mode, percentile, margin, minWidth, overrides);
    }

    public NormalizationConfig withOverrides(List<RangeOverride> overrides) {
        return new NormalizationConfig(mode, percentile, margin, minWidth, overrides);
    }
}
