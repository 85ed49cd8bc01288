package org.podtrace.normalize;

import org.podtrace.lang.Result;

/**
 * Affine bounds of one metric: {@code min} maps to 0, {@code max} maps to 1.
 *
 * @param metric Catalog metric name
 * @param min    Lower bound, finite
 * @param max    Upper bound, finite and greater than {@code min}
 */
public record NormalizationRange(String metric, double min, double max) {
    public static Result<NormalizationRange> normalizationRange(String metric, double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || max <= min) {
            return NormalizerError.invalidRange(metric, min, max).result();
        }
        return Result.success(new NormalizationRange(metric, min, max));
    }

    public double width() {
        return max - min;
    }

    /**
     * Scale into [0, 1]; values outside the bounds are clamped.
     */
    public double normalize(double value) {
        var scaled = (value - min) / (max - min);
        return Math.min(1.0, Math.max(0.0, scaled));
    }

    public double denormalize(double value) {
        return value * (max - min) + min;
    }
}
