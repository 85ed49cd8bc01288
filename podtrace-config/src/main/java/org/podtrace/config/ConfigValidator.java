package org.podtrace.config;

import org.podtrace.lang.Cause;
import org.podtrace.lang.Result;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Validates pipeline configuration.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Raw and processed directories and the entity column must not be blank</li>
 *   <li>Parallelism must be at least 1</li>
 *   <li>Percentile must lie in (0, 100]</li>
 *   <li>Margin and minimum width must be positive</li>
 *   <li>Range overrides must have finite bounds with max &gt; min, one per metric</li>
 * </ul>
 *
 * <p>Whether override names belong to the metric catalog is checked when the range table is built.
 */
public final class ConfigValidator {
    private ConfigValidator() {}

    /**
     * Validate configuration, returning all validation errors.
     */
    public static Result<PipelineConfig> validate(PipelineConfig config) {
        var errors = new ArrayList<String>();
        validateData(config.data(), errors);
        validateNormalization(config.normalization(), errors);
        if (errors.isEmpty()) {
            return Result.success(config);
        }
        return ConfigError.validationFailed(errors)
                          .result();
    }

    private static void validateData(DataConfig data, List<String> errors) {
        if (data.rawDir()
                .toString()
                .isBlank()) {
            errors.add("Raw data directory must not be blank");
        }
        if (data.processedDir()
                .toString()
                .isBlank()) {
            errors.add("Processed data directory must not be blank");
        }
        if (data.entityColumn() == null || data.entityColumn()
                                               .isBlank()) {
            errors.add("Entity column must not be blank");
        }
        if (data.parallelism() < 1) {
            errors.add("Parallelism must be at least 1. Got: " + data.parallelism());
        }
    }

    private static void validateNormalization(NormalizationConfig normalization, List<String> errors) {
        var percentile = normalization.percentile();
        if (!(percentile > 0.0 && percentile <= 100.0)) {
            errors.add("Percentile must be in (0, 100]. Got: " + percentile);
        }
        if (!(normalization.margin() > 0.0) || !Double.isFinite(normalization.margin())) {
            errors.add("Margin must be a positive number. Got: " + normalization.margin());
        }
        if (!(normalization.minWidth() > 0.0) || !Double.isFinite(normalization.minWidth())) {
            errors.add("Minimum range width must be a positive number. Got: " + normalization.minWidth());
        }
        var seen = new HashSet<String>();
        for (var override : normalization.overrides()) {
            if (!seen.add(override.metric())) {
                errors.add("Duplicate range override for " + override.metric());
            }
            if (!Double.isFinite(override.min()) || !Double.isFinite(override.max())) {
                errors.add("Range override for " + override.metric() + " must have finite bounds");
            } else if (override.max() <= override.min()) {
                errors.add("Range override for " + override.metric() + " must have max > min. Got: ["
                           + override.min() + ", " + override.max() + "]");
            }
        }
    }

    /**
     * Configuration validation error.
     */
    public sealed interface ConfigError extends Cause {
        record ValidationFailed(List<String> errors) implements ConfigError {
            @Override
            public String message() {
                return "Configuration validation failed:\n- " + String.join("\n- ", errors);
            }
        }

        static ConfigError validationFailed(List<String> errors) {
            return new ValidationFailed(List.copyOf(errors));
        }
    }
}
