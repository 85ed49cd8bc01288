package org.podtrace.normalize;

import org.podtrace.lang.Cause;

/**
 * Errors that can occur while building range tables and transforming traces.
 */
public sealed interface NormalizerError extends Cause {
    /**
     * Input does not have one column per catalog metric.
     */
    record ShapeMismatch(int expected, int actual, String context) implements NormalizerError {
        @Override
        public String message() {
            return "Expected " + expected + " metric columns but " + context + " has " + actual;
        }
    }

    /**
     * Range bounds are not finite or not ascending.
     */
    record InvalidRange(String metric, double min, double max) implements NormalizerError {
        @Override
        public String message() {
            return "Invalid range for metric '" + metric + "': [" + min + ", " + max + "]";
        }
    }

    /**
     * Range table has no bounds for a catalog metric.
     */
    record MissingRange(String metric) implements NormalizerError {
        @Override
        public String message() {
            return "No normalization range for metric '" + metric + "'";
        }
    }

    /**
     * Range bounds were given for a metric outside the catalog.
     */
    record UnknownMetric(String metric) implements NormalizerError {
        @Override
        public String message() {
            return "Metric '" + metric + "' is not part of the catalog";
        }
    }

    /**
     * Ranges cannot be derived without reference traces.
     */
    record EmptyReferenceSet() implements NormalizerError {
        public static final EmptyReferenceSet INSTANCE = new EmptyReferenceSet();

        @Override
        public String message() {
            return "Cannot derive normalization ranges from an empty set of reference traces";
        }
    }

    static NormalizerError shapeMismatch(int expected, int actual, String context) {
        return new ShapeMismatch(expected, actual, context);
    }

    static NormalizerError invalidRange(String metric, double min, double max) {
        return new InvalidRange(metric, min, max);
    }

    static NormalizerError missingRange(String metric) {
        return new MissingRange(metric);
    }

    static NormalizerError unknownMetric(String metric) {
        return new UnknownMetric(metric);
    }
}
