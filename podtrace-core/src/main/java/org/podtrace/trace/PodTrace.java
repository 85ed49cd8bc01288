package org.podtrace.trace;

import org.podtrace.error.TraceError;
import org.podtrace.lang.Result;

import java.util.Arrays;

/**
 * Multivariate trace of one entity: {@code timesteps x metrics} values plus metadata.
 * <p>
 * Column {@code j} holds catalog metric {@code j}. Values are copied on the way in and out, so a trace
 * never changes after construction. The metadata shape always equals the array shape.
 */
public record PodTrace(double[][] values, TraceMetadata metadata) {
    public PodTrace {
        values = deepCopy(values);
    }

    /**
     * Build a trace, checking that the array is rectangular, finite and matches the metadata shape.
     */
    public static Result<PodTrace> podTrace(double[][] values, TraceMetadata metadata) {
        if (values.length != metadata.timesteps()) {
            return shapeError(metadata, "has " + values.length + " rows, metadata declares " + metadata.timesteps());
        }
        for (int t = 0; t < values.length; t++) {
            if (values[t].length != metadata.metrics()) {
                return shapeError(metadata,
                                  "row " + t + " has " + values[t].length + " columns, metadata declares "
                                  + metadata.metrics());
            }
            for (double value : values[t]) {
                if (!Double.isFinite(value)) {
                    return shapeError(metadata, "row " + t + " contains a non-finite value");
                }
            }
        }
        return Result.success(new PodTrace(values, metadata));
    }

    private static Result<PodTrace> shapeError(TraceMetadata metadata, String detail) {
        return TraceError.invalidTrace(metadata.groupId(), metadata.entityId(), detail)
                         .result();
    }

    @Override
    public double[][] values() {
        return deepCopy(values);
    }

    public double valueAt(int timestep, int metric) {
        return values[timestep][metric];
    }

    public double[] column(int metric) {
        var column = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            column[t] = values[t][metric];
        }
        return column;
    }

    public int timesteps() {
        return values.length;
    }

    public int metrics() {
        return metadata.metrics();
    }

    /**
     * Same entity and metadata with transformed values of identical shape.
     */
    public PodTrace withValues(double[][] transformed) {
        if (transformed.length != values.length) {
            throw new IllegalArgumentException("Transformed trace must keep " + values.length + " rows");
        }
        return new PodTrace(transformed, metadata);
    }

    private static double[][] deepCopy(double[][] source) {
        var copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PodTrace other && metadata.equals(other.metadata) && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return metadata.hashCode() * 31 + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "PodTrace[" + metadata.groupId() + "/" + metadata.entityId() + ", shape=(" + values.length + ", "
               + metadata.metrics() + ")]";
    }
}
