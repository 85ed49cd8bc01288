package org.podtrace.trace;

import java.time.Instant;
import java.util.Arrays;

/**
 * One row of an {@link AlignedTable}: the values of all metrics for one entity at one timestamp.
 * Cells without an observation hold NaN.
 */
public record AlignedRow(Instant timestamp, String entity, double[] values) {
    public AlignedRow {
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double valueAt(int column) {
        return values[column];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AlignedRow other && timestamp.equals(other.timestamp) && entity.equals(other.entity)
               && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return (timestamp.hashCode() * 31 + entity.hashCode()) * 31 + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "AlignedRow[" + timestamp + ", " + entity + ", " + Arrays.toString(values) + "]";
    }
}
