package org.podtrace.trace;

import org.podtrace.error.TraceError;
import org.podtrace.lang.Result;

import java.util.regex.Pattern;

/**
 * One experiment configuration: a workload run with a given number of replicas.
 *
 * @param id          Group identifier exactly as found on disk, e.g. {@code resnet50_r3}
 * @param workload    Workload name, e.g. {@code resnet50}
 * @param cardinality Number of replicas, at least 1
 */
public record ExperimentGroup(String id, String workload, int cardinality) {
    private static final Pattern GROUP_PATTERN = Pattern.compile("^(.+)_r(\\d+)$");

    public ExperimentGroup(String workload, int cardinality) {
        this(workload + "_r" + cardinality, workload, cardinality);
    }

    /**
     * Parse a group identifier of the form {@code <workload>_r<cardinality>}.
     */
    public static Result<ExperimentGroup> experimentGroup(String id) {
        if (id == null) {
            return TraceError.ambiguousGroupName("null").result();
        }
        var matcher = GROUP_PATTERN.matcher(id);
        if (!matcher.matches()) {
            return TraceError.ambiguousGroupName(id).result();
        }
        int cardinality;
        try{
            cardinality = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return TraceError.ambiguousGroupName(id).result();
        }
        if (cardinality < 1) {
            return TraceError.ambiguousGroupName(id).result();
        }
        return Result.success(new ExperimentGroup(id, matcher.group(1), cardinality));
    }

    @Override
    public String toString() {
        return id();
    }
}
