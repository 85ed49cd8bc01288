package org.podtrace.trace;

/**
 * Descriptive record of one pod trace.
 *
 * @param workload    Workload name of the experiment group
 * @param cardinality Replica count of the experiment group
 * @param entityId    Entity (pod) the trace belongs to
 * @param groupId     Experiment group identifier, {@code <workload>_r<cardinality>}
 * @param timesteps   Number of rows of the trace
 * @param metrics     Number of columns of the trace
 */
public record TraceMetadata(String workload,
                            int cardinality,
                            String entityId,
                            String groupId,
                            int timesteps,
                            int metrics) {
    /**
     * Metadata of a trace of the given shape extracted for an entity of a group.
     */
    public static TraceMetadata traceMetadata(ExperimentGroup group, String entityId, int timesteps, int metrics) {
        return new TraceMetadata(group.workload(), group.cardinality(), entityId, group.id(), timesteps, metrics);
    }
}
