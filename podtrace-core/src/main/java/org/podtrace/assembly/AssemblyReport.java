package org.podtrace.assembly;

import org.podtrace.trace.PodTrace;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result of assembling all groups under a data root.
 *
 * @param groupsScanned Number of group directories found
 * @param traces        Traces of all complete groups, in group order then entity order
 * @param failures      Excluded groups, in group order
 */
public record AssemblyReport(int groupsScanned, List<PodTrace> traces, List<GroupFailure> failures) {
    public AssemblyReport {
        traces = List.copyOf(traces);
        failures = List.copyOf(failures);
    }

    public int groupsAssembled() {
        return groupsScanned - failures.size();
    }

    public Map<String, Integer> tracesByWorkload() {
        return countBy(trace -> trace.metadata()
                                     .workload());
    }

    public Map<Integer, Integer> tracesByCardinality() {
        return countBy(trace -> trace.metadata()
                                     .cardinality());
    }

    private <K extends Comparable<K>> Map<K, Integer> countBy(Function<PodTrace, K> key) {
        return traces.stream()
                     .collect(Collectors.groupingBy(key,
                                                    TreeMap::new,
                                                    Collectors.summingInt(trace -> 1)));
    }

    /**
     * Multi-line summary: counts, per-workload and per-cardinality breakdown, shape of the first trace.
     */
    public String summary() {
        var builder = new StringBuilder();
        builder.append("Groups: ")
               .append(groupsAssembled())
               .append(" assembled, ")
               .append(failures.size())
               .append(" excluded of ")
               .append(groupsScanned)
               .append('\n');
        builder.append("Traces: ")
               .append(traces.size())
               .append('\n');
        if (!traces.isEmpty()) {
            var first = traces.get(0);
            builder.append("Trace shape: (")
                   .append(first.timesteps())
                   .append(", ")
                   .append(first.metrics())
                   .append(")\n");
        }
        builder.append("By workload:\n");
        tracesByWorkload().forEach((workload, count) -> builder.append("  ")
                                                                .append(workload)
                                                                .append(": ")
                                                                .append(count)
                                                                .append('\n'));
        builder.append("By cardinality:\n");
        tracesByCardinality().forEach((cardinality, count) -> builder.append("  r")
                                                                      .append(cardinality)
                                                                      .append(": ")
                                                                      .append(count)
                                                                      .append('\n'));
        failures.forEach(failure -> builder.append("Excluded ")
                                           .append(failure.message())
                                           .append('\n'));
        return builder.toString();
    }
}
