package org.podtrace.source;

import org.podtrace.error.TraceError;
import org.podtrace.lang.Result;

import java.util.Collection;
import java.util.List;

/**
 * Name-based matching of source names against metric tokens.
 * <p>
 * A source named {@code resnet50_r3_cpu_usage_20260120_142305.csv} matches metric {@code cpu_usage}: the metric
 * must occur in the file stem as a run of whole underscore-separated tokens. Only {@code .csv} names are considered.
 */
final class SourceMatching {
    static final String EXTENSION = ".csv";

    private SourceMatching() {}

    static boolean matches(String sourceName, String metric) {
        if (!sourceName.endsWith(EXTENSION)) {
            return false;
        }
        var stem = sourceName.substring(0, sourceName.length() - EXTENSION.length());
        return ("_" + stem + "_").contains("_" + metric + "_");
    }

    static Result<String> resolve(String groupId, String location, String metric, Collection<String> names) {
        List<String> candidates = names.stream()
                                       .filter(name -> matches(name, metric))
                                       .sorted()
                                       .toList();
        if (candidates.isEmpty()) {
            return TraceError.sourceNotFound(groupId, metric, location).result();
        }
        if (candidates.size() > 1) {
            return TraceError.ambiguousSource(groupId, metric, candidates).result();
        }
        return Result.success(candidates.get(0));
    }
}
