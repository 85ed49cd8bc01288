package org.podtrace.trace;

import org.podtrace.lang.Cause;

import java.util.List;

/**
 * Outcome of extracting the traces of one group: the traces of complete entities plus one failure per
 * rejected entity. A rejected entity never prevents extraction of the others.
 */
public record ExtractionResult(ExperimentGroup group, List<PodTrace> traces, List<Cause> failures) {
    public ExtractionResult {
        traces = List.copyOf(traces);
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
