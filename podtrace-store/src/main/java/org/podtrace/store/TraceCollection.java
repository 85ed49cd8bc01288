package org.podtrace.store;

import org.podtrace.normalize.RangeTable;
import org.podtrace.trace.PodTrace;
import org.podtrace.trace.TraceMetadata;
import org.podtrace.lang.Option;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered traces with their metadata and, when the traces are normalized, the ranges used to normalize them.
 *
 * @param traces Traces in collection order
 * @param ranges Ranges the traces were normalized with, empty for raw traces
 */
public record TraceCollection(List<PodTrace> traces, Option<RangeTable> ranges) {
    private static final Logger log = LoggerFactory.getLogger(TraceCollection.class);

    public TraceCollection {
        traces = List.copyOf(traces);
    }

    public static TraceCollection traceCollection(List<PodTrace> traces) {
        return new TraceCollection(traces, Option.none());
    }

    public TraceCollection withRanges(RangeTable table) {
        return new TraceCollection(traces, Option.some(table));
    }

    public TraceCollection withTraces(List<PodTrace> replaced) {
        return new TraceCollection(replaced, ranges);
    }

    public int size() {
        return traces.size();
    }

    public boolean isEmpty() {
        return traces.isEmpty();
    }

    public List<TraceMetadata> metadata() {
        return traces.stream()
                     .map(PodTrace::metadata)
                     .toList();
    }

    /**
     * Ranges to denormalize this collection with: the stored ranges when present, otherwise the given ones.
     */
    public RangeTable rangesFor(RangeTable current) {
        return ranges.map(stored -> {
                         var differing = stored.differences(current);
                         if (!differing.isEmpty()) {
                             log.warn("Stored ranges differ from the current ranges for {}; using stored ranges",
                                      differing);
                         }
                         return stored;
                     })
                     .or(current);
    }
}
