package org.podtrace.error;

import org.podtrace.lang.Cause;

import java.util.List;

/**
 * Errors that can occur while locating, parsing, merging and extracting pod traces.
 * <p>
 * Every error carries the identifying context available where it was raised: group id, entity id,
 * metric name and source id.
 */
public sealed interface TraceError extends Cause {
    /**
     * No source matches the metric within the group.
     */
    record SourceNotFound(String groupId, String metric, String location) implements TraceError {
        @Override
        public String message() {
            return "No source found for metric '" + metric + "' in group " + groupId + " (" + location + ")";
        }
    }

    /**
     * More than one source matches the metric within the group.
     */
    record AmbiguousSource(String groupId, String metric, List<String> candidates) implements TraceError {
        public AmbiguousSource {
            candidates = List.copyOf(candidates);
        }

        @Override
        public String message() {
            return "Multiple sources found for metric '" + metric + "' in group " + groupId + ": " + candidates;
        }
    }

    /**
     * Source content does not have the expected structure.
     */
    record MalformedSource(String sourceId, String metric, String detail) implements TraceError {
        @Override
        public String message() {
            return "Malformed source " + sourceId + " for metric '" + metric + "': " + detail;
        }
    }

    /**
     * Entity trace has missing values or columns after merge.
     */
    record IncompleteTrace(String groupId, String entityId, String metric, String detail) implements TraceError {
        @Override
        public String message() {
            return "Incomplete trace for entity " + entityId + " in group " + groupId + ", metric '" + metric
                   + "': " + detail;
        }
    }

    /**
     * Trace array does not match its metadata or contains non-finite values.
     */
    record InvalidTrace(String groupId, String entityId, String detail) implements TraceError {
        @Override
        public String message() {
            return "Invalid trace for entity " + entityId + " in group " + groupId + ": " + detail;
        }
    }

    /**
     * Merged table of a group contains no entity rows.
     */
    record NoEntities(String groupId) implements TraceError {
        @Override
        public String message() {
            return "Group " + groupId + " has no per-entity observations";
        }
    }

    /**
     * Group identifier does not follow the {@code <workload>_r<cardinality>} pattern.
     */
    record AmbiguousGroupName(String name) implements TraceError {
        @Override
        public String message() {
            return "Cannot parse experiment group name '" + name + "', expected <workload>_r<cardinality>";
        }
    }

    /**
     * Metric catalog definition is inconsistent.
     */
    record InvalidCatalog(String detail) implements TraceError {
        @Override
        public String message() {
            return "Invalid metric catalog: " + detail;
        }
    }

    /**
     * Source collection cannot be read.
     */
    record SourceUnreadable(String location, String reason) implements TraceError {
        @Override
        public String message() {
            return "Cannot read " + location + ": " + reason;
        }
    }

    static TraceError sourceNotFound(String groupId, String metric, String location) {
        return new SourceNotFound(groupId, metric, location);
    }

    static TraceError ambiguousSource(String groupId, String metric, List<String> candidates) {
        return new AmbiguousSource(groupId, metric, candidates);
    }

    static TraceError malformedSource(String sourceId, String metric, String detail) {
        return new MalformedSource(sourceId, metric, detail);
    }

    static TraceError incompleteTrace(String groupId, String entityId, String metric, String detail) {
        return new IncompleteTrace(groupId, entityId, metric, detail);
    }

    static TraceError invalidTrace(String groupId, String entityId, String detail) {
        return new InvalidTrace(groupId, entityId, detail);
    }

    static TraceError noEntities(String groupId) {
        return new NoEntities(groupId);
    }

    static TraceError ambiguousGroupName(String name) {
        return new AmbiguousGroupName(name);
    }

    static TraceError invalidCatalog(String detail) {
        return new InvalidCatalog(detail);
    }

    static TraceError sourceUnreadable(String location, String reason) {
        return new SourceUnreadable(location, reason);
    }
}
