package org.podtrace.store;

import org.podtrace.normalize.RangeTable;
import org.podtrace.trace.TraceMetadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON shapes of the stored files.
 */
final class StoredDocuments {
    private StoredDocuments() {}

    /**
     * One element of {@code pod_metadata.json}.
     */
    record MetadataDocument(@JsonProperty("workload") String workload,
                            @JsonProperty("cardinality") int cardinality,
                            @JsonProperty("entity_id") String entityId,
                            @JsonProperty("group_id") String groupId,
                            @JsonProperty("timesteps") int timesteps,
                            @JsonProperty("metrics") int metrics) {
        static MetadataDocument metadataDocument(TraceMetadata metadata) {
            return new MetadataDocument(metadata.workload(),
                                        metadata.cardinality(),
                                        metadata.entityId(),
                                        metadata.groupId(),
                                        metadata.timesteps(),
                                        metadata.metrics());
        }

        TraceMetadata toMetadata() {
            return new TraceMetadata(workload, cardinality, entityId, groupId, timesteps, metrics);
        }
    }

    record BoundsDocument(@JsonProperty("min") double min, @JsonProperty("max") double max) {}

    /**
     * Content of {@code ranges.json}.
     */
    record RangesDocument(@JsonProperty("metrics") List<String> metrics,
                          @JsonProperty("ranges") Map<String, BoundsDocument> ranges,
                          @JsonProperty("mins") double[] mins,
                          @JsonProperty("maxs") double[] maxs,
                          @JsonProperty("scales") double[] scales) {
        static RangesDocument rangesDocument(RangeTable table) {
            var bounds = new LinkedHashMap<String, BoundsDocument>();
            table.ranges()
                 .forEach(range -> bounds.put(range.metric(), new BoundsDocument(range.min(), range.max())));
            return new RangesDocument(table.catalog()
                                           .order(),
                                      bounds,
                                      table.mins(),
                                      table.maxs(),
                                      table.scales());
        }
    }
}
