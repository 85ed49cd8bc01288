package org.podtrace.store;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.normalize.NormalizationRange;
import org.podtrace.normalize.RangeTable;
import org.podtrace.store.StoredDocuments.BoundsDocument;
import org.podtrace.store.StoredDocuments.MetadataDocument;
import org.podtrace.store.StoredDocuments.RangesDocument;
import org.podtrace.trace.PodTrace;
import org.podtrace.trace.TraceMetadata;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;
import org.podtrace.lang.Unit;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and restores a {@link TraceCollection} in a directory.
 * <p>
 * Layout:
 * <ul>
 *   <li>{@code pod_traces.json}: array of {@code timesteps x metrics} arrays</li>
 *   <li>{@code pod_metadata.json}: array of metadata records in the same order</li>
 *   <li>{@code ranges.json}: optional, the ranges the traces were normalized with</li>
 * </ul>
 * Doubles are written in their shortest exact decimal form, so a save/load cycle restores them bit for bit.
 */
public final class TraceCollectionStore {
    private static final Logger log = LoggerFactory.getLogger(TraceCollectionStore.class);

    public static final String TRACES_FILE = "pod_traces.json";
    public static final String METADATA_FILE = "pod_metadata.json";
    public static final String RANGES_FILE = "ranges.json";

    private static final TypeReference<List<double[][]>> TRACES_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<MetadataDocument>> METADATA_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper mapper;

    private TraceCollectionStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    public static TraceCollectionStore traceCollectionStore(Path directory) {
        return new TraceCollectionStore(directory, new ObjectMapper());
    }

    public Path directory() {
        return directory;
    }

    /**
     * Write traces, metadata and, when present, ranges. An existing ranges file is removed for raw collections.
     */
    public Result<Unit> save(TraceCollection collection) {
        var values = collection.traces()
                               .stream()
                               .map(PodTrace::values)
                               .toList();
        var metadata = collection.metadata()
                                 .stream()
                                 .map(MetadataDocument::metadataDocument)
                                 .toList();
        return createDirectory().flatMap(unit -> write(TRACES_FILE, values))
                                .flatMap(unit -> write(METADATA_FILE, metadata))
                                .flatMap(unit -> collection.ranges()
                                                           .map(this::saveRanges)
                                                           .or(this::deleteRanges))
                                .onSuccess(unit -> log.info("Saved {} traces to {}", collection.size(), directory));
    }

    public Result<Unit> saveRanges(RangeTable table) {
        return createDirectory().flatMap(unit -> write(RANGES_FILE, RangesDocument.rangesDocument(table)));
    }

    /**
     * Load traces and metadata as a pair, plus ranges when stored.
     */
    public Result<TraceCollection> load(MetricCatalog catalog) {
        return loadTraces().flatMap(values -> loadMetadata().flatMap(metadata -> pair(values, metadata)))
                           .flatMap(traces -> loadRanges(catalog).map(ranges -> new TraceCollection(traces, ranges)))
                           .onSuccess(collection -> log.info("Loaded {} traces from {}", collection.size(), directory));
    }

    public Result<List<double[][]>> loadTraces() {
        return read(TRACES_FILE, TRACES_TYPE).flatMap(this::checkTraces);
    }

    public Result<List<TraceMetadata>> loadMetadata() {
        return read(METADATA_FILE, METADATA_TYPE).flatMap(this::checkMetadata)
                                                 .map(documents -> documents.stream()
                                                                            .map(MetadataDocument::toMetadata)
                                                                            .toList());
    }

    /**
     * Stored ranges, empty when no ranges file exists. The stored metric order must equal the catalog order.
     */
    public Result<Option<RangeTable>> loadRanges(MetricCatalog catalog) {
        var path = directory.resolve(RANGES_FILE);
        if (!Files.exists(path)) {
            return Result.success(Option.none());
        }
        return Result.lift(e -> StoreError.storeFailure(path.toString(), e),
                           () -> mapper.readValue(path.toFile(), RangesDocument.class))
                     .flatMap(document -> toRangeTable(path, catalog, document))
                     .map(Option::some);
    }

    private Result<RangeTable> toRangeTable(Path path, MetricCatalog catalog, RangesDocument document) {
        if (document == null) {
            return StoreError.storeCorrupted(path.toString(), "file holds no ranges document").result();
        }
        if (document.metrics() == null || !document.metrics()
                                                   .equals(catalog.order())) {
            return StoreError.storeCorrupted(path.toString(),
                                             "stored metric order " + document.metrics() + " does not match catalog "
                                             + catalog.order())
                             .result();
        }
        var ranges = new LinkedHashMap<String, NormalizationRange>();
        var bounds = document.ranges() == null
                     ? new LinkedHashMap<String, BoundsDocument>()
                     : document.ranges();
        for (var entry : bounds.entrySet()) {
            var bound = entry.getValue();
            if (bound == null) {
                return StoreError.storeCorrupted(path.toString(), "range of " + entry.getKey() + " is null").result();
            }
            ranges.put(entry.getKey(), new NormalizationRange(entry.getKey(), bound.min(), bound.max()));
        }
        return RangeTable.rangeTable(catalog, ranges)
                         .mapError(cause -> StoreError.storeCorrupted(path.toString(), cause.message()));
    }

    private Result<List<double[][]>> checkTraces(List<double[][]> values) {
        var path = directory.resolve(TRACES_FILE)
                            .toString();
        if (values == null) {
            return StoreError.storeCorrupted(path, "file holds no trace array").result();
        }
        for (int i = 0; i < values.size(); i++) {
            var trace = values.get(i);
            if (trace == null) {
                return StoreError.storeCorrupted(path, "trace " + i + " is null").result();
            }
            for (int t = 0; t < trace.length; t++) {
                if (trace[t] == null) {
                    return StoreError.storeCorrupted(path, "trace " + i + " has a null row at step " + t).result();
                }
            }
        }
        return Result.success(values);
    }

    private Result<List<MetadataDocument>> checkMetadata(List<MetadataDocument> documents) {
        var path = directory.resolve(METADATA_FILE)
                            .toString();
        if (documents == null) {
            return StoreError.storeCorrupted(path, "file holds no metadata array").result();
        }
        for (int i = 0; i < documents.size(); i++) {
            var document = documents.get(i);
            if (document == null) {
                return StoreError.storeCorrupted(path, "metadata record " + i + " is null").result();
            }
            if (document.workload() == null || document.entityId() == null || document.groupId() == null) {
                return StoreError.storeCorrupted(path, "metadata record " + i + " lacks workload, entity_id or group_id")
                                 .result();
            }
        }
        return Result.success(documents);
    }

    private Result<List<PodTrace>> pair(List<double[][]> values, List<TraceMetadata> metadata) {
        if (values.size() != metadata.size()) {
            return StoreError.storeCorrupted(directory.toString(),
                                             values.size() + " traces but " + metadata.size() + " metadata records")
                             .result();
        }
        Result<List<PodTrace>> traces = Result.success(new ArrayList<>(values.size()));
        for (int i = 0; i < values.size(); i++) {
            var trace = PodTrace.podTrace(values.get(i), metadata.get(i))
                                .mapError(cause -> StoreError.storeCorrupted(directory.toString(), cause.message()));
            traces = traces.flatMap(list -> trace.map(restored -> {
                                                          list.add(restored);
                                                          return list;
                                                      }));
        }
        return traces;
    }

    private Result<Unit> createDirectory() {
        return Result.lift(e -> StoreError.storeFailure(directory.toString(), e),
                           () -> {
                               Files.createDirectories(directory);
                               return Unit.unit();
                           });
    }

    private Result<Unit> write(String file, Object value) {
        var path = directory.resolve(file);
        return Result.lift(e -> StoreError.storeFailure(path.toString(), e),
                           () -> {
                               mapper.writeValue(path.toFile(), value);
                               log.debug("Wrote {}", path);
                               return Unit.unit();
                           });
    }

    private Result<Unit> deleteRanges() {
        var path = directory.resolve(RANGES_FILE);
        return Result.lift(e -> StoreError.storeFailure(path.toString(), e),
                           () -> {
                               Files.deleteIfExists(path);
                               return Unit.unit();
                           });
    }

    private <T> Result<T> read(String file, TypeReference<T> type) {
        var path = directory.resolve(file);
        return Result.lift(e -> StoreError.storeFailure(path.toString(), e),
                           () -> mapper.readValue(path.toFile(), type));
    }
}
