package org.podtrace.catalog;

import org.podtrace.error.TraceError;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed, ordered set of metrics every trace contains, partitioned into per-entity and shared metrics.
 * <p>
 * Column {@code j} of every trace corresponds to {@code order().get(j)}. The same instance is handed to
 * the loader, merger, extractor and normalizer so that the partition cannot drift between them.
 */
public final class MetricCatalog {
    public static final String CPU_PSI = "cpu_psi";
    public static final String CPU_USAGE = "cpu_usage";
    public static final String GPU_MEMORY = "gpu_memory";
    public static final String GPU_POWER = "gpu_power";
    public static final String GPU_TEMPERATURE = "gpu_temperature";
    public static final String GPU_UTILIZATION = "gpu_utilization";
    public static final String INFERENCE_LATENCY_AVG = "inference_latency_avg";
    public static final String INFERENCE_LATENCY_P50 = "inference_latency_p50";
    public static final String INFERENCE_LATENCY_P95 = "inference_latency_p95";
    public static final String INFERENCE_LATENCY_P99 = "inference_latency_p99";
    public static final String INFERENCE_THROUGHPUT = "inference_throughput";
    public static final String INFERENCE_TOTAL = "inference_total";
    public static final String IO_PSI = "io_psi";
    public static final String MEMORY_PSI = "memory_psi";
    public static final String MEMORY_USAGE = "memory_usage";

    private static final MetricCatalog STANDARD = new MetricCatalog(List.of(CPU_PSI,
                                                                            CPU_USAGE,
                                                                            GPU_MEMORY,
                                                                            GPU_POWER,
                                                                            GPU_TEMPERATURE,
                                                                            GPU_UTILIZATION,
                                                                            INFERENCE_LATENCY_AVG,
                                                                            INFERENCE_LATENCY_P50,
                                                                            INFERENCE_LATENCY_P95,
                                                                            INFERENCE_LATENCY_P99,
                                                                            INFERENCE_THROUGHPUT,
                                                                            INFERENCE_TOTAL,
                                                                            IO_PSI,
                                                                            MEMORY_PSI,
                                                                            MEMORY_USAGE),
                                                                    Set.of(CPU_PSI,
                                                                           CPU_USAGE,
                                                                           INFERENCE_LATENCY_AVG,
                                                                           IO_PSI,
                                                                           MEMORY_PSI,
                                                                           MEMORY_USAGE));

    private final List<String> order;
    private final List<String> perEntity;
    private final List<String> shared;
    private final Map<String, Integer> indices;

    private MetricCatalog(List<String> order, Set<String> perEntityNames) {
        this.order = List.copyOf(order);
        this.perEntity = order.stream()
                              .filter(perEntityNames::contains)
                              .toList();
        this.shared = order.stream()
                           .filter(name -> !perEntityNames.contains(name))
                           .toList();
        var map = new HashMap<String, Integer>();
        for (int i = 0; i < order.size(); i++) {
            map.put(order.get(i), i);
        }
        this.indices = Map.copyOf(map);
    }

    /**
     * The 15-metric catalog of the inference workload experiments.
     */
    public static MetricCatalog standard() {
        return STANDARD;
    }

    /**
     * Build a custom catalog.
     *
     * @param order     Metric names in column order
     * @param perEntity Names of metrics observed per entity; every other metric is shared
     */
    public static Result<MetricCatalog> metricCatalog(List<String> order, Set<String> perEntity) {
        if (order == null || order.isEmpty()) {
            return TraceError.invalidCatalog("metric order must not be empty").result();
        }
        var unique = new LinkedHashSet<String>();
        for (var name : order) {
            if (name == null || name.isBlank()) {
                return TraceError.invalidCatalog("metric names must not be blank").result();
            }
            if (!unique.add(name)) {
                return TraceError.invalidCatalog("duplicate metric " + name).result();
            }
        }
        for (var name : perEntity) {
            if (!unique.contains(name)) {
                return TraceError.invalidCatalog("per-entity metric " + name + " is not in the metric order").result();
            }
        }
        if (perEntity.isEmpty()) {
            return TraceError.invalidCatalog("at least one per-entity metric is required").result();
        }
        return Result.success(new MetricCatalog(order, Set.copyOf(perEntity)));
    }

    /**
     * Metric names in column order.
     */
    public List<String> order() {
        return order;
    }

    /**
     * Per-entity metrics in column order.
     */
    public List<String> perEntity() {
        return perEntity;
    }

    /**
     * Shared metrics in column order.
     */
    public List<String> shared() {
        return shared;
    }

    public int size() {
        return order.size();
    }

    public boolean contains(String metric) {
        return indices.containsKey(metric);
    }

    public Option<Integer> indexOf(String metric) {
        return Option.option(indices.get(metric));
    }

    public Option<MetricKind> kindOf(String metric) {
        return indexOf(metric).map(index -> perEntity.contains(metric)
                                            ? MetricKind.PER_ENTITY
                                            : MetricKind.SHARED);
    }

    public boolean isPerEntity(String metric) {
        return perEntity.contains(metric);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetricCatalog other && order.equals(other.order) && perEntity.equals(other.perEntity);
    }

    @Override
    public int hashCode() {
        return order.hashCode() * 31 + perEntity.hashCode();
    }

    @Override
    public String toString() {
        return "MetricCatalog" + order + " perEntity=" + perEntity;
    }
}
