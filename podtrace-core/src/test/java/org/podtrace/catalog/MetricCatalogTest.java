package org.podtrace.catalog;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MetricCatalogTest {

    @Test
    void standard_hasFifteenMetricsInColumnOrder() {
        var catalog = MetricCatalog.standard();

        assertThat(catalog.size()).isEqualTo(15);
        assertThat(catalog.order().get(0)).isEqualTo(MetricCatalog.CPU_PSI);
        assertThat(catalog.order().get(14)).isEqualTo(MetricCatalog.MEMORY_USAGE);
        assertThat(catalog.indexOf(MetricCatalog.INFERENCE_TOTAL).or(-1)).isEqualTo(11);
    }

    @Test
    void standard_partitionsPerEntityAndSharedMetrics() {
        var catalog = MetricCatalog.standard();

        assertThat(catalog.perEntity()).containsExactly(MetricCatalog.CPU_PSI,
                                                        MetricCatalog.CPU_USAGE,
                                                        MetricCatalog.INFERENCE_LATENCY_AVG,
                                                        MetricCatalog.IO_PSI,
                                                        MetricCatalog.MEMORY_PSI,
                                                        MetricCatalog.MEMORY_USAGE);
        assertThat(catalog.shared()).hasSize(9)
                                    .contains(MetricCatalog.GPU_POWER, MetricCatalog.INFERENCE_LATENCY_P99)
                                    .doesNotContainAnyElementsOf(catalog.perEntity());
        assertThat(catalog.kindOf(MetricCatalog.GPU_MEMORY).or(MetricKind.PER_ENTITY)).isEqualTo(MetricKind.SHARED);
        assertThat(catalog.kindOf(MetricCatalog.CPU_USAGE).or(MetricKind.SHARED)).isEqualTo(MetricKind.PER_ENTITY);
    }

    @Test
    void kindOf_isEmpty_forUnknownMetric() {
        assertThat(MetricCatalog.standard().kindOf("disk_usage").isEmpty()).isTrue();
        assertThat(MetricCatalog.standard().contains("disk_usage")).isFalse();
    }

    @Test
    void metricCatalog_buildsCustomCatalog() {
        MetricCatalog.metricCatalog(List.of("b", "a", "c"), Set.of("c"))
                     .onFailure(cause -> Assertions.fail(cause.message()))
                     .onSuccess(catalog -> {
                         assertThat(catalog.order()).containsExactly("b", "a", "c");
                         assertThat(catalog.perEntity()).containsExactly("c");
                         assertThat(catalog.shared()).containsExactly("b", "a");
                     });
    }

    @Test
    void metricCatalog_fails_forDuplicateMetric() {
        MetricCatalog.metricCatalog(List.of("a", "a"), Set.of("a"))
                     .onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause.message()).contains("duplicate metric a"));
    }

    @Test
    void metricCatalog_fails_forPerEntityMetricOutsideOrder() {
        MetricCatalog.metricCatalog(List.of("a"), Set.of("b"))
                     .onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause.message()).contains("per-entity metric b"));
    }

    @Test
    void metricCatalog_fails_withoutPerEntityMetric() {
        MetricCatalog.metricCatalog(List.of("a"), Set.of())
                     .onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause.message()).contains("at least one per-entity metric"));
    }
}
