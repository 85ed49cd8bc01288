package org.podtrace.normalize;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.podtrace.catalog.MetricCatalog;
import org.podtrace.config.RangeOverride;
import org.podtrace.trace.ExperimentGroup;
import org.podtrace.trace.PodTrace;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RangeTableTest {
    private static final ExperimentGroup GROUP = new ExperimentGroup("toy", 1);

    private static MetricCatalog toyCatalog() {
        return MetricCatalog.metricCatalog(List.of("a", "b"), Set.of("a"))
                            .unwrap();
    }

    @Test
    void fixed_matchesStandardBounds() {
        RangeTable.fixed(MetricCatalog.standard())
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(table -> {
                      assertThat(table.size()).isEqualTo(15);
                      assertThat(table.mins()).containsOnly(0.0);
                      assertThat(table.maxs()).containsExactly(1.0, 8.0, 20000.0, 100.0, 100.0, 100.0, 5.0, 5.0, 8.0,
                                                               10.0, 500.0, 100000.0, 1.0, 1.0, 1e10);
                      assertThat(table.scales()).isEqualTo(table.maxs());
                  });
    }

    @Test
    void fixed_fails_forMetricWithoutStandardBounds() {
        RangeTable.fixed(toyCatalog())
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isInstanceOf(NormalizerError.MissingRange.class));
    }

    @Test
    void rangeTable_fails_forInvertedRange() {
        RangeTable.rangeTable(toyCatalog(),
                              Map.of("a", new NormalizationRange("a", 0.0, 1.0),
                                     "b", new NormalizationRange("b", 5.0, 5.0)))
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isInstanceOf(NormalizerError.InvalidRange.class));
    }

    @Test
    void withOverrides_fails_forUnknownMetric() {
        RangeTable.fixed(MetricCatalog.standard())
                  .flatMap(table -> table.withOverrides(List.of(new RangeOverride("disk_usage", 0.0, 1.0))))
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause.message()).contains("disk_usage"));
    }

    @Test
    void derived_usesInterpolatedPercentileWithMargin() {
        var rows = new double[101][];
        for (int i = 0; i <= 100; i++) {
            rows[i] = new double[]{i, 0.0};
        }
        var trace = AbsoluteNormalizerTest.trace(GROUP, "pod-0", rows);

        RangeTable.derived(toyCatalog(), List.of(trace), 99.5, 1.2, 1e-6)
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(table -> {
                      var a = table.rangeAt(0);
                      assertThat(a.min()).isEqualTo(0.0);
                      assertThat(a.max()).isCloseTo(99.5 * 1.2, within(1e-9));
                      var b = table.rangeAt(1);
                      assertThat(b.min()).isEqualTo(0.0);
                      assertThat(b.max()).isEqualTo(1.0);
                  });
    }

    @Test
    void derived_floorsMinimumAtZero() {
        var trace = AbsoluteNormalizerTest.trace(GROUP, "pod-0", new double[]{-4.0, 1.0}, new double[]{6.0, 2.0});

        RangeTable.derived(toyCatalog(), List.of(trace), 100.0, 1.0, 1e-6)
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(table -> {
                      assertThat(table.rangeAt(0).min()).isEqualTo(0.0);
                      assertThat(table.rangeAt(0).max()).isEqualTo(6.0);
                  });
    }

    @Test
    void derived_fails_forEmptyReferenceSet() {
        RangeTable.derived(toyCatalog(), List.<PodTrace>of(), 99.5, 1.2, 1e-6)
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isInstanceOf(NormalizerError.EmptyReferenceSet.class));
    }

    @Test
    void differences_namesChangedMetrics() {
        var fixed = RangeTable.fixed(MetricCatalog.standard())
                              .unwrap();
        var overridden = fixed.withOverrides(List.of(new RangeOverride(MetricCatalog.GPU_POWER, 0.0, 300.0)))
                              .unwrap();

        assertThat(fixed.differences(overridden)).containsExactly(MetricCatalog.GPU_POWER);
        assertThat(fixed.differences(fixed)).isEmpty();
        assertThat(overridden).isNotEqualTo(fixed);
    }

    @Test
    void percentile_interpolatesBetweenRanks() {
        assertThat(Percentiles.percentile(new double[]{1.0, 2.0, 3.0, 4.0}, 50.0)).isEqualTo(2.5);
        assertThat(Percentiles.percentile(new double[]{1.0, 2.0, 3.0, 4.0}, 100.0)).isEqualTo(4.0);
        assertThat(Percentiles.percentile(new double[]{7.0}, 99.5)).isEqualTo(7.0);
    }
}
