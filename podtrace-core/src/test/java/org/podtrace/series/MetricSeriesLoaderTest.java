package org.podtrace.series;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.podtrace.catalog.MetricCatalog;
import org.podtrace.catalog.MetricKind;
import org.podtrace.error.TraceError;
import org.podtrace.source.MetricSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MetricSeriesLoaderTest {
    private final MetricSeriesLoader loader = MetricSeriesLoader.metricSeriesLoader(MetricCatalog.standard(), "pod");

    @Test
    void load_readsPerEntitySeriesIgnoringExtraLabels() {
        var csv = """
            timestamp,value,pod,namespace
            2026-01-20 14:23:05,0.25,resnet50-pod-0,default
            2026-01-20 14:23:05,0.5,resnet50-pod-1,default
            """;

        loader.load(MetricSource.text("cpu.csv", csv), MetricCatalog.CPU_USAGE)
              .onFailure(cause -> Assertions.fail(cause.message()))
              .onSuccess(series -> {
                  assertThat(series.metric()).isEqualTo(MetricCatalog.CPU_USAGE);
                  assertThat(series.kind()).isEqualTo(MetricKind.PER_ENTITY);
                  assertThat(series.size()).isEqualTo(2);
                  var first = series.observations().get(0);
                  assertThat(first.timestamp()).isEqualTo(Instant.parse("2026-01-20T14:23:05Z"));
                  assertThat(first.value()).isEqualTo(0.25);
                  assertThat(first.entity().or("")).isEqualTo("resnet50-pod-0");
              });
    }

    @Test
    void load_readsSharedSeriesWithoutEntity() {
        var csv = """
            value,timestamp
            71.5,2026-01-20 14:23:05
            """;

        loader.load(MetricSource.text("power.csv", csv), MetricCatalog.GPU_POWER)
              .onFailure(cause -> Assertions.fail(cause.message()))
              .onSuccess(series -> {
                  assertThat(series.kind()).isEqualTo(MetricKind.SHARED);
                  assertThat(series.observations().get(0).value()).isEqualTo(71.5);
                  assertThat(series.observations().get(0).entity().isEmpty()).isTrue();
              });
    }

    @Test
    void load_returnsEmptySeries_forHeaderOnly() {
        loader.load(MetricSource.text("power.csv", "timestamp,value\n"), MetricCatalog.GPU_POWER)
              .onFailure(cause -> Assertions.fail(cause.message()))
              .onSuccess(series -> assertThat(series.isEmpty()).isTrue());
    }

    @Test
    void load_keepsEmptyValueAsNaN() {
        var csv = """
            timestamp,value
            2026-01-20 14:23:05,
            2026-01-20 14:23:10,NaN
            """;

        loader.load(MetricSource.text("power.csv", csv), MetricCatalog.GPU_POWER)
              .onFailure(cause -> Assertions.fail(cause.message()))
              .onSuccess(series -> assertThat(series.observations()).allMatch(observation -> Double.isNaN(observation.value())));
    }

    @Test
    void load_fails_forMissingEntityColumn() {
        var csv = """
            timestamp,value
            2026-01-20 14:23:05,0.25
            """;

        loader.load(MetricSource.text("cpu.csv", csv), MetricCatalog.CPU_USAGE)
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> {
                  assertThat(cause).isInstanceOf(TraceError.MalformedSource.class);
                  assertThat(cause.message()).contains("cpu.csv").contains("[pod]");
              });
    }

    @Test
    void load_usesConfiguredEntityColumn() {
        var csv = """
            timestamp,value,instance
            2026-01-20 14:23:05,0.25,node-a
            """;

        MetricSeriesLoader.metricSeriesLoader(MetricCatalog.standard(), "instance")
                          .load(MetricSource.text("cpu.csv", csv), MetricCatalog.CPU_USAGE)
                          .onFailure(cause -> Assertions.fail(cause.message()))
                          .onSuccess(series -> assertThat(series.observations().get(0).entity().or(""))
                              .isEqualTo("node-a"));
    }

    @Test
    void load_fails_forInvalidTimestamp() {
        var csv = """
            timestamp,value
            2026-01-20 14:23:05,1.0
            not-a-time,2.0
            """;

        loader.load(MetricSource.text("power.csv", csv), MetricCatalog.GPU_POWER)
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> assertThat(cause.message()).contains("line 3").contains("not-a-time"));
    }

    @Test
    void load_fails_forEpochSecondsOutOfRange() {
        var csv = """
            timestamp,value
            1768919000,1.0
            18446744073709551617,2.0
            """;

        loader.load(MetricSource.text("power.csv", csv), MetricCatalog.GPU_POWER)
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> {
                  assertThat(cause).isInstanceOf(TraceError.MalformedSource.class);
                  assertThat(cause.message()).contains("line 3").contains("18446744073709551617");
              });
    }

    @Test
    void load_fails_forInvalidValue() {
        var csv = """
            timestamp,value
            2026-01-20 14:23:05,high
            """;

        loader.load(MetricSource.text("power.csv", csv), MetricCatalog.GPU_POWER)
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> assertThat(cause.message()).contains("invalid value 'high'"));
    }

    @Test
    void load_fails_forEmptySource() {
        loader.load(MetricSource.text("power.csv", ""), MetricCatalog.GPU_POWER)
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> assertThat(cause.message()).contains("missing header row"));
    }

    @Test
    void load_fails_forMetricOutsideCatalog() {
        loader.load(MetricSource.text("disk.csv", "timestamp,value\n"), "disk_usage")
              .onSuccessRun(Assertions::fail)
              .onFailure(cause -> assertThat(cause).isInstanceOf(TraceError.MalformedSource.class));
    }
}
