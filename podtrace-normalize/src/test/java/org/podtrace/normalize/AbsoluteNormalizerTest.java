package org.podtrace.normalize;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.podtrace.catalog.MetricCatalog;
import org.podtrace.config.NormalizationConfig;
import org.podtrace.config.NormalizationMode;
import org.podtrace.config.RangeOverride;
import org.podtrace.trace.ExperimentGroup;
import org.podtrace.trace.PodTrace;
import org.podtrace.trace.TraceMetadata;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AbsoluteNormalizerTest {
    private static final MetricCatalog CATALOG = MetricCatalog.standard();
    private static final double[] EXAMPLE_POD = {0.0005, 1.2, 3850.0, 58.4, 72.0, 86.7, 0.298, 0.315, 0.598, 0.699,
                                                 171.25, 171.25, 0.0, 0.0, 1643693933.0};

    private final AbsoluteNormalizer normalizer = AbsoluteNormalizer.standard(CATALOG)
                                                                    .unwrap();

    @Test
    void normalize_thenDenormalize_restoresValuesWithinBounds() {
        normalizer.normalize(new double[][]{EXAMPLE_POD})
                  .flatMap(normalizer::denormalize)
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(restored -> {
                      for (int j = 0; j < EXAMPLE_POD.length; j++) {
                          assertThat(restored[0][j]).isCloseTo(EXAMPLE_POD[j], within(1e-3));
                      }
                  });
    }

    @Test
    void normalize_thenDenormalize_restoresValues_forRangeAboveZero() {
        var temperature = CATALOG.indexOf(MetricCatalog.GPU_TEMPERATURE).or(-1);
        var shifted = RangeTable.fixed(CATALOG)
                                .flatMap(table -> table.withOverrides(List.of(new RangeOverride(MetricCatalog.GPU_TEMPERATURE,
                                                                                                10.0,
                                                                                                20.0))))
                                .map(AbsoluteNormalizer::absoluteNormalizer)
                                .unwrap();
        var row = EXAMPLE_POD.clone();
        row[temperature] = 12.5;
        var belowMin = EXAMPLE_POD.clone();
        belowMin[temperature] = 4.0;

        shifted.normalize(new double[][]{row, belowMin})
               .onFailure(cause -> Assertions.fail(cause.message()))
               .onSuccess(normalized -> {
                   assertThat(normalized[0][temperature]).isCloseTo(0.25, within(1e-12));
                   assertThat(normalized[1][temperature]).isEqualTo(0.0);
               });
        shifted.normalize(new double[][]{row, belowMin})
               .flatMap(shifted::denormalize)
               .onFailure(cause -> Assertions.fail(cause.message()))
               .onSuccess(restored -> {
                   assertThat(restored[0][temperature]).isCloseTo(12.5, within(1e-9));
                   assertThat(restored[1][temperature]).isEqualTo(10.0);
               });
    }

    @Test
    void normalize_mapsBoundsToUnitInterval() {
        var memory = CATALOG.indexOf(MetricCatalog.MEMORY_USAGE).or(-1);
        var atMax = EXAMPLE_POD.clone();
        atMax[memory] = 1e10;
        var atMin = EXAMPLE_POD.clone();
        atMin[memory] = 0.0;
        var aboveMax = EXAMPLE_POD.clone();
        aboveMax[memory] = 5e10;

        normalizer.normalize(new double[][]{atMax, atMin, aboveMax})
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(normalized -> {
                      assertThat(normalized[0][memory]).isEqualTo(1.0);
                      assertThat(normalized[1][memory]).isEqualTo(0.0);
                      assertThat(normalized[2][memory]).isEqualTo(1.0);
                  });
        normalizer.normalize(new double[][]{aboveMax})
                  .flatMap(normalizer::denormalize)
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(restored -> assertThat(restored[0][memory]).isEqualTo(1e10));
    }

    @Test
    void normalize_clampsNegativeValuesToZero() {
        var values = EXAMPLE_POD.clone();
        values[0] = -0.5;

        normalizer.normalize(new double[][]{values})
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(normalized -> assertThat(normalized[0][0]).isEqualTo(0.0));
    }

    @Test
    void normalize_fails_forWrongColumnCount() {
        normalizer.normalize(new double[][]{{1.0, 2.0}})
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> {
                      assertThat(cause).isInstanceOf(NormalizerError.ShapeMismatch.class);
                      assertThat(cause.message()).contains("15").contains("2");
                  });
    }

    @Test
    void normalize_doesNotModifyInput() {
        var input = new double[][]{EXAMPLE_POD.clone()};

        normalizer.normalize(input)
                  .onFailure(cause -> Assertions.fail(cause.message()));

        assertThat(input[0]).containsExactly(EXAMPLE_POD);
    }

    @Test
    void normalizeAll_keepsMetadataAndOrder() {
        var group = new ExperimentGroup("resnet50", 2);
        var first = trace(group, "pod-0", EXAMPLE_POD);
        var second = trace(group, "pod-1", EXAMPLE_POD);

        normalizer.normalizeAll(List.of(first, second))
                  .flatMap(normalizer::denormalizeAll)
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(restored -> {
                      assertThat(restored).extracting(PodTrace::metadata)
                                          .containsExactly(first.metadata(), second.metadata());
                      assertThat(restored.get(1).valueAt(0, 3)).isCloseTo(58.4, within(1e-9));
                  });
    }

    @Test
    void absoluteNormalizer_appliesConfiguredOverrides() {
        var config = NormalizationConfig.defaults()
                                        .withOverrides(List.of(new RangeOverride(MetricCatalog.CPU_USAGE, 0.0, 16.0)));

        AbsoluteNormalizer.absoluteNormalizer(CATALOG, config, List.of())
                          .onFailure(cause -> Assertions.fail(cause.message()))
                          .onSuccess(configured -> assertThat(configured.rangeTable()
                                                                        .range(MetricCatalog.CPU_USAGE)
                                                                        .map(NormalizationRange::max)
                                                                        .or(0.0)).isEqualTo(16.0));
    }

    @Test
    void absoluteNormalizer_fails_forDerivedModeWithoutReferences() {
        var config = NormalizationConfig.defaults()
                                        .withMode(NormalizationMode.DERIVED);

        AbsoluteNormalizer.absoluteNormalizer(CATALOG, config, List.of())
                          .onSuccessRun(Assertions::fail)
                          .onFailure(cause -> assertThat(cause).isInstanceOf(NormalizerError.EmptyReferenceSet.class));
    }

    @Test
    void describe_listsEveryMetric() {
        var description = normalizer.describe();

        for (var metric : CATALOG.order()) {
            assertThat(description).contains(metric);
        }
        assertThat(description).contains("Width");
    }

    static PodTrace trace(ExperimentGroup group, String entity, double[]... rows) {
        return PodTrace.podTrace(rows, TraceMetadata.traceMetadata(group, entity, rows.length, rows[0].length))
                       .unwrap();
    }
}
