package org.podtrace.trace;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.podtrace.catalog.MetricCatalog;
import org.podtrace.error.TraceError;
import org.podtrace.fixture.GroupFixture;
import org.podtrace.series.MetricSeriesLoader;
import org.podtrace.source.MetricLocator;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PodTraceExtractorTest {
    private final MetricCatalog catalog = MetricCatalog.standard();
    private final ExperimentMerger merger = ExperimentMerger.experimentMerger(MetricSeriesLoader.metricSeriesLoader(catalog,
                                                                                                                    "pod"));
    private final PodTraceExtractor extractor = PodTraceExtractor.podTraceExtractor(catalog);

    private AlignedTable merged(GroupFixture fixture) {
        return ExperimentGroup.experimentGroup(fixture.groupId())
                              .map(group -> MetricLocator.inMemory(group, fixture.sources()))
                              .flatMap(merger::merge)
                              .unwrap();
    }

    @Test
    void extract_producesCompleteTracePerEntity() {
        var fixture = GroupFixture.groupFixture("resnet50", 3, 10);

        extractor.extract(merged(fixture))
                 .onFailure(cause -> Assertions.fail(cause.message()))
                 .onSuccess(result -> {
                     assertThat(result.isComplete()).isTrue();
                     assertThat(result.traces()).hasSize(3);
                     for (int e = 0; e < 3; e++) {
                         var trace = result.traces().get(e);
                         assertThat(trace.timesteps()).isEqualTo(10);
                         assertThat(trace.metrics()).isEqualTo(15);
                         assertThat(trace.metadata().workload()).isEqualTo("resnet50");
                         assertThat(trace.metadata().cardinality()).isEqualTo(3);
                         assertThat(trace.metadata().groupId()).isEqualTo("resnet50_r3");
                         assertThat(trace.metadata().entityId()).isEqualTo("resnet50-pod-" + e);
                         for (int t = 0; t < 10; t++) {
                             for (int j = 0; j < 15; j++) {
                                 var expected = catalog.isPerEntity(catalog.order().get(j))
                                                ? GroupFixture.perEntityValue(j, e, t)
                                                : GroupFixture.sharedValue(j, t);
                                 assertThat(trace.valueAt(t, j)).isEqualTo(expected);
                             }
                         }
                     }
                 });
    }

    @Test
    void extract_givesEntitiesIdenticalSharedColumns() {
        var fixture = GroupFixture.groupFixture("resnet50", 2, 5);
        var gpu = catalog.indexOf(MetricCatalog.GPU_UTILIZATION).or(-1);

        extractor.extract(merged(fixture))
                 .onFailure(cause -> Assertions.fail(cause.message()))
                 .onSuccess(result -> assertThat(result.traces().get(0).column(gpu))
                     .containsExactly(result.traces().get(1).column(gpu)));
    }

    @Test
    void extract_rejectsEntityWithGapAndKeepsSiblings() {
        var fixture = GroupFixture.groupFixture("resnet50", 3, 4)
                                  .withGap(MetricCatalog.MEMORY_USAGE, "resnet50-pod-1", 2);

        extractor.extract(merged(fixture))
                 .onFailure(cause -> Assertions.fail(cause.message()))
                 .onSuccess(result -> {
                     assertThat(result.traces()).extracting(trace -> trace.metadata().entityId())
                                                .containsExactly("resnet50-pod-0", "resnet50-pod-2");
                     assertThat(result.failures()).hasSize(1);
                     var failure = (TraceError.IncompleteTrace) result.failures().get(0);
                     assertThat(failure.entityId()).isEqualTo("resnet50-pod-1");
                     assertThat(failure.metric()).isEqualTo(MetricCatalog.MEMORY_USAGE);
                     assertThat(failure.detail()).contains("1 missing").contains(GroupFixture.timestamp(2).toString());
                 });
    }

    @Test
    void extract_rejectsEveryEntity_forMissingColumn() {
        var group = new ExperimentGroup("resnet50", 2);
        var columns = catalog.order().subList(0, 14);
        var rows = List.of(new AlignedRow(Instant.EPOCH, "a", new double[14]),
                           new AlignedRow(Instant.EPOCH, "b", new double[14]));

        extractor.extract(new AlignedTable(group, columns, rows))
                 .onFailure(cause -> Assertions.fail(cause.message()))
                 .onSuccess(result -> {
                     assertThat(result.traces()).isEmpty();
                     assertThat(result.failures()).hasSize(2)
                                                  .allMatch(cause -> cause.message().contains(MetricCatalog.MEMORY_USAGE));
                 });
    }

    @Test
    void extract_fails_forEmptyTable() {
        var group = new ExperimentGroup("resnet50", 2);

        extractor.extract(new AlignedTable(group, catalog.order(), List.of()))
                 .onSuccessRun(Assertions::fail)
                 .onFailure(cause -> assertThat(cause).isInstanceOf(TraceError.NoEntities.class));
    }

    @Test
    void extract_acceptsCardinalityMismatch() {
        var fixture = GroupFixture.groupFixture("resnet50", 2, 3)
                                  .withEntities(List.of("pod-a", "pod-b", "pod-c"));

        extractor.extract(merged(fixture))
                 .onFailure(cause -> Assertions.fail(cause.message()))
                 .onSuccess(result -> assertThat(result.traces()).hasSize(3));
    }
}
