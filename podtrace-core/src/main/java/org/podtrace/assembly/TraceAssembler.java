package org.podtrace.assembly;

import org.podtrace.catalog.MetricCatalog;
import org.podtrace.config.DataConfig;
import org.podtrace.series.MetricSeriesLoader;
import org.podtrace.source.ExperimentSources;
import org.podtrace.source.MetricLocator;
import org.podtrace.trace.ExperimentMerger;
import org.podtrace.trace.ExtractionResult;
import org.podtrace.trace.PodTrace;
import org.podtrace.trace.PodTraceExtractor;
import org.podtrace.lang.Result;
import org.podtrace.lang.Causes;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the trace collection of a whole data root, one experiment group at a time.
 * <p>
 * A failing group is logged and reported, never aborting the others. A group contributes traces only when
 * every one of its entities was extracted completely. Groups may be processed on a fixed worker pool; the
 * report lists traces and failures in group order regardless of parallelism.
 */
public final class TraceAssembler {
    private static final Logger log = LoggerFactory.getLogger(TraceAssembler.class);

    private final ExperimentMerger merger;
    private final PodTraceExtractor extractor;
    private final int parallelism;

    private TraceAssembler(ExperimentMerger merger, PodTraceExtractor extractor, int parallelism) {
        this.merger = merger;
        this.extractor = extractor;
        this.parallelism = parallelism;
    }

    public static TraceAssembler traceAssembler(MetricCatalog catalog, String entityColumn, int parallelism) {
        var loader = MetricSeriesLoader.metricSeriesLoader(catalog, entityColumn);
        return new TraceAssembler(ExperimentMerger.experimentMerger(loader),
                                  PodTraceExtractor.podTraceExtractor(catalog),
                                  Math.max(1, parallelism));
    }

    public static TraceAssembler traceAssembler(MetricCatalog catalog, DataConfig config) {
        return traceAssembler(catalog, config.entityColumn(), config.parallelism());
    }

    /**
     * Assemble every group directory under the root. Fails only when the root itself cannot be listed.
     */
    public Result<AssemblyReport> assembleAll(Path root) {
        return ExperimentSources.scan(root)
                                .map(this::assembleDirectories)
                                .onSuccess(report -> log.info("Assembled {} traces from {} of {} groups under {}",
                                                              report.traces()
                                                                    .size(),
                                                              report.groupsAssembled(),
                                                              report.groupsScanned(),
                                                              root));
    }

    private AssemblyReport assembleDirectories(List<Path> directories) {
        var outcomes = parallelism == 1 || directories.size() < 2
                       ? sequential(directories)
                       : parallel(directories);
        var traces = new ArrayList<PodTrace>();
        var failures = new ArrayList<GroupFailure>();
        for (int i = 0; i < directories.size(); i++) {
            var groupId = directories.get(i)
                                     .getFileName()
                                     .toString();
            outcomes.get(i)
                    .flatMap(extraction -> complete(groupId, extraction))
                    .onSuccess(traces::addAll)
                    .onFailure(cause -> {
                        var failure = cause instanceof GroupFailure groupFailure
                                      ? groupFailure
                                      : GroupFailure.groupFailure(groupId, cause);
                        log.warn(failure.message());
                        failures.add(failure);
                    });
        }
        return new AssemblyReport(directories.size(), traces, failures);
    }

    private static Result<List<PodTrace>> complete(String groupId, ExtractionResult extraction) {
        if (!extraction.isComplete()) {
            return new GroupFailure(groupId, extraction.failures()).result();
        }
        return Result.success(extraction.traces());
    }

    private List<Result<ExtractionResult>> sequential(List<Path> directories) {
        return directories.stream()
                          .map(this::assembleDirectory)
                          .toList();
    }

    private List<Result<ExtractionResult>> parallel(List<Path> directories) {
        var executor = workerPool();
        try{
            var futures = new ArrayList<Future<Result<ExtractionResult>>>(directories.size());
            for (var directory : directories) {
                futures.add(executor.submit(() -> assembleDirectory(directory)));
            }
            var results = new ArrayList<Result<ExtractionResult>>(futures.size());
            for (var future : futures) {
                results.add(await(future));
            }
            return results;
        } finally{
            executor.shutdownNow();
        }
    }

    private ExecutorService workerPool() {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism,
                                            runnable -> {
                                                var thread = new Thread(runnable,
                                                                        "podtrace-assembler-" + counter.incrementAndGet());
                                                thread.setDaemon(true);
                                                return thread;
                                            });
    }

    private static Result<ExtractionResult> await(Future<Result<ExtractionResult>> future) {
        try{
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread()
                  .interrupt();
            return Causes.fromThrowable(e)
                         .result();
        } catch (ExecutionException e) {
            return Causes.fromThrowable(e.getCause())
                         .result();
        }
    }

    /**
     * Merge and extract one group directory.
     */
    public Result<ExtractionResult> assembleDirectory(Path directory) {
        log.debug("Assembling group directory {}", directory);
        return ExperimentSources.groupDirectory(directory)
                                .flatMap(this::assembleGroup);
    }

    /**
     * Merge and extract the group served by the locator.
     */
    public Result<ExtractionResult> assembleGroup(MetricLocator locator) {
        return merger.merge(locator)
                     .flatMap(extractor::extract);
    }
}
