package org.podtrace.source;

import org.podtrace.error.TraceError;
import org.podtrace.trace.ExperimentGroup;
import org.podtrace.lang.Result;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link MetricLocator} backed by a directory with one CSV export per metric.
 */
final class DirectoryMetricLocator implements MetricLocator {
    private final ExperimentGroup group;
    private final Path directory;
    private final List<String> names;

    private DirectoryMetricLocator(ExperimentGroup group, Path directory, List<String> names) {
        this.group = group;
        this.directory = directory;
        this.names = names;
    }

    static Result<MetricLocator> directoryMetricLocator(ExperimentGroup group, Path directory) {
        return listFiles(directory).map(names -> new DirectoryMetricLocator(group, directory, names));
    }

    private static Result<List<String>> listFiles(Path directory) {
        return Result.lift(e -> TraceError.sourceUnreadable(directory.toString(), e.getMessage()),
                           () -> {
                               try (var entries = Files.list(directory)) {
                                   return entries.filter(Files::isRegularFile)
                                                 .map(path -> path.getFileName()
                                                                  .toString())
                                                 .sorted()
                                                 .toList();
                               }
                           });
    }

    @Override
    public ExperimentGroup group() {
        return group;
    }

    @Override
    public Result<MetricSource> locate(String metric) {
        return SourceMatching.resolve(group.id(), directory.toString(), metric, names)
                             .map(name -> MetricSource.file(directory.resolve(name)));
    }

    @Override
    public Result<MetricSource> source(String name) {
        if (!names.contains(name)) {
            return TraceError.sourceNotFound(group.id(), name, directory.toString()).result();
        }
        return Result.success(MetricSource.file(directory.resolve(name)));
    }

    @Override
    public List<String> sourceNames() {
        return names;
    }
}
