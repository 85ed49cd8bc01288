package org.podtrace.source;

import org.podtrace.error.TraceError;
import org.podtrace.trace.ExperimentGroup;
import org.podtrace.lang.Result;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Discovers experiment group directories under a data root.
 * <p>
 * Layout: {@code <root>/<workload>_r<cardinality>/<workload>_r<cardinality>_<metric>_<run>.csv}.
 */
public final class ExperimentSources {
    private ExperimentSources() {}

    /**
     * List group directories under the root in name order. Plain files are ignored.
     */
    public static Result<List<Path>> scan(Path root) {
        if (!Files.isDirectory(root)) {
            return TraceError.sourceUnreadable(root.toString(), "not a directory").result();
        }
        return Result.lift(e -> TraceError.sourceUnreadable(root.toString(), e.getMessage()),
                           () -> {
                               try (var entries = Files.list(root)) {
                                   return entries.filter(Files::isDirectory)
                                                 .sorted()
                                                 .toList();
                               }
                           });
    }

    /**
     * Build the locator of one group directory. Fails with
     * {@link TraceError.AmbiguousGroupName} before any source is read when the name does not parse.
     */
    public static Result<MetricLocator> groupDirectory(Path directory) {
        return ExperimentGroup.experimentGroup(directory.getFileName()
                                                        .toString())
                              .flatMap(group -> MetricLocator.directory(group, directory));
    }
}
