package org.podtrace.assembly;

import org.podtrace.lang.Cause;
import org.podtrace.lang.Option;

import java.util.List;

/**
 * Inspection result of one group directory.
 *
 * @param groupId Group directory name
 * @param sources One entry per source file, in name order
 * @param problem Set when the group could not be inspected at all
 */
public record SourceReport(String groupId, List<SourceEntry> sources, Option<Cause> problem) {
    public SourceReport {
        sources = List.copyOf(sources);
    }

    /**
     * Structure of one source file.
     *
     * @param name            File name
     * @param metrics         Catalog metrics the name resolves to
     * @param columns         Header columns
     * @param rows            Number of data rows
     * @param hasEntityColumn Whether the header contains the entity column
     * @param problem         Set when the file could not be read
     */
    public record SourceEntry(String name,
                              List<String> metrics,
                              List<String> columns,
                              int rows,
                              boolean hasEntityColumn,
                              Option<Cause> problem) {
        public SourceEntry {
            metrics = List.copyOf(metrics);
            columns = List.copyOf(columns);
        }
    }

    /**
     * Printable listing, one line per source.
     */
    public String render() {
        var builder = new StringBuilder("Group ").append(groupId)
                                                  .append('\n');
        problem.onPresent(cause -> builder.append("  ! ")
                                          .append(cause.message())
                                          .append('\n'));
        for (var entry : sources) {
            builder.append("  ")
                   .append(entry.name())
                   .append(" metrics=")
                   .append(entry.metrics())
                   .append(" columns=")
                   .append(entry.columns())
                   .append(" rows=")
                   .append(entry.rows())
                   .append(" entity=")
                   .append(entry.hasEntityColumn() ? "yes" : "no")
                   .append('\n');
            entry.problem()
                 .onPresent(cause -> builder.append("    ! ")
                                            .append(cause.message())
                                            .append('\n'));
        }
        return builder.toString();
    }
}
