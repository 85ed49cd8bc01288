package org.podtrace.trace;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merged wide table of one experiment group.
 * <p>
 * Rows are keyed by (timestamp, entity), sorted ascending by that key, and carry one value per column.
 * Every row belongs to an entity: shared metrics are broadcast onto entity rows, never the reverse.
 *
 * @param group   Experiment group the table was merged for
 * @param columns Metric names, one per value position
 * @param rows    Rows sorted by (timestamp, entity)
 */
public record AlignedTable(ExperimentGroup group, List<String> columns, List<AlignedRow> rows) {
    public AlignedTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int columnIndex(String metric) {
        return columns.indexOf(metric);
    }

    public Set<String> entities() {
        return rows.stream()
                   .map(AlignedRow::entity)
                   .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
