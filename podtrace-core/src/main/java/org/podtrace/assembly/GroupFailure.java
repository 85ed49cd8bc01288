package org.podtrace.assembly;

import org.podtrace.lang.Cause;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Experiment group excluded from an assembly, with every cause that excluded it.
 *
 * @param groupId Group directory name
 * @param causes  At least one cause, in the order they were raised
 */
public record GroupFailure(String groupId, List<Cause> causes) implements Cause {
    public GroupFailure {
        causes = List.copyOf(causes);
    }

    public static GroupFailure groupFailure(String groupId, Cause cause) {
        return new GroupFailure(groupId, List.of(cause));
    }

    @Override
    public String message() {
        return "Group " + groupId + " excluded: " + causes.stream()
                                                          .map(Cause::message)
                                                          .collect(Collectors.joining("; "));
    }
}
