package org.podtrace.lang;

/**
 * Description of a failure carried by {@link Result}.
 */
public interface Cause {
    String message();

    /**
     * Wrap this cause into a failed result.
     */
    default <T> Result<T> result() {
        return Result.failure(this);
    }
}
