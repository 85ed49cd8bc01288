package org.podtrace.lang;

public final class Causes {
    private Causes() {}

    public static Cause cause(String message) {
        return new SimpleCause(message);
    }

    public static Cause fromThrowable(Throwable throwable) {
        var message = throwable.getMessage();
        return new SimpleCause(message == null
                               ? throwable.getClass()
                                          .getName()
                               : throwable.getClass()
                                          .getSimpleName() + ": " + message);
    }

    record SimpleCause(String message) implements Cause {}
}
