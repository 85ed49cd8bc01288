package org.podtrace.lang;

/**
 * Value of operations that complete without producing anything.
 */
public enum Unit {
    UNIT;

    public static Unit unit() {
        return UNIT;
    }
}
