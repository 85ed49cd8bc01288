package org.podtrace.store;

import org.podtrace.lang.Cause;

/**
 * Errors that can occur while saving or loading a trace collection.
 */
public sealed interface StoreError extends Cause {
    /**
     * File could not be read or written.
     */
    record StoreFailure(String path, String reason) implements StoreError {
        @Override
        public String message() {
            return "Store operation failed for " + path + ": " + reason;
        }
    }

    /**
     * Stored files are readable but inconsistent with each other or with the catalog.
     */
    record StoreCorrupted(String path, String detail) implements StoreError {
        @Override
        public String message() {
            return "Stored collection at " + path + " is corrupted: " + detail;
        }
    }

    static StoreError storeFailure(String path, Throwable cause) {
        return new StoreFailure(path, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
    }

    static StoreError storeCorrupted(String path, String detail) {
        return new StoreCorrupted(path, detail);
    }
}
