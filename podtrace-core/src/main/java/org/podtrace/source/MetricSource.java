package org.podtrace.source;

import org.podtrace.error.TraceError;
import org.podtrace.lang.Result;

import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One raw per-metric export. The caller closes the reader returned by {@link #open()}.
 */
public interface MetricSource {
    /**
     * Source identifier used in error messages, e.g. the file name.
     */
    String id();

    Result<Reader> open();

    /**
     * Source backed by a file.
     */
    static MetricSource file(Path path) {
        record fileSource(Path path) implements MetricSource {
            @Override
            public String id() {
                return path.getFileName()
                           .toString();
            }

            @Override
            public Result<Reader> open() {
                return Result.lift(e -> TraceError.sourceUnreadable(path.toString(), e.getMessage()),
                                   () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
            }
        }
        return new fileSource(path);
    }

    /**
     * Source backed by in-memory CSV text.
     */
    static MetricSource text(String id, String content) {
        record textSource(String id, String content) implements MetricSource {
            @Override
            public Result<Reader> open() {
                return Result.success(new StringReader(content));
            }
        }
        return new textSource(id, content);
    }
}
