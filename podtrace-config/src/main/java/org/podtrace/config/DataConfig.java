package org.podtrace.config;

import java.nio.file.Path;

/**
 * Locations and layout of raw and processed data.
 *
 * @param rawDir       Root holding one directory per experiment group
 * @param processedDir Directory the trace collection is written to
 * @param entityColumn Column carrying the entity (pod) id in per-entity exports
 * @param parallelism  Number of groups assembled concurrently
 */
public record DataConfig(Path rawDir, Path processedDir, String entityColumn, int parallelism) {
    public static final String DEFAULT_RAW_DIR = "data/raw/phase1";
    public static final String DEFAULT_PROCESSED_DIR = "data/processed/phase1";
    public static final String DEFAULT_ENTITY_COLUMN = "pod";

    private static final DataConfig DEFAULT = new DataConfig(Path.of(DEFAULT_RAW_DIR),
                                                             Path.of(DEFAULT_PROCESSED_DIR),
                                                             DEFAULT_ENTITY_COLUMN,
                                                             1);

    public static DataConfig defaults() {
        return DEFAULT;
    }

    public DataConfig withRawDir(Path rawDir) {
        return new DataConfig(rawDir, processedDir, entityColumn, parallelism);
    }

    public DataConfig withProcessedDir(Path processedDir) {
        return new DataConfig(rawDir, processedDir, entityColumn, parallelism);
    }

    public DataConfig withEntityColumn(String entityColumn) {
        return new DataConfig(rawDir, processedDir, entityColumn, parallelism);
    }

    public DataConfig withParallelism(int parallelism) {
        return new DataConfig(rawDir, processedDir, entityColumn, parallelism);
    }
}
