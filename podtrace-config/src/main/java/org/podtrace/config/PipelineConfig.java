package org.podtrace.config;

/**
 * Root configuration of the trace pipeline.
 *
 * @param data          Raw/processed locations and ingest settings
 * @param normalization Range normalization settings
 */
public record PipelineConfig(DataConfig data, NormalizationConfig normalization) {
    private static final PipelineConfig DEFAULT = new PipelineConfig(DataConfig.defaults(),
                                                                     NormalizationConfig.defaults());

    public static PipelineConfig defaults() {
        return DEFAULT;
    }

    public PipelineConfig withData(DataConfig data) {
        return new PipelineConfig(data, normalization);
    }

    public PipelineConfig withNormalization(NormalizationConfig normalization) {
        return new PipelineConfig(data, normalization);
    }
}
