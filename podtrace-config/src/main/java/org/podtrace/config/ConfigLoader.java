package org.podtrace.config;

import org.podtrace.lang.Cause;
import org.podtrace.lang.Option;
import org.podtrace.lang.Result;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import static org.podtrace.lang.Option.none;
import static org.podtrace.lang.Option.some;

/**
 * Loads pipeline configuration from TOML files.
 *
 * <p>Configuration resolution order (highest priority first):
 * <ol>
 *   <li>Explicit overrides (command line)</li>
 *   <li>Values from TOML file</li>
 *   <li>Built-in defaults</li>
 * </ol>
 */
public final class ConfigLoader {
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {}

    /**
     * Load configuration from file path.
     */
    public static Result<PipelineConfig> load(Path path) {
        return readFile(path).flatMap(ConfigLoader::parse)
                             .flatMap(ConfigLoader::fromDocument)
                             .flatMap(ConfigValidator::validate);
    }

    /**
     * Load configuration from TOML string content.
     */
    public static Result<PipelineConfig> loadFromString(String content) {
        return parse(content).flatMap(ConfigLoader::fromDocument)
                             .flatMap(ConfigValidator::validate);
    }

    /**
     * Load configuration with command line overrides.
     */
    public static Result<PipelineConfig> loadWithOverrides(Path path, Map<String, String> overrides) {
        return readFile(path).flatMap(ConfigLoader::parse)
                             .flatMap(doc -> fromDocumentWithOverrides(doc, overrides))
                             .flatMap(ConfigValidator::validate);
    }

    /**
     * Apply command line overrides to the built-in defaults.
     */
    public static Result<PipelineConfig> defaultsWithOverrides(Map<String, String> overrides) {
        return fromDocumentWithOverrides(MAPPER.createObjectNode(), overrides).flatMap(ConfigValidator::validate);
    }

    private static Result<String> readFile(Path path) {
        return Result.lift(e -> ConfigError.unreadable(path, e.getMessage()), () -> Files.readString(path));
    }

    private static Result<JsonNode> parse(String content) {
        return Result.lift(e -> ConfigError.invalidConfig("malformed TOML: " + e.getMessage()),
                           () -> MAPPER.readTree(content));
    }

    private static Result<PipelineConfig> fromDocument(JsonNode doc) {
        return fromDocumentWithOverrides(doc, Map.of());
    }

    private static Result<PipelineConfig> fromDocumentWithOverrides(JsonNode doc, Map<String, String> overrides) {
        var modeStr = overrides.getOrDefault("mode",
                                             string(doc, "normalization", "mode")
                                                   .or(NormalizationMode.FIXED.value()));
        return NormalizationMode.normalizationMode(modeStr)
                                .flatMap(mode -> buildConfig(doc, overrides, mode));
    }

    private static Result<PipelineConfig> buildConfig(JsonNode doc,
                                                      Map<String, String> overrides,
                                                      NormalizationMode mode) {
        try{
            // Data section
            var data = DataConfig.defaults();
            var rawDir = string(doc, "data", "raw_dir").or(DataConfig.DEFAULT_RAW_DIR);
            var processedDir = string(doc, "data", "processed_dir").or(DataConfig.DEFAULT_PROCESSED_DIR);
            data = data.withRawDir(Path.of(overrides.getOrDefault("raw_dir", rawDir)))
                       .withProcessedDir(Path.of(overrides.getOrDefault("processed_dir", processedDir)))
                       .withEntityColumn(string(doc, "data", "entity_column").or(DataConfig.DEFAULT_ENTITY_COLUMN));
            var parallelism = integer(doc, "data", "parallelism").or(1);
            if (overrides.containsKey("parallelism")) {
                parallelism = Integer.parseInt(overrides.get("parallelism"));
            }
            data = data.withParallelism(parallelism);
            // Normalization section
            var percentile = number(doc, "normalization", "percentile").or(NormalizationConfig.DEFAULT_PERCENTILE);
            if (overrides.containsKey("percentile")) {
                percentile = Double.parseDouble(overrides.get("percentile"));
            }
            var margin = number(doc, "normalization", "margin").or(NormalizationConfig.DEFAULT_MARGIN);
            if (overrides.containsKey("margin")) {
                margin = Double.parseDouble(overrides.get("margin"));
            }
            var minWidth = number(doc, "normalization", "min_width").or(NormalizationConfig.DEFAULT_MIN_WIDTH);
            var normalization = new NormalizationConfig(mode, percentile, margin, minWidth, rangeOverrides(doc));
            return Result.success(new PipelineConfig(data, normalization));
        } catch (IllegalArgumentException e) {
            return ConfigError.invalidConfig(e.getMessage())
                              .result();
        }
    }

    private static List<RangeOverride> rangeOverrides(JsonNode doc) {
        var ranges = doc.path("normalization")
                        .path("ranges");
        var result = new ArrayList<RangeOverride>();
        var names = ranges.fieldNames();
        while (names.hasNext()) {
            var metric = names.next();
            var bounds = ranges.get(metric);
            if (!bounds.isArray() || bounds.size() != 2 || !bounds.get(0)
                                                                  .isNumber() || !bounds.get(1)
                                                                                        .isNumber()) {
                throw new IllegalArgumentException("normalization.ranges." + metric + " must be [min, max]");
            }
            result.add(new RangeOverride(metric,
                                         bounds.get(0)
                                               .asDouble(),
                                         bounds.get(1)
                                               .asDouble()));
        }
        return result;
    }

    private static Option<JsonNode> value(JsonNode doc, String section, String key) {
        var node = doc.path(section)
                      .path(key);
        return node.isMissingNode() || node.isNull()
               ? none()
               : some(node);
    }

    private static Option<String> string(JsonNode doc, String section, String key) {
        return value(doc, section, key).map(node -> {
            if (!node.isTextual()) {
                throw new IllegalArgumentException(section + "." + key + " must be a string");
            }
            return node.asText();
        });
    }

    private static Option<Double> number(JsonNode doc, String section, String key) {
        return value(doc, section, key).map(node -> {
            if (!node.isNumber()) {
                throw new IllegalArgumentException(section + "." + key + " must be a number");
            }
            return node.asDouble();
        });
    }

    private static Option<Integer> integer(JsonNode doc, String section, String key) {
        return value(doc, section, key).map(node -> {
            if (!node.isIntegralNumber()) {
                throw new IllegalArgumentException(section + "." + key + " must be an integer");
            }
            return node.asInt();
        });
    }

    /**
     * Configuration loading errors.
     */
    public sealed interface ConfigError extends Cause {
        record InvalidConfig(String reason) implements ConfigError {
            @Override
            public String message() {
                return "Invalid configuration: " + reason;
            }
        }

        record Unreadable(Path path, String reason) implements ConfigError {
            @Override
            public String message() {
                return "Cannot read configuration file " + path + ": " + reason;
            }
        }

        static ConfigError invalidConfig(String reason) {
            return new InvalidConfig(reason);
        }

        static ConfigError unreadable(Path path, String reason) {
            return new Unreadable(path, reason);
        }
    }
}
