package org.podtrace.cli;

import org.podtrace.assembly.AssemblyReport;
import org.podtrace.assembly.SourceInspector;
import org.podtrace.assembly.SourceReport;
import org.podtrace.assembly.TraceAssembler;
import org.podtrace.catalog.MetricCatalog;
import org.podtrace.config.ConfigLoader;
import org.podtrace.config.NormalizationMode;
import org.podtrace.config.PipelineConfig;
import org.podtrace.normalize.AbsoluteNormalizer;
import org.podtrace.normalize.RangeTable;
import org.podtrace.store.TraceCollection;
import org.podtrace.store.TraceCollectionStore;
import org.podtrace.lang.Cause;
import org.podtrace.lang.Result;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Pod trace pipeline CLI.
 *
 * <p>Usage examples:
 * <pre>
 * podtrace --raw-dir data/raw/phase1 inspect
 * podtrace -c podtrace.toml assemble --normalize
 * podtrace --mode derived ranges --from data/processed/phase1
 * podtrace normalize data/processed/phase1 data/processed/normalized
 * podtrace denormalize data/processed/normalized data/processed/restored
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when the pipeline fails, 2 on invalid usage.
 */
@Command(name = "podtrace",
         mixinStandardHelpOptions = true,
         version = "PodTrace 0.1.0",
         description = "Assemble, normalize and store per-pod metric traces",
         subcommands = {
                 PodTraceCli.AssembleCommand.class,
                 PodTraceCli.RangesCommand.class,
                 PodTraceCli.NormalizeCommand.class,
                 PodTraceCli.DenormalizeCommand.class,
                 PodTraceCli.InspectCommand.class
         })
public class PodTraceCli implements Runnable {
    static final int FAILURE = 1;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "TOML configuration file")
    private Path configFile;

    @Option(names = "--raw-dir", description = "Root directory of raw experiment groups")
    private String rawDir;

    @Option(names = "--processed-dir", description = "Directory of the assembled collection")
    private String processedDir;

    @Option(names = "--mode", description = "Range mode: fixed or derived")
    private String mode;

    @Option(names = "--percentile", description = "Percentile for derived ranges")
    private String percentile;

    @Option(names = "--margin", description = "Margin factor for derived ranges")
    private String margin;

    @Option(names = "--parallelism", description = "Number of groups assembled concurrently")
    private String parallelism;

    private final MetricCatalog catalog = MetricCatalog.standard();

    public static void main(String[] args) {
        System.exit(new CommandLine(new PodTraceCli()).execute(args));
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(out());
    }

    PrintWriter out() {
        return spec.commandLine()
                   .getOut();
    }

    PrintWriter err() {
        return spec.commandLine()
                   .getErr();
    }

    MetricCatalog catalog() {
        return catalog;
    }

    Result<PipelineConfig> config() {
        var overrides = overrides();
        return configFile == null
               ? ConfigLoader.defaultsWithOverrides(overrides)
               : ConfigLoader.loadWithOverrides(configFile, overrides);
    }

    private Map<String, String> overrides() {
        var overrides = new HashMap<String, String>();
        putIfSet(overrides, "raw_dir", rawDir);
        putIfSet(overrides, "processed_dir", processedDir);
        putIfSet(overrides, "mode", mode);
        putIfSet(overrides, "percentile", percentile);
        putIfSet(overrides, "margin", margin);
        putIfSet(overrides, "parallelism", parallelism);
        return overrides;
    }

    private static void putIfSet(Map<String, String> overrides, String key, String value) {
        if (value != null) {
            overrides.put(key, value);
        }
    }

    /**
     * Print the outcome and map it to an exit code.
     */
    int exit(Result<String> outcome) {
        return outcome.fold(cause -> {
                                err().println("Error: " + cause.message());
                                err().flush();
                                return FAILURE;
                            },
                            text -> {
                                out().print(text);
                                out().flush();
                                return CommandLine.ExitCode.OK;
                            });
    }

    /**
     * Normalizer for the configuration; derived ranges use the given traces as references.
     */
    Result<AbsoluteNormalizer> normalizer(PipelineConfig config, TraceCollection references) {
        return AbsoluteNormalizer.absoluteNormalizer(catalog, config.normalization(), references.traces());
    }

    @Command(name = "assemble", description = "Assemble all raw groups into a trace collection")
    static class AssembleCommand implements Callable<Integer> {
        @ParentCommand
        private PodTraceCli parent;

        @Option(names = "--normalize", description = "Store normalized traces with their ranges")
        private boolean normalize;

        @Option(names = "--strict", description = "Fail when any group is excluded")
        private boolean strict;

        @Override
        public Integer call() {
            return parent.exit(parent.config()
                                     .flatMap(this::assemble));
        }

        private Result<String> assemble(PipelineConfig config) {
            var assembler = TraceAssembler.traceAssembler(parent.catalog(), config.data());
            return assembler.assembleAll(config.data()
                                               .rawDir())
                            .flatMap(report -> check(report).flatMap(checked -> store(config, checked)));
        }

        private Result<AssemblyReport> check(AssemblyReport report) {
            if (report.traces()
                      .isEmpty()) {
                return new CommandFailed(report.summary() + "No traces assembled").result();
            }
            if (strict && !report.failures()
                                 .isEmpty()) {
                return new CommandFailed(report.summary() + report.failures()
                                                                   .size() + " groups excluded").result();
            }
            return Result.success(report);
        }

        private Result<String> store(PipelineConfig config, AssemblyReport report) {
            var collection = TraceCollection.traceCollection(report.traces());
            var target = TraceCollectionStore.traceCollectionStore(config.data()
                                                                         .processedDir());
            var prepared = normalize
                           ? parent.normalizer(config, collection)
                                   .flatMap(normalizer -> normalizer.normalizeAll(collection.traces())
                                                                    .map(traces -> collection.withTraces(traces)
                                                                                             .withRanges(normalizer.rangeTable())))
                           : Result.success(collection);
            return prepared.flatMap(ready -> target.save(ready))
                           .map(unit -> report.summary() + "Saved to " + target.directory() + "\n");
        }
    }

    @Command(name = "ranges", description = "Print normalization ranges, optionally derived from a stored collection")
    static class RangesCommand implements Callable<Integer> {
        @ParentCommand
        private PodTraceCli parent;

        @Option(names = "--from", description = "Stored raw collection to derive ranges from")
        private Path source;

        @Option(names = {"-o", "--output"}, description = "Directory to save ranges.json into")
        private Path output;

        @Override
        public Integer call() {
            return parent.exit(parent.config()
                                     .flatMap(this::ranges));
        }

        private Result<String> ranges(PipelineConfig config) {
            var references = source == null
                             ? Result.success(TraceCollection.traceCollection(List.of()))
                             : TraceCollectionStore.traceCollectionStore(source)
                                                   .load(parent.catalog())
                                                   .flatMap(this::requireRaw);
            return references.flatMap(collection -> parent.normalizer(config, collection))
                             .map(AbsoluteNormalizer::rangeTable)
                             .flatMap(this::save)
                             .map(RangeTable::describe);
        }

        private Result<TraceCollection> requireRaw(TraceCollection collection) {
            if (!collection.ranges()
                           .isEmpty()) {
                return new CommandFailed("Collection at " + source
                                         + " is normalized, ranges must be derived from raw traces").result();
            }
            return Result.success(collection);
        }

        private Result<RangeTable> save(RangeTable table) {
            if (output == null) {
                return Result.success(table);
            }
            return TraceCollectionStore.traceCollectionStore(output)
                                       .saveRanges(table)
                                       .map(unit -> table);
        }
    }

    @Command(name = "normalize", description = "Normalize a stored collection into another directory")
    static class NormalizeCommand implements Callable<Integer> {
        @ParentCommand
        private PodTraceCli parent;

        @Parameters(index = "0", description = "Directory of the raw collection")
        private Path input;

        @Parameters(index = "1", description = "Directory for the normalized collection")
        private Path output;

        @Override
        public Integer call() {
            return parent.exit(parent.config()
                                     .flatMap(this::normalize));
        }

        private Result<String> normalize(PipelineConfig config) {
            return TraceCollectionStore.traceCollectionStore(input)
                                       .load(parent.catalog())
                                       .flatMap(collection -> normalize(config, collection));
        }

        private Result<String> normalize(PipelineConfig config, TraceCollection collection) {
            if (!collection.ranges()
                           .isEmpty()) {
                return new CommandFailed("Collection at " + input + " is already normalized").result();
            }
            return parent.normalizer(config, collection)
                         .flatMap(normalizer -> normalizer.normalizeAll(collection.traces())
                                                          .map(traces -> collection.withTraces(traces)
                                                                                   .withRanges(normalizer.rangeTable())))
                         .flatMap(normalized -> TraceCollectionStore.traceCollectionStore(output)
                                                                    .save(normalized)
                                                                    .map(unit -> "Normalized " + normalized.size()
                                                                                 + " traces into " + output + "\n"));
        }
    }

    @Command(name = "denormalize", description = "Restore metric units of a normalized collection")
    static class DenormalizeCommand implements Callable<Integer> {
        @ParentCommand
        private PodTraceCli parent;

        @Parameters(index = "0", description = "Directory of the normalized collection")
        private Path input;

        @Parameters(index = "1", description = "Directory for the restored collection")
        private Path output;

        @Override
        public Integer call() {
            return parent.exit(parent.config()
                                     .flatMap(this::denormalize));
        }

        private Result<String> denormalize(PipelineConfig config) {
            return TraceCollectionStore.traceCollectionStore(input)
                                       .load(parent.catalog())
                                       .flatMap(collection -> denormalize(config, collection))
                                       .flatMap(restored -> TraceCollectionStore.traceCollectionStore(output)
                                                                                .save(restored)
                                                                                .map(unit -> "Denormalized " + restored.size()
                                                                                             + " traces into " + output
                                                                                             + "\n"));
        }

        private Result<TraceCollection> denormalize(PipelineConfig config, TraceCollection collection) {
            return ranges(config, collection).map(AbsoluteNormalizer::absoluteNormalizer)
                                             .flatMap(normalizer -> normalizer.denormalizeAll(collection.traces()))
                                             .map(TraceCollection::traceCollection);
        }

        private Result<RangeTable> ranges(PipelineConfig config, TraceCollection collection) {
            if (config.normalization()
                      .mode() == NormalizationMode.DERIVED) {
                return collection.ranges()
                                 .toResult(new CommandFailed("Collection at " + input
                                                              + " has no stored ranges to denormalize derived values"));
            }
            return parent.normalizer(config, collection)
                         .map(normalizer -> collection.rangesFor(normalizer.rangeTable()));
        }
    }

    @Command(name = "inspect", description = "Describe the raw sources of every group")
    static class InspectCommand implements Callable<Integer> {
        @ParentCommand
        private PodTraceCli parent;

        @Override
        public Integer call() {
            return parent.exit(parent.config()
                                     .flatMap(this::inspect));
        }

        private Result<String> inspect(PipelineConfig config) {
            return SourceInspector.sourceInspector(parent.catalog(),
                                                   config.data()
                                                         .entityColumn())
                                  .inspectAll(config.data()
                                                    .rawDir())
                                  .map(reports -> reports.stream()
                                                         .map(SourceReport::render)
                                                         .reduce("", String::concat));
        }
    }

    /**
     * Command precondition that does not hold.
     */
    record CommandFailed(String message) implements Cause {}
}
