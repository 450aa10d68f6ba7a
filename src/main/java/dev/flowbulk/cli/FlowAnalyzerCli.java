package dev.flowbulk.cli;

import ch.qos.logback.classic.Level;
import dev.flowbulk.engine.FlowAnalyzer;
import dev.flowbulk.engine.SettingsLoader;
import dev.flowbulk.fetch.FlowAnalysisException;
import dev.flowbulk.fetch.LocalFileFetcher;
import dev.flowbulk.model.AnalyzerSettings;
import dev.flowbulk.model.WorkflowAnalysis;
import dev.flowbulk.output.AnalysisWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for flow-bulk-analyzer.
 * Exit codes: 0 on success, 1 when no report could be produced, 2 when the report is missing sub-workflows.
 */
@Command(
    name = "flow-bulk-analyzer",
    mixinStandardHelpOptions = true,
    version = "flow-bulk-analyzer 0.1.0",
    exitCodeOnInvalidInput = FlowAnalyzerCli.EXIT_ERROR,
    description = "Analyze a workflow and its sub-workflows for bulkification and complexity."
)
public class FlowAnalyzerCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(FlowAnalyzerCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_UNRESOLVED = 2;

    enum Format { json, text }

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Workflow name or path to its metadata file")
    private String flow;

    @Option(names = "--flows-dir", defaultValue = ".",
        description = "Directory holding workflow metadata files (default: ${DEFAULT-VALUE})")
    private Path flowsDir;

    @Option(names = "--format", defaultValue = "json",
        description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format;

    @Option(names = "--max-depth", description = "Maximum sub-workflow nesting depth (default: 10)")
    private Integer maxDepth;

    @Option(names = "--settings", description = "JSON file with analyzer thresholds")
    private Path settingsFile;

    @Option(names = "--verbose", description = "Log propagation and cache details")
    private boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            var root = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }

        AnalyzerSettings settings;
        try {
            settings = settingsFile != null ? SettingsLoader.loadFromFile(settingsFile) : AnalyzerSettings.defaults();
            if (maxDepth != null) {
                settings = settings.withMaxRecursionDepth(maxDepth);
            }
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        var analyzer = new FlowAnalyzer(new LocalFileFetcher(flowsDir), settings);
        WorkflowAnalysis analysis;
        try {
            analysis = analyzer.analyze(flow);
        } catch (FlowAnalysisException e) {
            LOG.debug("Analysis of {} failed", flow, e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        out.println(format == Format.text ? AnalysisWriter.toText(analysis) : AnalysisWriter.toJson(analysis));
        out.flush();

        if (!analyzer.unresolvedWorkflows().isEmpty()) {
            err.println("Warning: unresolved sub-workflows: " + String.join(", ", analyzer.unresolvedWorkflows()));
            return EXIT_UNRESOLVED;
        }
        return EXIT_OK;
    }
}
