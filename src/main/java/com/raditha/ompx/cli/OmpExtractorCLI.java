package com.raditha.ompx.cli;

import com.raditha.ompx.analyzer.ExtractionContext;
import com.raditha.ompx.analyzer.PragmaAnalyzer;
import com.raditha.ompx.ast.TranslationUnit;
import com.raditha.ompx.config.ExtractorConfig;
import com.raditha.ompx.config.ExtractorSettings;
import com.raditha.ompx.frontend.JsonSyntaxTreeReader;
import com.raditha.ompx.frontend.SyntaxTreeProvider;
import com.raditha.ompx.report.ReportEmitter;
import com.raditha.ompx.report.UnitReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the OpenMP extractor.
 * <p>
 * Usage:
 * java -jar ompx.jar [options] &lt;tree.json&gt;...
 * <p>
 * Configuration priority: CLI arguments > ompx.yml > defaults
 */
@Command(name = "ompx", mixinStandardHelpOptions = true, version = "ompx v1.0.0",
        description = "Extracts OpenMP directive and loop metadata into per-file JSON reports")
public class OmpExtractorCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(OmpExtractorCLI.class);

    static final int EXIT_IO_ERROR = 3;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<tree.json>", description = "Syntax tree files to analyze")
    private List<Path> treeFiles = new ArrayList<>();

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--source-root", description = "Directory source file names are resolved against", paramLabel = "<path>")
    private String sourceRoot;

    @Option(names = "--output", description = "Write reports into this directory", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--no-code-snippets", description = "Leave source snippets out of the reports")
    private boolean noCodeSnippets = false;

    @Option(names = "--json", description = "Also print each report to standard output")
    private boolean jsonOutput = false;

    private final SyntaxTreeProvider provider;

    public OmpExtractorCLI() {
        this(null);
    }

    /**
     * @param provider tree provider to use instead of the JSON reader built from the configuration
     */
    OmpExtractorCLI(SyntaxTreeProvider provider) {
        this.provider = provider;
    }

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, 3 when any tree or report failed)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Map<String, Object> document = configFile != null
                ? ExtractorSettings.loadConfigMap(new File(configFile))
                : ExtractorSettings.loadConfigMap();
        ExtractorConfig config = ExtractorSettings.loadConfig(document, noCodeSnippets, sourceRoot, outputPath);
        logger.debug("Running with {}", config);

        SyntaxTreeProvider treeProvider = provider != null ? provider : new JsonSyntaxTreeReader(config.sourceRoot());
        ExtractionContext context = new ExtractionContext(config,
                new ReportEmitter(config.outputDirectory(), config.sourceRoot()));
        PragmaAnalyzer analyzer = new PragmaAnalyzer(context);

        List<UnitReport> reports = new ArrayList<>();
        int failedTrees = 0;
        for (Path treeFile : treeFiles) {
            try {
                TranslationUnit unit = treeProvider.load(treeFile);
                reports.addAll(analyzer.analyze(unit));
            } catch (IOException e) {
                failedTrees++;
                logger.error("Skipping {}: {}", treeFile, e.getMessage());
            }
        }

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            printJsonReports(out, reports);
        }
        printSummary(out, reports, failedTrees);
        out.flush();

        boolean writeFailed = reports.stream().anyMatch(r -> !r.written());
        return failedTrees > 0 || writeFailed ? EXIT_IO_ERROR : 0;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new OmpExtractorCLI()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit-code mapping used by {@link #main(String[])}.
     */
    static CommandLine commandLine(OmpExtractorCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() throws IOException {
        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (sourceRoot != null && !Files.isDirectory(Path.of(sourceRoot))) {
            throw new IllegalArgumentException("Source root is not a directory: " + sourceRoot);
        }

        if (outputPath != null) {
            Path outputDir = Path.of(outputPath);
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
            Files.createDirectories(outputDir);
        }
    }

    private static void printJsonReports(PrintWriter out, List<UnitReport> reports) {
        for (UnitReport report : reports) {
            out.println("// " + report.filename());
            out.println(ReportEmitter.toPrettyString(report.document()));
        }
    }

    private static void printSummary(PrintWriter out, List<UnitReport> reports, int failedTrees) {
        out.println("=".repeat(80));
        out.println("OPENMP EXTRACTION REPORT");
        out.println("=".repeat(80));
        out.printf("Files reported: %d%n", reports.size());
        if (failedTrees > 0) {
            out.printf("Trees that could not be read: %d%n", failedTrees);
        }
        out.println();

        if (reports.isEmpty()) {
            return;
        }
        out.printf("%-40s %7s %16s  %s%n", "File", "Loops", "Ordered/atomic", "Report");
        out.println("-".repeat(80));
        for (UnitReport report : reports) {
            out.printf("%-40s %7d %16d  %s%n",
                    report.filename(),
                    report.loopEntries(),
                    report.directiveEntries(),
                    report.written() ? report.output() : "NOT WRITTEN");
        }
        out.println();
    }
}
