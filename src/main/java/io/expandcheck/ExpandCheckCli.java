package io.expandcheck;

import io.expandcheck.analysis.AnalysisReport;
import io.expandcheck.analysis.UnitAnalyzer;
import io.expandcheck.report.ConsoleReporter;
import io.expandcheck.report.JsonReporter;
import io.expandcheck.report.Reporter;
import io.expandcheck.unit.CompilationUnit;
import io.expandcheck.unit.UnitLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the expand-check tool.
 */
@Command(
        name = "expand-check",
        mixinStandardHelpOptions = true,
        version = "expand-check 1.0.0",
        description = "Validates expanded-parameter signatures and resolves their call sites for a unit description.",
        footer = {
                "",
                "Exit codes: 0 = no errors, 1 = usage or I/O failure, 2 = errors reported.",
                "",
                "Examples:",
                "  expand-check unit.yaml",
                "  expand-check unit.yaml --output-format json --output-file report.json",
                "  expand-check unit.yaml --config expand-check.yaml --no-color"
        }
)
public class ExpandCheckCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_ERRORS = 2;

    @Parameters(
            index = "0",
            description = "Path to the unit description (YAML)"
    )
    private Path unitPath;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-j", "--parallelism"},
            description = "Worker threads for call resolution (overrides the config file)"
    )
    private Integer parallelism;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable debug logging of resolution decisions"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        // Must run before the first logger is created
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        if (!Files.isRegularFile(unitPath)) {
            System.err.println("Error: Unit file does not exist: " + unitPath);
            return EXIT_FAILURE;
        }

        EngineConfig config;
        try {
            config = configFile != null ? EngineConfig.load(configFile) : EngineConfig.loadDefault();
            if (parallelism != null) {
                config = config.withParallelism(parallelism);
            }
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error loading config: " + e.getMessage());
            return EXIT_FAILURE;
        }

        CompilationUnit unit;
        try {
            unit = new UnitLoader().load(unitPath);
        } catch (IOException e) {
            System.err.println("Error loading unit: " + e.getMessage());
            return EXIT_FAILURE;
        }

        ExpansionEngine engine = ExpansionEngine.standard(unit.symbols(), config);
        AnalysisReport report = new UnitAnalyzer(engine, config).analyze(unit);

        try {
            writeReport(report);
        } catch (IOException e) {
            System.err.println("Error writing report: " + e.getMessage());
            return EXIT_FAILURE;
        }

        return report.hasErrors(config.failOnTypeMismatch()) ? EXIT_ERRORS : EXIT_OK;
    }

    private void writeReport(AnalysisReport report) throws IOException {
        Reporter reporter = switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor && outputFile == null);
            case json -> new JsonReporter(true);
        };

        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            reporter.write(report, out);
            out.flush();
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExpandCheckCli()).execute(args);
        System.exit(exitCode);
    }
}
