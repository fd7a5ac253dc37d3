package io.expandcheck.report;

import io.expandcheck.analysis.AnalysisReport;
import io.expandcheck.analysis.CallReport;
import io.expandcheck.analysis.SignatureReport;
import io.expandcheck.model.CallArgument;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.ErrorKind;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.ResolutionResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Sections:
 * - Summary header
 * - Declarations (one line per function, violations below)
 * - Calls (one line per call, outcome below)
 * - Error breakdown by kind
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    // Unicode tree-drawing characters
    private static final String TREE_BRANCH = "\u251C\u2500\u2500 ";  // ├──
    private static final String TREE_LAST = "\u2514\u2500\u2500 ";    // └──
    private static final String TREE_PIPE = "\u2502   ";              // │

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printDeclarations(out, report.signatures());
        printCalls(out, report.calls());
        printBreakdown(out, report);

        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisReport report) {
        out.println(color(BOLD, "expand-check: " + report.unitName()));
        out.printf("  %d function(s), %d call(s), %d resolved, %d skipped, %d error(s) in %d ms%n",
            report.signatures().size(),
            report.calls().size(),
            report.resolvedCount(),
            report.skippedCount(),
            report.errorCount(true),
            report.duration().toMillis());
        out.println();
    }

    private void printDeclarations(PrintWriter out, List<SignatureReport> signatures) {
        if (signatures.isEmpty()) {
            return;
        }
        out.println(color(CYAN, "Declarations"));
        for (SignatureReport report : signatures) {
            String status = report.isValid() ? color(GREEN, "OK   ") : color(RED, "ERROR");
            out.println("  " + status + " " + report.signature().display());
            printErrors(out, report.errors());
        }
        out.println();
    }

    private void printCalls(PrintWriter out, List<CallReport> calls) {
        if (calls.isEmpty()) {
            return;
        }
        out.println(color(CYAN, "Calls"));
        for (CallReport report : calls) {
            if (report.isSkipped()) {
                out.println("  " + color(YELLOW, "SKIP ") + " " + report.call().display());
                out.println("        " + TREE_LAST + report.skipReason());
                continue;
            }
            ResolutionResult result = report.result();
            String status = result.isSuccess() ? color(GREEN, "OK   ") : color(RED, "ERROR");
            out.println("  " + status + " " + report.call().display());
            printResult(out, result);
        }
        out.println();
    }

    private void printResult(PrintWriter out, ResolutionResult result) {
        if (result instanceof ResolutionResult.Failed f) {
            printErrors(out, List.of(f.error()));
            return;
        }
        boolean hasRemainder = !result.remainder().isEmpty();
        out.println("        " + (hasRemainder ? TREE_BRANCH : TREE_LAST) + result.describe());
        if (result instanceof ResolutionResult.Constructed c) {
            out.println("        " + (hasRemainder ? TREE_PIPE : "    ")
                + "with " + describeArguments(c.expansionSpan()));
        }
        if (hasRemainder) {
            out.println("        " + TREE_LAST + "remainder " + describeArguments(result.remainder()));
        }
    }

    private void printErrors(PrintWriter out, List<ResolutionError> errors) {
        for (int i = 0; i < errors.size(); i++) {
            ResolutionError error = errors.get(i);
            String prefix = i == errors.size() - 1 ? TREE_LAST : TREE_BRANCH;
            String label = error.isTypeCheckFailure() ? color(YELLOW, error.kind().name()) : color(RED, error.kind().name());
            out.println("        " + prefix + label + ": " + error.message());
            if (error.kind() == ErrorKind.AMBIGUOUS_INITIALIZER) {
                for (ConstructorCandidate candidate : error.candidates()) {
                    out.println("            candidate " + candidate.signature());
                }
            }
        }
    }

    private void printBreakdown(PrintWriter out, AnalysisReport report) {
        Map<ErrorKind, Long> byKind = report.errorsByKind();
        if (byKind.isEmpty()) {
            out.println(color(GREEN, "No errors."));
            return;
        }
        out.println(color(CYAN, "Errors by kind"));
        byKind.forEach((kind, count) -> out.printf("  %-40s %d%n", kind.displayName(), count));
    }

    private static String describeArguments(List<CallArgument> arguments) {
        return arguments.stream()
            .map(CallArgument::describe)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    private String color(String code, String text) {
        return useColors ? code + text + RESET : text;
    }
}
