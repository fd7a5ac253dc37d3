package io.expandcheck.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.expandcheck.analysis.AnalysisReport;
import io.expandcheck.analysis.CallReport;
import io.expandcheck.analysis.SignatureReport;
import io.expandcheck.model.CallArgument;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.ResolutionResult;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    private JsonReport toJsonReport(AnalysisReport report) {
        return new JsonReport(
            new JsonReport.Metadata(
                report.unitName(),
                report.startTime(),
                report.duration().toMillis()
            ),
            new JsonReport.Summary(
                report.signatures().size(),
                report.calls().size(),
                report.resolvedCount(),
                report.skippedCount(),
                report.errorCount(true),
                report.errorsByKind().entrySet().stream()
                    .collect(Collectors.toMap(
                        e -> e.getKey().name(),
                        Map.Entry::getValue,
                        (a, b) -> a,
                        LinkedHashMap::new))
            ),
            report.signatures().stream().map(this::toJsonSignature).toList(),
            report.calls().stream().map(this::toJsonCall).toList()
        );
    }

    private JsonReport.Declaration toJsonSignature(SignatureReport report) {
        return new JsonReport.Declaration(
            report.signature().name(),
            report.signature().display(),
            report.signature().declarationSite().location(),
            report.errors().stream().map(this::toJsonError).toList()
        );
    }

    private JsonReport.Call toJsonCall(CallReport report) {
        if (report.isSkipped()) {
            return new JsonReport.Call(report.call().display(), report.call().callSite().location(),
                "SKIPPED", report.skipReason(), null, null, null, null);
        }
        ResolutionResult result = report.result();
        String outcome;
        String constructor = null;
        List<String> span = null;
        JsonReport.Error error = null;
        if (result instanceof ResolutionResult.Constructed c) {
            outcome = "CONSTRUCTED";
            constructor = c.candidate().signature();
            span = describe(c.expansionSpan());
        } else if (result instanceof ResolutionResult.Direct) {
            outcome = "DIRECT";
        } else if (result instanceof ResolutionResult.Defaulted) {
            outcome = "DEFAULTED";
        } else if (result instanceof ResolutionResult.NotApplicable) {
            outcome = "NOT_APPLICABLE";
        } else if (result instanceof ResolutionResult.Failed f) {
            outcome = "FAILED";
            error = toJsonError(f.error());
        } else {
            throw new IllegalStateException("Unknown ResolutionResult type: " + result.getClass());
        }
        return new JsonReport.Call(report.call().display(), report.call().callSite().location(),
            outcome, null, constructor, span,
            result.remainder().isEmpty() ? null : describe(result.remainder()), error);
    }

    private JsonReport.Error toJsonError(ResolutionError error) {
        return new JsonReport.Error(
            error.kind().name(),
            error.message(),
            error.parameterPositions().isEmpty() ? null : error.parameterPositions(),
            error.argumentPositions().isEmpty() ? null : error.argumentPositions(),
            error.candidates().isEmpty() ? null : error.candidates().stream()
                .map(ConstructorCandidate::signature)
                .toList(),
            error.isTypeCheckFailure() ? Boolean.TRUE : null
        );
    }

    private static List<String> describe(List<CallArgument> arguments) {
        return arguments.stream()
            .map(CallArgument::describe)
            .toList();
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
        Metadata metadata,
        Summary summary,
        List<Declaration> declarations,
        List<Call> calls
    ) {
        public record Metadata(
            String unit,
            Instant analyzedAt,
            long durationMs
        ) {}

        public record Summary(
            int functions,
            int calls,
            long resolved,
            long skipped,
            long errors,
            Map<String, Long> errorsByKind
        ) {}

        public record Declaration(
            String name,
            String signature,
            String site,
            List<Error> errors
        ) {}

        public record Call(
            String call,
            String site,
            String outcome,
            String skipReason,
            String constructor,
            List<String> expansionSpan,
            List<String> remainder,
            Error error
        ) {}

        public record Error(
            String kind,
            String message,
            List<Integer> parameterPositions,
            List<Integer> argumentPositions,
            List<String> candidates,
            Boolean typeCheckFailure
        ) {}
    }
}
