package io.expandcheck.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.expandcheck.Fixtures;
import io.expandcheck.analysis.AnalysisReport;
import io.expandcheck.analysis.CallReport;
import io.expandcheck.model.CallArgument;
import io.expandcheck.model.CallExpression;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.Expression;
import io.expandcheck.model.ResolutionResult;
import io.expandcheck.model.Signature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    @TempDir
    Path tempDir;

    private AnalysisReport report;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() throws IOException {
        report = ReportFixtures.analyzeResource("geometry.yaml");
        mapper = new ObjectMapper();
    }

    @Test
    void write_summaryAndMetadata() throws IOException {
        JsonNode root = mapper.readTree(new JsonReporter().toString(report));

        assertThat(root.path("metadata").path("unit").asText()).isEqualTo("geometry.yaml");
        assertThat(root.path("metadata").path("analyzedAt").isTextual()).isTrue();

        JsonNode summary = root.path("summary");
        assertThat(summary.path("functions").asInt()).isEqualTo(4);
        assertThat(summary.path("calls").asInt()).isEqualTo(6);
        assertThat(summary.path("resolved").asInt()).isEqualTo(2);
        assertThat(summary.path("skipped").asInt()).isEqualTo(3);
        assertThat(summary.path("errors").asInt()).isEqualTo(2);
        assertThat(summary.path("errorsByKind").path("ABSTRACT_TYPE_NOT_EXPANDABLE").asInt()).isEqualTo(1);
    }

    @Test
    void write_declarationsCarryErrors() throws IOException {
        JsonNode declarations = mapper.readTree(new JsonReporter().toString(report)).path("declarations");

        assertThat(declarations.size()).isEqualTo(4);
        assertThat(declarations.get(0).path("errors").size()).isZero();
        JsonNode error = declarations.get(1).path("errors").get(0);
        assertThat(error.path("kind").asText()).isEqualTo("ABSTRACT_TYPE_NOT_EXPANDABLE");
        assertThat(error.path("parameterPositions").get(0).asInt()).isZero();
        assertThat(error.has("typeCheckFailure")).isFalse();
    }

    @Test
    void write_callOutcomes() throws IOException {
        JsonNode calls = mapper.readTree(new JsonReporter().toString(report)).path("calls");

        JsonNode constructed = calls.get(0);
        assertThat(constructed.path("outcome").asText()).isEqualTo("CONSTRUCTED");
        assertThat(constructed.path("constructor").asText()).isEqualTo("Point(x: Int, y: Int)");
        assertThat(constructed.path("expansionSpan").get(1).asText()).isEqualTo("y: 2");
        assertThat(constructed.path("remainder").get(0).asText()).isEqualTo("color: red");
        assertThat(constructed.has("error")).isFalse();

        assertThat(calls.get(1).path("outcome").asText()).isEqualTo("DIRECT");

        JsonNode failed = calls.get(2);
        assertThat(failed.path("outcome").asText()).isEqualTo("FAILED");
        assertThat(failed.path("error").path("kind").asText()).isEqualTo("NO_MATCHING_INITIALIZER");
        assertThat(failed.path("error").path("candidates").size()).isEqualTo(2);

        JsonNode skipped = calls.get(5);
        assertThat(skipped.path("outcome").asText()).isEqualTo("SKIPPED");
        assertThat(skipped.path("skipReason").asText()).contains("missing");
    }

    @Test
    void write_keepsTrailingClosureForm() throws IOException {
        CallArgument closure = CallArgument.trailingClosure(Expression.untyped("print(1)"));
        CallExpression call = Fixtures.call("g", Fixtures.arg("a", "1", Fixtures.INT), closure);
        Signature g = Fixtures.signature("g", Fixtures.expanded("x", Fixtures.T), Fixtures.param(null, 1, Fixtures.INT));
        ConstructorCandidate candidate = Fixtures.ctor(Fixtures.T).parameter("a", Fixtures.INT).build();
        ResolutionResult result = new ResolutionResult.Constructed(candidate, List.of(call.arguments().get(0)), List.of(closure));
        AnalysisReport single = new AnalysisReport("closure.yaml", Instant.now(), Duration.ZERO,
            List.of(), List.of(CallReport.resolved(call, g, result)));

        JsonNode node = mapper.readTree(new JsonReporter().toString(single)).path("calls").get(0);

        assertThat(node.path("call").asText()).isEqualTo("g(a: 1, { print(1) })");
        assertThat(node.path("expansionSpan").get(0).asText()).isEqualTo("a: 1");
        assertThat(node.path("remainder").get(0).asText()).isEqualTo("{ print(1) }");
    }

    @Test
    void write_compactOutputIsSingleLine() {
        String json = new JsonReporter(false).toString(report);

        assertThat(json).doesNotContain("\n");
    }

    @Test
    void write_toFile() throws IOException {
        Path out = tempDir.resolve("report.json");

        new JsonReporter().write(report, out);

        assertThat(mapper.readTree(Files.readString(out)).path("summary").path("calls").asInt()).isEqualTo(6);
    }
}
