package io.expandcheck.analysis;

import io.expandcheck.model.ErrorKind;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.ResolutionResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Complete analysis of one unit.
 *
 * @param unitName    Name of the analyzed unit
 * @param startTime   When the analysis started
 * @param duration    How long it took
 * @param signatures  Validation results, in declaration order
 * @param calls       Resolution results, in source order
 */
public record AnalysisReport(
    String unitName,
    Instant startTime,
    Duration duration,
    List<SignatureReport> signatures,
    List<CallReport> calls
) {
    public AnalysisReport {
        if (unitName == null || unitName.isBlank()) {
            throw new IllegalArgumentException("unitName cannot be null or blank");
        }
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
        calls = calls == null ? List.of() : List.copyOf(calls);
    }

    public List<ResolutionError> declarationErrors() {
        return signatures.stream()
            .flatMap(s -> s.errors().stream())
            .toList();
    }

    public List<ResolutionError> callErrors() {
        return calls.stream()
            .flatMap(c -> c.failure().stream())
            .map(ResolutionResult.Failed::error)
            .toList();
    }

    public Stream<ResolutionError> allErrors() {
        return Stream.concat(declarationErrors().stream(), callErrors().stream());
    }

    /**
     * Counts errors; type mismatches are forwarded type-check failures and may be left out.
     */
    public long errorCount(boolean includeTypeMismatches) {
        return allErrors()
            .filter(e -> includeTypeMismatches || !e.isTypeCheckFailure())
            .count();
    }

    public boolean hasErrors(boolean includeTypeMismatches) {
        return errorCount(includeTypeMismatches) > 0;
    }

    public long resolvedCount() {
        return calls.stream()
            .filter(c -> !c.isSkipped() && c.result().isSuccess())
            .count();
    }

    public long skippedCount() {
        return calls.stream().filter(CallReport::isSkipped).count();
    }

    /**
     * Returns error counts grouped by kind, in declaration order of {@link ErrorKind}.
     */
    public Map<ErrorKind, Long> errorsByKind() {
        return allErrors().collect(Collectors.groupingBy(
            ResolutionError::kind,
            TreeMap::new,
            Collectors.counting()
        ));
    }
}
