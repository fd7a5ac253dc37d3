package io.expandcheck.analysis;

import io.expandcheck.EngineConfig;
import io.expandcheck.ExpansionEngine;
import io.expandcheck.model.CallExpression;
import io.expandcheck.model.ResolutionResult;
import io.expandcheck.model.Signature;
import io.expandcheck.unit.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Runs the engine over a whole unit: validates every declared function, then
 * resolves every call. Calls are independent and resolved on
 * {@link EngineConfig#parallelism()} worker threads; results keep source order.
 */
public class UnitAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(UnitAnalyzer.class);

    private final ExpansionEngine engine;
    private final EngineConfig config;

    public UnitAnalyzer(ExpansionEngine engine, EngineConfig config) {
        this.engine = engine;
        this.config = config;
    }

    public AnalysisReport analyze(CompilationUnit unit) {
        Instant start = Instant.now();

        List<SignatureReport> signatures = unit.signatures().stream()
            .map(s -> new SignatureReport(s, engine.validateSignature(s)))
            .toList();
        Set<Signature> invalid = signatures.stream()
            .filter(r -> !r.isValid())
            .map(SignatureReport::signature)
            .collect(Collectors.toSet());

        log.debug("Validated {} signature(s) in {}, {} invalid", signatures.size(), unit.name(), invalid.size());

        List<CallReport> calls = resolveCalls(unit, invalid);

        return new AnalysisReport(unit.name(), start, Duration.between(start, Instant.now()), signatures, calls);
    }

    private List<CallReport> resolveCalls(CompilationUnit unit, Set<Signature> invalid) {
        if (config.parallelism() == 1 || unit.calls().size() < 2) {
            return unit.calls().stream()
                .map(call -> resolveCall(unit, call, invalid))
                .toList();
        }

        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism());
        try {
            List<Callable<CallReport>> tasks = new ArrayList<>();
            for (CallExpression call : unit.calls()) {
                tasks.add(() -> resolveCall(unit, call, invalid));
            }
            List<CallReport> reports = new ArrayList<>();
            for (Future<CallReport> future : pool.invokeAll(tasks)) {
                reports.add(future.get());
            }
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving calls in " + unit.name(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Call resolution failed in " + unit.name(), e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    CallReport resolveCall(CompilationUnit unit, CallExpression call, Set<Signature> invalid) {
        List<Signature> candidates = unit.signaturesNamed(call.callee());
        if (candidates.isEmpty()) {
            log.warn("Skipping call to unknown function '{}' at {}", call.callee(), call.callSite().location());
            return CallReport.skipped(call, "no function named '" + call.callee() + "'");
        }
        if (candidates.size() > 1) {
            log.warn("Skipping call to overloaded function '{}' at {}", call.callee(), call.callSite().location());
            return CallReport.skipped(call, "'" + call.callee() + "' is overloaded; ordinary overload resolution applies");
        }

        Signature signature = candidates.get(0);
        if (invalid.contains(signature)) {
            return CallReport.skipped(call, "declaration of '" + call.callee() + "' is invalid");
        }

        ResolutionResult result = engine.resolveCall(signature, call);
        log.debug("{} -> {}", call.display(), result.describe());
        return CallReport.resolved(call, signature, result);
    }
}
