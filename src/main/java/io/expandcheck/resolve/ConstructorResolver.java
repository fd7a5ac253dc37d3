package io.expandcheck.resolve;

import io.expandcheck.model.CallArgument;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.ErrorKind;
import io.expandcheck.model.Labels;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.ResolutionResult;
import io.expandcheck.model.SiteContext;
import io.expandcheck.symbols.TypeCheckOracle;
import io.expandcheck.symbols.VisibilityOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Picks the constructor an expansion span is forwarded to.
 * <p>
 * Labels are matched first since they are known before type inference; types
 * only break ties between candidates with the same label shape. Ties that
 * types cannot break are reported as ambiguous, never guessed.
 */
public class ConstructorResolver {

    private static final Logger log = LoggerFactory.getLogger(ConstructorResolver.class);

    private final TypeCheckOracle typeChecker;
    private final VisibilityOracle visibility;

    public ConstructorResolver(TypeCheckOracle typeChecker, VisibilityOracle visibility) {
        this.typeChecker = typeChecker;
        this.visibility = visibility;
    }

    /**
     * Resolves the span against a catalog already locked to the declaration site.
     *
     * @param subject    Callee name, used in errors
     * @param span       Arguments forwarded to the constructor (argument positions start at 0)
     * @param remainder  Arguments left for ordinary matching
     * @param catalog    Constructor catalog of the expanded parameter's type
     * @param callSite   Where the call is written
     * @return {@code Constructed} or {@code Failed}
     */
    public ResolutionResult resolve(String subject,
                                    List<CallArgument> span,
                                    List<CallArgument> remainder,
                                    List<ConstructorCandidate> catalog,
                                    SiteContext callSite) {
        List<String> labels = span.stream().map(CallArgument::label).toList();

        List<ConstructorCandidate> shaped = catalog.stream()
            .filter(c -> hasLabelShape(c, labels))
            .toList();

        if (shaped.isEmpty()) {
            return fail(ResolutionError.builder(ErrorKind.NO_MATCHING_INITIALIZER)
                .subject(subject)
                .message("No initializer matches labels " + describeLabels(labels))
                .argumentPositions(positions(span.size()))
                .candidates(catalog)
                .build());
        }

        ConstructorCandidate chosen;
        if (shaped.size() == 1) {
            ConstructorCandidate only = shaped.get(0);
            List<Integer> mismatches = mismatchedArguments(only, span);
            if (!mismatches.isEmpty()) {
                return fail(ResolutionError.builder(ErrorKind.ARGUMENT_TYPE_MISMATCH)
                    .subject(subject)
                    .message("Arguments do not type-check against " + only.signature())
                    .argumentPositions(mismatches)
                    .candidates(List.of(only))
                    .build());
            }
            chosen = only;
        } else {
            List<ConstructorCandidate> typed = shaped.stream()
                .filter(c -> mismatchedArguments(c, span).isEmpty())
                .toList();
            if (typed.isEmpty()) {
                return fail(ResolutionError.builder(ErrorKind.NO_MATCHING_INITIALIZER)
                    .subject(subject)
                    .message("None of " + shaped.size() + " initializers with labels "
                        + describeLabels(labels) + " accepts the argument types")
                    .argumentPositions(positions(span.size()))
                    .candidates(shaped)
                    .build());
            }
            if (typed.size() > 1) {
                return fail(ResolutionError.builder(ErrorKind.AMBIGUOUS_INITIALIZER)
                    .subject(subject)
                    .message("Ambiguous use of " + typed.stream()
                        .map(ConstructorCandidate::signature)
                        .collect(Collectors.joining(", ")))
                    .argumentPositions(positions(span.size()))
                    .candidates(typed)
                    .build());
            }
            chosen = typed.get(0);
        }

        // Catalog membership proves declaration-site visibility; the call site may still be narrower
        if (!visibility.isVisible(chosen, callSite)) {
            return fail(ResolutionError.builder(ErrorKind.INACCESSIBLE_INITIALIZER)
                .subject(subject)
                .message(chosen.signature() + " is " + chosen.visibility().name().toLowerCase()
                    + " and not accessible from " + callSite.location())
                .argumentPositions(positions(span.size()))
                .candidates(List.of(chosen))
                .build());
        }

        log.debug("{}: resolved to {}", subject, chosen.signature());
        return new ResolutionResult.Constructed(chosen, span, remainder);
    }

    private boolean hasLabelShape(ConstructorCandidate candidate, List<String> labels) {
        if (candidate.arity() != labels.size()) {
            return false;
        }
        for (int i = 0; i < labels.size(); i++) {
            if (!Labels.matches(candidate.parameterLabels().get(i), labels.get(i))) {
                return false;
            }
        }
        return true;
    }

    private List<Integer> mismatchedArguments(ConstructorCandidate candidate, List<CallArgument> span) {
        List<Integer> mismatches = new ArrayList<>();
        for (int i = 0; i < span.size(); i++) {
            if (!typeChecker.typeChecks(span.get(i).value(), candidate.parameterTypes().get(i))) {
                mismatches.add(i);
            }
        }
        return mismatches;
    }

    private ResolutionResult fail(ResolutionError error) {
        log.debug("{}", error.describe());
        return new ResolutionResult.Failed(error);
    }

    private static List<Integer> positions(int count) {
        return IntStream.range(0, count).boxed().toList();
    }

    private static String describeLabels(List<String> labels) {
        return labels.stream()
            .map(l -> Labels.display(l) + ":")
            .collect(Collectors.joining("", "(", ")"));
    }
}
