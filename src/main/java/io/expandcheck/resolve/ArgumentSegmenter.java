package io.expandcheck.resolve;

import io.expandcheck.model.CallArgument;
import io.expandcheck.model.ErrorKind;
import io.expandcheck.model.Labels;
import io.expandcheck.model.ParameterDeclaration;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Splits call arguments into the run that builds the expanded parameter and
 * the remainder matched against the rest of the signature.
 * <p>
 * The boundary is the label of the parameter right after the expanded one;
 * scanning stops at the first argument carrying that label. Without a
 * following parameter every argument belongs to the span.
 * <p>
 * An empty span without a default value is still handed to the resolver, so a
 * zero-argument constructor can build the value.
 */
public class ArgumentSegmenter {

    private static final Logger log = LoggerFactory.getLogger(ArgumentSegmenter.class);

    public Segmentation segment(Signature signature, List<CallArgument> arguments) {
        Optional<ParameterDeclaration> found = signature.expandedParameter();
        if (found.isEmpty()) {
            return new Segmentation.NotApplicable();
        }
        ParameterDeclaration expanded = found.get();

        // Own label first: the caller passes a ready-made value
        if (!arguments.isEmpty() && Labels.matches(expanded.label(), arguments.get(0).label())) {
            log.debug("{}: first argument '{}' supplies the value directly",
                signature.name(), Labels.display(arguments.get(0).label()));
            return new Segmentation.Direct(arguments.get(0), arguments.subList(1, arguments.size()));
        }

        int end = boundaryIndex(signature, expanded, arguments);
        List<CallArgument> span = arguments.subList(0, end);
        List<CallArgument> remainder = arguments.subList(end, arguments.size());

        for (int i = 0; i < span.size(); i++) {
            if (span.get(i).isTrailingClosureForm()) {
                return new Segmentation.Rejected(ResolutionError.builder(ErrorKind.TRAILING_CLOSURE_NOT_ALLOWED)
                    .subject(signature.name())
                    .message("Trailing closure cannot be part of the arguments forwarded to '"
                        + expanded.displayLabel() + "'")
                    .parameterPosition(expanded.positionalIndex())
                    .argumentPosition(i)
                    .build());
            }
        }

        if (span.isEmpty() && expanded.hasDefaultValue()) {
            log.debug("{}: empty expansion span, using default of '{}'", signature.name(), expanded.displayLabel());
            return new Segmentation.Defaulted(remainder);
        }

        log.debug("{}: expansion span of {} argument(s), remainder of {}",
            signature.name(), span.size(), remainder.size());
        return new Segmentation.Span(span, remainder);
    }

    /**
     * Index of the first argument that belongs to the rest of the signature.
     */
    private int boundaryIndex(Signature signature, ParameterDeclaration expanded, List<CallArgument> arguments) {
        Optional<ParameterDeclaration> boundary = signature.parameterAt(expanded.positionalIndex() + 1);
        if (boundary.isEmpty()) {
            return arguments.size();
        }
        String boundaryLabel = boundary.get().label();
        for (int i = 0; i < arguments.size(); i++) {
            if (Labels.matches(boundaryLabel, arguments.get(i).label())) {
                return i;
            }
        }
        return arguments.size();
    }
}
