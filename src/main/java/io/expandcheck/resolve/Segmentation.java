package io.expandcheck.resolve;

import io.expandcheck.model.CallArgument;
import io.expandcheck.model.ResolutionError;

import java.util.List;

/**
 * How a call's arguments split between the expanded parameter and the rest of the signature.
 */
public sealed interface Segmentation {

    /**
     * The signature has no expanded parameter.
     */
    record NotApplicable() implements Segmentation {}

    /**
     * The first argument carries the expanded parameter's own label and supplies its value directly.
     */
    record Direct(CallArgument argument, List<CallArgument> remainder) implements Segmentation {
        public Direct {
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * The expansion span is empty and the expanded parameter's default value applies.
     */
    record Defaulted(List<CallArgument> remainder) implements Segmentation {
        public Defaulted {
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * Arguments to forward to a constructor (possibly none), followed by the remainder.
     * The span always starts at argument position 0.
     */
    record Span(List<CallArgument> expansionSpan, List<CallArgument> remainder) implements Segmentation {
        public Span {
            expansionSpan = List.copyOf(expansionSpan);
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * Segmentation itself failed.
     */
    record Rejected(ResolutionError error) implements Segmentation {}
}
