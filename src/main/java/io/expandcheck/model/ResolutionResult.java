package io.expandcheck.model;

import java.util.List;

/**
 * Outcome of resolving one call against a signature with an expanded parameter.
 * The host substitutes the expanded parameter's value and then matches
 * {@link #remainder()} against the rest of the signature as usual.
 */
public sealed interface ResolutionResult {

    /**
     * The signature has no expanded parameter; every argument is left to ordinary matching.
     */
    record NotApplicable(List<CallArgument> remainder) implements ResolutionResult {
        public NotApplicable {
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * The first argument supplies the expanded parameter's value unexpanded.
     */
    record Direct(CallArgument argument, List<CallArgument> remainder) implements ResolutionResult {
        public Direct {
            if (argument == null) {
                throw new IllegalArgumentException("argument cannot be null");
            }
            remainder = List.copyOf(remainder);
        }

        public Expression value() {
            return argument.value();
        }
    }

    /**
     * No argument belongs to the expanded parameter and its default value is used.
     */
    record Defaulted(List<CallArgument> remainder) implements ResolutionResult {
        public Defaulted {
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * An implicit constructor call built from the expansion span.
     */
    record Constructed(
        ConstructorCandidate candidate,
        List<CallArgument> expansionSpan,
        List<CallArgument> remainder
    ) implements ResolutionResult {
        public Constructed {
            if (candidate == null) {
                throw new IllegalArgumentException("candidate cannot be null");
            }
            expansionSpan = List.copyOf(expansionSpan);
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * Resolution failed with a static error.
     */
    record Failed(ResolutionError error) implements ResolutionResult {
        public Failed {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }

        @Override
        public List<CallArgument> remainder() {
            return List.of();
        }
    }

    /**
     * Arguments left for ordinary argument-parameter matching.
     */
    List<CallArgument> remainder();

    default boolean isSuccess() {
        return !(this instanceof Failed);
    }

    /**
     * Get a short human-readable description of this result.
     */
    default String describe() {
        if (this instanceof NotApplicable) {
            return "not applicable (no expanded parameter)";
        } else if (this instanceof Direct d) {
            return "direct " + d.argument().describe();
        } else if (this instanceof Defaulted) {
            return "default value";
        } else if (this instanceof Constructed c) {
            return "constructed via " + c.candidate().signature();
        } else if (this instanceof Failed f) {
            return f.error().describe();
        }
        throw new IllegalStateException("Unknown ResolutionResult type: " + this.getClass());
    }
}
