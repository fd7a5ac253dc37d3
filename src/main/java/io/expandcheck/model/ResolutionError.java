package io.expandcheck.model;

import java.util.List;

/**
 * A static error found while validating a signature or resolving a call.
 * Carries positions and, for ambiguity, the competing candidates so that the
 * host can render a precise diagnostic.
 *
 * @param kind                Error discriminant
 * @param subject             Callable name (signature or callee)
 * @param message             Human-readable summary
 * @param parameterPositions  Offending parameter positions
 * @param argumentPositions   Offending call argument positions
 * @param candidates          Constructors involved (competing or rejected)
 */
public record ResolutionError(
    ErrorKind kind,
    String subject,
    String message,
    List<Integer> parameterPositions,
    List<Integer> argumentPositions,
    List<ConstructorCandidate> candidates
) {
    public ResolutionError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (message == null) {
            message = kind.displayName();
        }
        parameterPositions = parameterPositions == null ? List.of() : List.copyOf(parameterPositions);
        argumentPositions = argumentPositions == null ? List.of() : List.copyOf(argumentPositions);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static Builder builder(ErrorKind kind) {
        return new Builder().kind(kind);
    }

    /**
     * Returns true if this error belongs to the host's ordinary type-checking channel.
     */
    public boolean isTypeCheckFailure() {
        return kind == ErrorKind.ARGUMENT_TYPE_MISMATCH;
    }

    public String describe() {
        return "[" + kind.name() + "] " + subject + ": " + message;
    }

    public static class Builder {
        private ErrorKind kind;
        private String subject;
        private String message;
        private List<Integer> parameterPositions = List.of();
        private List<Integer> argumentPositions = List.of();
        private List<ConstructorCandidate> candidates = List.of();

        public Builder kind(ErrorKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder parameterPositions(List<Integer> positions) {
            this.parameterPositions = positions;
            return this;
        }

        public Builder parameterPosition(int position) {
            this.parameterPositions = List.of(position);
            return this;
        }

        public Builder argumentPositions(List<Integer> positions) {
            this.argumentPositions = positions;
            return this;
        }

        public Builder argumentPosition(int position) {
            this.argumentPositions = List.of(position);
            return this;
        }

        public Builder candidates(List<ConstructorCandidate> candidates) {
            this.candidates = candidates;
            return this;
        }

        public ResolutionError build() {
            return new ResolutionError(kind, subject, message, parameterPositions, argumentPositions, candidates);
        }
    }
}
