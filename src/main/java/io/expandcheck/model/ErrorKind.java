package io.expandcheck.model;

/**
 * Discriminant of a resolution or validation error.
 */
public enum ErrorKind {
    INVALID_EXPANDED_PLACEMENT("Invalid expanded placement"),
    MULTIPLE_EXPANDED_PARAMETERS("Multiple expanded parameters"),
    OVERLOAD_CONFLICT_WITH_EXPANDED("Overload conflict with expanded"),
    NON_NOMINAL_EXPANDED_TYPE("Non-nominal expanded type"),
    ABSTRACT_TYPE_NOT_EXPANDABLE("Abstract type not expandable"),
    BY_REFERENCE_EXPANDED_CONFLICT("By-reference expanded conflict"),
    DEFAULT_ARGUMENT_ADJACENCY_VIOLATION("Default argument adjacency violation"),
    NO_MATCHING_INITIALIZER("No matching initializer"),
    AMBIGUOUS_INITIALIZER("Ambiguous initializer"),
    INACCESSIBLE_INITIALIZER("Inaccessible initializer"),
    TRAILING_CLOSURE_NOT_ALLOWED("Trailing closure not allowed"),

    /**
     * Not a resolution failure: the single label-matching constructor was found
     * but an argument does not type-check. Forwarded to the host's type-checking channel.
     */
    ARGUMENT_TYPE_MISMATCH("Argument type mismatch");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
