package io.expandcheck.model;

/**
 * One argument at a call site, in the order written.
 *
 * @param label                  Argument label (null when unlabeled)
 * @param value                  Argument expression
 * @param isTrailingClosureForm  Whether the argument is written as a trailing closure
 */
public record CallArgument(
    String label,
    Expression value,
    boolean isTrailingClosureForm
) {
    public CallArgument {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    public static CallArgument labeled(String label, Expression value) {
        return new CallArgument(label, value, false);
    }

    public static CallArgument unlabeled(Expression value) {
        return new CallArgument(null, value, false);
    }

    public static CallArgument trailingClosure(Expression value) {
        return new CallArgument(null, value, true);
    }

    public String describe() {
        if (isTrailingClosureForm) {
            return "{ " + value.source() + " }";
        }
        return label == null ? value.source() : label + ": " + value.source();
    }
}
