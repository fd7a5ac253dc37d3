package io.expandcheck.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A call expression as handed over by the parser.
 *
 * @param callee     Name of the called function
 * @param arguments  Arguments in source order
 * @param callSite   Where the call is written
 */
public record CallExpression(
    String callee,
    List<CallArgument> arguments,
    SiteContext callSite
) {
    public CallExpression {
        if (callee == null || callee.isBlank()) {
            throw new IllegalArgumentException("callee cannot be null or blank");
        }
        arguments = List.copyOf(arguments);
        if (callSite == null) {
            throw new IllegalArgumentException("callSite cannot be null");
        }
    }

    public String display() {
        return arguments.stream()
            .map(CallArgument::describe)
            .collect(Collectors.joining(", ", callee + "(", ")"));
    }
}
