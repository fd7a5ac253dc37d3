package io.expandcheck.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parameter list of a declared callable.
 * <p>
 * The expanded-parameter invariants (one at most, at position 0, no sibling
 * overloads) are checked by the signature validator, never assumed here.
 *
 * @param name                 Declared callable name
 * @param parameters           Parameters in declaration order
 * @param hasSiblingOverloads  Whether other callables share this name in the same scope
 * @param declarationSite      Where the callable is declared
 */
public record Signature(
    String name,
    List<ParameterDeclaration> parameters,
    boolean hasSiblingOverloads,
    SiteContext declarationSite
) {
    public Signature {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        parameters = List.copyOf(parameters);
        if (declarationSite == null) {
            throw new IllegalArgumentException("declarationSite cannot be null");
        }
    }

    /**
     * Returns the first parameter marked expanded, if any.
     */
    public Optional<ParameterDeclaration> expandedParameter() {
        return parameters.stream()
            .filter(ParameterDeclaration::isExpanded)
            .findFirst();
    }

    public List<ParameterDeclaration> expandedParameters() {
        return parameters.stream()
            .filter(ParameterDeclaration::isExpanded)
            .toList();
    }

    public boolean hasExpandedParameter() {
        return parameters.stream().anyMatch(ParameterDeclaration::isExpanded);
    }

    /**
     * Get the parameter declared at the given position.
     */
    public Optional<ParameterDeclaration> parameterAt(int positionalIndex) {
        return parameters.stream()
            .filter(p -> p.positionalIndex() == positionalIndex)
            .findFirst();
    }

    /**
     * Check if the parameter at the given position is the last one.
     */
    public boolean isLast(ParameterDeclaration parameter) {
        return parameters.stream().noneMatch(p -> p.positionalIndex() > parameter.positionalIndex());
    }

    public String display() {
        return parameters.stream()
            .map(ParameterDeclaration::describe)
            .collect(Collectors.joining(", ", name + "(", ")"));
    }
}
