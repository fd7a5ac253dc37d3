package io.expandcheck.validate;

import io.expandcheck.model.ErrorKind;
import io.expandcheck.model.ParameterDeclaration;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.Signature;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeRef;
import io.expandcheck.symbols.TypeIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Declaration-time legality checks for signatures with an expanded parameter.
 * Independent of any call site.
 * <p>
 * Every check runs and all violations are reported together, unless
 * {@code stopAtFirstViolation} is set.
 */
public class SignatureValidator {

    private final TypeIndex index;
    private final boolean stopAtFirstViolation;

    public SignatureValidator(TypeIndex index) {
        this(index, false);
    }

    public SignatureValidator(TypeIndex index, boolean stopAtFirstViolation) {
        this.index = index;
        this.stopAtFirstViolation = stopAtFirstViolation;
    }

    public List<ResolutionError> validate(Signature signature) {
        if (!signature.hasExpandedParameter()) {
            return List.of();
        }
        List<ParameterDeclaration> expanded = signature.expandedParameters();

        List<ResolutionError> errors = new ArrayList<>();
        for (ParameterDeclaration parameter : expanded) {
            checkPlacement(signature, parameter, errors);
        }
        checkUniqueness(signature, expanded, errors);
        checkNoOverloads(signature, errors);
        for (ParameterDeclaration parameter : expanded) {
            checkType(signature, parameter, errors);
            checkMutability(signature, parameter, errors);
        }
        checkDefaultAdjacency(signature, errors);

        if (stopAtFirstViolation && errors.size() > 1) {
            return List.of(errors.get(0));
        }
        return List.copyOf(errors);
    }

    private void checkPlacement(Signature signature, ParameterDeclaration parameter, List<ResolutionError> errors) {
        if (parameter.positionalIndex() != 0) {
            errors.add(error(ErrorKind.INVALID_EXPANDED_PLACEMENT, signature)
                .message("Expanded parameter '" + parameter.displayLabel() + "' must be the first parameter, found at position "
                    + parameter.positionalIndex())
                .parameterPosition(parameter.positionalIndex())
                .build());
        }
    }

    private void checkUniqueness(Signature signature, List<ParameterDeclaration> expanded, List<ResolutionError> errors) {
        if (expanded.size() > 1) {
            errors.add(error(ErrorKind.MULTIPLE_EXPANDED_PARAMETERS, signature)
                .message(expanded.size() + " parameters are marked expanded; at most one is allowed")
                .parameterPositions(expanded.stream().map(ParameterDeclaration::positionalIndex).toList())
                .build());
        }
    }

    private void checkNoOverloads(Signature signature, List<ResolutionError> errors) {
        if (signature.hasSiblingOverloads()) {
            errors.add(error(ErrorKind.OVERLOAD_CONFLICT_WITH_EXPANDED, signature)
                .message("A function with an expanded parameter cannot be overloaded")
                .parameterPositions(signature.expandedParameters().stream()
                    .map(ParameterDeclaration::positionalIndex)
                    .toList())
                .build());
        }
    }

    /**
     * Nominal-type and non-interface rules. A structural type, a type parameter
     * or an unknown name is not nominal; an optional wrapper is, as long as it
     * wraps a named type.
     */
    private void checkType(Signature signature, ParameterDeclaration parameter, List<ResolutionError> errors) {
        TypeRef type = parameter.declaredType();
        if (type instanceof TypeRef.OptionalOf o) {
            TypeRef wrapped = o.wrapped();
            while (wrapped instanceof TypeRef.OptionalOf inner) {
                wrapped = inner.wrapped();
            }
            if (!(wrapped instanceof TypeRef.Named)) {
                errors.add(nonNominal(signature, parameter,
                    "'" + type.display() + "' wraps a non-nominal type. " + describeStructural(wrapped)));
                return;
            }
        }
        Optional<TypeRef.Named> nominal = type.nominalType();
        if (nominal.isEmpty()) {
            errors.add(nonNominal(signature, parameter, describeStructural(type)));
            return;
        }

        Optional<TypeDeclaration> declaration = index.declarationOf(nominal.get());
        if (declaration.isEmpty()) {
            if (!(type instanceof TypeRef.OptionalOf)) {
                errors.add(nonNominal(signature, parameter, "'" + type.display() + "' does not resolve to a nominal type"));
            }
            return;
        }

        if (declaration.get().kind().isAbstract()) {
            errors.add(error(ErrorKind.ABSTRACT_TYPE_NOT_EXPANDABLE, signature)
                .message("'" + type.display() + "' is " + declaration.get().kind().name().toLowerCase()
                    + "; the concrete type to construct is unknown")
                .parameterPosition(parameter.positionalIndex())
                .build());
        }
    }

    private void checkMutability(Signature signature, ParameterDeclaration parameter, List<ResolutionError> errors) {
        if (parameter.isByReference()) {
            errors.add(error(ErrorKind.BY_REFERENCE_EXPANDED_CONFLICT, signature)
                .message("Expanded parameter '" + parameter.displayLabel() + "' cannot be inout")
                .parameterPosition(parameter.positionalIndex())
                .build());
        }
    }

    /**
     * A defaulted parameter right after the expanded one must be the last parameter.
     */
    private void checkDefaultAdjacency(Signature signature, List<ResolutionError> errors) {
        signature.parameterAt(1)
            .filter(ParameterDeclaration::hasDefaultValue)
            .filter(next -> !signature.isLast(next))
            .ifPresent(next -> errors.add(error(ErrorKind.DEFAULT_ARGUMENT_ADJACENCY_VIOLATION, signature)
                .message("Defaulted parameter '" + next.displayLabel()
                    + "' follows the expanded parameter; move it to the end of the parameter list")
                .parameterPosition(next.positionalIndex())
                .build()));
    }

    private ResolutionError nonNominal(Signature signature, ParameterDeclaration parameter, String message) {
        return error(ErrorKind.NON_NOMINAL_EXPANDED_TYPE, signature)
            .message(message)
            .parameterPosition(parameter.positionalIndex())
            .build();
    }

    private static ResolutionError.Builder error(ErrorKind kind, Signature signature) {
        return ResolutionError.builder(kind).subject(signature.name());
    }

    private static String describeStructural(TypeRef type) {
        if (type instanceof TypeRef.FunctionOf) {
            return "Function type '" + type.display() + "' cannot be expanded";
        } else if (type instanceof TypeRef.TupleOf) {
            return "Tuple type '" + type.display() + "' cannot be expanded";
        } else if (type instanceof TypeRef.TypeParameter) {
            return "Generic parameter '" + type.display() + "' cannot be expanded";
        }
        return "'" + type.display() + "' is not a nominal type";
    }
}
