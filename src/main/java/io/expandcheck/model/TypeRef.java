package io.expandcheck.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reference to a type as written in a declaration.
 * Value objects: two references to the same type are equal.
 */
public sealed interface TypeRef {

    /**
     * Name of the nominal type that backs the optional wrapper {@code T?}.
     */
    String OPTIONAL_WRAPPER = "Optional";

    /**
     * A named type (struct, class, interface...). Whether it really is nominal
     * is decided by the type index.
     */
    record Named(String name) implements TypeRef {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
        }
    }

    /**
     * Optional wrapper {@code T?}.
     */
    record OptionalOf(TypeRef wrapped) implements TypeRef {
        public OptionalOf {
            if (wrapped == null) {
                throw new IllegalArgumentException("wrapped cannot be null");
            }
        }
    }

    /**
     * Structural tuple type {@code (A, B)}.
     */
    record TupleOf(List<TypeRef> elements) implements TypeRef {
        public TupleOf {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Structural function type {@code (A, B) -> R}.
     */
    record FunctionOf(List<TypeRef> parameters, TypeRef result) implements TypeRef {
        public FunctionOf {
            parameters = List.copyOf(parameters);
            if (result == null) {
                throw new IllegalArgumentException("result cannot be null");
            }
        }
    }

    /**
     * Generic type parameter of the enclosing declaration.
     */
    record TypeParameter(String name) implements TypeRef {
        public TypeParameter {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
        }
    }

    static TypeRef named(String name) {
        return new Named(name);
    }

    static TypeRef optional(TypeRef wrapped) {
        return new OptionalOf(wrapped);
    }

    /**
     * Returns the nominal type whose constructors build a value of this type.
     * For {@code T?} that is the wrapper, not {@code T}.
     */
    default Optional<Named> nominalType() {
        if (this instanceof Named n) {
            return Optional.of(n);
        } else if (this instanceof OptionalOf) {
            return Optional.of(new Named(OPTIONAL_WRAPPER));
        }
        return Optional.empty();
    }

    /**
     * Source-like rendering, e.g. {@code (Int, Bool) -> Point?}.
     */
    default String display() {
        if (this instanceof Named n) {
            return n.name();
        } else if (this instanceof OptionalOf o) {
            String inner = o.wrapped().display();
            return o.wrapped() instanceof FunctionOf ? "(" + inner + ")?" : inner + "?";
        } else if (this instanceof TupleOf t) {
            return t.elements().stream().map(TypeRef::display).collect(Collectors.joining(", ", "(", ")"));
        } else if (this instanceof FunctionOf f) {
            return f.parameters().stream().map(TypeRef::display).collect(Collectors.joining(", ", "(", ")"))
                + " -> " + f.result().display();
        } else if (this instanceof TypeParameter p) {
            return p.name();
        }
        throw new IllegalStateException("Unknown TypeRef type: " + this.getClass());
    }
}
