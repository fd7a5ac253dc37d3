package io.expandcheck.model;

import java.util.Optional;

/**
 * Value expression supplied by the parser. Opaque to this engine except for
 * its static type, which the type-check oracle may consult.
 *
 * @param source      Source text of the expression
 * @param staticType  Type already inferred for the expression (null if not yet known)
 */
public record Expression(
    String source,
    TypeRef staticType
) {
    public Expression {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
    }

    public static Expression of(String source, TypeRef staticType) {
        return new Expression(source, staticType);
    }

    public static Expression untyped(String source) {
        return new Expression(source, null);
    }

    public Optional<TypeRef> findStaticType() {
        return Optional.ofNullable(staticType);
    }

    public boolean isNilLiteral() {
        return "nil".equals(source.trim());
    }
}
