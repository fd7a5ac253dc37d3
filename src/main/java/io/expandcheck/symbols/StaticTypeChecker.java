package io.expandcheck.symbols;

import io.expandcheck.model.Expression;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeRef;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Type-check oracle over already-inferred static types.
 * <p>
 * An expression checks against an expected type when its static type is the
 * same type, a subtype of it (walking the supertype chain), or checks against
 * the wrapped type of an expected optional. An untyped {@code nil} literal
 * checks against any optional. Other untyped expressions never check.
 */
public class StaticTypeChecker implements TypeCheckOracle {

    private final TypeIndex index;

    public StaticTypeChecker(TypeIndex index) {
        this.index = index;
    }

    @Override
    public boolean typeChecks(Expression expression, TypeRef expectedType) {
        Optional<TypeRef> staticType = expression.findStaticType();
        if (staticType.isEmpty()) {
            return expression.isNilLiteral() && expectedType instanceof TypeRef.OptionalOf;
        }
        return isAssignable(staticType.get(), expectedType);
    }

    /**
     * Check if a value of type {@code actual} may be passed where {@code expected} is required.
     */
    public boolean isAssignable(TypeRef actual, TypeRef expected) {
        if (actual.equals(expected)) {
            return true;
        }
        if (expected instanceof TypeRef.OptionalOf o && !(actual instanceof TypeRef.OptionalOf)) {
            return isAssignable(actual, o.wrapped());
        }
        if (actual instanceof TypeRef.Named a && expected instanceof TypeRef.Named e) {
            return isSubtype(a, e);
        }
        return false;
    }

    private boolean isSubtype(TypeRef.Named actual, TypeRef.Named expected) {
        Set<TypeRef.Named> visited = new HashSet<>();
        TypeRef.Named current = actual;
        while (current != null && visited.add(current)) {
            if (current.equals(expected)) {
                return true;
            }
            current = index.declarationOf(current)
                .flatMap(TypeDeclaration::findSupertype)
                .orElse(null);
        }
        return false;
    }
}
