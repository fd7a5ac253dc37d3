package io.expandcheck.symbols;

import io.expandcheck.model.Expression;
import io.expandcheck.model.TypeRef;

/**
 * Type-checking predicate supplied by the host. Only used to pick between
 * constructors whose label shapes match.
 */
@FunctionalInterface
public interface TypeCheckOracle {

    boolean typeChecks(Expression expression, TypeRef expectedType);
}
