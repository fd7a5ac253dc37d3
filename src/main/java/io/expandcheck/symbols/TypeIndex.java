package io.expandcheck.symbols;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeRef;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the host's declaration index.
 */
public interface TypeIndex {

    /**
     * Looks up the declaration of a named type.
     */
    Optional<TypeDeclaration> declarationOf(TypeRef.Named type);

    /**
     * Returns every constructor usable in ordinary construction syntax for the
     * given type, in declaration order. This includes constructors inherited
     * from supertypes; their {@code owningType} is the supertype.
     */
    List<ConstructorCandidate> constructorsOf(TypeRef.Named type);
}
