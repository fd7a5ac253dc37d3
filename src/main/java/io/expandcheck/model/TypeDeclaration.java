package io.expandcheck.model;

import java.util.Optional;

/**
 * A nominal type as the symbol table knows it.
 *
 * @param type       The declared type
 * @param kind       Struct, class, abstract class or interface
 * @param supertype  Direct supertype (null if none)
 * @param module     Declaring module
 */
public record TypeDeclaration(
    TypeRef.Named type,
    TypeKind kind,
    TypeRef.Named supertype,
    ModuleId module
) {
    public TypeDeclaration {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
    }

    public String name() {
        return type.name();
    }

    public Optional<TypeRef.Named> findSupertype() {
        return Optional.ofNullable(supertype);
    }
}
