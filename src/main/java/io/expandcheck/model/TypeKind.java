package io.expandcheck.model;

/**
 * Kind of a nominal type declaration.
 */
public enum TypeKind {
    STRUCT,
    CLASS,
    ABSTRACT_CLASS,
    INTERFACE;

    /**
     * Returns true for kinds whose constructors are requirements rather than
     * concrete implementations, so the runtime type to build is unknown.
     */
    public boolean isAbstract() {
        return this == INTERFACE || this == ABSTRACT_CLASS;
    }
}
