package io.expandcheck.model;

/**
 * Access level of a declaration, ordered from most to least restrictive.
 */
public enum VisibilityLevel {
    PRIVATE,
    FILE_PRIVATE,
    INTERNAL,
    PUBLIC
}
