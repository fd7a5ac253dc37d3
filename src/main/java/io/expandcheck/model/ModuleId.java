package io.expandcheck.model;

/**
 * Identifies a compilation module.
 *
 * @param name Module name
 */
public record ModuleId(String name) {
    public ModuleId {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public static ModuleId of(String name) {
        return new ModuleId(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
