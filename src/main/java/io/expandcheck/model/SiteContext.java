package io.expandcheck.model;

import java.util.Optional;

/**
 * Location of a declaration or a call, as seen by access control.
 *
 * @param module         Module containing the site
 * @param file           Source file containing the site
 * @param enclosingType  Name of the innermost enclosing type (null at top level)
 * @param sequence       Host-assigned declaration order; lower means declared earlier
 */
public record SiteContext(
    ModuleId module,
    String file,
    String enclosingType,
    long sequence
) {
    public SiteContext {
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
    }

    public static SiteContext topLevel(String module, String file, long sequence) {
        return new SiteContext(ModuleId.of(module), file, null, sequence);
    }

    public Optional<String> findEnclosingType() {
        return Optional.ofNullable(enclosingType);
    }

    public String location() {
        String scope = enclosingType != null ? "/" + enclosingType : "";
        return module + ":" + file + scope + "@" + sequence;
    }
}
