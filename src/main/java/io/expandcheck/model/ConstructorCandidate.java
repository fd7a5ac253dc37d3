package io.expandcheck.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A constructor that may be picked to build an expanded parameter's value.
 * Only the signature matters; bodies are never looked at.
 *
 * @param owningType       Type that declares the constructor
 * @param parameterLabels  Parameter labels in order (null entries are unlabeled)
 * @param parameterTypes   Parameter types in order
 * @param visibility       Declared access level
 * @param declaringModule  Module that declares the constructor (differs from the type's for extensions)
 * @param declaringFile    Source file of the declaration
 * @param sequence         Host-assigned declaration order
 */
public record ConstructorCandidate(
    TypeRef.Named owningType,
    List<String> parameterLabels,
    List<TypeRef> parameterTypes,
    VisibilityLevel visibility,
    ModuleId declaringModule,
    String declaringFile,
    long sequence
) {
    public ConstructorCandidate {
        if (owningType == null) {
            throw new IllegalArgumentException("owningType cannot be null");
        }
        parameterLabels = Labels.copyOf(parameterLabels);
        parameterTypes = List.copyOf(parameterTypes);
        if (parameterLabels.size() != parameterTypes.size()) {
            throw new IllegalArgumentException("labels and types differ in length: "
                + parameterLabels.size() + " vs " + parameterTypes.size());
        }
        if (visibility == null) {
            visibility = VisibilityLevel.INTERNAL;
        }
        if (declaringModule == null) {
            throw new IllegalArgumentException("declaringModule cannot be null");
        }
        if (declaringFile == null || declaringFile.isBlank()) {
            throw new IllegalArgumentException("declaringFile cannot be null or blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public int arity() {
        return parameterTypes.size();
    }

    /**
     * Check if this constructor was declared before the given site.
     */
    public boolean isDeclaredBefore(SiteContext site) {
        return sequence < site.sequence();
    }

    /**
     * Returns a signature like {@code Point(x: Int, _: Int)}.
     */
    public String signature() {
        return IntStream.range(0, arity())
            .mapToObj(i -> Labels.display(parameterLabels.get(i)) + ": " + parameterTypes.get(i).display())
            .collect(Collectors.joining(", ", owningType.name() + "(", ")"));
    }

    public static class Builder {
        private TypeRef.Named owningType;
        private final List<String> labels = new ArrayList<>();
        private final List<TypeRef> types = new ArrayList<>();
        private VisibilityLevel visibility = VisibilityLevel.INTERNAL;
        private ModuleId declaringModule;
        private String declaringFile;
        private long sequence;

        public Builder owningType(TypeRef.Named owningType) {
            this.owningType = owningType;
            return this;
        }

        /**
         * Appends a parameter; pass a null label for an unlabeled one.
         */
        public Builder parameter(String label, TypeRef type) {
            this.labels.add(label);
            this.types.add(type);
            return this;
        }

        public Builder visibility(VisibilityLevel visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder declaringModule(String declaringModule) {
            this.declaringModule = ModuleId.of(declaringModule);
            return this;
        }

        public Builder declaringFile(String declaringFile) {
            this.declaringFile = declaringFile;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public ConstructorCandidate build() {
            return new ConstructorCandidate(owningType, labels, types, visibility, declaringModule, declaringFile, sequence);
        }
    }
}
