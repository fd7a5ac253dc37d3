package io.expandcheck.model;

/**
 * One parameter of a callable's signature.
 *
 * @param label            External argument label (null when unlabeled)
 * @param positionalIndex  Zero-based position in the parameter list
 * @param declaredType     Declared parameter type
 * @param isExpanded       Whether the parameter is marked as expanded
 * @param hasDefaultValue  Whether the parameter declares a default value
 * @param isByReference    Whether the parameter is an in/out (mutable reference) parameter
 */
public record ParameterDeclaration(
    String label,
    int positionalIndex,
    TypeRef declaredType,
    boolean isExpanded,
    boolean hasDefaultValue,
    boolean isByReference
) {
    public ParameterDeclaration {
        if (positionalIndex < 0) {
            throw new IllegalArgumentException("positionalIndex cannot be negative: " + positionalIndex);
        }
        if (declaredType == null) {
            throw new IllegalArgumentException("declaredType cannot be null");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String displayLabel() {
        return Labels.display(label);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(displayLabel()).append(": ");
        if (isExpanded) {
            sb.append("@expanded ");
        }
        if (isByReference) {
            sb.append("inout ");
        }
        sb.append(declaredType.display());
        if (hasDefaultValue) {
            sb.append(" = <default>");
        }
        return sb.toString();
    }

    public static class Builder {
        private String label;
        private int positionalIndex;
        private TypeRef declaredType;
        private boolean isExpanded;
        private boolean hasDefaultValue;
        private boolean isByReference;

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder positionalIndex(int positionalIndex) {
            this.positionalIndex = positionalIndex;
            return this;
        }

        public Builder declaredType(TypeRef declaredType) {
            this.declaredType = declaredType;
            return this;
        }

        public Builder expanded(boolean isExpanded) {
            this.isExpanded = isExpanded;
            return this;
        }

        public Builder hasDefaultValue(boolean hasDefaultValue) {
            this.hasDefaultValue = hasDefaultValue;
            return this;
        }

        public Builder byReference(boolean isByReference) {
            this.isByReference = isByReference;
            return this;
        }

        public ParameterDeclaration build() {
            return new ParameterDeclaration(label, positionalIndex, declaredType, isExpanded, hasDefaultValue, isByReference);
        }
    }
}
