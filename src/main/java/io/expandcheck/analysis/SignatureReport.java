package io.expandcheck.analysis;

import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.Signature;

import java.util.List;

/**
 * Validation outcome of one declared function.
 *
 * @param signature  The validated signature
 * @param errors     Violations found (empty when valid)
 */
public record SignatureReport(
    Signature signature,
    List<ResolutionError> errors
) {
    public SignatureReport {
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
