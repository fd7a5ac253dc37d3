package io.expandcheck.analysis;

import io.expandcheck.model.CallExpression;
import io.expandcheck.model.ResolutionResult;
import io.expandcheck.model.Signature;

import java.util.Optional;

/**
 * Resolution outcome of one call expression.
 *
 * @param call        The call
 * @param signature   Signature the call was resolved against (null when skipped)
 * @param result      Resolution result (null when skipped)
 * @param skipReason  Why the call was not resolved (null when resolved)
 */
public record CallReport(
    CallExpression call,
    Signature signature,
    ResolutionResult result,
    String skipReason
) {
    public CallReport {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if ((result == null) == (skipReason == null)) {
            throw new IllegalArgumentException("exactly one of result and skipReason must be set");
        }
    }

    public static CallReport resolved(CallExpression call, Signature signature, ResolutionResult result) {
        return new CallReport(call, signature, result, null);
    }

    public static CallReport skipped(CallExpression call, String reason) {
        return new CallReport(call, null, null, reason);
    }

    public boolean isSkipped() {
        return result == null;
    }

    public Optional<ResolutionResult.Failed> failure() {
        if (result instanceof ResolutionResult.Failed f) {
            return Optional.of(f);
        }
        return Optional.empty();
    }
}
