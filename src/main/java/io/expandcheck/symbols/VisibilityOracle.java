package io.expandcheck.symbols;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.SiteContext;

/**
 * Access-control predicate supplied by the host.
 */
@FunctionalInterface
public interface VisibilityOracle {

    /**
     * Check if the constructor is accessible from the given site.
     */
    boolean isVisible(ConstructorCandidate candidate, SiteContext fromContext);
}
