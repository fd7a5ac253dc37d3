package io.expandcheck.catalog;

import io.expandcheck.model.SiteContext;
import io.expandcheck.model.TypeRef;

/**
 * Cache key for a constructor catalog: the nominal type plus the
 * declaration-site context the catalog is locked to. Compared by value.
 *
 * @param ownerType        Nominal type whose constructors are catalogued
 * @param declarationSite  Declaration site of the expandable signature
 */
public record CatalogKey(
    TypeRef.Named ownerType,
    SiteContext declarationSite
) {
    public CatalogKey {
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        if (declarationSite == null) {
            throw new IllegalArgumentException("declarationSite cannot be null");
        }
    }
}
