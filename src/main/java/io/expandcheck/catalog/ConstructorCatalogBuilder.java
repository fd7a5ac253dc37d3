package io.expandcheck.catalog;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.SiteContext;
import io.expandcheck.model.TypeRef;
import io.expandcheck.symbols.TypeIndex;
import io.expandcheck.symbols.VisibilityOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds the frozen set of constructors an expanded parameter may forward to.
 * <p>
 * A constructor is catalogued when it is
 * <ol>
 *   <li>visible from the signature's declaration site,</li>
 *   <li>declared directly on the owner type (inherited constructors are excluded), and</li>
 *   <li>declared before the signature (declaration-site lock).</li>
 * </ol>
 * For an optional {@code T?} the catalog is that of the wrapper type, not {@code T}.
 */
public class ConstructorCatalogBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConstructorCatalogBuilder.class);

    private final TypeIndex index;
    private final VisibilityOracle visibility;

    public ConstructorCatalogBuilder(TypeIndex index, VisibilityOracle visibility) {
        this.index = index;
        this.visibility = visibility;
    }

    /**
     * Builds the catalog for the type of an expanded parameter.
     * Structural types have no constructors and yield an empty catalog.
     */
    public List<ConstructorCandidate> build(TypeRef ownerType, SiteContext declarationSite) {
        Optional<TypeRef.Named> nominal = ownerType.nominalType();
        if (nominal.isEmpty()) {
            log.debug("No catalog for structural type {}", ownerType.display());
            return List.of();
        }
        return build(new CatalogKey(nominal.get(), declarationSite));
    }

    public List<ConstructorCandidate> build(CatalogKey key) {
        TypeRef.Named owner = key.ownerType();
        SiteContext site = key.declarationSite();

        List<ConstructorCandidate> catalog = index.constructorsOf(owner).stream()
            .filter(c -> c.owningType().equals(owner))
            .filter(c -> c.isDeclaredBefore(site))
            .filter(c -> visibility.isVisible(c, site))
            .toList();

        log.debug("Catalog for {} at {}: {} constructor(s)", owner.name(), site.location(), catalog.size());
        return catalog;
    }
}
