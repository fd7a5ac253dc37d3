package io.expandcheck.catalog;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.SiteContext;
import io.expandcheck.model.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-mostly store of constructor catalogs keyed by {@link CatalogKey}.
 * <p>
 * Each key is computed at most once ({@link ConcurrentHashMap#computeIfAbsent});
 * entries are immutable lists and are dropped, never edited, when a type's
 * constructor set changes.
 */
public class CatalogCache {

    private static final Logger log = LoggerFactory.getLogger(CatalogCache.class);

    private final ConstructorCatalogBuilder builder;
    private final boolean enabled;
    private final Map<CatalogKey, List<ConstructorCandidate>> entries = new ConcurrentHashMap<>();

    public CatalogCache(ConstructorCatalogBuilder builder) {
        this(builder, true);
    }

    public CatalogCache(ConstructorCatalogBuilder builder, boolean enabled) {
        this.builder = builder;
        this.enabled = enabled;
    }

    /**
     * Returns the catalog for an expanded parameter's type at the given declaration site.
     */
    public List<ConstructorCandidate> catalogFor(TypeRef ownerType, SiteContext declarationSite) {
        Optional<TypeRef.Named> nominal = ownerType.nominalType();
        if (nominal.isEmpty()) {
            return List.of();
        }
        CatalogKey key = new CatalogKey(nominal.get(), declarationSite);
        if (!enabled) {
            return builder.build(key);
        }
        List<ConstructorCandidate> cached = entries.get(key);
        if (cached != null) {
            log.debug("Catalog cache hit for {}", key.ownerType().name());
            return cached;
        }
        return entries.computeIfAbsent(key, builder::build);
    }

    /**
     * Drops every catalog built for the given type, e.g. after an extension
     * added a constructor to it.
     */
    public void invalidate(TypeRef type) {
        type.nominalType().ifPresent(owner -> {
            int before = entries.size();
            entries.keySet().removeIf(k -> k.ownerType().equals(owner));
            log.debug("Invalidated {} catalog(s) for {}", before - entries.size(), owner.name());
        });
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
