package io.expandcheck;

import io.expandcheck.catalog.CatalogCache;
import io.expandcheck.catalog.ConstructorCatalogBuilder;
import io.expandcheck.model.CallExpression;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.ParameterDeclaration;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.ResolutionResult;
import io.expandcheck.model.Signature;
import io.expandcheck.model.TypeRef;
import io.expandcheck.resolve.ArgumentSegmenter;
import io.expandcheck.resolve.ConstructorResolver;
import io.expandcheck.resolve.Segmentation;
import io.expandcheck.symbols.AccessControl;
import io.expandcheck.symbols.StaticTypeChecker;
import io.expandcheck.symbols.TypeCheckOracle;
import io.expandcheck.symbols.TypeIndex;
import io.expandcheck.symbols.VisibilityOracle;
import io.expandcheck.validate.SignatureValidator;

import java.util.List;

/**
 * Entry point used by the host compiler.
 * <ul>
 *   <li>{@link #validateSignature(Signature)} once per declared callable</li>
 *   <li>{@link #resolveCall(Signature, CallExpression)} once per call expression</li>
 * </ul>
 * Both are pure over their inputs and safe to call from many threads; the
 * only shared state is the catalog cache.
 */
public class ExpansionEngine {

    private final SignatureValidator validator;
    private final ArgumentSegmenter segmenter;
    private final ConstructorResolver resolver;
    private final CatalogCache catalogs;

    public ExpansionEngine(TypeIndex index,
                           VisibilityOracle visibility,
                           TypeCheckOracle typeChecker,
                           EngineConfig config) {
        this.validator = new SignatureValidator(index, !config.reportAllViolations());
        this.segmenter = new ArgumentSegmenter();
        this.resolver = new ConstructorResolver(typeChecker, visibility);
        this.catalogs = new CatalogCache(new ConstructorCatalogBuilder(index, visibility), config.cacheCatalogs());
    }

    /**
     * Creates an engine with the standard access rules and the static type checker.
     */
    public static ExpansionEngine standard(TypeIndex index, EngineConfig config) {
        return new ExpansionEngine(index, new AccessControl(), new StaticTypeChecker(index), config);
    }

    public List<ResolutionError> validateSignature(Signature signature) {
        return validator.validate(signature);
    }

    public ResolutionResult resolveCall(Signature signature, CallExpression call) {
        Segmentation segmentation = segmenter.segment(signature, call.arguments());

        if (segmentation instanceof Segmentation.NotApplicable) {
            return new ResolutionResult.NotApplicable(call.arguments());
        } else if (segmentation instanceof Segmentation.Direct d) {
            return new ResolutionResult.Direct(d.argument(), d.remainder());
        } else if (segmentation instanceof Segmentation.Defaulted d) {
            return new ResolutionResult.Defaulted(d.remainder());
        } else if (segmentation instanceof Segmentation.Rejected r) {
            return new ResolutionResult.Failed(r.error());
        } else if (segmentation instanceof Segmentation.Span s) {
            ParameterDeclaration expanded = signature.expandedParameter().orElseThrow();
            List<ConstructorCandidate> catalog = catalogs.catalogFor(expanded.declaredType(), signature.declarationSite());
            return resolver.resolve(call.callee(), s.expansionSpan(), s.remainder(), catalog, call.callSite());
        }
        throw new IllegalStateException("Unknown Segmentation type: " + segmentation.getClass());
    }

    /**
     * Drops cached catalogs of a type whose constructor set changed.
     */
    public void invalidateCatalogs(TypeRef type) {
        catalogs.invalidate(type);
    }

    public CatalogCache catalogs() {
        return catalogs;
    }
}
