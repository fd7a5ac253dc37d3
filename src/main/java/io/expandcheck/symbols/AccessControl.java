package io.expandcheck.symbols;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.SiteContext;

/**
 * Standard access rules:
 * <ul>
 *   <li>public - visible everywhere</li>
 *   <li>internal - visible inside the declaring module</li>
 *   <li>fileprivate - visible inside the declaring file</li>
 *   <li>private - visible inside the owning type's declarations in the declaring file</li>
 * </ul>
 */
public class AccessControl implements VisibilityOracle {

    @Override
    public boolean isVisible(ConstructorCandidate candidate, SiteContext fromContext) {
        boolean sameModule = candidate.declaringModule().equals(fromContext.module());
        boolean sameFile = sameModule && candidate.declaringFile().equals(fromContext.file());

        return switch (candidate.visibility()) {
            case PUBLIC -> true;
            case INTERNAL -> sameModule;
            case FILE_PRIVATE -> sameFile;
            case PRIVATE -> sameFile && isInsideType(fromContext, candidate.owningType().name());
        };
    }

    /**
     * Nested types count as inside their enclosing type ("Outer.Inner" is inside "Outer").
     */
    private boolean isInsideType(SiteContext context, String typeName) {
        String enclosing = context.enclosingType();
        if (enclosing == null) {
            return false;
        }
        return enclosing.equals(typeName) || enclosing.startsWith(typeName + ".");
    }
}
