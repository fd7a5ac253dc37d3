package io.expandcheck;

import io.expandcheck.model.CallArgument;
import io.expandcheck.model.CallExpression;
import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.Expression;
import io.expandcheck.model.ModuleId;
import io.expandcheck.model.ParameterDeclaration;
import io.expandcheck.model.Signature;
import io.expandcheck.model.SiteContext;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeKind;
import io.expandcheck.model.TypeRef;
import io.expandcheck.model.VisibilityLevel;

import java.util.List;

/**
 * Shared builders for tests. Declarations live in module "App", file "main.swift";
 * constructors default to sequence 1, signatures to 100 and calls to 200.
 */
public final class Fixtures {

    public static final TypeRef INT = TypeRef.named("Int");
    public static final TypeRef BOOL = TypeRef.named("Bool");
    public static final TypeRef STRING = TypeRef.named("String");
    public static final TypeRef.Named T = new TypeRef.Named("T");

    public static final String MODULE = "App";
    public static final String FILE = "main.swift";

    private Fixtures() {
    }

    public static SiteContext site(long sequence) {
        return SiteContext.topLevel(MODULE, FILE, sequence);
    }

    public static TypeDeclaration declaration(String name, TypeKind kind) {
        return new TypeDeclaration(new TypeRef.Named(name), kind, null, ModuleId.of(MODULE));
    }

    public static ConstructorCandidate.Builder ctor(TypeRef.Named owner) {
        return ConstructorCandidate.builder()
            .owningType(owner)
            .visibility(VisibilityLevel.PUBLIC)
            .declaringModule(MODULE)
            .declaringFile(FILE)
            .sequence(1);
    }

    public static ParameterDeclaration expanded(String label, TypeRef type) {
        return ParameterDeclaration.builder()
            .label(label)
            .positionalIndex(0)
            .declaredType(type)
            .expanded(true)
            .build();
    }

    public static ParameterDeclaration param(String label, int index, TypeRef type) {
        return ParameterDeclaration.builder()
            .label(label)
            .positionalIndex(index)
            .declaredType(type)
            .build();
    }

    public static ParameterDeclaration defaulted(String label, int index, TypeRef type) {
        return ParameterDeclaration.builder()
            .label(label)
            .positionalIndex(index)
            .declaredType(type)
            .hasDefaultValue(true)
            .build();
    }

    public static Signature signature(String name, ParameterDeclaration... parameters) {
        return new Signature(name, List.of(parameters), false, site(100));
    }

    public static CallArgument arg(String label, String source, TypeRef type) {
        return CallArgument.labeled(label, Expression.of(source, type));
    }

    public static CallExpression call(String callee, CallArgument... arguments) {
        return new CallExpression(callee, List.of(arguments), site(200));
    }
}
