package io.expandcheck.catalog;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.ModuleId;
import io.expandcheck.model.SiteContext;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeKind;
import io.expandcheck.model.TypeRef;
import io.expandcheck.model.VisibilityLevel;
import io.expandcheck.symbols.AccessControl;
import io.expandcheck.symbols.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.expandcheck.Fixtures.INT;
import static io.expandcheck.Fixtures.STRING;
import static io.expandcheck.Fixtures.T;
import static io.expandcheck.Fixtures.ctor;
import static io.expandcheck.Fixtures.declaration;
import static io.expandcheck.Fixtures.site;
import static org.assertj.core.api.Assertions.assertThat;

class ConstructorCatalogBuilderTest {

    private SymbolTable symbols;
    private ConstructorCatalogBuilder builder;

    @BeforeEach
    void setUp() {
        symbols = SymbolTable.builder()
            .addType(declaration("T", TypeKind.STRUCT))
            .addConstructor(ctor(T).parameter("a", INT).sequence(1).build())
            .build();
        builder = new ConstructorCatalogBuilder(symbols, new AccessControl());
    }

    @Test
    void build_includesVisibleEarlierConstructors() {
        List<ConstructorCandidate> catalog = builder.build(T, site(100));

        assertThat(catalog).extracting(ConstructorCandidate::signature).containsExactly("T(a: Int)");
    }

    @Test
    void build_excludesConstructorsDeclaredAfterSignature() {
        symbols.register(ctor(T).parameter("late", INT).sequence(150).build());

        assertThat(builder.build(T, site(100)))
            .extracting(ConstructorCandidate::signature)
            .containsExactly("T(a: Int)");
        assertThat(builder.build(T, site(200))).hasSize(2);
    }

    @Test
    void build_excludesConstructorsInvisibleFromDeclarationSite() {
        symbols.register(ctor(T).parameter("hidden", INT)
            .visibility(VisibilityLevel.FILE_PRIVATE)
            .declaringFile("other.swift")
            .sequence(2)
            .build());

        assertThat(builder.build(T, site(100)))
            .extracting(ConstructorCandidate::signature)
            .containsExactly("T(a: Int)");
    }

    @Test
    void build_excludesInheritedConstructors() {
        TypeRef.Named base = new TypeRef.Named("Base");
        TypeRef.Named derived = new TypeRef.Named("Derived");
        ModuleId app = ModuleId.of("App");
        symbols.register(new TypeDeclaration(base, TypeKind.CLASS, null, app));
        symbols.register(new TypeDeclaration(derived, TypeKind.CLASS, base, app));
        symbols.register(ctor(base).parameter("name", STRING).build());
        symbols.register(ctor(derived).parameter("id", INT).build());

        assertThat(symbols.constructorsOf(derived)).hasSize(2);
        assertThat(builder.build(derived, site(100)))
            .extracting(ConstructorCandidate::signature)
            .containsExactly("Derived(id: Int)");
    }

    @Test
    void build_optionalUsesWrapperConstructors() {
        TypeRef.Named wrapper = new TypeRef.Named(TypeRef.OPTIONAL_WRAPPER);
        symbols.register(ctor(wrapper).parameter(null, T).build());

        List<ConstructorCandidate> catalog = builder.build(TypeRef.optional(T), site(100));

        assertThat(catalog).extracting(ConstructorCandidate::owningType).containsExactly(wrapper);
    }

    @Test
    void build_structuralTypeHasEmptyCatalog() {
        TypeRef function = new TypeRef.FunctionOf(List.of(INT), STRING);

        assertThat(builder.build(function, site(100))).isEmpty();
    }

    @Test
    void build_extensionConstructorVisibleOnlyInItsModule() {
        symbols.register(ctor(T).parameter("ext", INT)
            .visibility(VisibilityLevel.INTERNAL)
            .declaringModule("Extras")
            .declaringFile("extras.swift")
            .sequence(2)
            .build());

        assertThat(builder.build(T, site(100))).hasSize(1);
        assertThat(builder.build(T, SiteContext.topLevel("Extras", "use.swift", 100))).hasSize(2);
    }
}
