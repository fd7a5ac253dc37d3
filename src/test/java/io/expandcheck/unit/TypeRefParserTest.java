package io.expandcheck.unit;

import io.expandcheck.model.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeRefParserTest {

    private static final TypeRef INT = TypeRef.named("Int");
    private static final TypeRef BOOL = TypeRef.named("Bool");

    @Test
    void parse_namedAndQualifiedNames() {
        assertThat(TypeRefParser.parse("Int")).isEqualTo(INT);
        assertThat(TypeRefParser.parse("  Geometry.Point ")).isEqualTo(TypeRef.named("Geometry.Point"));
    }

    @Test
    void parse_optionalSuffix() {
        assertThat(TypeRefParser.parse("Int?")).isEqualTo(TypeRef.optional(INT));
        assertThat(TypeRefParser.parse("Int??")).isEqualTo(TypeRef.optional(TypeRef.optional(INT)));
    }

    @Test
    void parse_tupleAndGrouping() {
        assertThat(TypeRefParser.parse("(Int, Bool)")).isEqualTo(new TypeRef.TupleOf(List.of(INT, BOOL)));
        assertThat(TypeRefParser.parse("()")).isEqualTo(new TypeRef.TupleOf(List.of()));
        assertThat(TypeRefParser.parse("(Int)")).isEqualTo(INT);
    }

    @Test
    void parse_functionTypes() {
        TypeRef parsed = TypeRefParser.parse("(Int, Bool) -> Point?");

        assertThat(parsed).isEqualTo(new TypeRef.FunctionOf(List.of(INT, BOOL), TypeRef.optional(TypeRef.named("Point"))));
        assertThat(parsed.display()).isEqualTo("(Int, Bool) -> Point?");
    }

    @Test
    void parse_optionalFunctionNeedsGrouping() {
        TypeRef parsed = TypeRefParser.parse("((Int) -> Bool)?");

        assertThat(parsed).isEqualTo(TypeRef.optional(new TypeRef.FunctionOf(List.of(INT), BOOL)));
        assertThat(parsed.display()).isEqualTo("((Int) -> Bool)?");
        assertThat(parsed.nominalType()).contains(new TypeRef.Named(TypeRef.OPTIONAL_WRAPPER));
    }

    @Test
    void parse_typeParameters() {
        assertThat(TypeRefParser.parse("T", Set.of("T"))).isEqualTo(new TypeRef.TypeParameter("T"));
        assertThat(TypeRefParser.parse("T")).isEqualTo(TypeRef.named("T"));
        assertThat(TypeRefParser.parse("T").nominalType()).isPresent();
        assertThat(TypeRefParser.parse("T", Set.of("T")).nominalType()).isEmpty();
    }

    @Test
    void parse_malformedTextReportsColumn() {
        assertThatThrownBy(() -> TypeRefParser.parse("(Int"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Expected ')'")
            .hasMessageContaining("column 5");
        assertThatThrownBy(() -> TypeRefParser.parse("Int Bool"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unexpected 'B'");
        assertThatThrownBy(() -> TypeRefParser.parse(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeRefParser.parse("->"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Expected type name");
    }
}
