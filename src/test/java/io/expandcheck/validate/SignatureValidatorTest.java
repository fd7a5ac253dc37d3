package io.expandcheck.validate;

import io.expandcheck.model.ErrorKind;
import io.expandcheck.model.ParameterDeclaration;
import io.expandcheck.model.ResolutionError;
import io.expandcheck.model.Signature;
import io.expandcheck.model.TypeKind;
import io.expandcheck.model.TypeRef;
import io.expandcheck.symbols.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.expandcheck.Fixtures.BOOL;
import static io.expandcheck.Fixtures.INT;
import static io.expandcheck.Fixtures.T;
import static io.expandcheck.Fixtures.declaration;
import static io.expandcheck.Fixtures.defaulted;
import static io.expandcheck.Fixtures.expanded;
import static io.expandcheck.Fixtures.param;
import static io.expandcheck.Fixtures.signature;
import static io.expandcheck.Fixtures.site;
import static org.assertj.core.api.Assertions.assertThat;

class SignatureValidatorTest {

    private SymbolTable symbols;
    private SignatureValidator validator;

    @BeforeEach
    void setUp() {
        symbols = SymbolTable.builder()
            .addType(declaration("T", TypeKind.STRUCT))
            .addType(declaration("Widget", TypeKind.CLASS))
            .addType(declaration("Shape", TypeKind.INTERFACE))
            .addType(declaration("Base", TypeKind.ABSTRACT_CLASS))
            .build();
        validator = new SignatureValidator(symbols);
    }

    private static ParameterDeclaration expandedAt(String label, int index, TypeRef type) {
        return ParameterDeclaration.builder()
            .label(label)
            .positionalIndex(index)
            .declaredType(type)
            .expanded(true)
            .build();
    }

    private List<ErrorKind> kindsOf(Signature signature) {
        return validator.validate(signature).stream().map(ResolutionError::kind).toList();
    }

    @Test
    void validate_validSignatureHasNoErrors() {
        assertThat(validator.validate(signature("f", expanded("x", T), param("y", 1, INT)))).isEmpty();
        assertThat(validator.validate(signature("f", expanded("w", TypeRef.named("Widget"))))).isEmpty();
    }

    @Test
    void validate_signatureWithoutExpandedParameterIsIgnored() {
        Signature plain = new Signature("f", List.of(param("a", 0, TypeRef.named("Nope"))), true, site(1));

        assertThat(validator.validate(plain)).isEmpty();
    }

    @Test
    void validate_expandedMustBeFirst() {
        Signature late = signature("f", param("y", 0, INT), expandedAt("x", 1, T));

        List<ResolutionError> errors = validator.validate(late);

        assertThat(errors).extracting(ResolutionError::kind).containsExactly(ErrorKind.INVALID_EXPANDED_PLACEMENT);
        assertThat(errors.get(0).parameterPositions()).containsExactly(1);
    }

    @Test
    void validate_atMostOneExpanded() {
        Signature twice = signature("f", expanded("x", T), expandedAt("z", 1, T));

        assertThat(kindsOf(twice)).containsExactly(
            ErrorKind.INVALID_EXPANDED_PLACEMENT,
            ErrorKind.MULTIPLE_EXPANDED_PARAMETERS);
    }

    @Test
    void validate_overloadedNameIsRejected() {
        Signature overloaded = new Signature("f", List.of(expanded("x", T)), true, site(100));

        assertThat(kindsOf(overloaded)).containsExactly(ErrorKind.OVERLOAD_CONFLICT_WITH_EXPANDED);
    }

    @Test
    void validate_functionTypeIsNotNominal() {
        TypeRef callback = new TypeRef.FunctionOf(List.of(INT), BOOL);

        List<ResolutionError> errors = validator.validate(signature("f", expanded("cb", callback)));

        assertThat(errors).extracting(ResolutionError::kind).containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
        assertThat(errors.get(0).message()).startsWith("Function type");
    }

    @Test
    void validate_tupleAndGenericAreNotNominal() {
        TypeRef pair = new TypeRef.TupleOf(List.of(INT, BOOL));
        TypeRef generic = new TypeRef.TypeParameter("U");

        assertThat(kindsOf(signature("f", expanded("p", pair)))).containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
        assertThat(kindsOf(signature("f", expanded("g", generic)))).containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
    }

    @Test
    void validate_unknownNameIsNotNominal() {
        assertThat(kindsOf(signature("f", expanded("x", TypeRef.named("Unknown")))))
            .containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
    }

    @Test
    void validate_optionalIsNominal() {
        assertThat(validator.validate(signature("f", expanded("x", TypeRef.optional(T))))).isEmpty();
    }

    @Test
    void validate_optionalOfGenericOrFunctionIsNotNominal() {
        TypeRef optionalGeneric = TypeRef.optional(new TypeRef.TypeParameter("U"));
        TypeRef optionalFunction = TypeRef.optional(new TypeRef.FunctionOf(List.of(INT), INT));
        TypeRef optionalPair = TypeRef.optional(TypeRef.optional(new TypeRef.TupleOf(List.of(INT, BOOL))));

        List<ResolutionError> errors = validator.validate(signature("f", expanded("x", optionalGeneric)));

        assertThat(errors).extracting(ResolutionError::kind).containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
        assertThat(errors.get(0).message()).contains("U?", "Generic parameter 'U'");
        assertThat(kindsOf(signature("f", expanded("cb", optionalFunction))))
            .containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
        assertThat(kindsOf(signature("f", expanded("p", optionalPair))))
            .containsExactly(ErrorKind.NON_NOMINAL_EXPANDED_TYPE);
    }

    @Test
    void validate_interfaceAndAbstractClassAreRejected() {
        assertThat(kindsOf(signature("f", expanded("s", TypeRef.named("Shape")))))
            .containsExactly(ErrorKind.ABSTRACT_TYPE_NOT_EXPANDABLE);
        assertThat(kindsOf(signature("f", expanded("b", TypeRef.named("Base")))))
            .containsExactly(ErrorKind.ABSTRACT_TYPE_NOT_EXPANDABLE);
    }

    @Test
    void validate_inoutIsRejected() {
        ParameterDeclaration inout = ParameterDeclaration.builder()
            .label("x").declaredType(T).expanded(true).byReference(true).build();

        assertThat(kindsOf(signature("f", inout))).containsExactly(ErrorKind.BY_REFERENCE_EXPANDED_CONFLICT);
    }

    @Test
    void validate_defaultedNeighbourMustBeLast() {
        Signature bad = signature("f", expanded("x", T), defaulted("y", 1, INT), param("z", 2, BOOL));

        List<ResolutionError> errors = validator.validate(bad);

        assertThat(errors).extracting(ResolutionError::kind)
            .containsExactly(ErrorKind.DEFAULT_ARGUMENT_ADJACENCY_VIOLATION);
        assertThat(errors.get(0).parameterPositions()).containsExactly(1);
    }

    @Test
    void validate_defaultedNeighbourThatIsLastIsAllowed() {
        assertThat(validator.validate(signature("f", expanded("x", T), defaulted("y", 1, INT)))).isEmpty();
        assertThat(validator.validate(
            signature("f", expanded("x", T), param("z", 1, BOOL), defaulted("y", 2, INT)))).isEmpty();
    }

    @Test
    void validate_reportsAllViolationsTogether() {
        ParameterDeclaration inoutShape = ParameterDeclaration.builder()
            .label("s").declaredType(TypeRef.named("Shape")).expanded(true).byReference(true).build();
        Signature messy = new Signature("f", List.of(inoutShape, defaulted("y", 1, INT), param("z", 2, BOOL)), true, site(100));

        assertThat(kindsOf(messy)).containsExactly(
            ErrorKind.OVERLOAD_CONFLICT_WITH_EXPANDED,
            ErrorKind.ABSTRACT_TYPE_NOT_EXPANDABLE,
            ErrorKind.BY_REFERENCE_EXPANDED_CONFLICT,
            ErrorKind.DEFAULT_ARGUMENT_ADJACENCY_VIOLATION);
    }

    @Test
    void validate_stopAtFirstViolationKeepsFirstError() {
        SignatureValidator strict = new SignatureValidator(symbols, true);
        ParameterDeclaration inoutShape = ParameterDeclaration.builder()
            .label("s").declaredType(TypeRef.named("Shape")).expanded(true).byReference(true).build();

        assertThat(strict.validate(signature("f", inoutShape)))
            .extracting(ResolutionError::kind)
            .containsExactly(ErrorKind.ABSTRACT_TYPE_NOT_EXPANDABLE);
    }
}
