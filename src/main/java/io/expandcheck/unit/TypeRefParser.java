package io.expandcheck.unit;

import io.expandcheck.model.TypeRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses the textual type syntax used in unit files:
 * <pre>
 *   type     := primary '?'*
 *   primary  := '(' [type (',' type)*] ')' ['->' type]
 *             | name
 * </pre>
 * A single parenthesized type is just grouping; zero or several elements form a
 * tuple. Names listed as type parameters parse as {@link TypeRef.TypeParameter}.
 */
public final class TypeRefParser {

    private final String text;
    private final Set<String> typeParameters;
    private int pos;

    private TypeRefParser(String text, Set<String> typeParameters) {
        this.text = text;
        this.typeParameters = typeParameters;
    }

    public static TypeRef parse(String text) {
        return parse(text, Set.of());
    }

    /**
     * @throws IllegalArgumentException if the text is not a well-formed type
     */
    public static TypeRef parse(String text, Set<String> typeParameters) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Type cannot be empty");
        }
        TypeRefParser parser = new TypeRefParser(text, typeParameters);
        TypeRef type = parser.parseType();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.pos) + "'");
        }
        return type;
    }

    private TypeRef parseType() {
        skipWhitespace();
        TypeRef base;
        if (peek('(')) {
            pos++;
            List<TypeRef> elements = new ArrayList<>();
            skipWhitespace();
            if (!peek(')')) {
                elements.add(parseType());
                skipWhitespace();
                while (peek(',')) {
                    pos++;
                    elements.add(parseType());
                    skipWhitespace();
                }
            }
            expect(')');
            skipWhitespace();
            if (text.startsWith("->", pos)) {
                pos += 2;
                return new TypeRef.FunctionOf(elements, parseType());
            }
            base = elements.size() == 1 ? elements.get(0) : new TypeRef.TupleOf(elements);
        } else {
            String name = readName();
            base = typeParameters.contains(name) ? new TypeRef.TypeParameter(name) : new TypeRef.Named(name);
        }

        skipWhitespace();
        while (peek('?')) {
            pos++;
            base = new TypeRef.OptionalOf(base);
            skipWhitespace();
        }
        return base;
    }

    private String readName() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        if (start == pos) {
            throw error(pos < text.length() ? "Expected type name, found '" + text.charAt(pos) + "'" : "Expected type name");
        }
        return text.substring(start, pos);
    }

    private boolean peek(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private void expect(char c) {
        skipWhitespace();
        if (!peek(c)) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at column " + (pos + 1) + " in type '" + text + "'");
    }
}
