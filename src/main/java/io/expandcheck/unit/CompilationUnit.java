package io.expandcheck.unit;

import io.expandcheck.model.CallExpression;
import io.expandcheck.model.Signature;
import io.expandcheck.symbols.SymbolTable;

import java.util.List;

/**
 * Declarations and calls of one unit description, ready for analysis.
 *
 * @param name        Unit name (usually the file name)
 * @param symbols     Types and constructors
 * @param signatures  Declared functions
 * @param calls       Call expressions in source order
 */
public record CompilationUnit(
    String name,
    SymbolTable symbols,
    List<Signature> signatures,
    List<CallExpression> calls
) {
    public CompilationUnit {
        if (symbols == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
        signatures = List.copyOf(signatures);
        calls = List.copyOf(calls);
    }

    /**
     * Returns every function declared with the given name.
     */
    public List<Signature> signaturesNamed(String name) {
        return signatures.stream()
            .filter(s -> s.name().equals(name))
            .toList();
    }
}
