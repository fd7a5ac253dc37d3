package io.expandcheck.symbols;

import io.expandcheck.model.ConstructorCandidate;
import io.expandcheck.model.TypeDeclaration;
import io.expandcheck.model.TypeRef;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link TypeIndex}.
 * <p>
 * Registration is safe while other threads read. Candidates themselves are
 * immutable; adding a constructor (e.g. from a later extension) only appends.
 * Callers caching derived catalogs must invalidate them after registering.
 */
public class SymbolTable implements TypeIndex {

    private final Map<TypeRef.Named, TypeDeclaration> declarations = new ConcurrentHashMap<>();
    private final Map<TypeRef.Named, List<ConstructorCandidate>> constructors = new ConcurrentHashMap<>();

    public static Builder builder() {
        return new Builder();
    }

    public void register(TypeDeclaration declaration) {
        declarations.put(declaration.type(), declaration);
    }

    public void register(ConstructorCandidate constructor) {
        constructors.computeIfAbsent(constructor.owningType(), k -> new CopyOnWriteArrayList<>()).add(constructor);
    }

    @Override
    public Optional<TypeDeclaration> declarationOf(TypeRef.Named type) {
        return Optional.ofNullable(declarations.get(type));
    }

    @Override
    public List<ConstructorCandidate> constructorsOf(TypeRef.Named type) {
        List<ConstructorCandidate> result = new ArrayList<>();
        Set<TypeRef.Named> visited = new HashSet<>();

        // Own constructors first, then each supertype's, walking up the chain
        TypeRef.Named current = type;
        while (current != null && visited.add(current)) {
            result.addAll(declaredOn(current));
            current = declarationOf(current)
                .flatMap(TypeDeclaration::findSupertype)
                .orElse(null);
        }
        return List.copyOf(result);
    }

    /**
     * Returns the constructors declared directly on a type, ordered by declaration sequence.
     */
    public List<ConstructorCandidate> declaredOn(TypeRef.Named type) {
        return constructors.getOrDefault(type, List.of()).stream()
            .sorted(Comparator.comparingLong(ConstructorCandidate::sequence))
            .toList();
    }

    public List<TypeDeclaration> allDeclarations() {
        return declarations.values().stream()
            .sorted(Comparator.comparing(TypeDeclaration::name))
            .toList();
    }

    public int constructorCount() {
        return constructors.values().stream().mapToInt(List::size).sum();
    }

    public static class Builder {
        private final SymbolTable table = new SymbolTable();

        public Builder addType(TypeDeclaration declaration) {
            table.register(declaration);
            return this;
        }

        public Builder addConstructor(ConstructorCandidate constructor) {
            table.register(constructor);
            return this;
        }

        public SymbolTable build() {
            return table;
        }
    }
}
