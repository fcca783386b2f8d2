package com.logicsynth.schema;

import com.logicsynth.ir.Bound;
import com.logicsynth.ir.Declaration;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, load-once view of the declarations known to a session, keyed by predicate symbol.
 * Extending the schema produces a new registry; an existing instance never changes.
 */
public final class SchemaRegistry {

    private static final SchemaRegistry EMPTY = new SchemaRegistry(Map.of());

    private final Map<String, Declaration> declarations;

    private SchemaRegistry(Map<String, Declaration> declarations) {
        this.declarations = declarations;
    }

    public static SchemaRegistry empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException when a predicate is declared twice
     */
    public static SchemaRegistry of(Collection<Declaration> decls) {
        return EMPTY.withDeclarations(decls);
    }

    /**
     * Returns a registry holding this registry's declarations plus {@code decls}.
     * Redeclaring a predicate with the same declaration is a no-op; a different one is rejected.
     */
    public SchemaRegistry withDeclarations(Collection<Declaration> decls) {
        Map<String, Declaration> merged = new LinkedHashMap<>(declarations);
        for (Declaration decl : decls) {
            Declaration existing = merged.putIfAbsent(decl.predicate(), decl);
            if (existing != null && !existing.equals(decl)) {
                throw new IllegalArgumentException("predicate " + decl.predicate() + " is already declared");
            }
        }
        return new SchemaRegistry(Collections.unmodifiableMap(merged));
    }

    public boolean isEmpty() {
        return declarations.isEmpty();
    }

    public boolean isDeclared(String predicate) {
        return declarations.containsKey(predicate);
    }

    public Optional<Declaration> find(String predicate) {
        return Optional.ofNullable(declarations.get(predicate));
    }

    public Optional<Integer> arity(String predicate) {
        return find(predicate).map(Declaration::arity);
    }

    public Set<String> predicates() {
        return declarations.keySet();
    }

    /**
     * Types accepted at an argument position: the union over all bound lists.
     * Empty when the position is unconstrained (no bounds, an {@code /any} bound or a
     * bound this registry does not recognise).
     */
    public Set<ValueType> allowedTypes(String predicate, int position) {
        Declaration decl = declarations.get(predicate);
        if (decl == null || decl.bounds().isEmpty()) {
            return Set.of();
        }
        Set<ValueType> allowed = EnumSet.noneOf(ValueType.class);
        for (Bound bound : decl.bounds()) {
            if (position >= bound.terms().size()) {
                return Set.of();
            }
            Optional<ValueType> type = ValueType.fromBound(bound.terms().get(position));
            if (type.isEmpty() || type.get() == ValueType.ANY) {
                return Set.of();
            }
            allowed.add(type.get());
        }
        return allowed;
    }

    /** The single type expected at a position, when the bounds pin exactly one. */
    public Optional<ValueType> expectedType(String predicate, int position) {
        Set<ValueType> allowed = allowedTypes(predicate, position);
        return allowed.size() == 1 ? Optional.of(allowed.iterator().next()) : Optional.empty();
    }
}
