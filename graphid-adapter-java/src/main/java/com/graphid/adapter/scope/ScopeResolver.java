package com.graphid.adapter.scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds a name used at some full scope path to the declaration it refers to, mirroring lexical
 * scoping: the use-site path is tried from the innermost prefix outwards, and a candidate matches
 * only if its own stored scope path equals that prefix exactly.
 *
 * Works on full scope paths only. The compressed named parent in an ID has lost the anonymous
 * blocks and cannot be used for this.
 */
public class ScopeResolver<T extends ScopedDeclaration> {

    private final Map<String, List<T>> byName = new HashMap<>();

    public ScopeResolver(Collection<? extends T> declarations) {
        for (T declaration : declarations) {
            byName.computeIfAbsent(declaration.getName(), k -> new ArrayList<>()).add(declaration);
        }
    }

    public Optional<T> resolve(String name, List<String> useScopePath) {
        return resolve(name, useScopePath, Integer.MAX_VALUE);
    }

    /**
     * @param declarationsBefore number of declarations made before the use site; an ordered
     *                           declaration at or beyond it is not visible yet, so the name falls
     *                           through to an outer scope
     */
    public Optional<T> resolve(String name, List<String> useScopePath, int declarationsBefore) {
        List<T> candidates = byName.get(name);
        if (candidates == null) return Optional.empty();

        for (int depth = useScopePath.size(); depth >= 0; depth--) {
            List<String> prefix = useScopePath.subList(0, depth);
            for (T candidate : candidates) {
                if (candidate.getScopePath().equals(prefix) && isVisible(candidate, declarationsBefore)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isVisible(ScopedDeclaration candidate, int declarationsBefore) {
        int order = candidate.getDeclarationOrder();
        return order < 0 || order < declarationsBefore;
    }
}
