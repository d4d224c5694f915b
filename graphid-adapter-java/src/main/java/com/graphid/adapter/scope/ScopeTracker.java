package com.graphid.adapter.scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Stack of lexical scopes for the traversal of one file.
 *
 * Named scopes (types, methods, constructors) feed the compressed named parent of an ID.
 * Counted scopes ({@code if#0}, {@code for#1}, {@code lambda#0}) are anonymous: they are kept in
 * the full scope path for reference resolution but never show up in an ID.
 */
public class ScopeTracker {

    private final String file;
    private final Deque<ScopeEntry> stack = new ArrayDeque<>();
    // "<parent path>|<type>" -> next counter
    private final Map<String, Integer> counters = new HashMap<>();

    public ScopeTracker(String file) {
        this.file = file;
    }

    public String getFile() { return file; }

    public void enterScope(String name, String type) {
        enter(ScopeEntry.named(name, type));
    }

    /**
     * Enters a named scope whose full-path segment differs from its name (overloadable callables).
     */
    public void enterScope(String name, String type, String segment) {
        enter(ScopeEntry.named(name, type, segment));
    }

    /**
     * Enters an anonymous scope and returns its synthetic name, {@code type#N}, where N counts
     * scopes of that type directly under the current scope.
     */
    public String enterCountedScope(String type) {
        String key = pathKey() + "|" + type;
        int counter = counters.merge(key, 1, Integer::sum) - 1;
        ScopeEntry entry = ScopeEntry.counted(type, counter);
        enter(entry);
        return entry.name();
    }

    /**
     * @throws IllegalStateException if no scope is open
     */
    public ScopeEntry exitScope() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("exitScope() without matching enter in " + file);
        }
        return stack.pop();
    }

    /**
     * Nearest enclosing named scope, skipping anonymous blocks at any depth.
     *
     * @return the scope's name, or null at file top level
     */
    public String getNamedParent() {
        for (ScopeEntry entry : stack) {  // ArrayDeque iterates from the top of the stack
            if (entry.named()) return entry.name();
        }
        return null;
    }

    /**
     * Full scope path, outermost first, anonymous blocks included.
     */
    public List<String> getScopePath() {
        List<String> path = new ArrayList<>(stack.size());
        Iterator<ScopeEntry> it = stack.descendingIterator();
        while (it.hasNext()) {
            path.add(it.next().segment());
        }
        return Collections.unmodifiableList(path);
    }

    /**
     * Kinds ({@code if}, {@code for}, ...) of the anonymous scopes opened since the nearest named
     * one, outermost first. Unlike the path segments these carry no counter.
     */
    public List<String> getAnonymousKinds() {
        List<String> kinds = new ArrayList<>();
        for (ScopeEntry entry : stack) {
            if (entry.named()) break;
            kinds.add(0, entry.type());
        }
        return kinds;
    }

    public boolean isTopLevel() {
        return stack.isEmpty();
    }

    private void enter(ScopeEntry entry) {
        stack.push(entry);
    }

    private String pathKey() {
        return String.join("->", getScopePath());
    }
}
