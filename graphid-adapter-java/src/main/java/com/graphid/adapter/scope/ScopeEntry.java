package com.graphid.adapter.scope;

/**
 * One lexical scope on the traversal stack.
 *
 * @param name    name used for the named parent; {@code type#N} for anonymous scopes
 * @param type    construct that opened the scope (CLASS, FUNCTION, if, for, lambda, ...)
 * @param named   true for declarations, false for anonymous blocks
 * @param segment element of the full scope path; differs from {@code name} only for callables,
 *                whose segment carries the parameter types so that overloads stay apart
 */
public record ScopeEntry(String name, String type, boolean named, String segment) {

    /** Reserved separator between a scope type and its counter. Never appears in a declared name. */
    public static final char COUNTER_SEPARATOR = '#';

    public static ScopeEntry named(String name, String type) {
        return new ScopeEntry(name, type, true, name);
    }

    public static ScopeEntry named(String name, String type, String segment) {
        return new ScopeEntry(name, type, true, segment);
    }

    public static ScopeEntry counted(String type, int counter) {
        String name = type + COUNTER_SEPARATOR + counter;
        return new ScopeEntry(name, type, false, name);
    }

    public static boolean isAnonymousName(String name) {
        return name.indexOf(COUNTER_SEPARATOR) >= 0;
    }
}
