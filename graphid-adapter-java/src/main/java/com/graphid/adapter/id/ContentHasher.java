package com.graphid.adapter.id;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns content hints into a 4-hex-char hash (16 bits) used to tell colliding nodes apart.
 * FNV-1a 32-bit over the UTF-16 code units of the hint string; not meant to be cryptographic.
 */
public final class ContentHasher {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private ContentHasher() {}

    public static String hash(ContentHashHints hints) {
        return fnv1a16(hintString(hints));
    }

    /**
     * Present fields in fixed order, each with its own prefix, joined by {@code |}.
     * Empty hints give the empty string.
     */
    static String hintString(ContentHashHints hints) {
        List<String> parts = new ArrayList<>(8);
        if (hints.arity() != null)           parts.add("a:" + hints.arity());
        if (hints.firstLiteralArg() != null) parts.add("l:" + hints.firstLiteralArg());
        if (hints.firstParamName() != null)  parts.add("p:" + hints.firstParamName());
        if (hints.rhsType() != null)         parts.add("r:" + hints.rhsType());
        if (hints.rhsToken() != null)        parts.add("t:" + hints.rhsToken());
        if (hints.objectChain() != null)     parts.add("o:" + hints.objectChain());
        if (hints.declaredType() != null)    parts.add("d:" + hints.declaredType());
        if (hints.signature() != null)       parts.add("s:" + hints.signature());
        return String.join("|", parts);
    }

    static String fnv1a16(String input) {
        int hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < input.length(); i++) {
            hash ^= input.charAt(i);
            hash *= FNV_PRIME;
        }
        return String.format("%04x", hash & 0xffff);
    }
}
