package com.graphid.adapter.id;

/**
 * Parsed components of a semantic ID. Optional parts are null when absent; a counter of 0 is
 * the implicit first occurrence and is normalized to null.
 */
public record ParsedSemanticId(
    String file,
    String type,
    String name,
    String namedParent,   // nullable
    String contentHash,   // nullable
    Integer counter       // nullable, > 0 when present
) {
    public ParsedSemanticId {
        if (namedParent != null && namedParent.isEmpty()) namedParent = null;
        if (contentHash != null && contentHash.isEmpty()) contentHash = null;
        if (counter != null && counter == 0) counter = null;
    }

    public boolean hasNamedParent() {
        return namedParent != null;
    }
}
