package com.graphid.adapter.scope;

import java.util.List;

/**
 * A declaration that can be the target of a name reference: variable, constant or parameter.
 */
public interface ScopedDeclaration {

    String getName();

    /** Full scope path the declaration lives in, outermost first, anonymous blocks included. */
    List<String> getScopePath();

    /**
     * Position among the file's declarations for names that are only visible after their
     * declaration (locals, parameters). Negative for members, which are visible throughout.
     */
    default int getDeclarationOrder() {
        return -1;
    }
}
