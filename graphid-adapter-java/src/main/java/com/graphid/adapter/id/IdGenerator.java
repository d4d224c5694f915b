package com.graphid.adapter.id;

import com.graphid.adapter.scope.ScopeTracker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out node IDs during the traversal of one file.
 *
 * Node types that Java guarantees unique (see {@link NodeType.Uniqueness}) get their final ID
 * immediately. Everything else gets a provisional base ID and is queued as a {@link PendingNode};
 * {@link CollisionResolver} rewrites the targets once traversal is over.
 *
 * Exactly one instance per file, shared by every visitor of that file. A second instance for
 * the same file would split the pending buffer and collisions across the two would go unnoticed.
 */
public class IdGenerator {

    private final String file;
    private final ScopeTracker scopes;
    private final List<PendingNode> pending = new ArrayList<>();
    private final Set<String> reserved = new LinkedHashSet<>();
    private int insertionOrder = 0;

    public IdGenerator(ScopeTracker scopes) {
        this.scopes = scopes;
        this.file = scopes.getFile();
    }

    public String getFile() { return file; }

    public ScopeTracker getScopes() { return scopes; }

    /**
     * Assigns an ID to {@code target} and returns it. For collision-prone types the returned
     * value is provisional; read the target again after resolution.
     */
    public String generate(NodeType type, String name, ContentHashHints hints, IdTarget target) {
        String namedParent = scopes.getNamedParent();
        String baseId = SemanticId.compose(type.name(), name, file, namedParent);

        if (isUniqueByConstruction(type)) {
            reserved.add(baseId);
            target.setId(baseId);
            return baseId;
        }

        boolean hashRequired = type.uniqueness() == NodeType.Uniqueness.CONTENT;
        pending.add(new PendingNode(baseId, hints != null ? hints : ContentHashHints.EMPTY,
                target, insertionOrder++, hashRequired));
        target.setId(baseId);
        return baseId;
    }

    private boolean isUniqueByConstruction(NodeType type) {
        return switch (type.uniqueness()) {
            case PER_FILE -> true;
            case TOP_LEVEL -> scopes.isTopLevel();
            case NONE, CONTENT -> false;
        };
    }

    /** Pending nodes in insertion order. */
    public List<PendingNode> getPendingNodes() {
        return Collections.unmodifiableList(pending);
    }

    /** Final IDs already issued on the immediate path. */
    public Set<String> getReservedIds() {
        return Collections.unmodifiableSet(reserved);
    }
}
