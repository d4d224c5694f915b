package com.graphid.adapter.id;

/**
 * A node whose name can legitimately repeat under the same named parent. Its final ID is
 * assigned by {@link CollisionResolver} once the whole file has been traversed.
 *
 * @param hashRequired true when the content hash is part of the node's identity even without
 *                     a collision
 */
public record PendingNode(
    String baseId,
    ContentHashHints hints,
    IdTarget target,
    int insertionOrder,
    boolean hashRequired
) {

    public PendingNode(String baseId, ContentHashHints hints, IdTarget target, int insertionOrder) {
        this(baseId, hints, target, insertionOrder, false);
    }
}
