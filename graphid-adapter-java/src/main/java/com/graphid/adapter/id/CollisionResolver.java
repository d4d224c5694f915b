package com.graphid.adapter.id;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns final IDs to the pending nodes of one file with graduated disambiguation:
 * a unique base ID is kept as is, colliding ones get a content hash, and nodes whose content
 * hash also collides get a counter in insertion order. Nodes that require a hash always get one.
 */
public class CollisionResolver {

    public int resolve(List<PendingNode> pendingNodes) {
        return resolve(pendingNodes, Set.of());
    }

    /**
     * @param pendingNodes every pending node of the file
     * @param reservedIds  final IDs issued outside the pending path; a base ID equal to one of
     *                     them counts as a collision even when its group has a single member
     * @return number of nodes whose ID changed
     */
    public int resolve(List<PendingNode> pendingNodes, Set<String> reservedIds) {
        if (pendingNodes.isEmpty()) return 0;

        Map<String, List<PendingNode>> byBaseId = new LinkedHashMap<>();
        for (PendingNode node : pendingNodes) {
            byBaseId.computeIfAbsent(node.baseId(), k -> new ArrayList<>()).add(node);
        }

        int changed = 0;
        for (Map.Entry<String, List<PendingNode>> group : byBaseId.entrySet()) {
            String baseId = group.getKey();
            List<PendingNode> members = group.getValue();
            if (members.size() == 1 && !reservedIds.contains(baseId) && !members.get(0).hashRequired()) {
                members.get(0).target().setId(baseId);
                continue;
            }
            changed += disambiguate(baseId, members);
        }
        return changed;
    }

    private int disambiguate(String baseId, List<PendingNode> members) {
        List<PendingNode> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparingInt(PendingNode::insertionOrder));

        Map<String, List<PendingNode>> byHash = new LinkedHashMap<>();
        for (PendingNode node : ordered) {
            byHash.computeIfAbsent(ContentHasher.hash(node.hints()), k -> new ArrayList<>()).add(node);
        }

        for (Map.Entry<String, List<PendingNode>> sameHash : byHash.entrySet()) {
            String hashedId = SemanticId.withContentHash(baseId, sameHash.getKey());
            assignInOrder(hashedId, sameHash.getValue());
        }
        return members.size();
    }

    private void assignInOrder(String hashedId, Collection<PendingNode> nodes) {
        int counter = 0;
        for (PendingNode node : nodes) {
            node.target().setId(counter == 0 ? hashedId : hashedId + "#" + counter);
            counter++;
        }
    }
}
