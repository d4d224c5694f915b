package com.graphid.adapter.id;

/**
 * A record that embeds the ID of another node. It keeps a reference to the node's
 * {@link IdTarget} until collision resolution is over, then copies the final ID.
 */
public interface CrossReference {

    /** Copies the final IDs of the referenced targets into this record and drops the references. */
    void materialize();
}
