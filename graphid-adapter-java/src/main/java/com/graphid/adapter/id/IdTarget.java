package com.graphid.adapter.id;

/**
 * The mutable ID slot of a node under construction. Pending nodes and cross references hold
 * the target itself, never a copy of its current ID.
 */
public interface IdTarget {

    String getId();

    void setId(String id);
}
