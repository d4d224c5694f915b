package com.graphid.adapter.id;

import java.util.Collection;

/**
 * Single linear pass run after {@link CollisionResolver}: every buffered cross reference picks up
 * the final ID of the node it points to.
 */
public class CrossReferenceFixup {

    /**
     * @return number of references materialized
     */
    public int apply(Collection<? extends CrossReference> references) {
        int count = 0;
        for (CrossReference reference : references) {
            reference.materialize();
            count++;
        }
        return count;
    }
}
