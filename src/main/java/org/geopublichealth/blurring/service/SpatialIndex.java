package org.geopublichealth.blurring.service;

import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Bounding-box index over a fixed set of features.
 * <p>
 * Queries only prune: the returned candidates are a superset of the features
 * whose geometry actually intersects the search area, and callers must
 * re-check every candidate with an exact geometry test.
 * <p>
 * An index is read-only once built and may be queried from several threads.
 * It should be built once per batch and shared, never rebuilt per item.
 *
 * @param <T> indexed item type
 * @author GeoPublicHealth Team
 * @since 0.1.0
 * @see StrTreeSpatialIndex
 */
public interface SpatialIndex<T> {

    /**
     * Returns the items whose bounding box intersects the search envelope.
     *
     * @param searchEnvelope area to search
     * @return candidate items, possibly empty, never null
     */
    List<T> query(Envelope searchEnvelope);

    /**
     * Returns the number of indexed items.
     */
    int size();
}
