package org.geopublichealth.blurring.service;

import org.geopublichealth.blurring.exceptions.SpatialIndexBuildException;
import org.geopublichealth.blurring.model.PolygonFeature;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * {@link SpatialIndex} backed by a JTS Sort-Tile-Recursive tree.
 * <p>
 * The tree is packed at construction time, after which it cannot be modified
 * and concurrent queries are safe.
 *
 * @param <T> indexed item type
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
public final class StrTreeSpatialIndex<T> implements SpatialIndex<T> {

    private static final Logger logger = LoggerFactory.getLogger(StrTreeSpatialIndex.class);

    private static final int NODE_CAPACITY = 10;

    private final STRtree tree;
    private final int size;

    private StrTreeSpatialIndex(STRtree tree, int size) {
        this.tree = tree;
        this.size = size;
    }

    /**
     * Builds an index over arbitrary items.
     *
     * @param items      items to index
     * @param geometryOf extracts the geometry of an item
     * @param idOf       extracts an identifier of an item, for error reporting
     * @param <T>        item type
     * @return the built index
     * @throws SpatialIndexBuildException if there are no items or an item has no usable geometry
     */
    public static <T> StrTreeSpatialIndex<T> build(Collection<? extends T> items,
                                                   Function<? super T, ? extends Geometry> geometryOf,
                                                   Function<? super T, String> idOf) {
        if (items == null || items.isEmpty()) {
            throw new SpatialIndexBuildException("Cannot build a spatial index over an empty geometry set", null);
        }

        STRtree tree = new STRtree(NODE_CAPACITY);
        for (T item : items) {
            Geometry geometry = geometryOf.apply(item);
            if (geometry == null || geometry.isEmpty()) {
                String id = idOf.apply(item);
                throw new SpatialIndexBuildException(
                        "Feature " + id + " has a missing or empty geometry", id);
            }
            tree.insert(geometry.getEnvelopeInternal(), item);
        }
        tree.build();

        logger.debug("Built STR tree over {} geometries", items.size());
        return new StrTreeSpatialIndex<>(tree, items.size());
    }

    /**
     * Builds an index over polygon features such as an envelope or a reference layer.
     *
     * @param features the features
     * @return the built index
     * @throws SpatialIndexBuildException if there are no features or one has no geometry
     */
    public static StrTreeSpatialIndex<PolygonFeature> ofFeatures(Collection<PolygonFeature> features) {
        return build(features, PolygonFeature::geometry, PolygonFeature::id);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<T> query(Envelope searchEnvelope) {
        return new ArrayList<>((List<T>) tree.query(searchEnvelope));
    }

    @Override
    public int size() {
        return size;
    }
}
