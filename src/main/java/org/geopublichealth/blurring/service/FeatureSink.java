package org.geopublichealth.blurring.service;

import org.locationtech.jts.geom.Geometry;

import java.util.Map;

/**
 * Destination for produced features, e.g. a file writer or an in-memory layer.
 * <p>
 * Persistence format and lifecycle belong to the implementation.
 *
 * @author GeoPublicHealth Team
 * @since 0.1.0
 */
@FunctionalInterface
public interface FeatureSink {

    /**
     * Accepts one feature.
     *
     * @param geometry   feature geometry
     * @param attributes attribute values in field order
     */
    void accept(Geometry geometry, Map<String, Object> attributes);
}
